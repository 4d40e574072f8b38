package com.masterbias.service;

import com.masterbias.model.CombineMethod;
import com.masterbias.model.CombineSettings;
import com.masterbias.model.FileDescriptor;
import com.masterbias.model.FrameStatistics;
import com.masterbias.model.FrameType;
import com.masterbias.model.InputDisposition;
import com.masterbias.model.MasterFrame;
import com.masterbias.model.PixelPlane;
import com.masterbias.model.PixelStack;
import com.masterbias.model.Precalibration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Drives a combining session: validates the selection, splits it into groups when asked to,
 * and for each group reads the frames, pre-calibrates, reduces and writes one master frame.
 * <p>
 * Every frame of a group is read into memory before reduction starts. Cancellation is checked
 * between groups; a group whose reduction finishes after cancellation is discarded, not written.
 */
public class FileCombiner {
    private static final Logger logger = LoggerFactory.getLogger(FileCombiner.class);

    private final FrameStore store;
    private final FileDispositionService dispositionService;
    private final OutputNaming naming;
    private final Consumer<String> fileMovedCallback;

    private final FrameGrouper grouper = new FrameGrouper();
    private final PreCalibrator preCalibrator = new PreCalibrator();
    private final FrameReducer reducer = new FrameReducer();
    private final FrameStatisticsService statisticsService = new FrameStatisticsService();

    public FileCombiner(FrameStore store, Consumer<String> fileMovedCallback) {
        this(store, new FileDispositionService(), new OutputNaming(), fileMovedCallback);
    }

    public FileCombiner(FrameStore store, FileDispositionService dispositionService,
                        OutputNaming naming, Consumer<String> fileMovedCallback) {
        this.store = store;
        this.dispositionService = dispositionService;
        this.naming = naming;
        this.fileMovedCallback = fileMovedCallback;
    }

    /**
     * Combines the whole selection into one master.
     *
     * @param outputFile target path, may contain %d/%t/%f tokens; null builds a name next to the first input
     * @return the written file, or empty if the session was cancelled first
     */
    public Optional<Path> combineSingle(List<FileDescriptor> selected, CombineSettings settings, Path outputFile,
                                        Console console, SessionController session)
            throws MasterMakerException, IOException {
        console.pushLevel();
        try {
            console.message("Using single-file processing", +1);
            if (selected.isEmpty()) throw new EmptyInputException("No files selected");
            validateGroup(selected, settings);

            // En bias el filtro no importa, pero el master lo lleva en la cabecera
            String filterName = FrameValidator.mostCommonFilterName(selected);
            Path target = (outputFile == null)
                    ? naming.defaultOutputPath(settings.combineMethod(), selected.get(0))
                    : Paths.get(naming.substitute(outputFile.toString(), filterName));

            if (session.threadCancelled()) return Optional.empty();
            if (!combineFiles(selected, settings, filterName, target, console, session)) return Optional.empty();

            handleInputFilesDisposition(settings, filterName, selected, console);
            console.message("Combining complete", 0);
            return Optional.of(target);
        } finally {
            console.popLevel();
        }
    }

    /**
     * Combines the selection group by group (size, then temperature) into {@code outputDirectory}.
     * Groups under the minimum size are skipped with a message.
     *
     * @return the masters written, in processing order
     */
    public List<Path> processGroups(CombineSettings settings, List<FileDescriptor> selected, Path outputDirectory,
                                    Console console, SessionController session)
            throws MasterMakerException, IOException {
        List<Path> written = new ArrayList<>();
        console.pushLevel();
        try {
            console.message("Process groups into output directory: " + outputDirectory, +1);
            ensureDirectoryExists(outputDirectory);
            int minimumGroupSize = settings.effectiveMinimumGroupSize();

            for (List<FileDescriptor> sizeGroup : grouper.groupBySize(selected, settings.groupBySize())) {
                if (session.threadCancelled()) {
                    console.message("Session cancelled", 0);
                    return written;
                }
                console.pushLevel();
                try {
                    if (!FrameGrouper.meetsMinimum(sizeGroup, minimumGroupSize)) {
                        console.message(String.format("Ignoring one size group: %d files sized %s (minimum is %d)",
                                sizeGroup.size(), sizeGroup.get(0).sizeKey(), minimumGroupSize), +1);
                        continue;
                    }
                    if (settings.groupBySize()) {
                        console.message(String.format("Processing one size group: %d files sized %s",
                                sizeGroup.size(), sizeGroup.get(0).sizeKey()), +1);
                    }
                    if (!processTemperatureGroups(settings, sizeGroup, outputDirectory, minimumGroupSize,
                            written, console, session)) {
                        return written;
                    }
                } finally {
                    console.popLevel();
                }
            }
            console.message("Group combining complete", 0);
            return written;
        } finally {
            console.popLevel();
        }
    }

    // false si la sesion fue cancelada
    private boolean processTemperatureGroups(CombineSettings settings, List<FileDescriptor> sizeGroup,
                                             Path outputDirectory, int minimumGroupSize, List<Path> written,
                                             Console console, SessionController session)
            throws MasterMakerException, IOException {
        List<List<FileDescriptor>> temperatureGroups = grouper.groupByTemperature(
                sizeGroup, settings.groupByTemperature(), settings.temperatureTolerance());
        for (List<FileDescriptor> temperatureGroup : temperatureGroups) {
            if (session.threadCancelled()) {
                console.message("Session cancelled", 0);
                return false;
            }
            console.pushLevel();
            try {
                double meanTemperature = meanTemperature(temperatureGroup);
                if (!FrameGrouper.meetsMinimum(temperatureGroup, minimumGroupSize)) {
                    console.message(String.format(Locale.US,
                            "Ignoring one temperature group: %d files at temp near %.1f (minimum is %d)",
                            temperatureGroup.size(), meanTemperature, minimumGroupSize), +1);
                    continue;
                }
                if (settings.groupByTemperature()) {
                    console.message(String.format(Locale.US,
                            "Processing one temperature group: %d files at temp near %.1f (%.1f%% threshold)",
                            temperatureGroup.size(), meanTemperature, settings.temperatureTolerance() * 100), +1);
                }
                processOneGroup(settings, temperatureGroup, outputDirectory, written, console, session)
                        .ifPresent(written::add);
            } finally {
                console.popLevel();
            }
        }
        return session.threadRunning();
    }

    /**
     * Combines one group into {@code outputDirectory}. The generated name gets a -2, -3, ... suffix
     * when it was already written in this run or exists on disk, so no earlier master is replaced.
     */
    Optional<Path> processOneGroup(CombineSettings settings, List<FileDescriptor> group, Path outputDirectory,
                                   Collection<Path> alreadyWritten, Console console, SessionController session)
            throws MasterMakerException, IOException {
        if (group.isEmpty()) throw new EmptyInputException("Empty group");
        FileDescriptor sample = group.get(0);
        console.pushLevel();
        try {
            describeGroup(settings, group.size(), sample, console);
            validateGroup(group, settings);

            String filterName = FrameValidator.mostCommonFilterName(group);
            Path output = naming.uniquePath(outputDirectory.resolve(naming.fileName(settings.combineMethod(), sample)),
                    p -> alreadyWritten.contains(p) || Files.exists(p));
            if (!combineFiles(group, settings, filterName, output, console, session)) return Optional.empty();

            handleInputFilesDisposition(settings, filterName, group, console);
            return Optional.of(output);
        } finally {
            console.popLevel();
        }
    }

    /**
     * Fails fast, before any pixel is read, if the group cannot be combined.
     */
    void validateGroup(List<FileDescriptor> group, CombineSettings settings) throws MasterMakerException {
        if (!FrameValidator.compatibleSizes(group)) {
            throw new IncompatibleSizesException(
                    "Files must have identical X and Y dimensions and identical binning to be combined");
        }
        if (!settings.ignoreFileType() && !FrameValidator.allOfType(group, settings.requiredType())) {
            throw new WrongFrameTypeException(settings.requiredType());
        }
        // Solo los flats exigen un mismo filtro
        if (settings.requiredType() == FrameType.FLAT && !settings.ignoreFilter()
                && !FrameValidator.allSameFilter(group)) {
            throw new FilterMismatchException();
        }
    }

    // true si el master se escribio
    private boolean combineFiles(List<FileDescriptor> inputs, CombineSettings settings, String filterName,
                                 Path outputPath, Console console, SessionController session)
            throws MasterMakerException, IOException {
        CombineMethod method = settings.combineMethod();
        console.pushLevel();
        try {
            console.message(String.format("Combining %d files by %s", inputs.size(), method.displayName()), +1);

            List<PixelPlane> planes = new ArrayList<>(inputs.size());
            for (FileDescriptor d : inputs) {
                PixelPlane plane = store.readPlane(d.absolutePath());
                if (!plane.sameDimensions(d.width(), d.height())) {
                    throw new IncompatibleSizesException(String.format("File %s is %dx%d, expected %dx%d",
                            d.absolutePath(), plane.width(), plane.height(), d.width(), d.height()));
                }
                planes.add(plane);
            }
            PixelStack stack = PixelStack.fromPlanes(planes);

            Precalibration precalibration = settings.precalibration();
            if (!(precalibration instanceof Precalibration.None)) {
                console.message("Precalibrating with " + precalibration.describe(), 0);
                stack = preCalibrator.apply(stack, precalibration);
            }

            long start = System.currentTimeMillis();
            int[] pixels = reducer.combine(stack, method);
            logger.debug("{} reduction of {} layers took {} ms", method.displayName(), stack.layerCount(),
                    System.currentTimeMillis() - start);

            if (session.threadCancelled()) {
                console.message("Session cancelled, result not written", 0);
                return false;
            }

            FileDescriptor sample = inputs.get(0);
            MasterFrame master = new MasterFrame(new PixelPlane(stack.width(), stack.height(), pixels),
                    settings.requiredType(), meanExposure(inputs), meanTemperature(inputs),
                    filterName, sample.binning(), method.provenance());
            store.writeMaster(outputPath, master);

            FrameStatistics stats = statisticsService.summarize(master.plane);
            console.message(String.format(Locale.US, "Wrote %s (mean %.1f, stdev %.2f, min %.0f, max %.0f)",
                    outputPath.getFileName(), stats.mean, stats.stdDev, stats.min, stats.max), 0);
            return true;
        } finally {
            console.popLevel();
        }
    }

    private void handleInputFilesDisposition(CombineSettings settings, String filterName,
                                             List<FileDescriptor> descriptors, Console console) {
        if (settings.disposition() == InputDisposition.NOTHING) return;

        String folder = naming.substitute(settings.dispositionSubfolder(), filterName);
        console.message("Moving processed files to " + folder, 0);
        for (FileDescriptor d : descriptors) {
            if (dispositionService.moveToSubfolder(d, folder)) {
                console.message("Moved " + d.fileName(), 0);
                fileMovedCallback.accept(d.absolutePath().toString());
            }
        }
    }

    private void describeGroup(CombineSettings settings, int count, FileDescriptor sample, Console console) {
        StringBuilder sb = new StringBuilder();
        if (settings.groupBySize()) {
            sb.append(" binned ").append(sample.binning()).append(" x ").append(sample.binning());
        }
        if (settings.groupByTemperature()) {
            if (sb.length() > 0) sb.append(",");
            sb.append(String.format(Locale.US, " at %.1f degrees", sample.temperature()));
        }
        console.message("Processing " + count + " files" + sb, +1);
    }

    private static void ensureDirectoryExists(Path directory) throws OutputDirectoryUnavailableException {
        if (Files.isDirectory(directory)) return;
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            logger.error("Unable to create output directory {}", directory, e);
            throw new OutputDirectoryUnavailableException(directory);
        }
    }

    static double meanExposure(List<FileDescriptor> descriptors) {
        double sum = 0;
        for (FileDescriptor d : descriptors) sum += d.exposure();
        return descriptors.isEmpty() ? 0 : sum / descriptors.size();
    }

    static double meanTemperature(List<FileDescriptor> descriptors) {
        double sum = 0;
        for (FileDescriptor d : descriptors) sum += d.temperature();
        return descriptors.isEmpty() ? 0 : sum / descriptors.size();
    }
}
