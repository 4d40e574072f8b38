package com.masterbias.main;

import com.masterbias.model.CombineMethod;
import com.masterbias.model.CombineSettings;
import com.masterbias.model.InputDisposition;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Command-line flags merged over the stored preferences. Problems are collected, not thrown,
 * so every mistake is reported in one go.
 */
public class CommandLineOptions {

    static final String USAGE = String.join("\n",
            "Usage: master-bias-maker [options] <file> ...",
            "  -o  <path>       output file (default: generated name next to the inputs)",
            "  -od <directory>  output directory, required with any grouping option",
            "  -m               combine by mean",
            "  -n               combine by median",
            "  -mm <n>          min-max clip <n> extremes per end, then mean",
            "  -s  <z>          sigma clip values with z-score above <z>, then mean",
            "  -p  <value>      subtract pedestal <value> before combining",
            "  -c  <file>       subtract calibration frame <file> before combining",
            "  -t               ignore FITS file type",
            "  -v  <folder>     move inputs into <folder> after processing",
            "  -gs              group by size",
            "  -gt <percent>    group by temperature with tolerance 0..100 %",
            "  -mg <n>          ignore groups with fewer than <n> files");

    private final List<Path> files = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();
    private Path outputPath;
    private Path outputDirectory;
    private Integer pedestal;
    private Path calibrationFile;
    private CombineSettings settings;

    public static CommandLineOptions parse(String[] args, CombineSettings.Builder defaults) {
        CommandLineOptions o = new CommandLineOptions();
        CombineSettings.Builder b = defaults;
        int methodsGiven = 0;

        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            switch (a) {
                case "-o": o.outputPath = o.pathArg(args, ++i, a); break;
                case "-od": o.outputDirectory = o.pathArg(args, ++i, a); break;
                case "-m": b.combineMethod(CombineMethod.mean()); methodsGiven++; break;
                case "-n": b.combineMethod(CombineMethod.median()); methodsGiven++; break;
                case "-mm": {
                    methodsGiven++;
                    Integer n = o.intArg(args, ++i, a);
                    if (n != null && n >= 1) b.combineMethod(CombineMethod.minMaxClip(n));
                    else if (n != null) o.errors.add("Min-Max clipping argument must be > 0, not " + n);
                    break;
                }
                case "-s": {
                    methodsGiven++;
                    Double z = o.doubleArg(args, ++i, a);
                    if (z != null && z > 0) b.combineMethod(CombineMethod.sigmaClip(z));
                    else if (z != null) o.errors.add("Sigma clipping threshold must be > 0, not " + z);
                    break;
                }
                case "-p": {
                    Integer p = o.intArg(args, ++i, a);
                    if (p != null && p >= 0) o.pedestal = p;
                    else if (p != null) o.errors.add("Pedestal must be >= 0, not " + p);
                    break;
                }
                case "-c": o.calibrationFile = o.pathArg(args, ++i, a); break;
                case "-t": b.ignoreFileType(true); break;
                case "-v": {
                    Path folder = o.pathArg(args, ++i, a);
                    if (folder != null) {
                        b.disposition(InputDisposition.SUBFOLDER).dispositionSubfolder(folder.toString());
                    }
                    break;
                }
                case "-gs": b.groupBySize(true); break;
                case "-gt": {
                    Double pct = o.doubleArg(args, ++i, a);
                    if (pct != null && pct >= 0 && pct <= 100) {
                        b.groupByTemperature(true).temperatureTolerance(pct / 100.0);
                    } else if (pct != null) {
                        o.errors.add("-gt tolerance must be between 0 and 100");
                    }
                    break;
                }
                case "-mg": {
                    Integer n = o.intArg(args, ++i, a);
                    if (n != null && n > 0) b.ignoreSmallGroups(true).minimumGroupSize(n);
                    else if (n != null) o.errors.add("Minimum group size must be > 0, not " + n);
                    break;
                }
                default:
                    if (a.startsWith("-")) o.errors.add("Unknown option " + a);
                    else o.files.add(Paths.get(a));
            }
        }

        if (methodsGiven > 1) o.errors.add("Only one of -m, -n, -mm, -s may be given");
        if (o.pedestal != null && o.calibrationFile != null) o.errors.add("Only one of -p, -c may be given");
        if (o.calibrationFile != null && !Files.isRegularFile(o.calibrationFile)) {
            o.errors.add("Calibration file does not exist: " + o.calibrationFile);
        }

        if (o.files.isEmpty()) o.errors.add("No file names given");
        for (Path f : o.files) {
            if (!Files.isRegularFile(f)) o.errors.add("File does not exist: " + f);
        }

        if (o.errors.isEmpty()) {
            o.settings = b.build();
            if (o.settings.isGrouped() && o.outputDirectory == null) {
                o.errors.add("If any of the group-by options are used, then the output directory option is mandatory");
            }
        }
        return o;
    }

    private Path pathArg(String[] args, int index, String flag) {
        if (index >= args.length) {
            errors.add(flag + " requires an argument");
            return null;
        }
        return Paths.get(args[index]);
    }

    private Integer intArg(String[] args, int index, String flag) {
        if (index >= args.length) {
            errors.add(flag + " requires an argument");
            return null;
        }
        try {
            return Integer.parseInt(args[index]);
        } catch (NumberFormatException e) {
            errors.add(flag + " expects an integer, not " + args[index]);
            return null;
        }
    }

    private Double doubleArg(String[] args, int index, String flag) {
        if (index >= args.length) {
            errors.add(flag + " requires an argument");
            return null;
        }
        try {
            return Double.parseDouble(args[index]);
        } catch (NumberFormatException e) {
            errors.add(flag + " expects a number, not " + args[index]);
            return null;
        }
    }

    public boolean isValid() { return errors.isEmpty(); }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public List<Path> getFiles() { return Collections.unmodifiableList(files); }
    public Path getOutputPath() { return outputPath; }
    public Path getOutputDirectory() { return outputDirectory; }
    public Integer getPedestal() { return pedestal; }
    public Path getCalibrationFile() { return calibrationFile; }

    /** Only available when {@link #isValid()}. */
    public CombineSettings getSettings() { return settings; }
}
