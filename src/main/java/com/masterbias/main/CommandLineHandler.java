package com.masterbias.main;

import com.masterbias.model.CombineSettings;
import com.masterbias.model.FileDescriptor;
import com.masterbias.model.Precalibration;
import com.masterbias.service.CalibrationDimensionMismatchException;
import com.masterbias.service.Console;
import com.masterbias.service.EmptyInputException;
import com.masterbias.service.FileCombiner;
import com.masterbias.service.FilterMismatchException;
import com.masterbias.service.FitsFrameStore;
import com.masterbias.service.IncompatibleSizesException;
import com.masterbias.service.LoggingConsole;
import com.masterbias.service.MasterMakerException;
import com.masterbias.service.OutputDirectoryUnavailableException;
import com.masterbias.service.SessionController;
import com.masterbias.service.WrongFrameTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AccessDeniedException;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * Runs one combining session from command-line arguments, no GUI.
 */
public class CommandLineHandler {
    private static final Logger logger = LoggerFactory.getLogger(CommandLineHandler.class);

    private final FitsFrameStore store;
    private final SessionController session = new SessionController();

    public CommandLineHandler() {
        this(new FitsFrameStore());
    }

    CommandLineHandler(FitsFrameStore store) {
        this.store = store;
    }

    /** @return process exit code, 0 on success */
    public int execute(String[] args, CombineSettings.Builder defaults) {
        CommandLineOptions options = CommandLineOptions.parse(args, defaults);
        if (!options.isValid()) {
            options.getErrors().forEach(e -> logger.error(e));
            System.out.println(CommandLineOptions.USAGE);
            return 1;
        }

        Console console = new LoggingConsole();
        console.message("Starting session", 0);
        try {
            CombineSettings settings = withPrecalibration(options);
            List<FileDescriptor> descriptors = store.readDescriptors(options.getFiles());
            FileCombiner combiner = new FileCombiner(store, path -> logger.debug("Input moved: {}", path));

            if (settings.isGrouped()) {
                combiner.processGroups(settings, descriptors, options.getOutputDirectory(), console, session);
            } else {
                combiner.combineSingle(descriptors, settings, options.getOutputPath(), console, session);
            }
            if (session.threadCancelled()) {
                logger.warn("Session cancelled before all groups were combined");
                return 1;
            }
            console.message("Successful completion", 0);
            return 0;
        } catch (MasterMakerException e) {
            reportError(e);
            return 1;
        } catch (NoSuchFileException e) {
            errorMessage("File not found", "File \"" + e.getFile() + "\" not found or not readable");
            return 1;
        } catch (AccessDeniedException e) {
            errorMessage("Unable to write file", "The file \"" + e.getFile()
                    + "\" cannot be written or replaced: permission error");
            return 1;
        } catch (IOException e) {
            logger.debug("I/O failure", e);
            errorMessage("I/O error", e.getMessage());
            return 1;
        }
    }

    /** Cancel flag of this handler's session; cancelling it stops the run between groups. */
    public SessionController getSession() {
        return session;
    }

    private CombineSettings withPrecalibration(CommandLineOptions options) throws IOException {
        CombineSettings settings = options.getSettings();
        if (options.getCalibrationFile() != null) {
            return settings.toBuilder()
                    .precalibration(Precalibration.fixedFrame(store.readPlane(options.getCalibrationFile())))
                    .build();
        }
        if (options.getPedestal() != null) {
            return settings.toBuilder().precalibration(Precalibration.pedestal(options.getPedestal())).build();
        }
        return settings;
    }

    // Un mensaje distinto por cada tipo de fallo
    private void reportError(MasterMakerException e) {
        if (e instanceof OutputDirectoryUnavailableException) {
            errorMessage("Group Directory Missing", "The specified output directory \""
                    + ((OutputDirectoryUnavailableException) e).getDirectory()
                    + "\" does not exist and could not be created.");
        } else if (e instanceof WrongFrameTypeException) {
            errorMessage("The selected files are not all " + ((WrongFrameTypeException) e).getRequiredType().fitsLabel()
                            + " frames",
                    "If you know the files are the right type, they may not have proper FITS data "
                            + "internally. Use the -t option to proceed anyway.");
        } else if (e instanceof IncompatibleSizesException) {
            errorMessage("The selected files can't be combined", e.getMessage());
        } else if (e instanceof FilterMismatchException) {
            errorMessage("The selected files use different filters", e.getMessage());
        } else if (e instanceof CalibrationDimensionMismatchException) {
            errorMessage("Calibration frame doesn't fit", e.getMessage());
        } else if (e instanceof EmptyInputException) {
            errorMessage("Nothing to combine", e.getMessage());
        } else {
            errorMessage("Combine failed", e.getMessage());
        }
    }

    private void errorMessage(String shortMessage, String longMessage) {
        logger.error("*** ERROR *** {}:\n   {}", shortMessage, longMessage);
    }
}
