package com.masterbias.service;

import com.masterbias.model.FileDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

public class FileDispositionService {
    private static final Logger logger = LoggerFactory.getLogger(FileDispositionService.class);

    /**
     * Moves the frame into {@code subfolderName} beside it, creating the folder if needed.
     * Returns false (and logs) when the move fails; a failed move never aborts the session.
     */
    public boolean moveToSubfolder(FileDescriptor descriptor, String subfolderName) {
        Path source = descriptor.absolutePath();
        Path folder = source.resolveSibling(subfolderName);
        try {
            Files.createDirectories(folder);
            Files.move(source, folder.resolve(source.getFileName()), StandardCopyOption.REPLACE_EXISTING);
            return true;
        } catch (IOException e) {
            logger.warn("Unable to move {} to {}: {}", source, folder, e.getMessage());
            return false;
        }
    }
}
