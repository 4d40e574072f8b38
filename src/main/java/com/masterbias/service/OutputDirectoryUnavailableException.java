package com.masterbias.service;

import java.nio.file.Path;

public class OutputDirectoryUnavailableException extends MasterMakerException {
    private final Path directory;

    public OutputDirectoryUnavailableException(Path directory) {
        super("Output directory " + directory + " does not exist and could not be created");
        this.directory = directory;
    }

    public Path getDirectory() {
        return directory;
    }
}
