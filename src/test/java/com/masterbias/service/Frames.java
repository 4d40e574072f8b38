package com.masterbias.service;

import com.masterbias.model.FileDescriptor;
import com.masterbias.model.FrameType;

import java.nio.file.Path;

// Descriptores de prueba
final class Frames {

    private Frames() {
    }

    static FileDescriptor bias(String name, int width, int height, int binning, double temperature) {
        return new FileDescriptor(Path.of("/data", name).toAbsolutePath(), width, height, binning,
                temperature, 0.0, "", FrameType.BIAS);
    }

    static FileDescriptor bias(String name, double temperature) {
        return bias(name, 4, 3, 1, temperature);
    }

    static FileDescriptor frame(String name, FrameType type, String filter) {
        return new FileDescriptor(Path.of("/data", name).toAbsolutePath(), 4, 3, 1,
                -10.0, 1.0, filter, type);
    }
}
