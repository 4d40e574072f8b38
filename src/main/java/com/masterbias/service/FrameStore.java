package com.masterbias.service;

import com.masterbias.model.FileDescriptor;
import com.masterbias.model.MasterFrame;
import com.masterbias.model.PixelPlane;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Storage the engine reads frames from and writes masters to.
 */
public interface FrameStore {

    FileDescriptor readDescriptor(Path path) throws IOException;

    PixelPlane readPlane(Path path) throws IOException;

    void writeMaster(Path path, MasterFrame master) throws IOException;
}
