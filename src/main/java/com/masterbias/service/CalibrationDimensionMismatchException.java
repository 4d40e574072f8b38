package com.masterbias.service;

public class CalibrationDimensionMismatchException extends MasterMakerException {
    private final int expectedWidth, expectedHeight;
    private final int actualWidth, actualHeight;

    public CalibrationDimensionMismatchException(int expectedWidth, int expectedHeight, int actualWidth, int actualHeight) {
        super(String.format("Calibration frame is %dx%d but frames to combine are %dx%d",
                actualWidth, actualHeight, expectedWidth, expectedHeight));
        this.expectedWidth = expectedWidth;
        this.expectedHeight = expectedHeight;
        this.actualWidth = actualWidth;
        this.actualHeight = actualHeight;
    }

    public int getExpectedWidth() { return expectedWidth; }
    public int getExpectedHeight() { return expectedHeight; }
    public int getActualWidth() { return actualWidth; }
    public int getActualHeight() { return actualHeight; }
}
