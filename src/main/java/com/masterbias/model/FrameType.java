package com.masterbias.model;

public enum FrameType {
    UNKNOWN("UNKNOWN"),
    LIGHT("LIGHT"),
    BIAS("BIAS"),
    DARK("DARK"),
    FLAT("FLAT");

    private final String fitsLabel;

    FrameType(String fitsLabel) {
        this.fitsLabel = fitsLabel;
    }

    // Valor para la clave IMAGETYP
    public String fitsLabel() {
        return fitsLabel;
    }
}
