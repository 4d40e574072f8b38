package com.masterbias.model;

public class MasterFrame {
    public final PixelPlane plane;
    public final FrameType type;

    // Metadatos agregados del grupo
    public final double exposure;      // media de EXPTIME (s)
    public final double temperature;   // media de CCD-TEMP (C)
    public final String filterName;    // filtro mas comun del grupo
    public final int binning;
    public final String comment;       // procedencia: metodo y parametros

    public MasterFrame(PixelPlane plane, FrameType type, double exposure, double temperature,
                       String filterName, int binning, String comment) {
        this.plane = plane;
        this.type = type;
        this.exposure = exposure;
        this.temperature = temperature;
        this.filterName = filterName;
        this.binning = binning;
        this.comment = comment;
    }
}
