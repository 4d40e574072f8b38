package com.masterbias.model;

import java.util.Objects;

/**
 * Settings of one combining session. Seeded from {@link AppConfig} and then overridden by
 * whoever drives the session (command line, tests).
 */
public final class CombineSettings {

    private final CombineMethod combineMethod;
    private final Precalibration precalibration;
    private final FrameType requiredType;
    private final boolean ignoreFileType;
    private final boolean ignoreFilter;
    private final InputDisposition disposition;
    private final String dispositionSubfolder;
    private final boolean groupBySize;
    private final boolean groupByTemperature;
    private final double temperatureTolerance;
    private final boolean ignoreSmallGroups;
    private final int minimumGroupSize;

    private CombineSettings(Builder b) {
        this.combineMethod = Objects.requireNonNull(b.combineMethod, "combineMethod");
        this.precalibration = Objects.requireNonNull(b.precalibration, "precalibration");
        this.requiredType = Objects.requireNonNull(b.requiredType, "requiredType");
        this.ignoreFileType = b.ignoreFileType;
        this.ignoreFilter = b.ignoreFilter;
        this.disposition = Objects.requireNonNull(b.disposition, "disposition");
        this.dispositionSubfolder = b.dispositionSubfolder;
        this.groupBySize = b.groupBySize;
        this.groupByTemperature = b.groupByTemperature;
        this.temperatureTolerance = b.temperatureTolerance;
        this.ignoreSmallGroups = b.ignoreSmallGroups;
        this.minimumGroupSize = b.minimumGroupSize;
        if (temperatureTolerance < 0) {
            throw new IllegalArgumentException("Temperature tolerance must be >= 0, not " + temperatureTolerance);
        }
        if (ignoreSmallGroups && minimumGroupSize < 1) {
            throw new IllegalArgumentException("Minimum group size must be > 0, not " + minimumGroupSize);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Builder preloaded with the stored preferences. */
    public static Builder fromPreferences() {
        return new Builder()
                .combineMethod(AppConfig.getCombineMethod())
                .disposition(AppConfig.getInputDisposition())
                .dispositionSubfolder(AppConfig.getDispositionSubfolderName())
                .groupBySize(AppConfig.getGroupBySize())
                .groupByTemperature(AppConfig.getGroupByTemperature())
                .temperatureTolerance(AppConfig.getTemperatureTolerance())
                .ignoreSmallGroups(AppConfig.getIgnoreGroupsFewerThan())
                .minimumGroupSize(AppConfig.getMinimumGroupSize());
    }

    public CombineMethod combineMethod() { return combineMethod; }
    public Precalibration precalibration() { return precalibration; }
    public FrameType requiredType() { return requiredType; }
    public boolean ignoreFileType() { return ignoreFileType; }
    public boolean ignoreFilter() { return ignoreFilter; }
    public InputDisposition disposition() { return disposition; }
    public String dispositionSubfolder() { return dispositionSubfolder; }
    public boolean groupBySize() { return groupBySize; }
    public boolean groupByTemperature() { return groupByTemperature; }
    public double temperatureTolerance() { return temperatureTolerance; }
    public boolean ignoreSmallGroups() { return ignoreSmallGroups; }
    public int minimumGroupSize() { return minimumGroupSize; }

    public boolean isGrouped() {
        return groupBySize || groupByTemperature;
    }

    // 0 = no se descarta ningun grupo
    public int effectiveMinimumGroupSize() {
        return ignoreSmallGroups ? minimumGroupSize : 0;
    }

    public Builder toBuilder() {
        return new Builder()
                .combineMethod(combineMethod)
                .precalibration(precalibration)
                .requiredType(requiredType)
                .ignoreFileType(ignoreFileType)
                .ignoreFilter(ignoreFilter)
                .disposition(disposition)
                .dispositionSubfolder(dispositionSubfolder)
                .groupBySize(groupBySize)
                .groupByTemperature(groupByTemperature)
                .temperatureTolerance(temperatureTolerance)
                .ignoreSmallGroups(ignoreSmallGroups)
                .minimumGroupSize(minimumGroupSize);
    }

    public static final class Builder {
        private CombineMethod combineMethod = CombineMethod.sigmaClip(3.0);
        private Precalibration precalibration = Precalibration.none();
        private FrameType requiredType = FrameType.BIAS;
        private boolean ignoreFileType;
        private boolean ignoreFilter;
        private InputDisposition disposition = InputDisposition.NOTHING;
        private String dispositionSubfolder = "originals-%d-%t";
        private boolean groupBySize;
        private boolean groupByTemperature;
        private double temperatureTolerance = 0.10;
        private boolean ignoreSmallGroups;
        private int minimumGroupSize = 3;

        private Builder() {
        }

        public Builder combineMethod(CombineMethod v) { this.combineMethod = v; return this; }
        public Builder precalibration(Precalibration v) { this.precalibration = v; return this; }
        public Builder requiredType(FrameType v) { this.requiredType = v; return this; }
        public Builder ignoreFileType(boolean v) { this.ignoreFileType = v; return this; }
        public Builder ignoreFilter(boolean v) { this.ignoreFilter = v; return this; }
        public Builder disposition(InputDisposition v) { this.disposition = v; return this; }
        public Builder dispositionSubfolder(String v) { this.dispositionSubfolder = v; return this; }
        public Builder groupBySize(boolean v) { this.groupBySize = v; return this; }
        public Builder groupByTemperature(boolean v) { this.groupByTemperature = v; return this; }
        public Builder temperatureTolerance(double v) { this.temperatureTolerance = v; return this; }
        public Builder ignoreSmallGroups(boolean v) { this.ignoreSmallGroups = v; return this; }
        public Builder minimumGroupSize(int v) { this.minimumGroupSize = v; return this; }

        public CombineSettings build() {
            return new CombineSettings(this);
        }
    }
}
