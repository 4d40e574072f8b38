package com.masterbias.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.prefs.Preferences;

public class AppConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);
    private static final Preferences prefs = Preferences.userNodeForPackage(AppConfig.class);

    // Metodo de combinacion
    private static final String KEY_METHOD = "master_combine_method";
    private static final String KEY_MINMAX_DROP = "min_max_number_clipped_per_end";
    private static final String KEY_SIGMA = "sigma_clip_threshold";

    // Disposicion de entradas
    private static final String KEY_DISPOSITION = "input_file_disposition";
    private static final String KEY_SUBFOLDER = "disposition_subfolder_name";

    // Agrupamiento
    private static final String KEY_GROUP_SIZE = "group_by_size";
    private static final String KEY_GROUP_TEMP = "group_by_temperature";
    private static final String KEY_TEMP_TOL = "temperature_group_tolerance";
    private static final String KEY_IGNORE_SMALL = "ignore_groups_fewer_than";
    private static final String KEY_MIN_GROUP = "minimum_group_size";

    private static final int DEFAULT_MINMAX_DROP = 2;
    private static final double DEFAULT_SIGMA = 3.0;

    public static final String METHOD_MEAN = "MEAN";
    public static final String METHOD_MEDIAN = "MEDIAN";
    public static final String METHOD_MINMAX = "MINMAX";
    public static final String METHOD_SIGMA = "SIGMA";

    // --- METODO ---
    public static String getCombineMethodName() { return prefs.get(KEY_METHOD, METHOD_SIGMA); }

    public static int getMinMaxDrop() { return prefs.getInt(KEY_MINMAX_DROP, DEFAULT_MINMAX_DROP); }

    public static double getSigmaThreshold() { return prefs.getDouble(KEY_SIGMA, DEFAULT_SIGMA); }

    public static CombineMethod getCombineMethod() {
        return combineMethodFor(getCombineMethodName(), getMinMaxDrop(), getSigmaThreshold());
    }

    // Un valor guardado fuera de rango vuelve al valor por defecto
    public static CombineMethod combineMethodFor(String name, int drop, double threshold) {
        switch (name) {
            case METHOD_MEAN: return CombineMethod.mean();
            case METHOD_MEDIAN: return CombineMethod.median();
            case METHOD_MINMAX:
                if (drop < 0) {
                    logger.warn("Stored min-max drop {} is invalid, using {}", drop, DEFAULT_MINMAX_DROP);
                    drop = DEFAULT_MINMAX_DROP;
                }
                return CombineMethod.minMaxClip(drop);
            default:
                if (!(threshold > 0)) {
                    logger.warn("Stored sigma threshold {} is invalid, using {}", threshold, DEFAULT_SIGMA);
                    threshold = DEFAULT_SIGMA;
                }
                return CombineMethod.sigmaClip(threshold);
        }
    }

    // --- DISPOSICION ---
    public static InputDisposition getInputDisposition() {
        try {
            return InputDisposition.valueOf(prefs.get(KEY_DISPOSITION, InputDisposition.NOTHING.name()));
        } catch (IllegalArgumentException e) {
            return InputDisposition.NOTHING;
        }
    }

    // %d = fecha, %t = hora, %f = filtro
    public static String getDispositionSubfolderName() { return prefs.get(KEY_SUBFOLDER, "originals-%d-%t"); }

    // --- GRUPOS ---
    public static boolean getGroupBySize() { return prefs.getBoolean(KEY_GROUP_SIZE, false); }

    public static boolean getGroupByTemperature() { return prefs.getBoolean(KEY_GROUP_TEMP, false); }

    // Fraccion: 0.10 = 10%
    public static double getTemperatureTolerance() {
        double v = prefs.getDouble(KEY_TEMP_TOL, 0.10);
        return (v >= 0) ? v : 0.10;
    }

    public static boolean getIgnoreGroupsFewerThan() { return prefs.getBoolean(KEY_IGNORE_SMALL, false); }

    public static int getMinimumGroupSize() {
        int v = prefs.getInt(KEY_MIN_GROUP, 3);
        return (v > 0) ? v : 3;
    }
}
