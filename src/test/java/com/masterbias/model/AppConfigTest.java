package com.masterbias.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void testStoredMethodNames() {
        assertEquals(CombineMethod.mean(), AppConfig.combineMethodFor(AppConfig.METHOD_MEAN, 2, 3.0));
        assertEquals(CombineMethod.median(), AppConfig.combineMethodFor(AppConfig.METHOD_MEDIAN, 2, 3.0));
        assertEquals(CombineMethod.minMaxClip(4), AppConfig.combineMethodFor(AppConfig.METHOD_MINMAX, 4, 3.0));
        assertEquals(CombineMethod.sigmaClip(2.0), AppConfig.combineMethodFor(AppConfig.METHOD_SIGMA, 2, 2.0));
        // Nombre desconocido: sigma clip
        assertEquals(CombineMethod.sigmaClip(2.0), AppConfig.combineMethodFor("BOGUS", 2, 2.0));
    }

    @Test
    void testOutOfRangeStoredValuesFallBackToDefaults() {
        assertEquals(CombineMethod.minMaxClip(2), AppConfig.combineMethodFor(AppConfig.METHOD_MINMAX, -1, 3.0));
        assertEquals(CombineMethod.sigmaClip(3.0), AppConfig.combineMethodFor(AppConfig.METHOD_SIGMA, 2, 0.0));
        assertEquals(CombineMethod.sigmaClip(3.0), AppConfig.combineMethodFor(AppConfig.METHOD_SIGMA, 2, -4.0));
        assertEquals(CombineMethod.sigmaClip(3.0), AppConfig.combineMethodFor(AppConfig.METHOD_SIGMA, 2, Double.NaN));
    }
}
