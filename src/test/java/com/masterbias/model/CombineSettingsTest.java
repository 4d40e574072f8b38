package com.masterbias.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CombineSettingsTest {

    @Test
    void testDefaults() {
        CombineSettings settings = CombineSettings.builder().build();
        assertEquals(CombineMethod.sigmaClip(3.0), settings.combineMethod());
        assertEquals(Precalibration.none(), settings.precalibration());
        assertEquals(FrameType.BIAS, settings.requiredType());
        assertEquals(InputDisposition.NOTHING, settings.disposition());
        assertFalse(settings.isGrouped());
        assertEquals(0, settings.effectiveMinimumGroupSize());
    }

    @Test
    void testMinimumGroupSizeOnlyAppliesWhenIgnoringSmallGroups() {
        CombineSettings settings = CombineSettings.builder().minimumGroupSize(5).build();
        assertEquals(0, settings.effectiveMinimumGroupSize());
        assertEquals(5, settings.toBuilder().ignoreSmallGroups(true).build().effectiveMinimumGroupSize());
    }

    @Test
    void testInvalidValuesRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> CombineSettings.builder().temperatureTolerance(-0.1).build());
        assertThrows(IllegalArgumentException.class,
                () -> CombineSettings.builder().ignoreSmallGroups(true).minimumGroupSize(0).build());
        assertThrows(NullPointerException.class,
                () -> CombineSettings.builder().combineMethod(null).build());
    }

    @Test
    void testToBuilderCopiesEverything() {
        CombineSettings original = CombineSettings.builder()
                .combineMethod(CombineMethod.minMaxClip(1))
                .precalibration(Precalibration.pedestal(20))
                .requiredType(FrameType.DARK)
                .ignoreFileType(true)
                .ignoreFilter(true)
                .disposition(InputDisposition.SUBFOLDER)
                .dispositionSubfolder("x-%f")
                .groupBySize(true)
                .groupByTemperature(true)
                .temperatureTolerance(0.25)
                .ignoreSmallGroups(true)
                .minimumGroupSize(4)
                .build();

        CombineSettings copy = original.toBuilder().build();

        assertEquals(original.combineMethod(), copy.combineMethod());
        assertEquals(original.precalibration(), copy.precalibration());
        assertEquals(FrameType.DARK, copy.requiredType());
        assertTrue(copy.ignoreFileType());
        assertTrue(copy.ignoreFilter());
        assertEquals(InputDisposition.SUBFOLDER, copy.disposition());
        assertEquals("x-%f", copy.dispositionSubfolder());
        assertTrue(copy.isGrouped());
        assertEquals(0.25, copy.temperatureTolerance());
        assertEquals(4, copy.effectiveMinimumGroupSize());
    }

    @Test
    void testStoredPreferencesGiveValidSettingsWithoutPrecalibration() {
        // Las preferencias no guardan pre-calibracion: solo -p o -c la activan
        CombineSettings settings = CombineSettings.fromPreferences().build();
        assertEquals(Precalibration.none(), settings.precalibration());
        assertEquals(FrameType.BIAS, settings.requiredType());
        assertTrue(settings.temperatureTolerance() >= 0);
    }
}
