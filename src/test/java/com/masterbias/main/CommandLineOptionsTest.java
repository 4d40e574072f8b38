package com.masterbias.main;

import com.masterbias.model.CombineMethod;
import com.masterbias.model.CombineSettings;
import com.masterbias.model.InputDisposition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    @TempDir
    Path tempDir;

    private String a;
    private String b;

    @BeforeEach
    void setUp() throws Exception {
        a = Files.createFile(tempDir.resolve("bias_1.fit")).toString();
        b = Files.createFile(tempDir.resolve("bias_2.fit")).toString();
    }

    private static CommandLineOptions parse(String... args) {
        return CommandLineOptions.parse(args, CombineSettings.builder());
    }

    @Test
    void testDefaultsWhenOnlyFilesGiven() {
        CommandLineOptions o = parse(a, b);

        assertTrue(o.isValid(), () -> o.getErrors().toString());
        assertEquals(List.of(Path.of(a), Path.of(b)), o.getFiles());
        assertEquals(CombineMethod.sigmaClip(3.0), o.getSettings().combineMethod());
        assertNull(o.getOutputPath());
        assertNull(o.getPedestal());
    }

    @Test
    void testMethodFlags() {
        assertEquals(CombineMethod.mean(), parse("-m", a).getSettings().combineMethod());
        assertEquals(CombineMethod.median(), parse("-n", a).getSettings().combineMethod());
        assertEquals(CombineMethod.minMaxClip(3), parse("-mm", "3", a).getSettings().combineMethod());
        assertEquals(CombineMethod.sigmaClip(2.5), parse("-s", "2.5", a).getSettings().combineMethod());
    }

    @Test
    void testOnlyOneMethodAllowed() {
        CommandLineOptions o = parse("-m", "-n", a);
        assertFalse(o.isValid());
        assertTrue(o.getErrors().contains("Only one of -m, -n, -mm, -s may be given"));
    }

    @Test
    void testBadMethodArguments() {
        assertFalse(parse("-mm", "0", a).isValid());
        assertFalse(parse("-s", "-1", a).isValid());
        assertFalse(parse("-s", "abc", a).isValid());
        assertFalse(parse(a, "-mm").isValid());
    }

    @Test
    void testPedestalAndCalibrationAreExclusive() {
        CommandLineOptions pedestal = parse("-p", "100", a);
        assertTrue(pedestal.isValid());
        assertEquals(100, pedestal.getPedestal().intValue());

        CommandLineOptions calibration = parse("-c", b, a);
        assertTrue(calibration.isValid());
        assertEquals(Path.of(b), calibration.getCalibrationFile());

        CommandLineOptions both = parse("-p", "100", "-c", b, a);
        assertFalse(both.isValid());
        assertTrue(both.getErrors().contains("Only one of -p, -c may be given"));

        assertFalse(parse("-p", "-5", a).isValid());
        assertFalse(parse("-c", tempDir.resolve("missing.fit").toString(), a).isValid());
    }

    @Test
    void testGroupingRequiresOutputDirectory() {
        CommandLineOptions o = parse("-gs", a, b);
        assertFalse(o.isValid());
        assertTrue(o.getErrors().get(0).startsWith("If any of the group-by options are used"));

        CommandLineOptions ok = parse("-gs", "-gt", "15", "-mg", "4", "-od", tempDir.toString(), a, b);
        assertTrue(ok.isValid(), () -> ok.getErrors().toString());
        CombineSettings s = ok.getSettings();
        assertTrue(s.groupBySize());
        assertTrue(s.groupByTemperature());
        assertEquals(0.15, s.temperatureTolerance(), 1e-12);
        assertEquals(4, s.effectiveMinimumGroupSize());
        assertEquals(tempDir, ok.getOutputDirectory());
    }

    @Test
    void testTemperatureToleranceRange() {
        assertFalse(parse("-gt", "150", "-od", tempDir.toString(), a).isValid());
        assertFalse(parse("-mg", "0", a).isValid());
    }

    @Test
    void testDispositionAndIgnoreType() {
        CommandLineOptions o = parse("-t", "-v", "done-%d", a);
        assertTrue(o.isValid());
        assertTrue(o.getSettings().ignoreFileType());
        assertEquals(InputDisposition.SUBFOLDER, o.getSettings().disposition());
        assertEquals("done-%d", o.getSettings().dispositionSubfolder());
    }

    @Test
    void testFileProblems() {
        assertTrue(parse().getErrors().contains("No file names given"));
        String missing = tempDir.resolve("nope.fit").toString();
        assertTrue(parse(a, missing).getErrors().contains("File does not exist: " + missing));
        assertTrue(parse("-x", a).getErrors().contains("Unknown option -x"));
    }

    @Test
    void testFlagsOverridePreferenceDefaults() {
        CombineSettings.Builder stored = CombineSettings.builder()
                .combineMethod(CombineMethod.median())
                .groupBySize(true);
        CommandLineOptions o = CommandLineOptions.parse(new String[]{"-m", "-od", tempDir.toString(), a}, stored);

        assertTrue(o.isValid());
        assertEquals(CombineMethod.mean(), o.getSettings().combineMethod());
        assertTrue(o.getSettings().groupBySize());
    }
}
