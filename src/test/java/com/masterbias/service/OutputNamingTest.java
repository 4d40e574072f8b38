package com.masterbias.service;

import com.masterbias.model.CombineMethod;
import com.masterbias.model.FileDescriptor;
import com.masterbias.model.FrameType;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class OutputNamingTest {

    private final OutputNaming naming = new OutputNaming(
            Clock.fixed(Instant.parse("2025-11-02T03:07:00Z"), ZoneOffset.UTC));

    private static final FileDescriptor SAMPLE = new FileDescriptor(Path.of("/night/raw/bias_001.fit"),
            4656, 3520, 2, -9.96, 0.0001, "", FrameType.BIAS);

    @Test
    void testSubstituteTokens() {
        assertEquals("master-20251102-0307-Red.fit", naming.substitute("master-%d-%t-%f.fit", "Red"));
        assertEquals("originals-", naming.substitute("originals-%f", null));
        assertEquals("plain", naming.substitute("plain", "L"));
    }

    @Test
    void testGeneratedFileName() {
        assertEquals("BIAS-Sigma Clip-20251102-0307-0.000s--10.0C-4656x3520-2x2.fit",
                naming.fileName(CombineMethod.sigmaClip(3), SAMPLE));
        assertEquals("BIAS-Min-Max Clip-20251102-0307-0.000s--10.0C-4656x3520-2x2.fit",
                naming.fileName(CombineMethod.minMaxClip(2), SAMPLE));
    }

    @Test
    void testDefaultOutputPathIsSiblingOfSample() {
        Path path = naming.defaultOutputPath(CombineMethod.mean(), SAMPLE);
        assertEquals(Path.of("/night/raw"), path.getParent());
        assertTrue(path.getFileName().toString().startsWith("BIAS-Mean-20251102-0307"));
    }

    @Test
    void testUniquePathAddsCounterBeforeExtension() {
        Path candidate = Path.of("/out/master.fit");
        Set<Path> taken = Set.of(candidate, Path.of("/out/master-2.fit"));

        assertEquals(Path.of("/out/free.fit"), naming.uniquePath(Path.of("/out/free.fit"), taken::contains));
        assertEquals(Path.of("/out/master-3.fit"), naming.uniquePath(candidate, taken::contains));
        assertEquals(Path.of("/out/noext-2"),
                naming.uniquePath(Path.of("/out/noext"), p -> p.getFileName().toString().equals("noext")));
    }
}
