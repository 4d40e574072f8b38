package com.masterbias.main;

import com.masterbias.model.CombineSettings;
import com.masterbias.model.FrameType;
import com.masterbias.model.MasterFrame;
import com.masterbias.model.PixelPlane;
import com.masterbias.service.FitsFrameStore;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineHandlerTest {

    @TempDir
    Path tempDir;

    private final FitsFrameStore store = new FitsFrameStore();
    private final CommandLineHandler handler = new CommandLineHandler(store);

    // Un frame de entrada real en disco, con todos los pixeles a 'fill'
    private String frame(String name, int width, int height, FrameType type, int fill) throws IOException {
        int[] pixels = new int[width * height];
        Arrays.fill(pixels, fill);
        Path path = tempDir.resolve(name);
        store.writeMaster(path, new MasterFrame(new PixelPlane(width, height, pixels), type,
                0.001, -10.0, "", 1, "test frame"));
        return path.toString();
    }

    @Test
    void testCombinesFilesIntoNamedOutput() throws Exception {
        String a = frame("bias_1.fit", 4, 3, FrameType.BIAS, 1000);
        String b = frame("bias_2.fit", 4, 3, FrameType.BIAS, 1010);
        String c = frame("bias_3.fit", 4, 3, FrameType.BIAS, 1020);
        Path output = tempDir.resolve("master.fit");

        int code = handler.execute(new String[]{"-n", "-o", output.toString(), a, b, c}, CombineSettings.builder());

        assertEquals(0, code);
        PixelPlane master = store.readPlane(output);
        for (int v : master.pixels()) assertEquals(1010, v);
        assertEquals(FrameType.BIAS, store.readDescriptor(output).type());
    }

    @Test
    void testPedestalFromCommandLine() throws Exception {
        String a = frame("bias_1.fit", 2, 2, FrameType.BIAS, 300);
        Path output = tempDir.resolve("master.fit");

        assertEquals(0, handler.execute(new String[]{"-m", "-p", "100", "-o", output.toString(), a},
                CombineSettings.builder()));

        assertEquals(200, store.readPlane(output).get(1, 1));
    }

    @Test
    void testCalibrationFrameFromCommandLine() throws Exception {
        String a = frame("bias_1.fit", 2, 2, FrameType.BIAS, 300);
        String cal = frame("reference.fit", 2, 2, FrameType.BIAS, 50);
        Path output = tempDir.resolve("master.fit");

        assertEquals(0, handler.execute(new String[]{"-m", "-c", cal, "-o", output.toString(), a},
                CombineSettings.builder()));
        assertEquals(250, store.readPlane(output).get(0, 0));

        String smallCal = frame("small.fit", 1, 1, FrameType.BIAS, 50);
        assertEquals(1, handler.execute(new String[]{"-m", "-c", smallCal, "-o", output.toString(), a},
                CombineSettings.builder()));
    }

    @Test
    void testGroupedRunWritesIntoDirectory() throws Exception {
        String a = frame("bias_1.fit", 4, 3, FrameType.BIAS, 10);
        String b = frame("bias_2.fit", 4, 3, FrameType.BIAS, 10);
        String c = frame("bias_3.fit", 6, 2, FrameType.BIAS, 20);
        Path out = tempDir.resolve("masters");

        int code = handler.execute(new String[]{"-m", "-gs", "-od", out.toString(), a, b, c},
                CombineSettings.builder());

        assertEquals(0, code);
        try (Stream<Path> files = Files.list(out)) {
            List<String> names = files.map(p -> p.getFileName().toString()).sorted().collect(Collectors.toList());
            assertEquals(2, names.size());
            assertTrue(names.get(0).endsWith("-4x3-1x1.fit"));
            assertTrue(names.get(1).endsWith("-6x2-1x1.fit"));
        }
    }

    @Test
    void testWrongFrameTypeFails() throws Exception {
        String a = frame("bias_1.fit", 2, 2, FrameType.BIAS, 1);
        String d = frame("dark_1.fit", 2, 2, FrameType.DARK, 1);
        Path output = tempDir.resolve("master.fit");

        assertEquals(1, handler.execute(new String[]{"-m", "-o", output.toString(), a, d},
                CombineSettings.builder()));
        assertFalse(Files.exists(output));

        assertEquals(0, handler.execute(new String[]{"-m", "-t", "-o", output.toString(), a, d},
                CombineSettings.builder()));
        assertTrue(Files.exists(output));
    }

    @Test
    void testInvalidArgumentsFail() {
        assertEquals(1, handler.execute(new String[]{"-m", "-n"}, CombineSettings.builder()));
    }

    @Test
    void testUnreadableInputFails() throws Exception {
        Path junk = Files.writeString(tempDir.resolve("junk.fit"), "");
        assertEquals(1, handler.execute(new String[]{"-m", junk.toString()}, CombineSettings.builder()));
    }

    @Test
    void testCancelledSessionWritesNothingAndFails() throws Exception {
        String a = frame("bias_1.fit", 2, 2, FrameType.BIAS, 1);
        Path output = tempDir.resolve("master.fit");
        handler.getSession().cancel();

        assertEquals(1, handler.execute(new String[]{"-m", "-o", output.toString(), a}, CombineSettings.builder()));
        assertFalse(Files.exists(output));
    }

    @Test
    void testShutdownHookCancelsSession() throws Exception {
        Thread worker = new Thread(() -> { });
        worker.start();
        worker.join();

        Thread hook = MasterBiasMakerApp.cancelOnShutdown(handler, worker);
        hook.start();
        hook.join();

        assertTrue(handler.getSession().threadCancelled());
    }
}
