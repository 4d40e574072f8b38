package com.masterbias.service;

import com.masterbias.model.FileDescriptor;
import com.masterbias.model.FrameType;
import com.masterbias.model.MasterFrame;
import com.masterbias.model.PixelPlane;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class FitsFrameStore implements FrameStore {
    private static final Logger logger = LoggerFactory.getLogger(FitsFrameStore.class);

    // Palabras del nombre de archivo que indican un LIGHT cuando no hay IMAGETYP
    private static final String[] LIGHT_KEYWORDS = {"light", "lum", "red", "green", "blue", "ha"};

    private static final int UNSIGNED_16_ZERO = 32768;

    @Override
    public FileDescriptor readDescriptor(Path path) throws IOException {
        requireExists(path);
        try (Fits fits = new Fits(path.toFile())) {
            Header header = primaryHdu(fits, path).getHeader();

            FrameType type = header.containsKey("IMAGETYP")
                    ? typeFromLabel(header.getStringValue("IMAGETYP"))
                    : typeFromFileName(path.getFileName().toString());

            int binning = header.getIntValue("XBINNING", 1);
            String filter = header.getStringValue("FILTER");
            filter = (filter == null) ? "" : filter.trim();
            int width = header.getIntValue("NAXIS1", 0);
            int height = header.getIntValue("NAXIS2", 0);

            // EXPOSURE tiene prioridad sobre EXPTIME
            double exposure = header.containsKey("EXPOSURE")
                    ? header.getDoubleValue("EXPOSURE", 0)
                    : header.getDoubleValue("EXPTIME", 0);
            double temperature = header.getDoubleValue("CCD-TEMP", 0);

            return new FileDescriptor(path.toAbsolutePath(), width, height, binning,
                    temperature, exposure, filter, type);
        } catch (FitsException e) {
            throw new IOException("Unable to read FITS header of " + path, e);
        }
    }

    /** Reads descriptors for all paths; the first unreadable file aborts with its path. */
    public List<FileDescriptor> readDescriptors(List<Path> paths) throws IOException {
        List<FileDescriptor> result = new ArrayList<>();
        for (Path p : paths) result.add(readDescriptor(p));
        return result;
    }

    @Override
    public PixelPlane readPlane(Path path) throws IOException {
        requireExists(path);
        try (Fits fits = new Fits(path.toFile())) {
            BasicHDU<?> hdu = primaryHdu(fits, path);
            Header header = hdu.getHeader();
            double bzero = header.getDoubleValue("BZERO", 0);
            double bscale = header.getDoubleValue("BSCALE", 1);
            return toPlane(hdu.getKernel(), bzero, bscale, path);
        } catch (FitsException e) {
            throw new IOException("Unable to read FITS data of " + path, e);
        }
    }

    @Override
    public void writeMaster(Path path, MasterFrame master) throws IOException {
        PixelPlane plane = master.plane;
        Path partial = path.resolveSibling(path.getFileName() + ".part");
        // Entero 16 bits sin signo: se guarda con BZERO = 32768
        short[][] data = new short[plane.height()][plane.width()];
        for (int y = 0; y < plane.height(); y++)
            for (int x = 0; x < plane.width(); x++)
                data[y][x] = (short) (plane.get(x, y) - UNSIGNED_16_ZERO);

        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(data);
            Header header = hdu.getHeader();
            header.addValue("BZERO", UNSIGNED_16_ZERO, "offset for unsigned 16-bit data");
            header.addValue("BSCALE", 1, "");
            header.addValue("IMAGETYP", master.type.fitsLabel(), "frame type");
            header.addValue("FILTER", master.filterName, "filter");
            header.addValue("EXPTIME", master.exposure, "mean exposure of combined frames (s)");
            header.addValue("CCD-TEMP", master.temperature, "mean CCD temperature (C)");
            header.addValue("XBINNING", master.binning, "");
            header.addValue("YBINNING", master.binning, "");
            header.insertComment(master.comment);
            fits.addHDU(hdu);
            // Se escribe al lado y se renombra: un fallo no destruye el master anterior
            if (Files.isRegularFile(partial)) Files.delete(partial);
            fits.write(partial.toFile());
            Files.move(partial, path, StandardCopyOption.REPLACE_EXISTING);
            logger.debug("Wrote {}x{} master to {}", plane.width(), plane.height(), path);
        } catch (FitsException e) {
            discardPartial(partial);
            throw new IOException("Unable to write FITS file " + path, e);
        } catch (IOException e) {
            discardPartial(partial);
            throw e;
        }
    }

    private static void discardPartial(Path partial) {
        try {
            if (Files.isRegularFile(partial)) Files.delete(partial);
        } catch (IOException e) {
            logger.warn("Unable to remove partial file {}: {}", partial, e.getMessage());
        }
    }

    static FrameType typeFromLabel(String label) {
        String upper = (label == null) ? "" : label.toUpperCase(Locale.ROOT);
        if (upper.contains("BIAS")) return FrameType.BIAS;
        if (upper.contains("DARK")) return FrameType.DARK;
        if (upper.contains("FLAT")) return FrameType.FLAT;
        if (upper.contains("LIGHT")) return FrameType.LIGHT;
        return FrameType.UNKNOWN;
    }

    static FrameType typeFromFileName(String fileName) {
        String upper = fileName.toUpperCase(Locale.ROOT);
        if (upper.contains("BIAS")) return FrameType.BIAS;
        if (upper.contains("DARK")) return FrameType.DARK;
        if (upper.contains("FLAT")) return FrameType.FLAT;
        for (String keyword : LIGHT_KEYWORDS) {
            if (upper.contains(keyword.toUpperCase(Locale.ROOT))) return FrameType.LIGHT;
        }
        return FrameType.UNKNOWN;
    }

    private static void requireExists(Path path) throws NoSuchFileException {
        if (!Files.isRegularFile(path)) throw new NoSuchFileException(path.toString());
    }

    private static BasicHDU<?> primaryHdu(Fits fits, Path path) throws FitsException, IOException {
        BasicHDU<?> hdu = fits.getHDU(0);
        if (hdu == null) throw new IOException("No primary HDU in " + path);
        return hdu;
    }

    private static PixelPlane toPlane(Object k, double bzero, double bscale, Path path) throws IOException {
        if (k instanceof short[][]) {
            short[][] s = (short[][]) k;
            int h = s.length, w = (h == 0) ? 0 : s[0].length;
            int[] px = new int[w * h];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = scale(s[y][x], bzero, bscale);
            return new PixelPlane(w, h, px);
        }
        if (k instanceof int[][]) {
            int[][] a = (int[][]) k;
            int h = a.length, w = (h == 0) ? 0 : a[0].length;
            int[] px = new int[w * h];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = scale(a[y][x], bzero, bscale);
            return new PixelPlane(w, h, px);
        }
        if (k instanceof float[][]) {
            float[][] f = (float[][]) k;
            int h = f.length, w = (h == 0) ? 0 : f[0].length;
            int[] px = new int[w * h];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = scale(f[y][x], bzero, bscale);
            return new PixelPlane(w, h, px);
        }
        if (k instanceof byte[][]) {
            byte[][] b = (byte[][]) k;
            int h = b.length, w = (h == 0) ? 0 : b[0].length;
            int[] px = new int[w * h];
            for (int y = 0; y < h; y++) for (int x = 0; x < w; x++) px[y * w + x] = scale(b[y][x] & 0xFF, bzero, bscale);
            return new PixelPlane(w, h, px);
        }
        throw new IOException("Unsupported FITS image layout in " + path
                + " (" + (k == null ? "no data" : k.getClass().getSimpleName()) + ")");
    }

    private static int scale(double raw, double bzero, double bscale) {
        return (int) PreCalibrator.clamp(Math.rint(raw * bscale + bzero));
    }
}
