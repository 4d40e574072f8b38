package com.masterbias.service;

import com.masterbias.model.CombineMethod;
import com.masterbias.model.FileDescriptor;

import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.function.Predicate;

/**
 * Output file names and the placeholder tokens allowed in user-supplied names:
 * {@code %d} date (yyyyMMdd), {@code %t} time (HHmm), {@code %f} filter name.
 */
public class OutputNaming {
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyyMMdd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HHmm");
    private static final DateTimeFormatter STAMP = DateTimeFormatter.ofPattern("yyyyMMdd-HHmm");

    private final Clock clock;

    public OutputNaming() {
        this(Clock.systemDefaultZone());
    }

    public OutputNaming(Clock clock) {
        this.clock = clock;
    }

    public String substitute(String template, String filterName) {
        LocalDateTime now = LocalDateTime.now(clock);
        return template
                .replace("%d", DATE.format(now))
                .replace("%t", TIME.format(now))
                .replace("%f", filterName == null ? "" : filterName);
    }

    // BIAS-<metodo>-<fecha>-<exp>s-<temp>C-<WxH>-<BxB>.fit
    public String fileName(CombineMethod method, FileDescriptor sample) {
        return String.format(Locale.US, "BIAS-%s-%s-%.3fs-%.1fC-%dx%d-%dx%d.fit",
                method.displayName(),
                STAMP.format(LocalDateTime.now(clock)),
                sample.exposure(),
                sample.temperature(),
                sample.width(), sample.height(),
                sample.binning(), sample.binning());
    }

    /** Generated name placed next to the sample input file. */
    public Path defaultOutputPath(CombineMethod method, FileDescriptor sample) {
        return sample.absolutePath().resolveSibling(fileName(method, sample));
    }

    /** {@code candidate} if free, else the first of name-2.ext, name-3.ext, ... that is not taken. */
    public Path uniquePath(Path candidate, Predicate<Path> taken) {
        if (!taken.test(candidate)) return candidate;
        String name = candidate.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String base = (dot > 0) ? name.substring(0, dot) : name;
        String extension = (dot > 0) ? name.substring(dot) : "";
        for (int n = 2; ; n++) {
            Path next = candidate.resolveSibling(base + "-" + n + extension);
            if (!taken.test(next)) return next;
        }
    }
}
