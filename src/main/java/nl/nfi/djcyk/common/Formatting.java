package nl.nfi.djcyk.common;

import java.text.CharacterIterator;
import java.text.StringCharacterIterator;
import java.time.Duration;
import java.util.Locale;

import static java.lang.Long.signum;
import static java.lang.Math.abs;

public final class Formatting {

    public static String toHumanReadableSize(final long size) {
        final long absB = size == Long.MIN_VALUE ? Long.MAX_VALUE : abs(size);
        if (absB < 1024) {
            return size + " B";
        }
        long value = absB;
        final CharacterIterator ci = new StringCharacterIterator("KMGTPE");
        for (int i = 40; i >= 0 && absB > 0xfffccccccccccccL >> i; i -= 10) {
            value >>= 10;
            ci.next();
        }
        value *= signum(size);
        return String.format(Locale.ROOT, "%.1f%ciB", value / 1024.0, ci.current());
    }

    // e.g. 0.000123 s
    public static String toSeconds(final Duration duration) {
        return String.format(Locale.ROOT, "%.6f s", duration.toNanos() / 1_000_000_000.0);
    }
}
