package nl.nfi.djcyk.common;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class FormattingTest {

    @ParameterizedTest(name = "{0} bytes is {1}")
    @CsvSource({
            "0,0 B",
            "1023,1023 B",
            "1024,1.0KiB",
            "1536,1.5KiB",
            "1048576,1.0MiB",
    })
    void humanReadableSize(final long size, final String expected) {
        assertThat(Formatting.toHumanReadableSize(size)).isEqualTo(expected);
    }

    @Test
    void secondsWithMicrosecondPrecision() {
        assertThat(Formatting.toSeconds(Duration.ofNanos(123_456_789))).isEqualTo("0.123457 s");
        assertThat(Formatting.toSeconds(Duration.ZERO)).isEqualTo("0.000000 s");
    }
}
