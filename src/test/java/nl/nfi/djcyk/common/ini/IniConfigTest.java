package nl.nfi.djcyk.common.ini;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IniConfigTest {

    @Test
    void parsesSectionsAndKeysInFileOrder() {
        final IniConfig config = IniConfig.parse(List.of(
                "# comment",
                "[LANGUAGE]",
                "name = english",
                "",
                "; another comment",
                "[RULES]",
                "S = [\"NP VP\"]",
                "NP = [\"'she'\", \"'he'\"]"
        ));

        assertThat(config.hasSection("LANGUAGE")).isTrue();
        assertThat(config.hasSection("EXAMPLES")).isFalse();
        assertThat(config.getString("LANGUAGE", "name")).isEqualTo("english");
        assertThat(config.keys("RULES")).containsExactly("S", "NP");
        assertThat(config.getStringList("RULES", "NP")).containsExactly("'she'", "'he'");
    }

    @Test
    void valueMayContainSeparator() {
        final IniConfig config = IniConfig.parse(List.of("[A]", "formula = a = b"));

        assertThat(config.getString("A", "formula")).isEqualTo("a = b");
    }

    @Test
    void defaultsApplyOnlyToMissingKeys() {
        final IniConfig config = IniConfig.parse(List.of("[LANGUAGE]", "name = x"));
        final IniSection section = config.getSection("LANGUAGE");

        assertThat(section.getString("name", "fallback")).isEqualTo("x");
        assertThat(section.getString("description", "fallback")).isEqualTo("fallback");
        assertThat(section.hasKey("description")).isFalse();
    }

    @Test
    void rejectsEntryOutsideSection() {
        assertThatThrownBy(() -> IniConfig.parse(List.of("name = x")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @ParameterizedTest(name = "\"{0}\" is not a section header")
    @ValueSource(strings = {"[EXAMPLES", "[", "[]"})
    void rejectsMalformedSectionHeader(final String header) {
        assertThatThrownBy(() -> IniConfig.parse(List.of("[LANGUAGE]", "name = x", header, "accepted = []")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(header);
    }

    @Test
    void rejectsMissingKeyAndNonListValue() {
        final IniConfig config = IniConfig.parse(List.of("[RULES]", "S = NP VP"));

        assertThatThrownBy(() -> config.getString("RULES", "VP"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RULES -> VP");
        assertThatThrownBy(() -> config.getStringList("RULES", "S"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a list");
    }
}
