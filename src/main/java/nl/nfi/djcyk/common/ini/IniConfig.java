package nl.nfi.djcyk.common.ini;

import org.json.JSONArray;
import org.json.JSONException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static java.nio.charset.StandardCharsets.UTF_8;
import static java.nio.file.Files.readAllLines;

public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public boolean hasSection(final String section) {
        return sections.containsKey(section);
    }

    public boolean hasKey(final String section, final String key) {
        return sections.containsKey(section) && sections.get(section).containsKey(key);
    }

    public IniSection getSection(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config does not contain given section: %s".formatted(section));
        }
        return IniSection.ofConfig(this, section);
    }

    // keys in file order
    public Set<String> keys(final String section) {
        if (!hasSection(section)) {
            throw new IllegalArgumentException("INI config does not contain given section: %s".formatted(section));
        }
        return sections.get(section).keySet();
    }

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public String getString(final String section, final String key, final String defaultValue) {
        return hasKey(section, key) ? getString(section, key) : defaultValue;
    }

    public List<String> getStringList(final String section, final String key) {
        try {
            final JSONArray array = new JSONArray(getString(section, key));
            final List<String> values = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                values.add(array.getString(i));
            }
            return values;
        } catch (final JSONException e) {
            throw new IllegalArgumentException("INI value is not a list of strings: %s -> %s".formatted(section, key), e);
        }
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }
        return parse(readAllLines(path, UTF_8));
    }

    public static IniConfig loadFrom(final InputStream input) throws IOException {
        try (final BufferedReader reader = new BufferedReader(new InputStreamReader(input, UTF_8))) {
            return parse(reader.lines().toList());
        }
    }

    static IniConfig parse(final List<String> lines) {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        String sectionTitle = null;
        Map<String, String> section = new LinkedHashMap<>();
        for (final String rawLine : lines) {
            final String line = rawLine.strip();
            if (line.isEmpty() || line.startsWith("#") || line.startsWith(";")) {
                continue;
            }
            if (line.startsWith("[")) {
                if (!line.endsWith("]") || line.length() < 3) {
                    throw new IllegalArgumentException("Malformed INI section header: %s".formatted(line));
                }
                if (sectionTitle != null) {
                    sections.put(sectionTitle, section);
                    section = new LinkedHashMap<>();
                }
                sectionTitle = line.substring(1, line.length() - 1).strip();
            } else {
                if (sectionTitle == null) {
                    throw new IllegalArgumentException("INI entry outside of a section: %s".formatted(line));
                }
                final int separator = line.indexOf('=');
                if (separator == -1) {
                    section.put(line, "");
                } else {
                    section.put(line.substring(0, separator).strip(), line.substring(separator + 1).strip());
                }
            }
        }
        if (sectionTitle != null) {
            sections.put(sectionTitle, section);
        }
        return new IniConfig(sections);
    }
}
