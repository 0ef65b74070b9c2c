package nl.nfi.djcnf.common.ini;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.file.Files.readAllLines;

// minimal INI reader: [SECTION] headers followed by "key = value" lines, ';' and '#' start comments
public final class IniConfig {

    private final Map<String, Map<String, String>> sections;

    private IniConfig(final Map<String, Map<String, String>> sections) {
        this.sections = sections;
    }

    public static IniConfig empty() {
        return new IniConfig(Map.of());
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

    public String getString(final String section, final String key) {
        if (!hasKey(section, key)) {
            throw new IllegalArgumentException("INI config does not contain key in given section: %s -> %s".formatted(section, key));
        }
        return sections.get(section).get(key);
    }

    public boolean getBoolean(final String section, final String key) {
        return Boolean.parseBoolean(getString(section, key));
    }

    public int getInt(final String section, final String key) {
        final String value = getString(section, key);
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException("INI config value is not an integer: %s -> %s = %s".formatted(section, key, value), e);
        }
    }

    public int getInt(final String section, final String key, final int defaultValue) {
        return hasKey(section, key) ? getInt(section, key) : defaultValue;
    }

    public boolean getBoolean(final String section, final String key, final boolean defaultValue) {
        return hasKey(section, key) ? getBoolean(section, key) : defaultValue;
    }

    public static IniConfig loadFrom(final Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new IllegalArgumentException("INI config file path does not exist: %s".formatted(path));
        }
        return parse(readAllLines(path));
    }

    static IniConfig parse(final List<String> lines) {
        final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

        Map<String, String> section = null;
        for (final String rawLine : lines) {
            final String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith(";") || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("[") && line.endsWith("]")) {
                section = sections.computeIfAbsent(line.substring(1, line.length() - 1).trim(), key -> new LinkedHashMap<>());
                continue;
            }
            if (section == null) {
                throw new IllegalArgumentException("INI config entry outside of a section: %s".formatted(line));
            }
            final int separator = line.indexOf('=');
            if (separator < 0) {
                section.put(line, "");
            } else {
                section.put(line.substring(0, separator).trim(), line.substring(separator + 1).trim());
            }
        }
        return new IniConfig(sections);
    }
}
