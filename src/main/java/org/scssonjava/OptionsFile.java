package org.scssonjava;

import org.scssonjava.ArgumentParser.CompilerOptions;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Reads parser options from a YAML document such as:
 * <pre>
 * plainCss: false
 * verbose: true
 * fatalDeprecations: [elseif]
 * </pre>
 * Keys that are absent leave the current option values unchanged.
 */
public final class OptionsFile {

    private OptionsFile() {
    }

    public static void load(Path path, CompilerOptions options) throws IOException {
        String content = Files.readString(path, StandardCharsets.UTF_8);
        try {
            apply(content, options);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Applies the options in a YAML document to {@code options}.
     *
     * @throws IllegalArgumentException if the document is malformed, has unknown
     *                                  keys, or has values of the wrong type
     */
    public static void apply(String yaml, CompilerOptions options) {
        LoadSettings loadSettings = LoadSettings.builder()
                .setAllowDuplicateKeys(false)
                .build();
        Object document;
        try {
            document = new Load(loadSettings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new IllegalArgumentException("Invalid options file: " + e.getMessage(), e);
        }
        if (document == null) {
            return;
        }
        if (!(document instanceof Map)) {
            throw new IllegalArgumentException("Options file must contain a mapping.");
        }

        for (Map.Entry<?, ?> entry : ((Map<?, ?>) document).entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            switch (key) {
                case "plainCss":
                    options.plainCss = bool(key, value);
                    break;
                case "quiet":
                    options.quietDeps = bool(key, value);
                    break;
                case "verbose":
                    options.verbose = bool(key, value);
                    break;
                case "debug":
                    options.debugEnabled = bool(key, value);
                    break;
                case "fatalDeprecations":
                    options.fatalDeprecations.addAll(ArgumentParser.parseDeprecations(idList(key, value)));
                    break;
                case "silenceDeprecations":
                    options.silenceDeprecations.addAll(ArgumentParser.parseDeprecations(idList(key, value)));
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option \"" + key + "\".");
            }
        }
    }

    private static boolean bool(String key, Object value) {
        if (!(value instanceof Boolean)) {
            throw new IllegalArgumentException("Option \"" + key + "\" must be true or false.");
        }
        return (Boolean) value;
    }

    /**
     * Accepts a YAML sequence or a comma-separated string, and returns it as a
     * comma-separated string.
     */
    private static String idList(String key, Object value) {
        if (value instanceof String) {
            return (String) value;
        }
        if (value instanceof List) {
            StringBuilder sb = new StringBuilder();
            for (Object item : (List<?>) value) {
                if (sb.length() > 0) {
                    sb.append(',');
                }
                sb.append(item);
            }
            return sb.toString();
        }
        throw new IllegalArgumentException("Option \"" + key + "\" must be a list of deprecation ids.");
    }
}
