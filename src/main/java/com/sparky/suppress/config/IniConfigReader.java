package com.sparky.suppress.config;

import com.sparky.suppress.Const;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Reads the {@code [SparkPost]} section of an ini file into a flat json object of string values.
 *
 * Keys are matched without regard to case. A line that starts with whitespace continues the value
 * of the key above it; the parts are joined with a line break. Lines starting with {@code #} or
 * {@code ;} are comments. Keys before the first section header are read as part of the section.
 */
public class IniConfigReader {
    private static final Logger LOGGER = LoggerFactory.getLogger(IniConfigReader.class);

    public static final String SECTION = "SparkPost";

    private static final Map<String, String> KNOWN_KEYS = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    static {
        for (String key : List.of(
            Const.Config.AuthorizationProp,
            Const.Config.HostProp,
            Const.Config.TimezoneProp,
            Const.Config.PropertiesProp,
            Const.Config.BatchSizeProp,
            Const.Config.TypeDefaultProp,
            Const.Config.DescriptionDefaultProp,
            Const.Config.FileCharacterEncodingsProp,
            Const.Config.DeleteThreadsProp,
            Const.Config.SubAccountProp,
            Const.Config.RequestTimeoutSecondsProp,
            Const.Config.ListBackoffSecondsProp,
            Const.Config.UpdateBackoffSecondsProp,
            Const.Config.DeleteBackoffSecondsProp)) {
            KNOWN_KEYS.put(key, key);
        }
    }

    private IniConfigReader() {}

    public static JsonObject read(List<String> lines) throws ConfigException {
        JsonObject out = new JsonObject();
        boolean inSection = true;
        String currentKey = null;
        // the previous line was a key line, so an indented line continues it
        boolean afterKey = false;
        int lineNumber = 0;

        for (String raw : lines) {
            lineNumber++;
            String line = stripTrailing(lineNumber == 1 && raw.startsWith("\uFEFF") ? raw.substring(1) : raw);
            String trimmed = line.trim();

            if (trimmed.isEmpty()) {
                currentKey = null;
                afterKey = false;
                continue;
            }
            if (trimmed.startsWith("#") || trimmed.startsWith(";")) {
                continue;
            }

            if (Character.isWhitespace(line.charAt(0))) {
                if (!afterKey) {
                    throw new ConfigException("line " + lineNumber + ": continuation line without a key: " + trimmed);
                }
                if (currentKey == null) {
                    continue;
                }
                out.put(currentKey, out.getString(currentKey) + "\n" + trimmed);
                continue;
            }

            if (trimmed.startsWith("[")) {
                if (!trimmed.endsWith("]")) {
                    throw new ConfigException("line " + lineNumber + ": malformed section header: " + trimmed);
                }
                inSection = SECTION.equals(trimmed.substring(1, trimmed.length() - 1).trim());
                currentKey = null;
                afterKey = false;
                continue;
            }

            int sep = separatorIndex(trimmed);
            if (sep <= 0) {
                throw new ConfigException("line " + lineNumber + ": expected key = value, got: " + trimmed);
            }
            afterKey = true;
            if (!inSection) {
                currentKey = null;
                continue;
            }

            String name = trimmed.substring(0, sep).trim();
            String key = KNOWN_KEYS.get(name);
            if (key == null) {
                LOGGER.warn("Ignoring unknown configuration key: {}", name);
                currentKey = null;
                continue;
            }
            out.put(key, trimmed.substring(sep + 1).trim());
            currentKey = key;
        }
        return out;
    }

    private static int separatorIndex(String line) {
        int eq = line.indexOf('=');
        int colon = line.indexOf(':');
        if (eq < 0) {
            return colon;
        }
        if (colon < 0) {
            return eq;
        }
        return Math.min(eq, colon);
    }

    private static String stripTrailing(String line) {
        int end = line.length();
        while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) {
            end--;
        }
        return line.substring(0, end);
    }
}
