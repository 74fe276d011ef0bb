package net.ox.util.config;

import java.util.logging.Logger;
import net.ox.util.Logging;

/* Typed accessors for configuration values. Malformed values are logged
 * and replaced by the default. */
public final class Settings {

    private static final Logger LOGGER = Logging.getLogger("Settings");

    private Settings() {}

    public static String getString(Configuration config, String key,
                                   String defaultValue) {
        String ret = config.get(key);
        return (ret == null) ? defaultValue : ret.trim();
    }

    public static int getInt(Configuration config, String key,
                             int defaultValue) {
        String value = config.get(key);
        if (value == null) return defaultValue;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException exc) {
            LOGGER.warning("Configuration value " + key + "=" + value +
                           " is not an integer; using " + defaultValue);
            return defaultValue;
        }
    }

    public static boolean getBoolean(Configuration config, String key,
                                     boolean defaultValue) {
        String value = config.get(key);
        if (value == null) return defaultValue;
        value = value.trim().toLowerCase();
        if (value.equals("true") || value.equals("yes") ||
                value.equals("1"))
            return true;
        if (value.equals("false") || value.equals("no") ||
                value.equals("0"))
            return false;
        LOGGER.warning("Configuration value " + key + "=" + value +
                       " is not a boolean; using " + defaultValue);
        return defaultValue;
    }

}
