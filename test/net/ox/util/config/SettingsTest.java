package net.ox.util.config;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import java.util.Properties;
import org.junit.Test;

public class SettingsTest {

    @Test
    public void testDefaults() {
        DynamicConfiguration config = new DynamicConfiguration();
        assertNull(config.get("ox.test.missing"));
        assertEquals("x", Settings.getString(config, "ox.test.missing",
                                             "x"));
        assertEquals(3, Settings.getInt(config, "ox.test.missing", 3));
        assertTrue(Settings.getBoolean(config, "ox.test.missing", true));
    }

    @Test
    public void testTypedValues() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put("ox.test.str", "  value ");
        config.put("ox.test.int", "12");
        config.put("ox.test.bool", "no");
        assertEquals("value", Settings.getString(config, "ox.test.str",
                                                 null));
        assertEquals(12, Settings.getInt(config, "ox.test.int", 0));
        assertFalse(Settings.getBoolean(config, "ox.test.bool", true));
    }

    @Test
    public void testMalformedValuesFallBack() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put("ox.test.int", "twelve");
        config.put("ox.test.bool", "maybe");
        assertEquals(7, Settings.getInt(config, "ox.test.int", 7));
        assertTrue(Settings.getBoolean(config, "ox.test.bool", true));
    }

    @Test
    public void testSources() {
        Properties props = new Properties();
        props.setProperty("ox.test.key", "from-source");
        DynamicConfiguration config = new DynamicConfiguration();
        assertNull(config.get("ox.test.key"));
        config.addSource(new PropertiesConfiguration(props));
        assertEquals("from-source", config.get("ox.test.key"));
        config.put("ox.test.key", "explicit");
        assertEquals("explicit", config.get("ox.test.key"));
        config.remove("ox.test.key");
        assertEquals("from-source", config.get("ox.test.key"));
    }

    @Test
    public void testBundledDefaults() {
        assertEquals(4, Settings.getInt(Configuration.DEFAULT,
                                        "ox.print.indent", 0));
    }

}
