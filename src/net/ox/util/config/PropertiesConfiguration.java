package net.ox.util.config;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

public class PropertiesConfiguration implements Configuration {

    private final Properties base;

    public PropertiesConfiguration(Properties base) {
        this.base = base;
    }
    public PropertiesConfiguration(File path) throws IOException {
        this(loadProperties(new FileInputStream(path)));
    }

    public Properties getBase() {
        return base;
    }

    public String get(String key) {
        return base.getProperty(key);
    }

    public static Properties loadProperties(InputStream in)
            throws IOException {
        Properties ret = new Properties();
        try {
            ret.load(in);
        } finally {
            in.close();
        }
        return ret;
    }

    /* Returns null if there is no such resource. */
    public static PropertiesConfiguration fromResource(ClassLoader loader,
                                                       String name) {
        if (loader == null) loader = ClassLoader.getSystemClassLoader();
        InputStream in = loader.getResourceAsStream(name);
        if (in == null) return null;
        try {
            return new PropertiesConfiguration(loadProperties(in));
        } catch (IOException exc) {
            throw new RuntimeException("Cannot load configuration " +
                "resource " + name, exc);
        }
    }

}
