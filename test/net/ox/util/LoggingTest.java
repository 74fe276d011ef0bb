package net.ox.util;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertTrue;
import java.io.ByteArrayOutputStream;
import java.io.UnsupportedEncodingException;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import net.ox.util.config.DynamicConfiguration;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;

public class LoggingTest {

    private Logger root;
    private Level oldLevel;
    private Handler[] oldHandlers;

    @Before
    public void setUp() {
        root = Logger.getLogger(Logging.ROOT_LOGGER);
        oldLevel = root.getLevel();
        oldHandlers = Logger.getLogger("").getHandlers();
    }

    @After
    public void tearDown() {
        root.setLevel(oldLevel);
        Logger global = Logger.getLogger("");
        for (Handler hnd : global.getHandlers()) global.removeHandler(hnd);
        for (Handler hnd : oldHandlers) global.addHandler(hnd);
    }

    @Test
    public void testComponentLoggers() {
        assertEquals("net.ox.Parser", Logging.getLogger("Parser").getName());
        assertTrue(Logging.getLogger("Parser").getParent() != null);
    }

    @Test
    public void testApplyLevel() {
        DynamicConfiguration config = new DynamicConfiguration();
        config.put(Logging.LEVEL_KEY, "FINE");
        assertEquals(Level.FINE, Logging.applyLevel(config));
        assertEquals(Level.FINE, root.getLevel());
        config.put(Logging.LEVEL_KEY, "loud");
        assertEquals(Level.INFO, Logging.applyLevel(config));
    }

    @Test
    public void testRedirect() throws UnsupportedEncodingException {
        Logging.initFormat();
        assertNotNull(System.getProperty(
            "java.util.logging.SimpleFormatter.format"));
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        Logging.redirectToStream(out);
        root.setLevel(Level.INFO);
        Logging.getLogger("LoggingTest").warning("redirected message");
        assertTrue(out.toString("UTF-8").contains("redirected message"));
    }

}
