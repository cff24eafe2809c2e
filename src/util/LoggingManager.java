package util;

import util.logging.LogManager;
import util.logging.Logger;

/**
 * Entry point for obtaining loggers; initializes {@link LogManager} on first use.
 */
public class LoggingManager {
    private static boolean inited = false;

    public static synchronized void init() {
        if (inited) return;
        LogManager.init();
        inited = true;
    }

    public static Logger getLogger(Class<?> cls) {
        if (!inited) init();
        return LogManager.getLogger(cls);
    }
}
