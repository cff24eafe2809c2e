package driver;

/*
 * configuration of the IR library, read once from JVM system properties
 */
public class Config {
    private static Config config = new Config();

    public static final String DEBUG = "corebuilder.debug";
    public static final String LOG_CONSOLE = "corebuilder.log.console";
    public static final String LOG_FILE = "corebuilder.log.file";

    public boolean isDebug = false;
    public boolean logToConsole = false;
    public String logFile = null; // null: no file output

    private Config() {
        isDebug = getFlag(DEBUG);
        logToConsole = getFlag(LOG_CONSOLE);
        String file = System.getProperty(LOG_FILE);
        if (file != null && !file.isBlank()) {
            logFile = file;
        }
    }

    /**
     * Check if a boolean system property is set to "true" (case-insensitive).
     * @param name the system property name
     * @return true if the property is exactly "true", false otherwise
     */
    public static boolean getFlag(String name) {
        String raw = System.getProperty(name);
        return raw != null && raw.equalsIgnoreCase("true");
    }

    public static Config getInstance() {
        return config;
    }
}
