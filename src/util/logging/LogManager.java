package util.logging;

import driver.Config;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Manager for creating and configuring Logger instances
 */
public class LogManager {
    private static final Map<String, Logger> loggers = new ConcurrentHashMap<>();
    private static LogLevel rootLevel = LogLevel.INFO;
    private static boolean initialized = false;

    // 配置选项
    private static boolean consoleEnabled = false;  // 默认不输出到控制台
    private static boolean fileEnabled = false;     // 默认不输出到文件
    private static PrintWriter fileWriter;
    private static final Object FILE_LOCK = new Object();

    private LogManager() {
        // Private constructor to prevent instantiation
    }

    /**
     * Get a logger for the specified class. Its level follows the root level.
     * @param clazz The class requesting the logger
     * @return A Logger instance
     */
    public static Logger getLogger(Class<?> clazz) {
        return getLogger(clazz.getName(), null);
    }

    /**
     * Get a logger for the specified name
     * @param name The logger name
     * @param level fixed level, or null to follow the root level
     * @return A Logger instance
     */
    public static synchronized Logger getLogger(String name, LogLevel level) {
        if (!initialized) {
            init();
        }

        return loggers.computeIfAbsent(name, n -> new SimpleLogger(n, level));
    }

    /**
     * Initialize the logging system from {@link Config}
     */
    public static synchronized void init() {
        if (initialized) {
            return;
        }
        Config config = Config.getInstance();

        // Set log level based on configuration
        if (config.isDebug) {
            rootLevel = LogLevel.DEBUG;
        }
        consoleEnabled = config.logToConsole;
        if (config.logFile != null) {
            openFile(new File(config.logFile));
        }

        initialized = true;
    }

    private static void openFile(File logFile) {
        File logDir = logFile.getAbsoluteFile().getParentFile();
        if (logDir != null && !logDir.exists()) {
            logDir.mkdirs();
        }
        try {
            synchronized (FILE_LOCK) {
                fileWriter = new PrintWriter(new FileWriter(logFile, true), true);
            }
            fileEnabled = true;
        } catch (IOException e) {
            fileEnabled = false;
            System.err.println("Cannot open log file " + logFile + ": " + e.getMessage());
        }
    }

    /**
     * Set the root log level
     * @param level The new log level
     */
    public static synchronized void setRootLevel(LogLevel level) {
        rootLevel = level;
    }

    /**
     * Get the root log level
     * @return The current root log level
     */
    public static synchronized LogLevel getRootLevel() {
        return rootLevel;
    }

    /**
     * Write log message to configured appenders
     * @param level Log level of the message
     * @param message The formatted log message
     */
    static void writeLog(LogLevel level, String message) {
        // Write to console only if enabled
        if (consoleEnabled) {
            if (level.getValue() >= LogLevel.WARN.getValue()) {
                System.err.println(message);
            } else {
                System.out.println(message);
            }
        }

        // Write to file only if enabled
        if (fileEnabled) {
            synchronized (FILE_LOCK) {
                if (fileWriter != null) {
                    fileWriter.println(message);
                }
            }
        }
    }

    /**
     * 启用文件输出
     */
    public static synchronized void enableFile(File logFile) {
        disableFile();
        openFile(logFile);
    }

    /**
     * 禁用文件输出
     */
    public static void disableFile() {
        fileEnabled = false;
        synchronized (FILE_LOCK) {
            if (fileWriter != null) {
                fileWriter.close();
                fileWriter = null;
            }
        }
    }
}
