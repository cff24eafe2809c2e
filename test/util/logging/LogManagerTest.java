package util.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import util.LoggingManager;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LogManagerTest {
    private LogLevel saved;

    @AfterEach
    void restore() {
        if (saved != null) {
            LogManager.setRootLevel(saved);
        }
    }

    @Test
    public void testLoggersAreCachedByClass() {
        Logger a = LoggingManager.getLogger(LogManagerTest.class);
        Logger b = LoggingManager.getLogger(LogManagerTest.class);
        assertSame(a, b);
    }

    @Test
    public void testLevelFollowsRoot() {
        saved = LogManager.getRootLevel();
        Logger log = LogManager.getLogger("follow.root", null);

        LogManager.setRootLevel(LogLevel.WARN);
        assertFalse(log.isInfoEnabled());
        assertTrue(log.isErrorEnabled());

        LogManager.setRootLevel(LogLevel.TRACE);
        assertTrue(log.isTraceEnabled());
    }

    @Test
    public void testFixedLevel() {
        Logger log = LogManager.getLogger("fixed.level", LogLevel.ERROR);
        assertFalse(log.isWarnEnabled());
        assertTrue(log.isFatalEnabled());
    }

    @Test
    public void testFileSink(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("logs").resolve("builder.log");
        Logger log = LogManager.getLogger("file.sink", LogLevel.INFO);

        LogManager.enableFile(file.toFile());
        log.info("built {} blocks", 3);
        log.debug("dropped");
        LogManager.disableFile();
        log.info("after close");

        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        assertEquals(1, lines.size());
        assertTrue(lines.get(0).contains("[INFO] file.sink - [testFileSink:"));
        assertTrue(lines.get(0).endsWith("built 3 blocks"));
    }

    @Test
    public void testLevelOrdering() {
        assertTrue(LogLevel.TRACE.isLessSpecificThan(LogLevel.DEBUG));
        assertFalse(LogLevel.ERROR.isLessSpecificThan(LogLevel.WARN));
        assertFalse(LogLevel.INFO.isLessSpecificThan(LogLevel.INFO));
    }
}
