package inkwell.coordinator;

import org.junit.jupiter.api.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Test runs log coordinator code at INFO; per-message debug output stays off.
 */
class TestLoggingConfigTest {

    @Test
    void coordinatorLogsAtInfo() {
        Logger logger = LoggerFactory.getLogger("inkwell.coordinator.pipeline.PipelineScheduler");

        assertTrue(logger.isInfoEnabled());
        assertFalse(logger.isDebugEnabled());
    }

    @Test
    void librariesLogOnlyWarnings() {
        assertFalse(LoggerFactory.getLogger("io.netty.channel.DefaultChannelPipeline").isInfoEnabled());
        assertFalse(LoggerFactory.getLogger("com.zaxxer.hikari.HikariDataSource").isInfoEnabled());
        assertTrue(LoggerFactory.getLogger("com.zaxxer.hikari.HikariDataSource").isWarnEnabled());
    }
}
