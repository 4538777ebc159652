package energy.server.services;

import energy.server.Driver;
import io.vertx.core.Vertx;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;

@ExtendWith(VertxExtension.class)
class LogUtilTest {

    private final int originalLevel = Driver.logLevel;

    @AfterEach
    void restoreLevel() {
        Driver.logLevel = originalLevel;
    }

    @Test
    void testCommasAndNewlinesAreEscaped() {
        String line = LogUtil.formatLogMessage("a,b\nc", LogUtil.INFO, "Comp", "Op", "Cat");
        assertEquals("a;b c,1,Comp,Op,Cat", line);
    }

    @Test
    void testCauseChainIsFlattened() {
        Exception e = new IllegalStateException("Query execution failed", new SQLException("timeout"));
        assertEquals("Query execution failed <- SQLException: timeout", LogUtil.describe(e));
    }

    @Test
    void testErrorIsPublishedOnLogAddress(Vertx vertx, VertxTestContext testContext) {
        Driver.logLevel = LogUtil.ERROR;
        vertx.eventBus().<String>consumer(LogUtil.LOG_ADDRESS, msg -> testContext.verify(() -> {
            assertEquals("store down: refused,0,JdbcQueryExecutor,Execute,Database", msg.body());
            testContext.completeNow();
        }));

        LogUtil.logError(vertx, "store down", new RuntimeException("refused"),
            "JdbcQueryExecutor", "Execute", "Database", false);
    }

    @Test
    void testDebugSuppressedBelowLevel(Vertx vertx, VertxTestContext testContext) {
        Driver.logLevel = LogUtil.INFO;
        vertx.eventBus().<String>consumer(LogUtil.LOG_ADDRESS, msg -> testContext.verify(() -> {
            assertTrue(msg.body().contains(",1,"), msg.body());
            testContext.completeNow();
        }));

        LogUtil.logDebug(vertx, "hidden", "Comp", "Op", "Cat");
        LogUtil.logInfo(vertx, "shown", "Comp", "Op", "Cat", false);
    }
}
