package tools.sqlscope.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OperationLogTest {

    @AfterEach
    void tearDown() {
        OperationLog.setAppender(null);
    }

    @Test
    void logIsDroppedWithoutAppender() {
        assertFalse(OperationLog.isReady());
        assertDoesNotThrow(() -> OperationLog.log("ignored"));
    }

    @Test
    void logIsTimestamped() {
        List<String> messages = new ArrayList<>();
        OperationLog.setAppender(messages::add);

        OperationLog.log("解析完成");
        OperationLog.log(null);

        assertTrue(OperationLog.isReady());
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).matches("\\[\\d{2}:\\d{2}:\\d{2}] 解析完成"));
    }

    @Test
    void abbreviate() {
        assertEquals("<null>", OperationLog.abbreviate(null, 10));
        assertEquals("SELECT 1", OperationLog.abbreviate("SELECT 1", 10));
        assertEquals("SELECT ...", OperationLog.abbreviate("SELECT * FROM t", 10));
    }
}
