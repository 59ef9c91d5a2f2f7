package tools.sqlscope.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConfigTest {

    @AfterEach
    void tearDown() {
        System.clearProperty(Config.CLAUSE_WINDOW);
        System.clearProperty(Config.BATCH_SEPARATOR);
        System.clearProperty(Config.MAX_NESTING_DEPTH);
        OperationLog.setAppender(null);
    }

    @Test
    void defaultsFromBundledProperties() {
        assertEquals(7, Config.qualifiedNameWindow());
        assertEquals(10, Config.referenceWindow());
        assertEquals(15, Config.leftOperandWindow());
        assertEquals(50, Config.subqueryWindow());
        assertEquals(200, Config.clauseWindow());
        assertEquals(32, Config.maxNestingDepth());
        assertEquals("GO", Config.batchSeparator());
    }

    @Test
    void systemPropertyOverrides() {
        System.setProperty(Config.CLAUSE_WINDOW, " 40 ");
        System.setProperty(Config.BATCH_SEPARATOR, "BATCH");

        assertEquals(40, Config.clauseWindow());
        assertEquals("BATCH", Config.batchSeparator());
    }

    @Test
    void invalidValuesFallBackToDefault() {
        List<String> messages = new ArrayList<>();
        OperationLog.setAppender(messages::add);

        System.setProperty(Config.CLAUSE_WINDOW, "abc");
        assertEquals(200, Config.clauseWindow());

        System.setProperty(Config.MAX_NESTING_DEPTH, "0");
        assertEquals(32, Config.maxNestingDepth());
        assertEquals(1, messages.size());
        assertTrue(messages.get(0).contains(Config.MAX_NESTING_DEPTH));
    }
}
