package tools.sqlscope.scope;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import tools.sqlscope.Cursor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ScopeContextJsonTest {

    private final ScopeResolver resolver = new ScopeResolver(
            (database, schema, table) -> "Orders".equals(table) ? List.of("OrderID", "Total") : List.of());

    private JsonObject json(String marked) {
        Cursor c = Cursor.of(marked);
        String text = ScopeContextJson.toJson(resolver.resolve(c.text(), c.line(), c.column()));
        return JsonParser.parseString(text).getAsJsonObject();
    }

    @Test
    void qualifiedColumnContext() {
        JsonObject obj = json("SELECT o.| FROM Orders o");

        assertEquals("COLUMN", obj.get("trigger").getAsString());
        assertEquals("IN_SELECT_LIST", obj.get("clause").getAsString());
        assertEquals("SELECT", obj.get("statement").getAsString());
        assertEquals(0, obj.get("batch").getAsInt());
        assertFalse(obj.has("prefix"));
        assertFalse(obj.has("leftOperand"));

        JsonArray tables = obj.getAsJsonArray("tables");
        assertEquals(1, tables.size());
        JsonObject orders = tables.get(0).getAsJsonObject();
        assertEquals("Orders", orders.get("name").getAsString());
        assertEquals("o", orders.get("alias").getAsString());
        assertEquals("TABLE", orders.get("kind").getAsString());
        assertFalse(orders.has("schema"));
        assertEquals(2, orders.getAsJsonArray("columns").size());

        JsonObject qualifier = obj.getAsJsonObject("qualifier");
        assertEquals("o", qualifier.getAsJsonArray("parts").get(0).getAsString());
        assertTrue(qualifier.get("trailingDot").getAsBoolean());
        assertEquals("MATCHED", qualifier.get("status").getAsString());
        assertEquals("ALIAS", qualifier.getAsJsonArray("readings").get(0).getAsJsonObject().get("role").getAsString());
        assertEquals("o", obj.get("target").getAsString());
    }

    @Test
    void leftOperandAndPrefix() {
        JsonObject obj = json("SELECT * FROM Orders o WHERE o.Total > T|");

        assertEquals("T", obj.get("prefix").getAsString());
        JsonObject operand = obj.getAsJsonObject("leftOperand");
        assertEquals("o", operand.get("table").getAsString());
        assertEquals("Total", operand.get("column").getAsString());
        assertFalse(obj.has("qualifier"));
    }

    @Test
    void silentContextHasNoStatement() {
        JsonObject obj = json("-- |");

        assertEquals("NONE", obj.get("trigger").getAsString());
        assertFalse(obj.has("statement"));
        assertEquals(0, obj.getAsJsonArray("tables").size());
    }
}
