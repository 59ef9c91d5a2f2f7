package tools.sqlscope.scope;

import com.google.gson.Gson;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import tools.sqlscope.context.ComparisonOperand;
import tools.sqlscope.context.NameReading;
import tools.sqlscope.context.QualifiedName;
import tools.sqlscope.context.Resolution;

import java.util.List;

/**
 * 把 {@link ScopeContext} 转成交给元数据缓存的 JSON 文档，也用于调试输出。
 * 空字段不输出。
 */
public final class ScopeContextJson {
    private static final Gson GSON = new Gson();

    private ScopeContextJson() {
    }

    public static String toJson(ScopeContext context) {
        return GSON.toJson(toJsonObject(context));
    }

    public static JsonObject toJsonObject(ScopeContext context) {
        JsonObject obj = new JsonObject();
        obj.addProperty("trigger", context.triggerKind().name());
        obj.addProperty("clause", context.clause().name());
        if (context.statementKind() != null) {
            obj.addProperty("statement", context.statementKind().name());
        }
        obj.addProperty("batch", context.batchIndex());
        if (!context.prefix().isEmpty()) {
            obj.addProperty("prefix", context.prefix());
        }
        JsonArray tables = new JsonArray();
        for (VisibleTable t : context.visibleTables()) {
            tables.add(table(t));
        }
        obj.add("tables", tables);
        if (!context.qualifier().isEmpty()) {
            obj.add("qualifier", qualifier(context.qualifier(), context.qualifierReading()));
        }
        if (context.qualifierTarget() != null) {
            obj.addProperty("target", context.qualifierTarget().alias());
        }
        context.leftOperand().value().ifPresent(operand -> obj.add("leftOperand", operand(operand)));
        return obj;
    }

    private static JsonObject table(VisibleTable t) {
        JsonObject obj = new JsonObject();
        obj.addProperty("name", t.name());
        addIfPresent(obj, "schema", t.schema());
        addIfPresent(obj, "database", t.database());
        obj.addProperty("alias", t.alias());
        obj.addProperty("kind", t.kind().name());
        obj.addProperty("depth", t.depth());
        obj.add("columns", strings(t.columns()));
        return obj;
    }

    private static JsonObject qualifier(QualifiedName name, Resolution<NameReading> reading) {
        JsonObject obj = new JsonObject();
        obj.add("parts", strings(name.parts()));
        obj.addProperty("trailingDot", name.hasTrailingDot());
        obj.addProperty("status", reading.status().name());
        JsonArray readings = new JsonArray();
        for (NameReading r : reading.candidates()) {
            JsonObject ro = new JsonObject();
            ro.addProperty("role", r.role().name());
            ro.add("path", strings(r.path()));
            readings.add(ro);
        }
        obj.add("readings", readings);
        return obj;
    }

    private static JsonObject operand(ComparisonOperand operand) {
        JsonObject obj = new JsonObject();
        obj.addProperty("qualified", operand.qualified());
        addIfPresent(obj, "schema", operand.schema());
        addIfPresent(obj, "table", operand.tableRef());
        obj.addProperty("column", operand.columnName());
        return obj;
    }

    private static JsonArray strings(List<String> values) {
        JsonArray arr = new JsonArray();
        for (String v : values) {
            arr.add(v);
        }
        return arr;
    }

    private static void addIfPresent(JsonObject obj, String key, String value) {
        if (value != null && !value.isBlank()) {
            obj.addProperty(key, value);
        }
    }
}
