package tools.sqlscope.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;

/**
 * 读取解析器配置（sqlscope.properties）。
 * 优先级：系统属性 &gt; 工作目录 sqlscope.properties &gt; classpath sqlscope.properties &gt; 内置默认值。
 */
public class Config {
    private static final Logger log = LoggerFactory.getLogger(Config.class);
    private static final String FILE_NAME = "sqlscope.properties";

    public static final String QUALIFIED_NAME_WINDOW = "scope.window.qualifiedName";
    public static final String REFERENCE_WINDOW = "scope.window.referenceBeforeDot";
    public static final String LEFT_OPERAND_WINDOW = "scope.window.leftOperand";
    public static final String SUBQUERY_WINDOW = "scope.window.subquery";
    public static final String CLAUSE_WINDOW = "scope.window.clause";
    public static final String BATCH_SEPARATOR = "scope.batchSeparator";
    public static final String MAX_NESTING_DEPTH = "scope.maxNestingDepth";

    private static final int DEFAULT_QUALIFIED_NAME_WINDOW = 7;
    private static final int DEFAULT_REFERENCE_WINDOW = 10;
    private static final int DEFAULT_LEFT_OPERAND_WINDOW = 15;
    private static final int DEFAULT_SUBQUERY_WINDOW = 50;
    private static final int DEFAULT_CLAUSE_WINDOW = 200;
    private static final String DEFAULT_BATCH_SEPARATOR = "GO";
    private static final int DEFAULT_MAX_NESTING_DEPTH = 32;

    private static final Properties PROPS = new Properties();

    static {
        loadFromClasspath();
        loadFromWorkingDir();
    }

    private Config() {
    }

    private static void loadFromClasspath() {
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(FILE_NAME)) {
            if (in != null) {
                PROPS.load(in);
                log.debug("已从 classpath 读取 {}", FILE_NAME);
            }
        } catch (Exception e) {
            log.warn("读取 classpath 配置失败: {}", e.getMessage());
        }
    }

    private static void loadFromWorkingDir() {
        Path path = Path.of(FILE_NAME);
        if (!Files.exists(path)) {
            return;
        }
        try (InputStream in = Files.newInputStream(path)) {
            Properties override = new Properties();
            override.load(in);
            PROPS.putAll(override);
            log.info("已加载工作目录下的 {}，覆盖默认配置", FILE_NAME);
        } catch (Exception e) {
            log.warn("读取工作目录配置失败: {}", e.getMessage());
        }
    }

    public static int qualifiedNameWindow() {
        return positiveInt(QUALIFIED_NAME_WINDOW, DEFAULT_QUALIFIED_NAME_WINDOW);
    }

    public static int referenceWindow() {
        return positiveInt(REFERENCE_WINDOW, DEFAULT_REFERENCE_WINDOW);
    }

    public static int leftOperandWindow() {
        return positiveInt(LEFT_OPERAND_WINDOW, DEFAULT_LEFT_OPERAND_WINDOW);
    }

    public static int subqueryWindow() {
        return positiveInt(SUBQUERY_WINDOW, DEFAULT_SUBQUERY_WINDOW);
    }

    public static int clauseWindow() {
        return positiveInt(CLAUSE_WINDOW, DEFAULT_CLAUSE_WINDOW);
    }

    public static int maxNestingDepth() {
        return positiveInt(MAX_NESTING_DEPTH, DEFAULT_MAX_NESTING_DEPTH);
    }

    public static String batchSeparator() {
        String raw = getRawProperty(BATCH_SEPARATOR);
        if (raw == null || raw.isBlank()) {
            return DEFAULT_BATCH_SEPARATOR;
        }
        return raw.trim();
    }

    public static String getRawProperty(String key) {
        String sys = System.getProperty(key);
        if (sys != null && !sys.isBlank()) {
            return sys;
        }
        return PROPS.getProperty(key);
    }

    private static int positiveInt(String key, int defaultValue) {
        int value = parseIntOrDefault(key, getRawProperty(key), defaultValue);
        if (value < 1) {
            OperationLog.log("配置 " + key + "=" + value + " 无效，使用默认值 " + defaultValue);
            return defaultValue;
        }
        return value;
    }

    private static int parseIntOrDefault(String key, String raw, int defaultValue) {
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("配置项 {} 解析失败，使用默认值 {}: {}", key, defaultValue, raw);
            return defaultValue;
        }
    }
}
