package tools.sqlscope.util;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.function.Consumer;

/**
 * 面向调用方的诊断日志：
 * - 通过 {@link #setAppender(Consumer)} 注入宿主（编辑器集成层）的日志追加方法。
 * - 未注册追加器时 {@link #log(String)} 直接忽略，解析核心不依赖任何 UI 线程。
 */
public final class OperationLog {
    private static volatile Consumer<String> appender = null;
    private static final DateTimeFormatter FORMATTER = DateTimeFormatter.ofPattern("HH:mm:ss");

    private OperationLog() {}

    public static void setAppender(Consumer<String> appender) {
        OperationLog.appender = appender;
    }

    /**
     * 当前是否已经有宿主注册了日志追加器，用来在拼接较长消息前快速判断。
     */
    public static boolean isReady() {
        return appender != null;
    }

    public static void log(String message) {
        Consumer<String> target = appender;
        if (target == null || message == null) {
            return;
        }
        target.accept("[" + LocalDateTime.now().format(FORMATTER) + "] " + message);
    }

    /**
     * 将长文本缩略到指定长度，避免整段 SQL 写进日志。
     */
    public static String abbreviate(String text, int max) {
        if (text == null) return "<null>";
        if (text.length() <= max) return text;
        return text.substring(0, Math.max(0, max - 3)) + "...";
    }
}
