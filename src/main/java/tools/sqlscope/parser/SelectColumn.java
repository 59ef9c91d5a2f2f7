package tools.sqlscope.parser;

/**
 * SELECT 列表中的一项。{@code SELECT x AS y} 得到 name=y；{@code t.*} 得到 star=true、qualifier=t。
 */
public record SelectColumn(String name, String qualifier, boolean star) {

    public static SelectColumn named(String name) {
        return new SelectColumn(name, null, false);
    }

    public static SelectColumn star(String qualifier) {
        return new SelectColumn(null, qualifier, true);
    }
}
