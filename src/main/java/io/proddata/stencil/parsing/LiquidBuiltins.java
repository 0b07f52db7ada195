package io.proddata.stencil.parsing;

import java.util.Map;

/**
 * Qualified names of the builtin functions behind liquid filters and tags.
 */
final class LiquidBuiltins {
    private static final Map<String, String[]> FUNCTIONS = Map.ofEntries(
        Map.entry("abs", new String[]{"math", "abs"}),
        Map.entry("append", new String[]{"string", "append"}),
        Map.entry("capitalize", new String[]{"string", "capitalize"}),
        Map.entry("ceil", new String[]{"math", "ceil"}),
        Map.entry("compact", new String[]{"array", "compact"}),
        Map.entry("concat", new String[]{"array", "concat"}),
        Map.entry("contains", new String[]{"array", "contains"}),
        Map.entry("cycle", new String[]{"array", "cycle"}),
        Map.entry("date", new String[]{"date", "parse"}),
        Map.entry("default", new String[]{"object", "default"}),
        Map.entry("divided_by", new String[]{"math", "divided_by"}),
        Map.entry("downcase", new String[]{"string", "downcase"}),
        Map.entry("escape", new String[]{"html", "escape"}),
        Map.entry("escape_once", new String[]{"html", "escape_once"}),
        Map.entry("first", new String[]{"array", "first"}),
        Map.entry("floor", new String[]{"math", "floor"}),
        Map.entry("join", new String[]{"array", "join"}),
        Map.entry("last", new String[]{"array", "last"}),
        Map.entry("lstrip", new String[]{"string", "lstrip"}),
        Map.entry("map", new String[]{"array", "map"}),
        Map.entry("minus", new String[]{"math", "minus"}),
        Map.entry("modulo", new String[]{"math", "modulo"}),
        Map.entry("newline_to_br", new String[]{"html", "newline_to_br"}),
        Map.entry("plus", new String[]{"math", "plus"}),
        Map.entry("prepend", new String[]{"string", "prepend"}),
        Map.entry("remove", new String[]{"string", "remove"}),
        Map.entry("remove_first", new String[]{"string", "remove_first"}),
        Map.entry("replace", new String[]{"string", "replace"}),
        Map.entry("replace_first", new String[]{"string", "replace_first"}),
        Map.entry("reverse", new String[]{"array", "reverse"}),
        Map.entry("round", new String[]{"math", "round"}),
        Map.entry("rstrip", new String[]{"string", "rstrip"}),
        Map.entry("size", new String[]{"object", "size"}),
        Map.entry("slice", new String[]{"string", "slice1"}),
        Map.entry("sort", new String[]{"array", "sort"}),
        Map.entry("split", new String[]{"string", "split"}),
        Map.entry("strip", new String[]{"string", "strip"}),
        Map.entry("strip_html", new String[]{"html", "strip"}),
        Map.entry("strip_newlines", new String[]{"string", "strip_newlines"}),
        Map.entry("times", new String[]{"math", "times"}),
        Map.entry("truncate", new String[]{"string", "truncate"}),
        Map.entry("truncatewords", new String[]{"string", "truncatewords"}),
        Map.entry("uniq", new String[]{"array", "uniq"}),
        Map.entry("upcase", new String[]{"string", "upcase"})
    );

    private LiquidBuiltins() {
    }

    /**
     * Returns the {@code [object, member]} pair a liquid function name maps to, or {@code null}.
     */
    static String[] toQualifiedName(String liquidName) {
        String[] name = FUNCTIONS.get(liquidName);
        return name == null ? null : name.clone();
    }
}
