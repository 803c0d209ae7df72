package com.impetus.impetus_backend.codec.sexpr;

import java.util.List;

/**
 * Parsed S-expression: an atom (bare symbol, quoted string or bracket atom) or a list.
 */
public record SExpr(Kind kind, String value, List<SExpr> items) {

    public enum Kind {
        SYMBOL,
        STRING,
        BRACKET,
        LIST
    }

    public static SExpr atom(Kind kind, String value) {
        return new SExpr(kind, value, List.of());
    }

    public static SExpr list(List<SExpr> items) {
        return new SExpr(Kind.LIST, "", List.copyOf(items));
    }

    public boolean isList() {
        return kind == Kind.LIST;
    }

    public boolean isAtom() {
        return kind != Kind.LIST;
    }

    public int size() {
        return items.size();
    }

    public SExpr item(int i) {
        return items.get(i);
    }

    /** Value of the first item when it is an atom, otherwise null. */
    public String head() {
        return isList() && !items.isEmpty() && items.get(0).isAtom() ? items.get(0).value() : null;
    }

    /** A list of at least {@code minSize} items whose first item is the atom {@code name}. */
    public boolean isForm(String name, int minSize) {
        return isList() && items.size() >= minSize && name.equals(head());
    }
}
