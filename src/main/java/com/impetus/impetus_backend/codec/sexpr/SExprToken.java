package com.impetus.impetus_backend.codec.sexpr;

/**
 * One lexical unit of an S-expression document. For {@link Kind#STRING} the text excludes the
 * quotes, for {@link Kind#BRACKET} it excludes the brackets.
 */
public record SExprToken(Kind kind, String text, int offset) {

    public enum Kind {
        OPEN,
        CLOSE,
        STRING,
        BRACKET,
        SYMBOL
    }
}
