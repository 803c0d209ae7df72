package com.impetus.impetus_backend.codec.sexpr;

import com.impetus.impetus_backend.exception.LayoutFormatException;

import java.util.ArrayList;
import java.util.List;

/**
 * Recursive-descent parser producing one {@link SExpr} per document.
 */
public final class SExprParser {

    /** Deepest list nesting accepted; real layouts stay far below this. */
    static final int MAX_DEPTH = 512;

    private final List<SExprToken> tokens;
    private int pos;
    private int depth;

    private SExprParser(List<SExprToken> tokens) {
        this.tokens = tokens;
    }

    /** Parses exactly one expression; anything after it is an error. */
    public static SExpr parse(String content) {
        SExprParser parser = new SExprParser(SExprTokenizer.tokenize(content));
        SExpr expr = parser.next();
        if (parser.pos < parser.tokens.size()) {
            SExprToken extra = parser.tokens.get(parser.pos);
            throw new LayoutFormatException(SExprTokenizer.FORMAT,
                    "Trailing tokens after document at offset " + extra.offset());
        }
        return expr;
    }

    private SExpr next() {
        if (pos >= tokens.size()) {
            throw new LayoutFormatException(SExprTokenizer.FORMAT, "Unexpected end of tokens");
        }
        SExprToken token = tokens.get(pos++);
        switch (token.kind()) {
            case OPEN -> {
                if (++depth > MAX_DEPTH) {
                    throw new LayoutFormatException(SExprTokenizer.FORMAT,
                            "Lists nested deeper than " + MAX_DEPTH + " levels at offset " + token.offset());
                }
                List<SExpr> items = new ArrayList<>();
                while (pos < tokens.size() && tokens.get(pos).kind() != SExprToken.Kind.CLOSE) {
                    items.add(next());
                }
                if (pos >= tokens.size()) {
                    throw new LayoutFormatException(SExprTokenizer.FORMAT,
                            "Missing closing parenthesis for list at offset " + token.offset());
                }
                pos++;
                depth--;
                return SExpr.list(items);
            }
            case CLOSE -> throw new LayoutFormatException(SExprTokenizer.FORMAT,
                    "Unexpected ')' at offset " + token.offset());
            case STRING -> {
                return SExpr.atom(SExpr.Kind.STRING, token.text());
            }
            case BRACKET -> {
                return SExpr.atom(SExpr.Kind.BRACKET, token.text());
            }
            default -> {
                return SExpr.atom(SExpr.Kind.SYMBOL, token.text());
            }
        }
    }
}
