package com.impetus.impetus_backend.codec.sexpr;

import com.impetus.impetus_backend.exception.LayoutFormatException;

import java.util.ArrayList;
import java.util.List;

/**
 * Single left-to-right scan. Strings are double-quoted without escapes, {@code [..]} is a
 * bracket atom and {@code ;;} starts a comment that runs to the end of the line.
 */
public final class SExprTokenizer {

    static final String FORMAT = "S-expression";

    private SExprTokenizer() {
    }

    public static List<SExprToken> tokenize(String content) {
        List<SExprToken> tokens = new ArrayList<>();
        int len = content.length();
        int i = 0;
        while (i < len) {
            char c = content.charAt(i);

            if (Character.isWhitespace(c) || c == '\uFEFF') {
                i++;
            } else if (c == ';' && i + 1 < len && content.charAt(i + 1) == ';') {
                while (i < len && content.charAt(i) != '\n' && content.charAt(i) != '\r') i++;
            } else if (c == '(') {
                tokens.add(new SExprToken(SExprToken.Kind.OPEN, "(", i++));
            } else if (c == ')') {
                tokens.add(new SExprToken(SExprToken.Kind.CLOSE, ")", i++));
            } else if (c == '"') {
                int end = content.indexOf('"', i + 1);
                if (end < 0) throw new LayoutFormatException(FORMAT, "Unterminated string at offset " + i);
                tokens.add(new SExprToken(SExprToken.Kind.STRING, content.substring(i + 1, end), i));
                i = end + 1;
            } else if (c == '[') {
                int end = content.indexOf(']', i + 1);
                if (end < 0) throw new LayoutFormatException(FORMAT, "Unterminated bracket at offset " + i);
                tokens.add(new SExprToken(SExprToken.Kind.BRACKET, content.substring(i + 1, end).trim(), i));
                i = end + 1;
            } else {
                int start = i;
                while (i < len && !endsSymbol(content, i)) i++;
                tokens.add(new SExprToken(SExprToken.Kind.SYMBOL, content.substring(start, i), start));
            }
        }
        return tokens;
    }

    private static boolean endsSymbol(String content, int i) {
        char c = content.charAt(i);
        if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == '[') return true;
        return c == ';' && i + 1 < content.length() && content.charAt(i + 1) == ';';
    }
}
