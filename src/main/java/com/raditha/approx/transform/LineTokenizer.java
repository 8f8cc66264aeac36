package com.raditha.approx.transform;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a single line of C/C++ into tokens. Concatenating the token texts always
 * gives back the original line.
 * <p>
 * Unterminated string literals and block comments run to the end of the line.
 */
public final class LineTokenizer {

    private static final String[] MULTI_CHAR_PUNCTUATION = {
            "<<=", ">>=", "->", "::", "++", "--", "+=", "-=", "*=", "/=", "%=",
            "&=", "|=", "^=", "==", "!=", "<=", ">=", "&&", "||", "<<", ">>"
    };

    private LineTokenizer() {
    }

    public static List<Token> tokenize(String line) {
        List<Token> tokens = new ArrayList<>();
        int i = 0;
        int n = line.length();

        while (i < n) {
            char c = line.charAt(i);
            int end;
            Token.Type type;

            if (Character.isWhitespace(c)) {
                end = i;
                while (end < n && Character.isWhitespace(line.charAt(end))) {
                    end++;
                }
                type = Token.Type.WHITESPACE;
            } else if (line.startsWith("//", i)) {
                end = n;
                type = Token.Type.COMMENT;
            } else if (line.startsWith("/*", i)) {
                int close = line.indexOf("*/", i + 2);
                end = close < 0 ? n : close + 2;
                type = Token.Type.COMMENT;
            } else if (c == '"' || c == '\'') {
                end = scanLiteral(line, i, c);
                type = Token.Type.LITERAL;
            } else if (Character.isLetter(c) || c == '_') {
                end = i;
                while (end < n && isIdentifierPart(line.charAt(end))) {
                    end++;
                }
                type = Token.Type.IDENTIFIER;
            } else if (Character.isDigit(c) || (c == '.' && i + 1 < n && Character.isDigit(line.charAt(i + 1)))) {
                end = scanNumber(line, i);
                type = Token.Type.NUMBER;
            } else {
                end = i + punctuationLength(line, i);
                type = Token.Type.PUNCTUATION;
            }

            tokens.add(new Token(type, line.substring(i, end)));
            i = end;
        }
        return tokens;
    }

    private static int scanLiteral(String line, int start, char quote) {
        int i = start + 1;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                return i + 1;
            }
            i++;
        }
        return line.length();
    }

    private static int scanNumber(String line, int start) {
        boolean hex = line.startsWith("0x", start) || line.startsWith("0X", start);
        int i = start;
        while (i < line.length()) {
            char c = line.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '.' || c == '_') {
                i++;
            } else if ((c == '+' || c == '-') && isExponentMarker(line.charAt(i - 1), hex)) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    private static boolean isExponentMarker(char c, boolean hex) {
        if (hex) {
            return c == 'p' || c == 'P';
        }
        return c == 'e' || c == 'E';
    }

    private static int punctuationLength(String line, int i) {
        for (String candidate : MULTI_CHAR_PUNCTUATION) {
            if (line.startsWith(candidate, i)) {
                return candidate.length();
            }
        }
        return 1;
    }

    private static boolean isIdentifierPart(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
