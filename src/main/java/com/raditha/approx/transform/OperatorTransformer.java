package com.raditha.approx.transform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Rewrites binary arithmetic in a source line into calls to approximate operators.
 * <p>
 * {@code a + b} becomes {@code FADDX(a, b)} when {@code +} maps to {@code FADDX}. The
 * leftmost rewritable occurrence is replaced first and the line is rescanned until no
 * occurrence qualifies, so {@code a + b + c} yields {@code FADDX(FADDX(a, b), c)} and
 * {@code a + b * c} yields {@code FADDX(a, FMULX(b, c))}.
 * <p>
 * This is a token-level rewrite, not a parse. An occurrence is left alone whenever its
 * surroundings make the grouping uncertain: a unary operator, a cast, a pointer
 * declaration, postfix increment, or a tighter-binding operator that is not itself
 * being rewritten. A line with nothing rewritable comes back unchanged, and output of
 * this class has nothing rewritable left, so applying it twice changes nothing.
 */
public class OperatorTransformer {

    public static final Set<String> SUPPORTED_OPERATORS = Set.of("+", "-", "*", "/", "%");

    private static final Pattern CALL_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private static final Set<String> KEYWORDS = Set.of(
            "auto", "bool", "break", "case", "char", "const", "constexpr", "continue", "default",
            "delete", "do", "double", "else", "enum", "extern", "float", "for", "goto", "if",
            "inline", "int", "long", "new", "register", "return", "short", "signed", "static",
            "struct", "switch", "typedef", "union", "unsigned", "void", "volatile", "while");

    private static final Set<String> UNARY_PREFIXES = Set.of("!", "~", "&", "++", "--", ")");

    private final Map<String, String> operatorToCall;

    /**
     * @param operatorToCall operator symbol to approximate call name, e.g. {@code "*" -> "FMULX"}
     * @throws IllegalArgumentException for unsupported operators or invalid call names
     */
    public OperatorTransformer(Map<String, String> operatorToCall) {
        if (operatorToCall == null || operatorToCall.isEmpty()) {
            throw new IllegalArgumentException("operator map cannot be empty");
        }
        Map<String, String> copy = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : operatorToCall.entrySet()) {
            String operator = entry.getKey() == null ? null : entry.getKey().strip();
            if (!SUPPORTED_OPERATORS.contains(operator)) {
                throw new IllegalArgumentException("Unsupported operator '" + entry.getKey()
                        + "'. Must be one of: + - * / %");
            }
            if (entry.getValue() == null || !CALL_NAME.matcher(entry.getValue()).matches()) {
                throw new IllegalArgumentException("Invalid call name for operator '" + operator
                        + "': " + entry.getValue());
            }
            copy.put(operator, entry.getValue());
        }
        this.operatorToCall = Collections.unmodifiableMap(copy);
    }

    public Map<String, String> getOperatorToCall() {
        return operatorToCall;
    }

    /**
     * Apply every configured rewrite to one line.
     *
     * @return the rewritten line, or the input itself when nothing matched
     */
    public String applyTransform(String line) {
        String current = line;
        while (true) {
            List<Token> tokens = LineTokenizer.tokenize(current);
            Rewrite rewrite = findLeftmostRewrite(tokens);
            if (rewrite == null) {
                return current;
            }
            current = rewrite.apply(tokens);
        }
    }

    private Rewrite findLeftmostRewrite(List<Token> tokens) {
        for (int i = 0; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() != Token.Type.PUNCTUATION || !operatorToCall.containsKey(token.text())) {
                continue;
            }
            Rewrite rewrite = tryRewriteAt(tokens, i);
            if (rewrite != null) {
                return rewrite;
            }
        }
        return null;
    }

    private Rewrite tryRewriteAt(List<Token> tokens, int operatorIndex) {
        String operator = tokens.get(operatorIndex).text();
        int tier = tier(operator);

        int leftEnd = previousSignificant(tokens, operatorIndex);
        if (leftEnd < 0) {
            return null;
        }
        int leftStart = operandStartBackward(tokens, leftEnd);
        if (leftStart < 0) {
            return null;
        }

        int rightStart = nextSignificant(tokens, operatorIndex);
        if (rightStart < 0) {
            return null;
        }
        int rightEnd = operandEndForward(tokens, rightStart);
        if (rightEnd < 0) {
            return null;
        }

        int before = previousSignificant(tokens, leftStart);
        int after = nextSignificant(tokens, rightEnd);
        if (!leftContextAllows(tokens, before, tier) || !rightContextAllows(tokens, after, tier)) {
            return null;
        }
        if (operator.equals("*") && leftStart == leftEnd && rightStart == rightEnd
                && looksLikeDeclaration(tokens, before, after)) {
            return null;
        }
        return new Rewrite(operatorToCall.get(operator), leftStart, leftEnd, rightStart, rightEnd);
    }

    /**
     * Walks back over identifiers, literals, member access chains, calls, subscripts and
     * parenthesised groups.
     */
    private int operandStartBackward(List<Token> tokens, int end) {
        int pos = end;
        while (true) {
            Token token = tokens.get(pos);
            if (token.is(")") || token.is("]")) {
                int open = matchBackward(tokens, pos);
                if (open < 0) {
                    return -1;
                }
                int before = previousSignificant(tokens, open);
                if (token.is("]")) {
                    if (before < 0) {
                        return -1;
                    }
                    pos = before;
                    continue;
                }
                if (before >= 0 && isCallee(tokens.get(before))) {
                    pos = before;
                    continue;
                }
                return open;
            }
            if (isAtom(token)) {
                int before = previousSignificant(tokens, pos);
                if (before >= 0 && isMemberAccess(tokens.get(before))) {
                    int owner = previousSignificant(tokens, before);
                    if (owner < 0) {
                        return tokens.get(before).is("::") ? before : -1;
                    }
                    pos = owner;
                    continue;
                }
                return pos;
            }
            return -1;
        }
    }

    private int operandEndForward(List<Token> tokens, int start) {
        Token first = tokens.get(start);
        int end;
        if (first.is("(")) {
            end = matchForward(tokens, start);
        } else if (first.is("::")) {
            int name = nextSignificant(tokens, start);
            end = name >= 0 && isAtom(tokens.get(name)) ? name : -1;
        } else if (isAtom(first)) {
            end = start;
        } else {
            end = -1;
        }
        if (end < 0) {
            return -1;
        }

        while (true) {
            int next = nextSignificant(tokens, end);
            if (next < 0) {
                return end;
            }
            Token token = tokens.get(next);
            if (token.is("(") || token.is("[")) {
                int close = matchForward(tokens, next);
                if (close < 0) {
                    return -1;
                }
                end = close;
            } else if (isMemberAccess(token)) {
                int member = nextSignificant(tokens, next);
                if (member < 0 || tokens.get(member).type() != Token.Type.IDENTIFIER) {
                    return -1;
                }
                end = member;
            } else {
                return end;
            }
        }
    }

    private boolean leftContextAllows(List<Token> tokens, int index, int tier) {
        if (index < 0) {
            return true;
        }
        Token token = tokens.get(index);
        switch (token.type()) {
            case COMMENT:
                return true;
            case IDENTIFIER:
                return KEYWORDS.contains(token.text());
            case NUMBER:
            case LITERAL:
                return false;
            default:
                break;
        }
        String text = token.text();
        if (UNARY_PREFIXES.contains(text)) {
            return false;
        }
        return tier(text) < tier;
    }

    private boolean rightContextAllows(List<Token> tokens, int index, int tier) {
        if (index < 0) {
            return true;
        }
        Token token = tokens.get(index);
        if (token.type() == Token.Type.COMMENT) {
            return true;
        }
        if (token.type() != Token.Type.PUNCTUATION) {
            return false;
        }
        String text = token.text();
        if (text.equals("++") || text.equals("--") || text.equals("=")
                || text.equals("(") || text.equals("[") || text.equals("{")) {
            return false;
        }
        return tier(text) <= tier;
    }

    /**
     * {@code Type *name;} at the start of a statement.
     */
    private static boolean looksLikeDeclaration(List<Token> tokens, int before, int after) {
        boolean statementStart = before < 0 || tokens.get(before).is(";")
                || tokens.get(before).is("{") || tokens.get(before).is("}");
        boolean declarationEnd = after < 0 || tokens.get(after).is(";") || tokens.get(after).is(",");
        return statementStart && declarationEnd;
    }

    private static boolean isAtom(Token token) {
        return switch (token.type()) {
            case NUMBER -> true;
            case IDENTIFIER -> !KEYWORDS.contains(token.text());
            default -> false;
        };
    }

    private static boolean isCallee(Token token) {
        return isAtom(token) && token.type() == Token.Type.IDENTIFIER
                || token.is(")") || token.is("]")
                || token.type() == Token.Type.IDENTIFIER && token.text().equals("sizeof");
    }

    private static boolean isMemberAccess(Token token) {
        return token.is(".") || token.is("->") || token.is("::");
    }

    /**
     * Binding strength of arithmetic operators; 0 for everything else.
     */
    private static int tier(String operator) {
        return switch (operator) {
            case "*", "/", "%" -> 2;
            case "+", "-" -> 1;
            default -> 0;
        };
    }

    private static int previousSignificant(List<Token> tokens, int index) {
        for (int i = index - 1; i >= 0; i--) {
            if (!tokens.get(i).isWhitespace()) {
                return i;
            }
        }
        return -1;
    }

    private static int nextSignificant(List<Token> tokens, int index) {
        for (int i = index + 1; i < tokens.size(); i++) {
            if (!tokens.get(i).isWhitespace()) {
                return i;
            }
        }
        return -1;
    }

    private static int matchBackward(List<Token> tokens, int close) {
        String closer = tokens.get(close).text();
        String opener = closer.equals(")") ? "(" : "[";
        int depth = 0;
        for (int i = close; i >= 0; i--) {
            Token token = tokens.get(i);
            if (token.type() == Token.Type.COMMENT) {
                return -1;
            }
            if (token.is(closer)) {
                depth++;
            } else if (token.is(opener)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int matchForward(List<Token> tokens, int open) {
        String opener = tokens.get(open).text();
        String closer = opener.equals("(") ? ")" : "]";
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (token.type() == Token.Type.COMMENT) {
                return -1;
            }
            if (token.is(opener)) {
                depth++;
            } else if (token.is(closer)) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private record Rewrite(String callName, int leftStart, int leftEnd, int rightStart, int rightEnd) {

        String apply(List<Token> tokens) {
            StringBuilder out = new StringBuilder();
            append(out, tokens, 0, leftStart);
            out.append(callName).append('(');
            append(out, tokens, leftStart, leftEnd + 1);
            out.append(", ");
            append(out, tokens, rightStart, rightEnd + 1);
            out.append(')');
            append(out, tokens, rightEnd + 1, tokens.size());
            return out.toString();
        }

        private static void append(StringBuilder out, List<Token> tokens, int from, int to) {
            for (int i = from; i < to; i++) {
                out.append(tokens.get(i).text());
            }
        }
    }
}
