package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.error.CrushException;
import io.crusher.registry.CrusherKind;

/**
 * Douglas Crockford's JSMin: removes comments and insignificant whitespace without renaming or
 * otherwise rewriting the program.
 */
public class JsMinCrusher extends InProcessCrusher {
    private static final int EOF = -1;

    public JsMinCrusher() {
        super(CrusherKind.JSMIN);
    }

    @Override
    protected String compact(ContentType type, String content) throws CrushException {
        return new Minifier(content).run();
    }

    private static final class Minifier {
        private final String in;
        private final StringBuilder out;
        private int pos;
        private int a;
        private int b;
        private int x = EOF;
        private int y = EOF;
        private int lookahead = EOF;
        private boolean peeked;

        Minifier(String in) {
            this.in = in == null ? "" : in;
            this.out = new StringBuilder(this.in.length());
        }

        String run() throws CrushException {
            if (in.startsWith("\uFEFF")) pos = 1;
            a = '\n';
            action(3);
            while (a != EOF) {
                switch (a) {
                    case ' ':
                        action(isAlphanum(b) ? 1 : 2);
                        break;
                    case '\n':
                        switch (b) {
                            case '{': case '[': case '(': case '+': case '-': case '!': case '~':
                                action(1);
                                break;
                            case ' ':
                                action(3);
                                break;
                            default:
                                action(isAlphanum(b) ? 1 : 2);
                        }
                        break;
                    default:
                        switch (b) {
                            case ' ':
                                action(isAlphanum(a) ? 1 : 3);
                                break;
                            case '\n':
                                switch (a) {
                                    case '}': case ']': case ')': case '+': case '-': case '"': case '\'': case '`':
                                        action(1);
                                        break;
                                    default:
                                        action(isAlphanum(a) ? 1 : 3);
                                }
                                break;
                            default:
                                action(1);
                        }
                }
            }
            // the first action emits the leading newline sentinel
            int start = 0;
            while (start < out.length() && out.charAt(start) == '\n') start++;
            return out.substring(start);
        }

        /**
         * 1: output a, copy b to a, get next b. 2: copy b to a, get next b. 3: get next b.
         * Strings and regular expression literals are copied verbatim.
         */
        private void action(int d) throws CrushException {
            if (d <= 1) {
                put(a);
                if ((y == '\n' || y == ' ') && isOperator(a) && isOperator(b)) put(y);
            }
            if (d <= 2) {
                a = b;
                if (a == '\'' || a == '"' || a == '`') {
                    for (;;) {
                        put(a);
                        a = get();
                        if (a == b) break;
                        if (a == '\\') {
                            put(a);
                            a = get();
                        }
                        if (a == EOF) throw new CrushException("Unterminated string literal");
                    }
                }
            }
            b = next();
            if (b == '/' && "(,=:[!&|?{};\n".indexOf(a) >= 0) {
                put(a);
                if (a == '/' || a == '*') put(' ');
                put(b);
                for (;;) {
                    a = get();
                    if (a == '[') {
                        for (;;) {
                            put(a);
                            a = get();
                            if (a == ']') break;
                            if (a == '\\') {
                                put(a);
                                a = get();
                            }
                            if (a == EOF) throw new CrushException("Unterminated set in regular expression literal");
                        }
                    } else if (a == '/') {
                        break;
                    } else if (a == '\\') {
                        put(a);
                        a = get();
                    }
                    if (a == EOF) throw new CrushException("Unterminated regular expression literal");
                    put(a);
                }
                b = next();
            }
        }

        /** Next character with comments collapsed to a single space or newline. */
        private int next() throws CrushException {
            int c = get();
            if (c == '/') {
                int p = peek();
                if (p == '/') {
                    do {
                        c = get();
                    } while (c > '\n');
                } else if (p == '*') {
                    get();
                    c = skipBlockComment();
                }
            }
            y = x;
            x = c;
            return c;
        }

        private int skipBlockComment() throws CrushException {
            for (;;) {
                int c = get();
                if (c == EOF) throw new CrushException("Unterminated comment");
                if (c == '*' && peek() == '/') {
                    get();
                    return ' ';
                }
            }
        }

        private int peek() {
            if (!peeked) {
                lookahead = get();
                peeked = true;
            }
            return lookahead;
        }

        private int get() {
            int c;
            if (peeked) {
                peeked = false;
                c = lookahead;
            } else {
                c = pos < in.length() ? in.charAt(pos++) : EOF;
            }
            if (c >= ' ' || c == '\n' || c == EOF) return c;
            if (c == '\r') return '\n';
            return ' ';
        }

        private void put(int c) {
            if (c != EOF) out.append((char) c);
        }

        private static boolean isOperator(int c) {
            return c == '+' || c == '-' || c == '*' || c == '/';
        }

        private static boolean isAlphanum(int c) {
            return (c >= 'a' && c <= 'z') || (c >= '0' && c <= '9') || (c >= 'A' && c <= 'Z')
                    || c == '_' || c == '$' || c == '\\' || c > 126;
        }
    }
}
