package io.crusher.transform;

import io.crusher.core.ContentType;
import io.crusher.error.CrushException;
import io.crusher.registry.CrusherKind;

/**
 * Stylesheet compaction: drops comments, collapses whitespace, tightens punctuation and removes
 * the last semicolon of each block. String literals are copied untouched.
 */
public class CssCrusher extends InProcessCrusher {
    private static final String TIGHT = "{};,>";

    public CssCrusher() {
        super(CrusherKind.SQWISH);
    }

    @Override
    protected String compact(ContentType type, String content) throws CrushException {
        String css = content == null ? "" : content;
        StringBuilder out = new StringBuilder(css.length());
        boolean space = false;
        int i = 0;
        int n = css.length();
        while (i < n) {
            char c = css.charAt(i);
            if (c == '/' && i + 1 < n && css.charAt(i + 1) == '*') {
                int end = css.indexOf("*/", i + 2);
                if (end < 0) throw new CrushException("Unterminated comment at offset " + i);
                i = end + 2;
                space = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                space = true;
                i++;
                continue;
            }
            if (space && out.length() > 0 && !tightAfter(out.charAt(out.length() - 1)) && TIGHT.indexOf(c) < 0) {
                out.append(' ');
            }
            space = false;
            if (c == '"' || c == '\'') {
                i = copyString(css, i, out);
                continue;
            }
            if (c == '}' && out.length() > 0 && out.charAt(out.length() - 1) == ';') {
                out.setLength(out.length() - 1);
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    private static boolean tightAfter(char c) {
        return TIGHT.indexOf(c) >= 0 || c == ':';
    }

    private static int copyString(String css, int start, StringBuilder out) throws CrushException {
        char quote = css.charAt(start);
        int i = start + 1;
        while (i < css.length()) {
            char c = css.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == quote) {
                out.append(css, start, i + 1);
                return i + 1;
            }
            i++;
        }
        throw new CrushException("Unterminated string at offset " + start);
    }
}
