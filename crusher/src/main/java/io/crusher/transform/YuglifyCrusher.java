package io.crusher.transform;

import com.yahoo.platform.yui.compressor.CssCompressor;
import com.yahoo.platform.yui.compressor.JavaScriptCompressor;
import io.crusher.core.ContentType;
import io.crusher.error.CrushException;
import io.crusher.registry.CrusherKind;
import org.mozilla.javascript.ErrorReporter;
import org.mozilla.javascript.EvaluatorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;

/**
 * YUI's minifiers run in process: the Rhino-based script compressor with local name munging, and
 * the stylesheet compressor. Needs no Java executable or vendor jar.
 */
public class YuglifyCrusher extends InProcessCrusher {
    private static final Logger log = LoggerFactory.getLogger(YuglifyCrusher.class);
    private static final int NO_LINE_BREAK = -1;

    public YuglifyCrusher() {
        super(CrusherKind.YUGLIFY);
    }

    @Override
    protected String compact(ContentType type, String content) throws CrushException {
        String source = content == null ? "" : content;
        StringWriter out = new StringWriter(source.length());
        Errors errors = new Errors();
        try {
            if (type == ContentType.CSS) {
                new CssCompressor(new StringReader(source)).compress(out, NO_LINE_BREAK);
            } else {
                new JavaScriptCompressor(new StringReader(source), errors)
                        .compress(out, NO_LINE_BREAK, true, false, false, false);
            }
        } catch (EvaluatorException e) {
            throw new CrushException(errors.describe(e), e);
        } catch (IOException e) {
            throw new CrushException("yuglify failed: " + e.getMessage(), e);
        }
        return out.toString();
    }

    /** Collects parse errors so the reply carries the first one with its position. */
    private static final class Errors implements ErrorReporter {
        private final List<String> messages = new ArrayList<>();

        @Override
        public void warning(String message, String sourceName, int line, String lineSource, int lineOffset) {
            log.debug("yuglify warning at {}:{}: {}", line, lineOffset, message);
        }

        @Override
        public void error(String message, String sourceName, int line, String lineSource, int lineOffset) {
            messages.add(message + " at line " + line + ", column " + lineOffset);
        }

        @Override
        public EvaluatorException runtimeError(String message, String sourceName, int line, String lineSource,
                                               int lineOffset) {
            error(message, sourceName, line, lineSource, lineOffset);
            return new EvaluatorException(message, sourceName, line, lineSource, lineOffset);
        }

        String describe(EvaluatorException e) {
            return messages.isEmpty() ? "yuglify failed: " + e.getMessage() : messages.get(0);
        }
    }
}
