package org.dxworks.thesisdoc.render;

import org.dxworks.thesisdoc.model.document.Paragraph;
import org.dxworks.thesisdoc.model.document.Run;
import org.dxworks.thesisdoc.model.token.InlineSpan;

import java.util.List;

/**
 * Turns the flat children of an inline token into runs of one paragraph.
 * Emphasis, strikethrough and link markers are consumed without changing the
 * run formatting.
 */
public class InlineRenderer {

    private final String monospaceFont;

    public InlineRenderer(String monospaceFont) {
        this.monospaceFont = monospaceFont;
    }

    public void render(List<InlineSpan> spans, Paragraph paragraph) {
        for (InlineSpan span : spans) {
            switch (span.getKind()) {
                case TEXT -> paragraph.addRun(span.getContent());
                case CODE_INLINE -> {
                    Run run = paragraph.addRun(span.getContent());
                    run.fontFamily = monospaceFont;
                }
                case SOFT_BREAK, HARD_BREAK -> paragraph.addRun("\n");
                case EM_OPEN, EM_CLOSE, STRONG_OPEN, STRONG_CLOSE,
                        STRIKE_OPEN, STRIKE_CLOSE, LINK_OPEN, LINK_CLOSE -> {
                    // formatting markers carry no text
                }
                default -> {
                    if (span.hasContent()) {
                        paragraph.addRun(span.getContent());
                    }
                }
            }
        }
    }
}
