package org.dxworks.thesisdoc.convert;

import org.dxworks.thesisdoc.markdown.MarkdownTokenizer;
import org.dxworks.thesisdoc.model.document.StyledDocument;
import org.dxworks.thesisdoc.model.token.Token;
import org.dxworks.thesisdoc.render.DocumentBuilder;
import org.dxworks.thesisdoc.style.StyleApplier;
import org.dxworks.thesisdoc.style.StyleSheet;
import org.dxworks.thesisdoc.writer.DocxWriter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Built-in renderer used when no external converter is available: tokenizes the
 * Markdown, applies the style sheet to a blank document, builds the blocks and
 * writes the result with {@link DocxWriter}.
 */
public class FallbackConverter implements DocumentConverter {

    private final StyleSheet styleSheet;
    private final String headerText;
    private final MarkdownTokenizer tokenizer = new MarkdownTokenizer();
    private final DocxWriter writer = new DocxWriter();

    public FallbackConverter(StyleSheet styleSheet, String headerText) {
        this.styleSheet = styleSheet;
        this.headerText = headerText;
    }

    @Override
    public boolean convert(Path markdownInput, Path docxOutput) throws IOException {
        String markdown = Files.readString(markdownInput, StandardCharsets.UTF_8);
        writer.write(render(markdown), docxOutput);
        return true;
    }

    public StyledDocument render(String markdown) {
        // Remove BOM if present
        if (markdown.startsWith("\uFEFF")) {
            markdown = markdown.substring(1);
        }
        List<Token> tokens = tokenizer.tokenize(markdown);
        StyledDocument document = StyledDocument.blank();
        StyleApplier.apply(document, styleSheet, headerText);
        new DocumentBuilder(styleSheet).appendTo(document, tokens);
        return document;
    }
}
