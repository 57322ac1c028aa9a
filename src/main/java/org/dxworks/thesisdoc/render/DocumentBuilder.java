package org.dxworks.thesisdoc.render;

import org.dxworks.thesisdoc.model.document.Paragraph;
import org.dxworks.thesisdoc.model.document.Run;
import org.dxworks.thesisdoc.model.document.StyledDocument;
import org.dxworks.thesisdoc.model.token.Token;
import org.dxworks.thesisdoc.model.token.TokenKind;
import org.dxworks.thesisdoc.style.StyleSheet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Walks a token stream once, front to back, and appends styled blocks to a
 * document. Assumes a balanced stream as produced by
 * {@link org.dxworks.thesisdoc.markdown.MarkdownTokenizer}; unbalanced input is
 * not detected.
 *
 * <p>An instance keeps the list context of the walk in progress and must not be
 * shared between threads.
 */
public class DocumentBuilder {

    public static final String MONOSPACE_FONT = "Consolas";
    public static final String BULLET_GLYPH = "•";
    // Every ordered item gets the same marker; see DESIGN.md
    public static final String ORDERED_MARKER = "1.";
    public static final String LIST_INDENT = "    ";
    public static final String QUOTE_PREFIX = "> ";
    public static final String HORIZONTAL_RULE_TEXT = "——————";

    private final StyleSheet styleSheet;
    private final InlineRenderer inlineRenderer = new InlineRenderer(MONOSPACE_FONT);
    private final Deque<ListContext> listStack = new ArrayDeque<>();

    public DocumentBuilder(StyleSheet styleSheet) {
        this.styleSheet = styleSheet;
    }

    /**
     * Builds a new document holding only the blocks of {@code tokens}.
     */
    public StyledDocument build(List<Token> tokens) {
        StyledDocument document = StyledDocument.blank();
        appendTo(document, tokens);
        return document;
    }

    public void appendTo(StyledDocument document, List<Token> tokens) {
        listStack.clear();
        TokenCursor cursor = new TokenCursor(tokens);
        while (cursor.hasCurrent()) {
            Token token = cursor.current();
            switch (token.getKind()) {
                case HEADING_OPEN -> heading(cursor, document);
                case PARAGRAPH_OPEN -> paragraph(cursor, document);
                case BULLET_LIST_OPEN -> openList(cursor, ListContext.Kind.BULLET);
                case ORDERED_LIST_OPEN -> openList(cursor, ListContext.Kind.ORDERED);
                case BULLET_LIST_CLOSE, ORDERED_LIST_CLOSE -> closeList(cursor);
                case LIST_ITEM_OPEN -> listItem(cursor, document);
                case FENCE, CODE_BLOCK -> codeBlock(cursor, document);
                case BLOCKQUOTE_OPEN -> blockquote(cursor, document);
                case HORIZONTAL_RULE -> {
                    document.addParagraph(HORIZONTAL_RULE_TEXT);
                    cursor.advance();
                }
                default -> cursor.advance();
            }
        }
    }

    /**
     * Number of lists still open; zero after walking a balanced stream.
     */
    public int openListCount() {
        return listStack.size();
    }

    private void heading(TokenCursor cursor, StyledDocument document) {
        int level = cursor.next().getLevel();
        String text = cursor.consumeIf(TokenKind.INLINE).map(Token::plainText).orElse("");
        document.addHeading(text, Math.min(level, StyledDocument.MAX_HEADING_LEVEL));
        cursor.consumeIf(TokenKind.HEADING_CLOSE);
    }

    private void paragraph(TokenCursor cursor, StyledDocument document) {
        cursor.advance();
        Paragraph paragraph = document.addParagraph();
        // No children leaves the paragraph without runs
        cursor.consumeIf(TokenKind.INLINE)
                .filter(Token::hasChildren)
                .ifPresent(inline -> inlineRenderer.render(inline.getChildren(), paragraph));
        cursor.consumeIf(TokenKind.PARAGRAPH_CLOSE);
    }

    private void openList(TokenCursor cursor, ListContext.Kind kind) {
        listStack.push(new ListContext(kind, listStack.size()));
        cursor.advance();
    }

    private void closeList(TokenCursor cursor) {
        if (!listStack.isEmpty()) {
            listStack.pop();
        }
        cursor.advance();
    }

    /**
     * Emits one paragraph per item from the inline text that precedes any nested
     * list directly under the item. Such a list is left on the cursor and walked
     * as usual; the outer item close that follows it is then skipped as an
     * unhandled token. Lists nested deeper (inside a quote) stay part of the item.
     */
    private void listItem(TokenCursor cursor, StyledDocument document) {
        cursor.advance();
        List<Token> itemTokens = cursor.takeUntilOutside(
                token -> token.is(TokenKind.LIST_ITEM_CLOSE) || token.getKind().opensList(),
                token -> token.getKind().opensContainer(),
                token -> token.getKind().closesContainer());
        String text = "";
        for (Token token : itemTokens) {
            if (token.is(TokenKind.INLINE) && token.hasChildren()) {
                text = token.plainText();
            }
        }
        cursor.consumeIf(TokenKind.LIST_ITEM_CLOSE);

        ListContext innermost = listStack.peek();
        String marker = innermost != null && innermost.getKind() == ListContext.Kind.BULLET
                ? BULLET_GLYPH
                : ORDERED_MARKER;
        String indent = innermost != null ? LIST_INDENT.repeat(innermost.getDepth()) : "";
        Paragraph paragraph = document.addParagraph(indent + marker + " " + text);
        paragraph.lineSpacingPt = styleSheet.getBody().getLineSpacingPt();
    }

    private void codeBlock(TokenCursor cursor, StyledDocument document) {
        String code = stripTrailingNewline(cursor.next().getContent());
        Paragraph paragraph = document.addParagraph();
        paragraph.runs.add(new Run(code, MONOSPACE_FONT));
    }

    private void blockquote(TokenCursor cursor, StyledDocument document) {
        List<Token> quoted = cursor.takeBalanced(
                TokenCursor.kind(TokenKind.BLOCKQUOTE_OPEN),
                TokenCursor.kind(TokenKind.BLOCKQUOTE_CLOSE));
        List<String> lines = new ArrayList<>();
        for (Token token : quoted) {
            if (token.is(TokenKind.INLINE) && !token.getContent().isEmpty()) {
                lines.add(token.getContent());
            }
        }
        for (String line : lines) {
            document.addParagraph(QUOTE_PREFIX + line);
        }
    }

    private static String stripTrailingNewline(String text) {
        if (text.endsWith("\r\n")) {
            return text.substring(0, text.length() - 2);
        }
        if (text.endsWith("\n") || text.endsWith("\r")) {
            return text.substring(0, text.length() - 1);
        }
        return text;
    }
}
