package org.dxworks.thesisdoc.markdown;

import org.dxworks.thesisdoc.model.token.InlineSpan;
import org.dxworks.thesisdoc.model.token.SpanKind;
import org.dxworks.thesisdoc.model.token.Token;
import org.dxworks.thesisdoc.model.token.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.dxworks.thesisdoc.model.token.TokenKind.BULLET_LIST_CLOSE;
import static org.dxworks.thesisdoc.model.token.TokenKind.BULLET_LIST_OPEN;
import static org.dxworks.thesisdoc.model.token.TokenKind.INLINE;
import static org.dxworks.thesisdoc.model.token.TokenKind.LIST_ITEM_CLOSE;
import static org.dxworks.thesisdoc.model.token.TokenKind.LIST_ITEM_OPEN;
import static org.dxworks.thesisdoc.model.token.TokenKind.PARAGRAPH_CLOSE;
import static org.dxworks.thesisdoc.model.token.TokenKind.PARAGRAPH_OPEN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MarkdownTokenizerTest {

    private final MarkdownTokenizer tokenizer = new MarkdownTokenizer();

    private static List<TokenKind> kinds(List<Token> tokens) {
        return tokens.stream().map(Token::getKind).collect(Collectors.toList());
    }

    private static List<SpanKind> spanKinds(Token token) {
        return token.getChildren().stream().map(InlineSpan::getKind).collect(Collectors.toList());
    }

    @Test
    void tokenize_HeadingAndParagraph() {
        List<Token> tokens = tokenizer.tokenize("# Intro\n\nSome text.\n");

        assertEquals(List.of(TokenKind.HEADING_OPEN, INLINE, TokenKind.HEADING_CLOSE,
                PARAGRAPH_OPEN, INLINE, PARAGRAPH_CLOSE), kinds(tokens));
        assertEquals(1, tokens.get(0).getLevel());
        assertEquals("Intro", tokens.get(1).getContent());
        assertEquals("Some text.", tokens.get(4).plainText());
    }

    @Test
    void tokenize_EmphasisBecomesMarkers() {
        List<Token> tokens = tokenizer.tokenize("a *b* **c** [d](http://x)");

        Token inline = tokens.get(1);
        assertEquals(List.of(SpanKind.TEXT,
                SpanKind.EM_OPEN, SpanKind.TEXT, SpanKind.EM_CLOSE,
                SpanKind.TEXT,
                SpanKind.STRONG_OPEN, SpanKind.TEXT, SpanKind.STRONG_CLOSE,
                SpanKind.TEXT,
                SpanKind.LINK_OPEN, SpanKind.TEXT, SpanKind.LINK_CLOSE), spanKinds(inline));
        assertEquals("a b c d", inline.plainText());
        assertEquals("a *b* **c** [d](http://x)", inline.getContent());
    }

    @Test
    void tokenize_StrikethroughSoftBreakAndCode() {
        List<Token> tokens = tokenizer.tokenize("~~old~~\n`new`");

        assertEquals(List.of(SpanKind.STRIKE_OPEN, SpanKind.TEXT, SpanKind.STRIKE_CLOSE,
                SpanKind.SOFT_BREAK, SpanKind.CODE_INLINE), spanKinds(tokens.get(1)));
        assertEquals("new", tokens.get(1).getChildren().get(4).getContent());
    }

    @Test
    void tokenize_NestedListOrder() {
        List<Token> tokens = tokenizer.tokenize("- a\n  - b\n");

        assertEquals(List.of(
                BULLET_LIST_OPEN, LIST_ITEM_OPEN, PARAGRAPH_OPEN, INLINE, PARAGRAPH_CLOSE,
                BULLET_LIST_OPEN, LIST_ITEM_OPEN, PARAGRAPH_OPEN, INLINE, PARAGRAPH_CLOSE, LIST_ITEM_CLOSE,
                BULLET_LIST_CLOSE,
                LIST_ITEM_CLOSE, BULLET_LIST_CLOSE), kinds(tokens));
    }

    @Test
    void tokenize_OrderedList() {
        List<Token> tokens = tokenizer.tokenize("1. one\n");

        assertEquals(TokenKind.ORDERED_LIST_OPEN, tokens.get(0).getKind());
        assertEquals(TokenKind.ORDERED_LIST_CLOSE, tokens.get(tokens.size() - 1).getKind());
    }

    @Test
    void tokenize_FenceKeepsLiteral() {
        List<Token> tokens = tokenizer.tokenize("```python\nx=1\n```\n");

        assertEquals(1, tokens.size());
        assertEquals(TokenKind.FENCE, tokens.get(0).getKind());
        assertEquals("x=1\n", tokens.get(0).getContent());
    }

    @Test
    void tokenize_BlockquoteInlineHoldsRawSource() {
        List<Token> tokens = tokenizer.tokenize("> quoted **text**\n");

        assertEquals(List.of(TokenKind.BLOCKQUOTE_OPEN, PARAGRAPH_OPEN, INLINE, PARAGRAPH_CLOSE,
                TokenKind.BLOCKQUOTE_CLOSE), kinds(tokens));
        assertEquals("quoted **text**", tokens.get(2).getContent());
    }

    @Test
    void tokenize_TableAndHtmlBecomeOther() {
        List<Token> tokens = tokenizer.tokenize("| a | b |\n|---|---|\n| 1 | 2 |\n\n<div>x</div>\n");

        assertEquals(List.of(TokenKind.OTHER, TokenKind.OTHER), kinds(tokens));
    }

    @Test
    void tokenize_ThematicBreak() {
        List<Token> tokens = tokenizer.tokenize("***\n");

        assertEquals(List.of(TokenKind.HORIZONTAL_RULE), kinds(tokens));
    }

    @Test
    void tokenize_ImageKeepsAltText() {
        List<Token> tokens = tokenizer.tokenize("![a diagram](img.png)");

        InlineSpan image = tokens.get(1).getChildren().get(0);
        assertEquals(SpanKind.IMAGE, image.getKind());
        assertEquals("a diagram", image.getContent());
    }

    @Test
    void tokenize_EmptyDocument() {
        assertTrue(tokenizer.tokenize("").isEmpty());
    }
}
