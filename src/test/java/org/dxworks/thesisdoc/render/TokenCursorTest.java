package org.dxworks.thesisdoc.render;

import org.dxworks.thesisdoc.model.token.InlineSpan;
import org.dxworks.thesisdoc.model.token.Token;
import org.dxworks.thesisdoc.model.token.TokenKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenCursorTest {

    private static Token quoteOpen() {
        return Token.of(TokenKind.BLOCKQUOTE_OPEN);
    }

    private static Token quoteClose() {
        return Token.of(TokenKind.BLOCKQUOTE_CLOSE);
    }

    @Test
    void consumeIf_OnlyConsumesMatchingKind() {
        TokenCursor cursor = new TokenCursor(List.of(
                Token.of(TokenKind.PARAGRAPH_OPEN),
                Token.inline("x", List.of(InlineSpan.text("x")))));

        assertFalse(cursor.consumeIf(TokenKind.INLINE).isPresent());
        assertEquals(0, cursor.position());
        assertTrue(cursor.consumeIf(TokenKind.PARAGRAPH_OPEN).isPresent());
        assertEquals(TokenKind.INLINE, cursor.current().getKind());
    }

    @Test
    void peek_ReturnsEmptyPastTheEnd() {
        TokenCursor cursor = new TokenCursor(List.of(Token.of(TokenKind.HORIZONTAL_RULE)));

        assertEquals(TokenKind.HORIZONTAL_RULE, cursor.peek(0).orElseThrow().getKind());
        assertFalse(cursor.peek(1).isPresent());
        assertFalse(cursor.peek(-1).isPresent());
    }

    @Test
    void takeBalanced_SkipsNestedPairs() {
        TokenCursor cursor = new TokenCursor(List.of(
                quoteOpen(),
                quoteOpen(),
                Token.of(TokenKind.HORIZONTAL_RULE),
                quoteClose(),
                Token.of(TokenKind.FENCE),
                quoteClose(),
                Token.of(TokenKind.OTHER)));

        List<Token> inner = cursor.takeBalanced(
                TokenCursor.kind(TokenKind.BLOCKQUOTE_OPEN), TokenCursor.kind(TokenKind.BLOCKQUOTE_CLOSE));

        assertEquals(4, inner.size());
        assertEquals(TokenKind.FENCE, inner.get(3).getKind());
        assertEquals(TokenKind.OTHER, cursor.current().getKind());
    }

    @Test
    void takeBalanced_UnbalancedStreamStopsAtEnd() {
        TokenCursor cursor = new TokenCursor(List.of(quoteOpen(), Token.of(TokenKind.OTHER)));

        List<Token> inner = cursor.takeBalanced(
                TokenCursor.kind(TokenKind.BLOCKQUOTE_OPEN), TokenCursor.kind(TokenKind.BLOCKQUOTE_CLOSE));

        assertEquals(1, inner.size());
        assertFalse(cursor.hasCurrent());
    }

    @Test
    void takeUntilOutside_LeavesCursorOnStopToken() {
        TokenCursor cursor = new TokenCursor(List.of(
                Token.of(TokenKind.PARAGRAPH_OPEN),
                Token.of(TokenKind.PARAGRAPH_CLOSE),
                Token.of(TokenKind.LIST_ITEM_CLOSE)));

        List<Token> taken = cursor.takeUntilOutside(TokenCursor.kind(TokenKind.LIST_ITEM_CLOSE),
                TokenCursor.kind(TokenKind.BLOCKQUOTE_OPEN), TokenCursor.kind(TokenKind.BLOCKQUOTE_CLOSE));

        assertEquals(2, taken.size());
        assertEquals(TokenKind.LIST_ITEM_CLOSE, cursor.current().getKind());
    }

    @Test
    void takeUntilOutside_IgnoresStopTokensInsideNestedPairs() {
        TokenCursor cursor = new TokenCursor(List.of(
                quoteOpen(),
                Token.of(TokenKind.BULLET_LIST_OPEN),
                quoteClose(),
                Token.of(TokenKind.BULLET_LIST_OPEN)));

        List<Token> taken = cursor.takeUntilOutside(TokenCursor.kind(TokenKind.BULLET_LIST_OPEN),
                TokenCursor.kind(TokenKind.BLOCKQUOTE_OPEN), TokenCursor.kind(TokenKind.BLOCKQUOTE_CLOSE));

        assertEquals(3, taken.size());
        assertEquals(3, cursor.position());
    }

    @Test
    void advance_IsNoOpAtEnd() {
        TokenCursor cursor = new TokenCursor(List.of());

        cursor.advance();

        assertFalse(cursor.hasCurrent());
        assertEquals(0, cursor.position());
    }
}
