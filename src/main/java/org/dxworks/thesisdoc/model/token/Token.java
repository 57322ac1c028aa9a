package org.dxworks.thesisdoc.model.token;

import java.util.List;

/**
 * A block-level token of a parsed Markdown document, in document order.
 *
 * <p>{@code level} is the heading level for heading tokens and 0 otherwise.
 * {@code content} is the raw source of an inline token or the literal text of a
 * code block. Only inline tokens carry children.
 */
public final class Token {

    private final TokenKind kind;
    private final int level;
    private final String content;
    private final List<InlineSpan> children;

    public Token(TokenKind kind, int level, String content, List<InlineSpan> children) {
        this.kind = kind;
        this.level = level;
        this.content = content == null ? "" : content;
        this.children = children == null ? List.of() : List.copyOf(children);
    }

    public static Token of(TokenKind kind) {
        return new Token(kind, 0, "", List.of());
    }

    public static Token headingOpen(int level) {
        return new Token(TokenKind.HEADING_OPEN, level, "", List.of());
    }

    public static Token headingClose(int level) {
        return new Token(TokenKind.HEADING_CLOSE, level, "", List.of());
    }

    public static Token inline(String content, List<InlineSpan> children) {
        return new Token(TokenKind.INLINE, 0, content, children);
    }

    public static Token fence(String code) {
        return new Token(TokenKind.FENCE, 0, code, List.of());
    }

    public TokenKind getKind() {
        return kind;
    }

    public int getLevel() {
        return level;
    }

    public String getContent() {
        return content;
    }

    public List<InlineSpan> getChildren() {
        return children;
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean hasChildren() {
        return !children.isEmpty();
    }

    /**
     * Concatenates the content of every child span. Marker spans contribute nothing.
     */
    public String plainText() {
        StringBuilder text = new StringBuilder();
        for (InlineSpan child : children) {
            if (child.hasContent()) {
                text.append(child.getContent());
            }
        }
        return text.toString();
    }

    @Override
    public String toString() {
        return level > 0 ? kind + "(" + level + ")" : kind.toString();
    }
}
