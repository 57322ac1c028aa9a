package org.dxworks.thesisdoc.model.token;

/**
 * One child of an {@link TokenKind#INLINE} token. Marker spans (emphasis, links)
 * carry an empty content string.
 */
public final class InlineSpan {

    private final SpanKind kind;
    private final String content;

    public InlineSpan(SpanKind kind, String content) {
        this.kind = kind;
        this.content = content == null ? "" : content;
    }

    public static InlineSpan text(String content) {
        return new InlineSpan(SpanKind.TEXT, content);
    }

    public static InlineSpan code(String content) {
        return new InlineSpan(SpanKind.CODE_INLINE, content);
    }

    public static InlineSpan marker(SpanKind kind) {
        return new InlineSpan(kind, "");
    }

    public SpanKind getKind() {
        return kind;
    }

    public String getContent() {
        return content;
    }

    public boolean hasContent() {
        return !content.isEmpty();
    }

    @Override
    public String toString() {
        return kind + "(" + content + ")";
    }
}
