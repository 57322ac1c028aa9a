package org.dxworks.thesisdoc.model.token;

public enum TokenKind {
    HEADING_OPEN,
    HEADING_CLOSE,
    PARAGRAPH_OPEN,
    PARAGRAPH_CLOSE,
    INLINE,
    BULLET_LIST_OPEN,
    BULLET_LIST_CLOSE,
    ORDERED_LIST_OPEN,
    ORDERED_LIST_CLOSE,
    LIST_ITEM_OPEN,
    LIST_ITEM_CLOSE,
    FENCE,
    CODE_BLOCK,
    BLOCKQUOTE_OPEN,
    BLOCKQUOTE_CLOSE,
    HORIZONTAL_RULE,
    OTHER;

    public boolean opensList() {
        return this == BULLET_LIST_OPEN || this == ORDERED_LIST_OPEN;
    }

    public boolean opensContainer() {
        return opensList() || this == LIST_ITEM_OPEN || this == BLOCKQUOTE_OPEN;
    }

    public boolean closesContainer() {
        return this == BULLET_LIST_CLOSE || this == ORDERED_LIST_CLOSE
                || this == LIST_ITEM_CLOSE || this == BLOCKQUOTE_CLOSE;
    }
}
