package org.dxworks.thesisdoc.model.token;

public enum SpanKind {
    TEXT,
    CODE_INLINE,
    SOFT_BREAK,
    HARD_BREAK,
    EM_OPEN,
    EM_CLOSE,
    STRONG_OPEN,
    STRONG_CLOSE,
    STRIKE_OPEN,
    STRIKE_CLOSE,
    LINK_OPEN,
    LINK_CLOSE,
    IMAGE,
    HTML_INLINE
}
