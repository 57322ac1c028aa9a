package org.dxworks.thesisdoc.render;

/**
 * An open list while walking the token stream; {@code depth} is the number of
 * lists that were already open when this one started.
 */
public class ListContext {

    public enum Kind {
        BULLET,
        ORDERED
    }

    private final Kind kind;
    private final int depth;

    public ListContext(Kind kind, int depth) {
        this.kind = kind;
        this.depth = depth;
    }

    public Kind getKind() {
        return kind;
    }

    public int getDepth() {
        return depth;
    }
}
