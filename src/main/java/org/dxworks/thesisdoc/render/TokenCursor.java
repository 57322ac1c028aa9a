package org.dxworks.thesisdoc.render;

import org.dxworks.thesisdoc.model.token.Token;
import org.dxworks.thesisdoc.model.token.TokenKind;

import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Forward-only cursor over an immutable token list with one-token lookahead and
 * helpers that skip to the close token matching an open token.
 */
public class TokenCursor {

    private final List<Token> tokens;
    private int position;

    public TokenCursor(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public boolean hasCurrent() {
        return position < tokens.size();
    }

    public Token current() {
        return tokens.get(position);
    }

    public int position() {
        return position;
    }

    public Optional<Token> peek(int offset) {
        int index = position + offset;
        return index >= 0 && index < tokens.size() ? Optional.of(tokens.get(index)) : Optional.empty();
    }

    public Token next() {
        return tokens.get(position++);
    }

    public void advance() {
        if (hasCurrent()) {
            position++;
        }
    }

    /**
     * Consumes the current token when it has the given kind.
     */
    public Optional<Token> consumeIf(TokenKind kind) {
        if (hasCurrent() && current().is(kind)) {
            return Optional.of(next());
        }
        return Optional.empty();
    }

    /**
     * Returns the tokens from the current position up to, but not including, the
     * first token accepted by {@code stop} that is not nested inside an
     * {@code opens}/{@code closes} pair started after the current position. The
     * cursor is left on that token, or at the end of the stream when none matches.
     */
    public List<Token> takeUntilOutside(Predicate<Token> stop, Predicate<Token> opens, Predicate<Token> closes) {
        int start = position;
        int depth = 0;
        while (hasCurrent()) {
            Token token = current();
            if (depth == 0 && stop.test(token)) {
                break;
            }
            if (opens.test(token)) {
                depth++;
            } else if (closes.test(token) && depth > 0) {
                depth--;
            }
            position++;
        }
        return tokens.subList(start, position);
    }

    /**
     * The cursor must be on a token accepted by {@code opens}. Returns the tokens
     * strictly between it and its matching close, counting nested opens, and
     * moves the cursor past that close. An unbalanced stream ends at the last token.
     */
    public List<Token> takeBalanced(Predicate<Token> opens, Predicate<Token> closes) {
        position++;
        int start = position;
        int depth = 1;
        while (hasCurrent()) {
            Token token = current();
            if (opens.test(token)) {
                depth++;
            } else if (closes.test(token)) {
                depth--;
                if (depth == 0) {
                    List<Token> inner = tokens.subList(start, position);
                    position++;
                    return inner;
                }
            }
            position++;
        }
        return tokens.subList(start, position);
    }

    public static Predicate<Token> kind(TokenKind kind) {
        return token -> token.is(kind);
    }
}
