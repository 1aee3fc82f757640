package org.twistmodal.logic.formula.lexer;

import java.util.Objects;

/**
 * @param value    atom name, action of a modal prefix, or the symbol; {@code null} for EOF
 * @param position zero-based offset of the first character of the token
 */
public record Token(TokenKind kind, String value, int position) {

    public Token {
        Objects.requireNonNull(kind);
        assert value != null || kind == TokenKind.EOF;
        assert position >= 0;
    }

    public boolean is(TokenKind other) {
        return kind == other;
    }

    @Override
    public String toString() {
        return kind + (value == null ? "" : "(" + value + ")") + "@" + position;
    }
}
