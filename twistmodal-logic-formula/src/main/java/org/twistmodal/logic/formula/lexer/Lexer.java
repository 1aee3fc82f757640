package org.twistmodal.logic.formula.lexer;

import org.twistmodal.logic.common.FormulaSyntaxException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/*
Whitespace separates tokens and is otherwise ignored.

The literals 1 and TOP become the atom TOP, 0 and BOT the atom BOT (case-insensitive).
'<' starts either a diamond <a>, the material equivalence <-> or the residuated equivalence <=>.
 */
public class Lexer {
    public static final String TOP = "TOP";
    public static final String BOT = "BOT";

    private final String text;
    private int pos;

    public Lexer(String text) {
        this.text = Objects.requireNonNull(text);
    }

    private char current() {
        return pos < text.length() ? text.charAt(pos) : 0;
    }

    private boolean atEnd() {
        return pos >= text.length();
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    private String identifier() {
        int start = pos;
        while (!atEnd() && isIdentifierChar(current())) pos++;
        return text.substring(start, pos);
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        Token token;
        do {
            token = next();
            tokens.add(token);
        } while (!token.is(TokenKind.EOF));
        return tokens;
    }

    public Token next() {
        while (!atEnd() && Character.isWhitespace(current())) pos++;
        if (atEnd()) return new Token(TokenKind.EOF, null, text.length());

        int start = pos;
        char c = current();
        return switch (c) {
            case '[' -> box(start);
            case '<' -> angle(start);
            case '~' -> single(TokenKind.NOT, start);
            case '&' -> single(TokenKind.AND, start);
            case '|' -> single(TokenKind.OR, start);
            case '(' -> single(TokenKind.LPAREN, start);
            case ')' -> single(TokenKind.RPAREN, start);
            case '-' -> arrow(TokenKind.MAT_IMPLIES, start);
            case '=' -> arrow(TokenKind.IMPLIES, start);
            default -> atom(c, start);
        };
    }

    private Token single(TokenKind kind, int start) {
        pos++;
        return new Token(kind, text.substring(start, pos), start);
    }

    // '->' or '=>'
    private Token arrow(TokenKind kind, int start) {
        char first = current();
        pos++;
        expect('>', start, "Expected '>' after '" + first + "'");
        return new Token(kind, first + ">", start);
    }

    private Token atom(char c, int start) {
        if (!Character.isLetterOrDigit(c)) {
            throw new FormulaSyntaxException(start, "Unknown character '" + c + "'");
        }
        String value = identifier();
        String upper = value.toUpperCase(Locale.ROOT);
        if ("1".equals(value) || TOP.equals(upper)) return new Token(TokenKind.ATOM, TOP, start);
        if ("0".equals(value) || BOT.equals(upper)) return new Token(TokenKind.ATOM, BOT, start);
        return new Token(TokenKind.ATOM, value, start);
    }

    private void expect(char c, int errorPosition, String message) {
        if (current() != c || atEnd()) throw new FormulaSyntaxException(errorPosition, message);
        pos++;
    }

    private Token box(int start) {
        pos++;
        if (current() == ']') {
            throw new FormulaSyntaxException(start, "Box operator '[]' requires an action identifier");
        }
        String action = identifier();
        if (action.isEmpty()) {
            throw new FormulaSyntaxException(start, "Invalid action identifier inside Box operator");
        }
        expect(']', pos, "Expected ']' after action");
        return new Token(TokenKind.BOX, action, start);
    }

    private Token angle(int start) {
        pos++;
        if (current() == '-') {
            pos++;
            expect('>', start, "Expected '>' after '<-'");
            return new Token(TokenKind.MAT_IFF, "<->", start);
        }
        if (current() == '=') {
            pos++;
            expect('>', start, "Expected '>' after '<='");
            return new Token(TokenKind.IFF, "<=>", start);
        }
        if (current() == '>') {
            throw new FormulaSyntaxException(start, "Diamond operator '<>' requires an action identifier");
        }
        String action = identifier();
        if (action.isEmpty()) {
            throw new FormulaSyntaxException(start, "Invalid action identifier inside Diamond operator");
        }
        expect('>', pos, "Expected '>' after action");
        return new Token(TokenKind.DIAMOND, action, start);
    }
}
