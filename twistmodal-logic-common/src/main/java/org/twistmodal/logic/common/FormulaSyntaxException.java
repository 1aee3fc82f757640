package org.twistmodal.logic.common;

/**
 * Lexical or grammatical error in a formula. The position is the zero-based character offset
 * at which the problem was detected; for an unexpected end of input it equals the length of the text.
 */
public class FormulaSyntaxException extends LogicException {
    private final int position;

    public FormulaSyntaxException(int position, String message) {
        super(ErrorKind.SYNTAX, "Syntax error at index " + position + ": " + message);
        this.position = position;
    }

    public int position() {
        return position;
    }
}
