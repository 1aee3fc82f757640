package org.twistmodal.logic.common;

public class InvalidValueException extends LogicException {
    private final String text;

    public InvalidValueException(String text, String message) {
        super(ErrorKind.INVALID_VALUE, "Invalid value " + text + ": " + message);
        this.text = text;
    }

    public String getText() {
        return text;
    }
}
