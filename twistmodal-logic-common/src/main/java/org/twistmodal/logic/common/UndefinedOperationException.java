package org.twistmodal.logic.common;

public class UndefinedOperationException extends LogicException {

    public UndefinedOperationException(String message) {
        super(ErrorKind.UNDEFINED_OPERATION, message);
    }
}
