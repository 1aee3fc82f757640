package org.twistmodal.logic.common;

/*
construction-time kinds first, then the kinds raised while parsing or evaluating a formula
 */
public enum ErrorKind {
    INVALID_ALGEBRA(true),
    INVALID_MODEL(true),
    INVALID_VALUE(false),
    UNDEFINED_OPERATION(false),
    SYNTAX(false),
    UNDEFINED_ATOM(false),
    UNDEFINED_ACTION(false);

    private final boolean construction;

    ErrorKind(boolean construction) {
        this.construction = construction;
    }

    public boolean isConstruction() {
        return construction;
    }
}
