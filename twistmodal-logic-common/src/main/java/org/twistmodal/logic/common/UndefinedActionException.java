package org.twistmodal.logic.common;

public class UndefinedActionException extends LogicException {
    private final String action;

    public UndefinedActionException(String action, String modelName) {
        super(ErrorKind.UNDEFINED_ACTION, "Action '" + action + "' is not defined in PLTS '" + modelName + "'");
        this.action = action;
    }

    public String getAction() {
        return action;
    }
}
