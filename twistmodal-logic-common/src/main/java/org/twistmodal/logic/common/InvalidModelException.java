package org.twistmodal.logic.common;

public class InvalidModelException extends LogicException {
    private final String modelName;

    public InvalidModelException(String modelName, String message) {
        super(ErrorKind.INVALID_MODEL, "PLTS '" + modelName + "': " + message);
        this.modelName = modelName;
    }

    public String getModelName() {
        return modelName;
    }
}
