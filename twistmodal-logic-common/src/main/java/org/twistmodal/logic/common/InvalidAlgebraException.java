package org.twistmodal.logic.common;

public class InvalidAlgebraException extends LogicException {
    private final String structureName;

    public InvalidAlgebraException(String structureName, String message) {
        super(ErrorKind.INVALID_ALGEBRA, "The object '" + structureName + "' is not a valid lattice: " + message);
        this.structureName = structureName;
    }

    public InvalidAlgebraException(String structureName, UndefinedOperationException cause) {
        super(ErrorKind.INVALID_ALGEBRA, "The object '" + structureName + "' is not a valid lattice: "
                                         + cause.getMessage(), cause);
        this.structureName = structureName;
    }

    public String getStructureName() {
        return structureName;
    }
}
