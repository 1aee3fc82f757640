package org.twistmodal.logic.common;

import java.util.List;

public class UndefinedAtomException extends LogicException {
    private final String world;
    private final List<String> atoms;

    public UndefinedAtomException(String world, List<String> atoms) {
        super(ErrorKind.UNDEFINED_ATOM, message(world, atoms));
        assert !atoms.isEmpty();
        this.world = world;
        this.atoms = List.copyOf(atoms);
    }

    private static String message(String world, List<String> atoms) {
        if (atoms.size() == 1) {
            return "Undefined atom: '" + atoms.get(0) + "' is not assigned in state '" + world + "'";
        }
        return "State '" + world + "' is missing assignments for: " + String.join(", ", atoms);
    }

    public String getWorld() {
        return world;
    }

    public List<String> getAtoms() {
        return atoms;
    }
}
