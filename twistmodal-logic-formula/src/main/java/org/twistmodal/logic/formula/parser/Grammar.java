package org.twistmodal.logic.formula.parser;

/*
MATERIAL: -> and <-> only, both defined through negation and weak join.
RESIDUATED: adds => and <=>, evaluated with the residuated implication of the twist structure.
 */
public enum Grammar {
    MATERIAL,
    RESIDUATED
}
