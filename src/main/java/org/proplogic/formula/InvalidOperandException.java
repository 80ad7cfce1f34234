package org.proplogic.formula;

/**
 * Operando non valido per un confronto o un test di contenimento che richiede una Formula.
 */
public class InvalidOperandException extends IllegalArgumentException {

    public InvalidOperandException(String message) {
        super(message);
    }
}
