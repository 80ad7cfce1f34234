package org.proplogic.formula;

/**
 * Costruzione malformata di una formula: etichetta vuota, operandi null o arità errata.
 */
public class InvalidFormulaException extends IllegalArgumentException {

    public InvalidFormulaException(String message) {
        super(message);
    }
}
