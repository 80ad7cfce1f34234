package org.proplogic.support;

import org.proplogic.formula.Formula;

/**
 * Atomi pronti all'uso: lettere proposizionali e metavariabili greche.
 */
public final class Atoms {

    public static final Formula P = Formula.atom("P");
    public static final Formula Q = Formula.atom("Q");
    public static final Formula R = Formula.atom("R");
    public static final Formula S = Formula.atom("S");
    public static final Formula T = Formula.atom("T");

    public static final Formula PHI = Formula.atom("φ");
    public static final Formula PSI = Formula.atom("ψ");
    public static final Formula CHI = Formula.atom("χ");

    private Atoms() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }
}
