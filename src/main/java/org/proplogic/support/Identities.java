package org.proplogic.support;

import org.proplogic.formula.Formula;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.proplogic.support.Atoms.CHI;
import static org.proplogic.support.Atoms.PHI;
import static org.proplogic.support.Atoms.PSI;

/**
 * IDENTITÀ CLASSICHE - Biimplicazioni tautologiche sulle metavariabili φ, ψ, χ
 *
 * Ogni costante è della forma sinistra ↔ destra; i due lati sono equivalenti,
 * quindi ogni identità è una tautologia.
 */
public final class Identities {

    public static final Formula DOUBLE_NEGATION = PHI.negation().negation().biconditional(PHI);

    public static final Formula IDEMPOTENT_AND = PHI.conjunction(PHI).biconditional(PHI);
    public static final Formula IDEMPOTENT_OR = PHI.disjunction(PHI).biconditional(PHI);

    public static final Formula COMMUTATIVE_AND = PHI.conjunction(PSI).biconditional(PSI.conjunction(PHI));
    public static final Formula COMMUTATIVE_OR = PHI.disjunction(PSI).biconditional(PSI.disjunction(PHI));

    public static final Formula ASSOCIATIVE_AND =
            PHI.conjunction(PSI).conjunction(CHI).biconditional(PHI.conjunction(PSI.conjunction(CHI)));
    public static final Formula ASSOCIATIVE_OR =
            PHI.disjunction(PSI).disjunction(CHI).biconditional(PHI.disjunction(PSI.disjunction(CHI)));

    // φ ∧ (ψ ∨ χ) ↔ (φ ∧ ψ) ∨ (φ ∧ χ)
    public static final Formula DISTRIBUTIVE_1 = PHI.conjunction(PSI.disjunction(CHI))
            .biconditional(PHI.conjunction(PSI).disjunction(PHI.conjunction(CHI)));
    // φ ∨ (ψ ∧ χ) ↔ (φ ∨ ψ) ∧ (φ ∨ χ)
    public static final Formula DISTRIBUTIVE_2 = PHI.disjunction(PSI.conjunction(CHI))
            .biconditional(PHI.disjunction(PSI).conjunction(PHI.disjunction(CHI)));

    public static final Formula DE_MORGAN_AND =
            PHI.conjunction(PSI).negation().biconditional(PHI.negation().disjunction(PSI.negation()));
    public static final Formula DE_MORGAN_OR =
            PHI.disjunction(PSI).negation().biconditional(PHI.negation().conjunction(PSI.negation()));

    public static final Formula ABSORPTION_1 = PHI.conjunction(PHI.disjunction(PSI)).biconditional(PHI);
    public static final Formula ABSORPTION_2 = PHI.disjunction(PHI.conjunction(PSI)).biconditional(PHI);

    public static final Formula IMPLICATION = PHI.implication(PSI).biconditional(PHI.negation().disjunction(PSI));

    private Identities() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @return tutte le identità, nome → formula, nell'ordine di dichiarazione
     */
    public static Map<String, Formula> all() {
        Map<String, Formula> identities = new LinkedHashMap<>();
        identities.put("DOUBLE_NEGATION", DOUBLE_NEGATION);
        identities.put("IDEMPOTENT_AND", IDEMPOTENT_AND);
        identities.put("IDEMPOTENT_OR", IDEMPOTENT_OR);
        identities.put("COMMUTATIVE_AND", COMMUTATIVE_AND);
        identities.put("COMMUTATIVE_OR", COMMUTATIVE_OR);
        identities.put("ASSOCIATIVE_AND", ASSOCIATIVE_AND);
        identities.put("ASSOCIATIVE_OR", ASSOCIATIVE_OR);
        identities.put("DISTRIBUTIVE_1", DISTRIBUTIVE_1);
        identities.put("DISTRIBUTIVE_2", DISTRIBUTIVE_2);
        identities.put("DE_MORGAN_AND", DE_MORGAN_AND);
        identities.put("DE_MORGAN_OR", DE_MORGAN_OR);
        identities.put("ABSORPTION_1", ABSORPTION_1);
        identities.put("ABSORPTION_2", ABSORPTION_2);
        identities.put("IMPLICATION", IMPLICATION);
        return Collections.unmodifiableMap(identities);
    }
}
