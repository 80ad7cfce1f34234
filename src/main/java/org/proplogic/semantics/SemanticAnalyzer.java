package org.proplogic.semantics;

import org.proplogic.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * ANALIZZATORE SEMANTICO - Valutazione e proprietà semantiche per enumerazione esaustiva
 *
 * Valuta formule sotto una valutazione e ne ricava le proprietà (tautologia, contraddizione,
 * soddisfacibilità, falsificabilità, equivalenza) enumerando tutte le 2^n valutazioni
 * dei suoi n atomi.
 *
 * COSTO:
 * • evaluate: lineare nella dimensione della formula
 * • predicati: O(2^n · dimensione), con uscita anticipata al primo controesempio
 * • isEquivalent(f, g): O(2^n) con n = atomi distinti di f e g insieme; è il costo dominante
 *   dell'intero motore e non scala oltre qualche decina di atomi
 *
 * Nessuno stato: ogni metodo è una funzione pura dei suoi argomenti, indipendente
 * dalla tabella di simboli attiva.
 */
public final class SemanticAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(SemanticAnalyzer.class.getName());

    private SemanticAnalyzer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region VALUTAZIONE

    /**
     * Valuta la formula per discesa ricorsiva.
     *
     * SEMANTICA:
     * • ATOM: valore assegnato all'etichetta
     * • NOT: negazione dell'operando
     * • AND, OR: congiunzione e disgiunzione classiche
     * • IMPLIES: ¬a ∨ b
     * • IFF: a == b
     *
     * Entrambi gli operandi dei connettivi binari vengono sempre valutati, quindi un atomo
     * non assegnato viene segnalato indipendentemente dai valori degli altri atomi.
     *
     * @param formula formula da valutare (non null)
     * @param valuation valori degli atomi (non null)
     * @return valore di verità della formula
     * @throws UnboundAtomException se un atomo della formula non è assegnato
     */
    public static boolean evaluate(Formula formula, Valuation valuation) {
        if (formula == null || valuation == null) {
            throw new IllegalArgumentException("Formula e valutazione non possono essere null");
        }

        return switch (formula.getType()) {
            case ATOM -> valuation.valueOf(formula.getLabel());

            case NOT -> !evaluate(formula.getOperands().get(0), valuation);

            default -> {
                boolean left = evaluate(formula.getOperands().get(0), valuation);
                boolean right = evaluate(formula.getOperands().get(1), valuation);
                yield switch (formula.getType()) {
                    case AND -> left && right;
                    case OR -> left || right;
                    case IMPLIES -> !left || right;
                    case IFF -> left == right;
                    default -> throw new IllegalStateException("Tipo non binario: " + formula.getType());
                };
            }
        };
    }

    /**
     * Variante con mappa etichetta → valore.
     */
    public static boolean evaluate(Formula formula, Map<String, Boolean> values) {
        return evaluate(formula, Valuation.of(values));
    }

    //endregion

    //region TABELLA DI VERITÀ

    /**
     * @see TruthTable#of(Formula, boolean)
     */
    public static TruthTable truthTable(Formula formula, boolean showIntermediate) {
        return TruthTable.of(formula, showIntermediate);
    }

    //endregion

    //region PROPRIETÀ SEMANTICHE

    /**
     * @return true se la formula è vera sotto ogni valutazione
     */
    public static boolean isTautology(Formula formula) {
        boolean result = !existsValuation(formula, false);
        LOGGER.fine("Tautologia " + formula.canonical() + ": " + result);
        return result;
    }

    /**
     * @return true se la formula è falsa sotto ogni valutazione
     */
    public static boolean isContradiction(Formula formula) {
        boolean result = !existsValuation(formula, true);
        LOGGER.fine("Contraddizione " + formula.canonical() + ": " + result);
        return result;
    }

    /**
     * @return true se esiste almeno una valutazione che rende vera la formula
     */
    public static boolean isSatisfiable(Formula formula) {
        return !isContradiction(formula);
    }

    /**
     * @return true se esiste almeno una valutazione che rende falsa la formula
     */
    public static boolean isFalsifiable(Formula formula) {
        return !isTautology(formula);
    }

    /**
     * Equivalenza semantica: la biimplicazione f ↔ g è una tautologia.
     * Costo O(2^n) sugli atomi distinti di entrambe le formule.
     */
    public static boolean isEquivalent(Formula f, Formula g) {
        return isTautology(Formula.iff(f, g));
    }

    /**
     * @return valutazioni (nell'ordine della tabella di verità) che rendono vera la formula
     */
    public static List<Valuation> satisfyingValuations(Formula formula) {
        return collectValuations(formula, true);
    }

    /**
     * @return valutazioni (nell'ordine della tabella di verità) che rendono falsa la formula
     */
    public static List<Valuation> falsifyingValuations(Formula formula) {
        return collectValuations(formula, false);
    }

    /**
     * Cerca una valutazione sotto cui la formula assume il valore indicato.
     */
    private static boolean existsValuation(Formula formula, boolean expected) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        ValuationEnumerator enumerator = new ValuationEnumerator(formula.atoms());
        while (enumerator.hasNext()) {
            if (evaluate(formula, enumerator.next()) == expected) {
                return true;
            }
        }
        return false;
    }

    private static List<Valuation> collectValuations(Formula formula, boolean expected) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }
        List<Valuation> matching = new ArrayList<>();
        ValuationEnumerator enumerator = new ValuationEnumerator(formula.atoms());
        while (enumerator.hasNext()) {
            Valuation valuation = enumerator.next();
            if (evaluate(formula, valuation) == expected) {
                matching.add(valuation);
            }
        }
        LOGGER.fine("Valutazioni con valore " + expected + " per " + formula.canonical()
                + ": " + matching.size() + "/" + enumerator.getRowCount());
        return Collections.unmodifiableList(matching);
    }

    //endregion
}
