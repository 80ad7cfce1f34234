package org.proplogic.optionalfeatures;

import org.proplogic.formula.Formula;
import org.proplogic.formula.Formula.Type;

import java.util.List;
import java.util.Random;
import java.util.logging.Logger;

/**
 * GENERATORE DI FORMULE CASUALI - Alberi ben formati di altezza richiesta
 *
 * Costruisce formule usando solo le factory di Formula. La sorgente di entropia è iniettata,
 * quindi a parità di seme, altezza ed etichette il risultato è riproducibile.
 *
 * ALGORITMO:
 * • Altezza 1: atomo scelto uniformemente tra le etichette
 * • Altezza h &gt; 1: connettivo scelto uniformemente tra i cinque
 *   - NOT: negazione di una formula di altezza h-1
 *   - binari: operandi di altezza h/2 e h - h/2
 *
 * Etichette di default: le undici lettere da P a Z.
 */
public class RandomFormulaGenerator {

    private static final Logger LOGGER = Logger.getLogger(RandomFormulaGenerator.class.getName());

    /** Etichette di default: P, Q, R, ..., Z */
    public static final List<String> DEFAULT_LABELS =
            List.of("P", "Q", "R", "S", "T", "U", "V", "W", "X", "Y", "Z");

    private static final Type[] CONNECTIVES = {Type.NOT, Type.AND, Type.OR, Type.IMPLIES, Type.IFF};

    /** Sorgente di entropia */
    private final Random random;

    /** Numero di formule prodotte da questo generatore */
    private int generatedFormulas = 0;

    public RandomFormulaGenerator() {
        this(new Random());
    }

    /**
     * @param random sorgente di entropia (non null)
     */
    public RandomFormulaGenerator(Random random) {
        if (random == null) {
            throw new IllegalArgumentException("Sorgente casuale non può essere null");
        }
        this.random = random;
        LOGGER.fine("RandomFormulaGenerator inizializzato");
    }

    /**
     * Genera una formula sulle etichette di default.
     */
    public Formula generate(int height) {
        return generate(height, DEFAULT_LABELS);
    }

    /**
     * Genera una formula casuale.
     *
     * @param height altezza dell'albero (≥ 1)
     * @param labels etichette tra cui scegliere gli atomi (null o vuota → default)
     * @return formula ben formata
     * @throws IllegalArgumentException se height &lt; 1
     */
    public Formula generate(int height, List<String> labels) {
        if (height < 1) {
            throw new IllegalArgumentException("Altezza deve essere ≥ 1, ricevuto: " + height);
        }
        List<String> pool = labels == null || labels.isEmpty() ? DEFAULT_LABELS : labels;

        Formula formula = build(height, pool);
        generatedFormulas++;
        LOGGER.finest("Formula generata (altezza " + height + "): " + formula.canonical());
        return formula;
    }

    private Formula build(int height, List<String> labels) {
        if (height == 1) {
            return Formula.atom(labels.get(random.nextInt(labels.size())));
        }

        Type connective = CONNECTIVES[random.nextInt(CONNECTIVES.length)];
        if (connective == Type.NOT) {
            return build(height - 1, labels).negation();
        }
        return Formula.of(connective,
                build(height / 2, labels),
                build(height - height / 2, labels));
    }

    /**
     * @return numero di formule generate finora
     */
    public int getGeneratedFormulasCount() {
        return generatedFormulas;
    }
}
