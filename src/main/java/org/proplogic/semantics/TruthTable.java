package org.proplogic.semantics;

import org.proplogic.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

/**
 * TABELLA DI VERITÀ - Risultato strutturato dell'enumerazione di tutte le valutazioni
 *
 * Contiene colonne ordinate (formule) e righe ordinate (una per valutazione degli atomi).
 * L'ordine di righe e colonne è un contratto:
 * • Atomi: ordinati come Formula.atoms() ("più semplici prima")
 * • Colonne senza intermedi: atomi, poi la formula radice
 * • Colonne con intermedi: atomi, poi le sottoformule non atomiche in ordine "più semplici
 *   prima"; la radice è sempre l'ultima colonna perché è la più lunga
 * • Righe: ordine di {@link ValuationEnumerator}, con tutti gli atomi veri nella prima riga
 *
 * Se la radice è un atomo compare una sola volta, come unica colonna.
 * La presentazione è separata dai dati: format() produce una griglia testuale,
 * getRows() espone i dati grezzi.
 */
public final class TruthTable {

    private static final Logger LOGGER = Logger.getLogger(TruthTable.class.getName());

    /** Limite per la materializzazione in memoria (2^30 righe) */
    public static final int MAX_ATOMS = 30;

    //region STRUTTURA DATI

    private final Formula formula;
    private final List<Formula> atoms;
    private final List<Formula> columns;
    private final List<Row> rows;

    /**
     * Riga della tabella: valutazione degli atomi e valori di tutte le colonne.
     */
    public static final class Row {

        private final Valuation valuation;
        private final List<Boolean> values;

        private Row(Valuation valuation, List<Boolean> values) {
            this.valuation = valuation;
            this.values = Collections.unmodifiableList(values);
        }

        public Valuation getValuation() {
            return valuation;
        }

        /**
         * @return valori nell'ordine delle colonne della tabella
         */
        public List<Boolean> getValues() {
            return values;
        }

        /**
         * @return valore della formula radice (ultima colonna)
         */
        public boolean getRootValue() {
            return values.get(values.size() - 1);
        }

        @Override
        public String toString() {
            return valuation + " -> " + values;
        }
    }

    //endregion

    //region COSTRUZIONE

    private TruthTable(Formula formula, List<Formula> atoms, List<Formula> columns, List<Row> rows) {
        this.formula = formula;
        this.atoms = atoms;
        this.columns = columns;
        this.rows = Collections.unmodifiableList(rows);
    }

    /**
     * Tabella con sole colonne di atomi e radice.
     */
    public static TruthTable of(Formula formula) {
        return of(formula, false);
    }

    /**
     * Costruisce la tabella di verità valutando ogni colonna sotto ogni valutazione.
     *
     * @param formula formula radice (non null)
     * @param showIntermediate true per includere tutte le sottoformule come colonne
     * @return tabella con 2^n righe, n = numero di atomi distinti
     * @throws IllegalArgumentException se la formula ha più di {@value #MAX_ATOMS} atomi
     */
    public static TruthTable of(Formula formula, boolean showIntermediate) {
        if (formula == null) {
            throw new IllegalArgumentException("Formula non può essere null");
        }

        List<Formula> atoms = formula.atoms();
        if (atoms.size() > MAX_ATOMS) {
            throw new IllegalArgumentException("Tabella di verità limitata a " + MAX_ATOMS
                    + " atomi, ricevuti: " + atoms.size());
        }

        List<Formula> columns = buildColumns(formula, atoms, showIntermediate);

        ValuationEnumerator enumerator = new ValuationEnumerator(atoms);
        List<Row> rows = new ArrayList<>((int) enumerator.getRowCount());
        while (enumerator.hasNext()) {
            Valuation valuation = enumerator.next();
            List<Boolean> values = new ArrayList<>(columns.size());
            for (Formula column : columns) {
                values.add(SemanticAnalyzer.evaluate(column, valuation));
            }
            rows.add(new Row(valuation, values));
        }

        LOGGER.fine("Tabella di verità: " + atoms.size() + " atomi, "
                + columns.size() + " colonne, " + rows.size() + " righe");
        return new TruthTable(formula, atoms, columns, rows);
    }

    private static List<Formula> buildColumns(Formula formula, List<Formula> atoms, boolean showIntermediate) {
        List<Formula> columns = new ArrayList<>(atoms);
        if (showIntermediate) {
            for (Formula subformula : formula.subformulas()) {
                if (!subformula.isAtomic()) {
                    columns.add(subformula);
                }
            }
        } else if (!formula.isAtomic()) {
            columns.add(formula);
        }
        return List.copyOf(columns);
    }

    //endregion

    //region ACCESSORS

    public Formula getFormula() {
        return formula;
    }

    public List<Formula> getAtoms() {
        return atoms;
    }

    public List<Formula> getColumns() {
        return columns;
    }

    public List<Row> getRows() {
        return rows;
    }

    public int getRowCount() {
        return rows.size();
    }

    /**
     * @param column formula presente tra le colonne
     * @return indice della colonna
     * @throws IllegalArgumentException se la formula non è una colonna della tabella
     */
    public int indexOf(Formula column) {
        int index = columns.indexOf(column);
        if (index < 0) {
            throw new IllegalArgumentException("Colonna non presente nella tabella: " + column);
        }
        return index;
    }

    /**
     * @return valore della colonna indicata nella riga indicata
     */
    public boolean valueAt(int row, Formula column) {
        return rows.get(row).getValues().get(indexOf(column));
    }

    /**
     * @return valori della formula radice, uno per riga
     */
    public List<Boolean> getRootValues() {
        List<Boolean> values = new ArrayList<>(rows.size());
        for (Row row : rows) {
            values.add(row.getRootValue());
        }
        return Collections.unmodifiableList(values);
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Griglia testuale: intestazione con le colonne (simboli attivi), poi una riga T/F
     * per valutazione, celle centrate sulla larghezza della colonna.
     */
    public String format() {
        List<String> headers = new ArrayList<>(columns.size());
        for (Formula column : columns) {
            headers.add(column.toString());
        }

        StringBuilder out = new StringBuilder();
        appendLine(out, headers, headers);
        StringBuilder separator = new StringBuilder();
        for (int i = 0; i < headers.size(); i++) {
            if (i > 0) separator.append("-+-");
            separator.append("-".repeat(headers.get(i).length()));
        }
        out.append(separator).append('\n');

        for (Row row : rows) {
            List<String> cells = new ArrayList<>(headers.size());
            for (Boolean value : row.getValues()) {
                cells.add(value ? "T" : "F");
            }
            appendLine(out, headers, cells);
        }
        return out.toString();
    }

    private static void appendLine(StringBuilder out, List<String> headers, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) out.append(" | ");
            out.append(center(cells.get(i), headers.get(i).length()));
        }
        out.append('\n');
    }

    private static String center(String text, int width) {
        int padding = Math.max(0, width - text.length());
        int left = padding / 2;
        return " ".repeat(left) + text + " ".repeat(padding - left);
    }

    @Override
    public String toString() {
        return format();
    }

    //endregion
}
