package org.proplogic.formula;

import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * FORMULA PROPOSIZIONALE - Albero immutabile di connettivi logici su atomi etichettati
 *
 * Rappresenta una formula della logica proposizionale come albero: le foglie sono atomi
 * identificati da un'etichetta, i nodi interni sono connettivi (negazione, congiunzione,
 * disgiunzione, implicazione, biimplicazione) con arità fissata dal tipo.
 *
 * INVARIANTI:
 * • Nodi ATOM: etichetta non vuota, nessun operando
 * • Nodi NOT: nessuna etichetta, esattamente un operando
 * • Nodi binari: nessuna etichetta, esattamente due operandi (sinistro, destro)
 * • Nessuna mutazione dopo la costruzione: ogni combinazione produce un nuovo nodo
 *
 * UGUAGLIANZA E ORDINAMENTO:
 * • Due formule sono uguali se coincidono le loro forme canoniche (rendering ASCII),
 *   indipendentemente dalla tabella di simboli attiva
 * • L'uguaglianza è strutturale: A & B e B & A sono formule diverse, l'equivalenza
 *   semantica si verifica con SemanticAnalyzer.isEquivalent
 * • Ordinamento per liste deduplicate: prima lunghezza della forma canonica, poi ordine lessicale
 *
 * RENDERING:
 * • toString() usa la tabella di simboli attiva (vedi {@link Symbols}), ricalcolata a ogni chiamata
 * • render(SymbolTable) usa una tabella esplicita senza toccare lo stato globale
 */
public final class Formula implements Comparable<Formula>, Iterable<Formula> {

    //region TIPI E STRUTTURA DATI

    /**
     * Tipi di nodo supportati, con arità, precedenza e simbolo canonico.
     * Insieme chiuso: non è previsto alcun punto di estensione.
     */
    public enum Type {
        ATOM(0, 4, null),      // Proposizione atomica: P, Q, R, ...
        NOT(1, 3, "~"),        // Negazione: ~A
        AND(2, 2, "&"),        // Congiunzione: A & B
        OR(2, 2, "|"),         // Disgiunzione: A | B
        IMPLIES(2, 1, "->"),   // Implicazione: A -> B
        IFF(2, 1, "<->");      // Biimplicazione: A <-> B

        private final int arity;
        private final int precedence;
        private final String canonicalSymbol;

        Type(int arity, int precedence, String canonicalSymbol) {
            this.arity = arity;
            this.precedence = precedence;
            this.canonicalSymbol = canonicalSymbol;
        }

        /**
         * @return numero di operandi richiesti dal tipo
         */
        public int getArity() {
            return arity;
        }

        /**
         * @return precedenza di rendering (valori alti legano più strettamente)
         */
        public int getPrecedence() {
            return precedence;
        }

        /**
         * @return simbolo ASCII canonico (null per ATOM)
         */
        public String getCanonicalSymbol() {
            return canonicalSymbol;
        }

        /**
         * @return true per i cinque connettivi, false per ATOM
         */
        public boolean isConnective() {
            return this != ATOM;
        }
    }

    /** Ordinamento "più semplice prima": lunghezza, poi ordine lessicale della forma canonica */
    private static final Comparator<Formula> SIMPLEST_FIRST =
            Comparator.comparingInt((Formula f) -> f.canonical().length())
                    .thenComparing(Formula::canonical);

    /** Tipo del nodo corrente */
    private final Type type;

    /** Etichetta della proposizione (solo per nodi ATOM) */
    private final String label;

    /** Operandi ordinati (vuoti per ATOM) */
    private final List<Formula> operands;

    /** Forma canonica calcolata alla prima richiesta; indipendente dai simboli attivi */
    private volatile String canonical;

    //endregion

    //region COSTRUTTORI E FACTORY

    private Formula(Type type, String label, List<Formula> operands) {
        this.type = type;
        this.label = label;
        this.operands = operands;
    }

    /**
     * Costruisce un atomo con l'etichetta indicata.
     *
     * @param label etichetta della proposizione (non null, non vuota)
     * @return nuovo nodo ATOM
     * @throws InvalidFormulaException se l'etichetta è null o vuota
     */
    public static Formula atom(String label) {
        if (label == null || label.isEmpty()) {
            throw new InvalidFormulaException("Etichetta dell'atomo non può essere null o vuota");
        }
        return new Formula(Type.ATOM, label, List.of());
    }

    /**
     * Costruisce un nodo connettivo generico validandone l'arità.
     *
     * @param type connettivo (non ATOM)
     * @param operands operandi in ordine, tanti quanti richiesti dal connettivo
     * @return nuovo nodo
     * @throws InvalidFormulaException se tipo, arità o operandi non sono validi
     */
    public static Formula of(Type type, Formula... operands) {
        if (type == null) {
            throw new InvalidFormulaException("Tipo del nodo non può essere null");
        }
        if (!type.isConnective()) {
            throw new InvalidFormulaException("Gli atomi si costruiscono con Formula.atom(label)");
        }
        if (operands == null || operands.length != type.getArity()) {
            int received = operands == null ? 0 : operands.length;
            throw new InvalidFormulaException("Operatore " + type + " richiede esattamente "
                    + type.getArity() + " operandi, ricevuti: " + received);
        }
        for (Formula operand : operands) {
            if (operand == null) {
                throw new InvalidFormulaException("Operandi di " + type + " non possono essere null");
            }
        }
        return new Formula(type, null, List.of(operands));
    }

    /** Negazione: ~f */
    public static Formula not(Formula f) {
        return of(Type.NOT, f);
    }

    /** Congiunzione: f & g */
    public static Formula and(Formula f, Formula g) {
        return of(Type.AND, f, g);
    }

    /** Disgiunzione: f | g */
    public static Formula or(Formula f, Formula g) {
        return of(Type.OR, f, g);
    }

    /** Implicazione: f -> g */
    public static Formula implies(Formula f, Formula g) {
        return of(Type.IMPLIES, f, g);
    }

    /** Biimplicazione: f <-> g */
    public static Formula iff(Formula f, Formula g) {
        return of(Type.IFF, f, g);
    }

    //endregion

    //region COMBINATORI FLUENTI

    /**
     * @return negazione di questa formula
     */
    public Formula negation() {
        return not(this);
    }

    /**
     * @return congiunzione tra questa formula e other
     */
    public Formula conjunction(Formula other) {
        return and(this, other);
    }

    /**
     * @return disgiunzione tra questa formula e other
     */
    public Formula disjunction(Formula other) {
        return or(this, other);
    }

    /**
     * @return implicazione da questa formula verso other
     */
    public Formula implication(Formula other) {
        return implies(this, other);
    }

    /**
     * @return biimplicazione tra questa formula e other
     */
    public Formula biconditional(Formula other) {
        return iff(this, other);
    }

    //endregion

    //region ACCESSORS

    public Type getType() {
        return type;
    }

    /**
     * @return etichetta per nodi ATOM, null per i connettivi
     */
    public String getLabel() {
        return label;
    }

    /**
     * @return lista immutabile degli operandi (vuota per ATOM)
     */
    public List<Formula> getOperands() {
        return operands;
    }

    public boolean isAtomic() {
        return type == Type.ATOM;
    }

    //endregion

    //region RAPPRESENTAZIONE TESTUALE

    /**
     * Genera la rappresentazione testuale con la tabella di simboli indicata.
     *
     * REGOLE DI PARENTESIZZAZIONE:
     * • Atomi: etichetta senza parentesi
     * • NOT: simbolo + operando, operando tra parentesi se è un connettivo di precedenza ≤ 3
     * • Binari: sinistro + " simbolo " + destro, ciascun lato tra parentesi se la sua
     *   precedenza è ≤ di quella del nodo corrente
     *
     * @param symbols tabella di simboli da usare (non null)
     * @return stringa della formula
     */
    public String render(SymbolTable symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("Tabella di simboli non può essere null");
        }
        StringBuilder result = new StringBuilder();
        appendTo(result, symbols);
        return result.toString();
    }

    private void appendTo(StringBuilder out, SymbolTable symbols) {
        switch (type) {
            case ATOM -> out.append(label);
            case NOT -> {
                out.append(symbols.symbolOf(Type.NOT));
                appendOperand(out, operands.get(0), symbols);
            }
            default -> {
                appendOperand(out, operands.get(0), symbols);
                out.append(' ').append(symbols.symbolOf(type)).append(' ');
                appendOperand(out, operands.get(1), symbols);
            }
        }
    }

    private void appendOperand(StringBuilder out, Formula operand, SymbolTable symbols) {
        if (operand.type.getPrecedence() <= type.getPrecedence()) {
            out.append('(');
            operand.appendTo(out, symbols);
            out.append(')');
        } else {
            operand.appendTo(out, symbols);
        }
    }

    /**
     * Forma canonica con simboli ASCII, base di uguaglianza, hash e ordinamento.
     */
    public String canonical() {
        String result = canonical;
        if (result == null) {
            result = render(SymbolTable.ASCII);
            canonical = result;
        }
        return result;
    }

    /**
     * Rendering con la tabella di simboli attiva in questo momento.
     */
    @Override
    public String toString() {
        return render(Symbols.current());
    }

    /**
     * @return formula con simboli Unicode (¬ ∧ ∨ → ↔)
     */
    public String toUnicode() {
        return renderWithin(SymbolTable.UNICODE);
    }

    /**
     * @return formula con simboli UTF-8 dichiarati come escape
     */
    public String toUtf() {
        return renderWithin(SymbolTable.UTF);
    }

    /**
     * @return formula con simboli ASCII (~ &amp; | -&gt; &lt;-&gt;)
     */
    public String toAscii() {
        return renderWithin(SymbolTable.ASCII);
    }

    /**
     * Restituisce la formula con gli operatori sostituiti da comandi LaTeX.
     * Esempio: not(and(p, implies(q, p))) diventa {@code \lnot (p \land (q \rightarrow p))}.
     */
    public String toLatex() {
        return renderWithin(SymbolTable.LATEX);
    }

    /**
     * Albero sintattico per il pacchetto TikZ con parametri di default e tabulazioni.
     */
    public String toLatexTikz() {
        return TikzParseTree.render(this, TikzParseTree.DEFAULT_PARAMETERS, false);
    }

    /**
     * Albero sintattico per il pacchetto TikZ.
     *
     * @param tikzParameters parametri dello stile di livello
     * @param useSpaces true per indentare con quattro spazi invece di tabulazioni
     */
    public String toLatexTikz(String tikzParameters, boolean useSpaces) {
        return TikzParseTree.render(this, tikzParameters, useSpaces);
    }

    /**
     * Attiva temporaneamente una tabella, produce toString() e ripristina la precedente.
     */
    private String renderWithin(SymbolTable table) {
        try (Symbols.Scope ignored = Symbols.use(table)) {
            return toString();
        }
    }

    //endregion

    //region ATOMI E SOTTOFORMULE

    /**
     * Raccoglie gli atomi distinti raggiungibili da questo nodo.
     *
     * @return lista immutabile, deduplicata e ordinata (più semplici prima)
     */
    public List<Formula> atoms() {
        Set<Formula> atoms = new TreeSet<>();
        collectAtoms(atoms);
        return List.copyOf(atoms);
    }

    private void collectAtoms(Set<Formula> atoms) {
        if (isAtomic()) {
            atoms.add(this);
            return;
        }
        for (Formula operand : operands) {
            operand.collectAtoms(atoms);
        }
    }

    /**
     * Raccoglie tutte le sottoformule, incluso questo nodo.
     * Un atomo restituisce una lista contenente solo se stesso.
     *
     * @return lista immutabile, deduplicata e ordinata (più semplici prima)
     */
    public List<Formula> subformulas() {
        Set<Formula> subformulas = new TreeSet<>();
        collectSubformulas(subformulas);
        return List.copyOf(subformulas);
    }

    private void collectSubformulas(Set<Formula> subformulas) {
        subformulas.add(this);
        for (Formula operand : operands) {
            operand.collectSubformulas(subformulas);
        }
    }

    /**
     * Itera sulle sottoformule nell'ordine di {@link #subformulas()}.
     */
    @Override
    public Iterator<Formula> iterator() {
        return subformulas().iterator();
    }

    /**
     * Contenimento testuale: true se la forma canonica di other compare come sottostringa
     * della forma canonica di questa formula.
     *
     * Non è un test logico di sottoformula: etichette o simboli che coincidono per caso
     * producono corrispondenze (es. l'atomo "P" è "contenuto" in "PQ"). Per il test strutturale
     * usare subformulas().contains(other).
     *
     * @throws InvalidOperandException se other è null
     */
    public boolean contains(Formula other) {
        if (other == null) {
            throw new InvalidOperandException("Il contenimento richiede una Formula come operando, ricevuto: null");
        }
        return canonical().contains(other.canonical());
    }

    /**
     * Variante non tipizzata del contenimento, per operandi di provenienza generica.
     *
     * @throws InvalidOperandException se item non è una Formula
     */
    public boolean contains(Object item) {
        if (!(item instanceof Formula)) {
            String typeName = item == null ? "null" : item.getClass().getSimpleName();
            throw new InvalidOperandException("Il contenimento richiede una Formula come operando, ricevuto: " + typeName);
        }
        return contains((Formula) item);
    }

    /**
     * Confronto con una stringa: true se text coincide con la forma canonica ASCII.
     */
    public boolean isRenderedAs(String text) {
        return canonical().equals(text);
    }

    //endregion

    //region METRICHE STRUTTURALI

    /**
     * Altezza dell'albero: 1 per un atomo, 1 + massimo degli operandi altrimenti.
     */
    public int height() {
        int maxHeight = 0;
        for (Formula operand : operands) {
            maxHeight = Math.max(maxHeight, operand.height());
        }
        return 1 + maxHeight;
    }

    /**
     * Numero di nodi dell'albero, ripetizioni incluse.
     */
    public int size() {
        int nodes = 1;
        for (Formula operand : operands) {
            nodes += operand.size();
        }
        return nodes;
    }

    //endregion

    //region UGUAGLIANZA, HASH E ORDINAMENTO

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Formula other = (Formula) obj;
        return canonical().equals(other.canonical());
    }

    @Override
    public int hashCode() {
        return canonical().hashCode();
    }

    @Override
    public int compareTo(Formula other) {
        return SIMPLEST_FIRST.compare(this, other);
    }

    /**
     * @return comparatore "più semplice prima" usato per atomi e sottoformule
     */
    public static Comparator<Formula> simplestFirst() {
        return SIMPLEST_FIRST;
    }

    //endregion
}
