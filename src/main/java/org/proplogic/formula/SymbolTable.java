package org.proplogic.formula;

import org.proplogic.formula.Formula.Type;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * TABELLA DI SIMBOLI - Associazione immutabile connettivo → simbolo di visualizzazione
 *
 * Usata dal rendering delle formule. Copre sempre tutti e cinque i connettivi;
 * le tabelle personalizzate si ottengono sovrascrivendo parzialmente una tabella esistente.
 *
 * TABELLE PREDEFINITE:
 * • UNICODE: ¬ ∧ ∨ → ↔
 * • UTF: stessi caratteri dichiarati come escape UTF-8
 * • ASCII: simboli canonici ~ &amp; | -&gt; &lt;-&gt; (identità)
 * • LATEX: comandi \lnot \land \lor \rightarrow \leftrightarrow
 */
public final class SymbolTable {

    //region TABELLE PREDEFINITE

    public static final SymbolTable UNICODE = new SymbolTable("unicode",
            symbols("¬", "∧", "∨", "→", "↔"));

    public static final SymbolTable UTF = new SymbolTable("utf",
            symbols("\u00AC", "\u2227", "\u2228", "\u2192", "\u2194"));

    public static final SymbolTable ASCII = new SymbolTable("ascii",
            symbols(Type.NOT.getCanonicalSymbol(), Type.AND.getCanonicalSymbol(), Type.OR.getCanonicalSymbol(),
                    Type.IMPLIES.getCanonicalSymbol(), Type.IFF.getCanonicalSymbol()));

    public static final SymbolTable LATEX = new SymbolTable("latex",
            symbols("\\lnot ", "\\land", "\\lor", "\\rightarrow", "\\leftrightarrow"));

    //endregion

    //region STRUTTURA DATI

    /** Nome descrittivo della tabella (predefinita o "custom") */
    private final String name;

    /** Simboli per ciascun connettivo; invariante: tutti i connettivi presenti */
    private final Map<Type, String> symbols;

    //endregion

    //region COSTRUZIONE

    private SymbolTable(String name, Map<Type, String> symbols) {
        this.name = name;
        this.symbols = Collections.unmodifiableMap(symbols);
    }

    private static Map<Type, String> symbols(String not, String and, String or, String implies, String iff) {
        Map<Type, String> map = new EnumMap<>(Type.class);
        map.put(Type.NOT, not);
        map.put(Type.AND, and);
        map.put(Type.OR, or);
        map.put(Type.IMPLIES, implies);
        map.put(Type.IFF, iff);
        return map;
    }

    /**
     * Costruisce una tabella completa da una mappa che copre tutti i connettivi.
     *
     * @param symbols simbolo per ogni connettivo
     * @return nuova tabella "custom"
     * @throws IllegalArgumentException se manca un connettivo o un simbolo è vuoto
     */
    public static SymbolTable of(Map<Type, String> symbols) {
        if (symbols == null) {
            throw new IllegalArgumentException("Mappa dei simboli non può essere null");
        }
        for (Type type : Type.values()) {
            if (type.isConnective() && !symbols.containsKey(type)) {
                throw new IllegalArgumentException("Simbolo mancante per il connettivo " + type);
            }
        }
        return UNICODE.withOverrides(symbols);
    }

    /**
     * Produce una nuova tabella in cui solo i connettivi indicati cambiano simbolo.
     * I connettivi assenti dalla mappa mantengono il simbolo di questa tabella.
     *
     * @param overrides simboli sostitutivi (parziale)
     * @return nuova tabella "custom"
     * @throws IllegalArgumentException se la mappa contiene ATOM o simboli null/vuoti
     */
    public SymbolTable withOverrides(Map<Type, String> overrides) {
        if (overrides == null) {
            throw new IllegalArgumentException("Mappa delle sostituzioni non può essere null");
        }
        Map<Type, String> merged = new EnumMap<>(symbols);
        for (Map.Entry<Type, String> entry : overrides.entrySet()) {
            if (entry.getKey() == null || !entry.getKey().isConnective()) {
                throw new IllegalArgumentException("Solo i connettivi hanno un simbolo, ricevuto: " + entry.getKey());
            }
            if (entry.getValue() == null || entry.getValue().isEmpty()) {
                throw new IllegalArgumentException("Simbolo per " + entry.getKey() + " non può essere null o vuoto");
            }
            merged.put(entry.getKey(), entry.getValue());
        }
        return new SymbolTable("custom", merged);
    }

    //endregion

    //region ACCESSORS

    /**
     * @param type connettivo
     * @return simbolo di visualizzazione del connettivo
     * @throws IllegalArgumentException se type è ATOM o null
     */
    public String symbolOf(Type type) {
        String symbol = type == null ? null : symbols.get(type);
        if (symbol == null) {
            throw new IllegalArgumentException("Nessun simbolo definito per: " + type);
        }
        return symbol;
    }

    public String getName() {
        return name;
    }

    /**
     * @return vista immutabile connettivo → simbolo
     */
    public Map<Type, String> asMap() {
        return symbols;
    }

    //endregion

    //region UGUAGLIANZA E HASH

    /**
     * Due tabelle sono uguali se associano gli stessi simboli (il nome è ignorato).
     */
    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        SymbolTable other = (SymbolTable) obj;
        return symbols.equals(other.symbols);
    }

    @Override
    public int hashCode() {
        return Objects.hash(symbols);
    }

    @Override
    public String toString() {
        return "SymbolTable{" + name + ", " + symbols + '}';
    }

    //endregion
}
