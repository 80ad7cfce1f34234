package org.proplogic.formula;

import org.proplogic.formula.Formula.Type;

import java.util.Map;
import java.util.logging.Logger;

/**
 * SIMBOLI ATTIVI - Configurazione globale della tabella usata da Formula.toString()
 *
 * Esiste una sola tabella attiva per processo; cambiarla influenza tutti i rendering
 * successivi di ogni formula. Il cambio è un'assegnazione "last writer wins" senza lock:
 * thread che rendono formule mentre un altro thread cambia tabella devono serializzarsi
 * da soli, oppure usare Formula.render(SymbolTable) che non legge lo stato globale.
 *
 * FORME DI CONFIGURAZIONE:
 * • set(...) e setXxxSymbols(): cambio permanente
 * • setSymbols(map): sostituzione parziale della tabella attiva
 * • use(table): cambio con ripristino garantito alla chiusura dello Scope
 *   (try-with-resources), rientrante per chiamate annidate
 */
public final class Symbols {

    private static final Logger LOGGER = Logger.getLogger(Symbols.class.getName());

    /** Tabella attiva; Unicode all'avvio */
    private static volatile SymbolTable active = SymbolTable.UNICODE;

    private Symbols() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region LETTURA E IMPOSTAZIONE

    /**
     * @return tabella di simboli attiva
     */
    public static SymbolTable current() {
        return active;
    }

    /**
     * Sostituisce la tabella attiva.
     *
     * @param table nuova tabella (non null)
     */
    public static void set(SymbolTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Tabella di simboli non può essere null");
        }
        active = table;
        LOGGER.fine("Tabella di simboli attiva: " + table.getName());
    }

    /**
     * Sovrascrive solo i connettivi indicati; gli altri restano quelli della tabella attiva.
     *
     * @param overrides simboli sostitutivi (mappa parziale)
     */
    public static void setSymbols(Map<Type, String> overrides) {
        set(active.withOverrides(overrides));
    }

    public static void setUnicodeSymbols() {
        set(SymbolTable.UNICODE);
    }

    public static void setUtfSymbols() {
        set(SymbolTable.UTF);
    }

    public static void setAsciiSymbols() {
        set(SymbolTable.ASCII);
    }

    public static void setLatexSymbols() {
        set(SymbolTable.LATEX);
    }

    //endregion

    //region CAMBIO CON RIPRISTINO

    /**
     * Attiva una tabella fino alla chiusura dello Scope restituito.
     * Alla chiusura viene ripristinata esattamente la tabella attiva al momento della chiamata,
     * anche se nel frattempo è stata sollevata un'eccezione.
     *
     * @param table tabella da attivare (non null)
     * @return scope da chiudere con try-with-resources
     */
    public static Scope use(SymbolTable table) {
        if (table == null) {
            throw new IllegalArgumentException("Tabella di simboli non può essere null");
        }
        Scope scope = new Scope(active);
        active = table;
        return scope;
    }

    /**
     * Ambito di validità di una tabella attivata con {@link #use(SymbolTable)}.
     */
    public static final class Scope implements AutoCloseable {

        private final SymbolTable previous;
        private boolean closed;

        private Scope(SymbolTable previous) {
            this.previous = previous;
        }

        /**
         * @return tabella che verrà ripristinata alla chiusura
         */
        public SymbolTable getPrevious() {
            return previous;
        }

        /**
         * Ripristina la tabella precedente. Chiusure ripetute non hanno effetto.
         */
        @Override
        public void close() {
            if (!closed) {
                active = previous;
                closed = true;
            }
        }
    }

    //endregion
}
