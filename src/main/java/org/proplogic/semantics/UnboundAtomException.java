package org.proplogic.semantics;

/**
 * Valutazione di un atomo assente dalla valutazione fornita.
 * Nessun valore di default: l'atomo mancante è un errore del chiamante.
 */
public class UnboundAtomException extends RuntimeException {

    /** Etichetta dell'atomo non assegnato */
    private final String label;

    public UnboundAtomException(String label) {
        super("Atomo non presente nella valutazione: " + label);
        this.label = label;
    }

    /**
     * @return etichetta dell'atomo non assegnato
     */
    public String getLabel() {
        return label;
    }
}
