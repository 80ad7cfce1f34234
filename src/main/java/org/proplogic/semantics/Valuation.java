package org.proplogic.semantics;

import org.proplogic.formula.Formula;
import org.proplogic.formula.InvalidFormulaException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * VALUTAZIONE - Assegnamento immutabile di valori di verità agli atomi
 *
 * Associa a ogni etichetta di atomo un valore booleano. L'ordine di inserimento è preservato,
 * così le righe della tabella di verità elencano gli atomi nell'ordine delle colonne.
 *
 * INVARIANTI:
 * • Etichette non null e non vuote, valori non null
 * • Nessun valore di default: leggere un atomo assente solleva UnboundAtomException
 * • Uguaglianza indipendente dall'ordine degli atomi
 */
public final class Valuation {

    //region STRUTTURA DATI

    /** Etichetta atomo → valore, in ordine di inserimento */
    private final Map<String, Boolean> values;

    //endregion

    //region COSTRUZIONE

    private Valuation(Map<String, Boolean> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    /**
     * Costruisce una valutazione da una mappa etichetta → valore.
     *
     * @throws InvalidFormulaException se un'etichetta è null/vuota o un valore è null
     */
    public static Valuation of(Map<String, Boolean> values) {
        if (values == null) {
            throw new IllegalArgumentException("Mappa dei valori non può essere null");
        }
        Builder builder = builder();
        for (Map.Entry<String, Boolean> entry : values.entrySet()) {
            builder.put(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    /**
     * Costruisce una valutazione da una mappa atomo → valore.
     *
     * @throws InvalidFormulaException se una chiave non è un atomo
     */
    public static Valuation ofAtoms(Map<Formula, Boolean> values) {
        if (values == null) {
            throw new IllegalArgumentException("Mappa dei valori non può essere null");
        }
        Builder builder = builder();
        for (Map.Entry<Formula, Boolean> entry : values.entrySet()) {
            builder.put(entry.getKey(), entry.getValue());
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Costruttore incrementale; un'etichetta ripetuta sovrascrive il valore precedente.
     */
    public static final class Builder {

        private final Map<String, Boolean> values = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder put(String label, Boolean value) {
            if (label == null || label.isEmpty()) {
                throw new InvalidFormulaException("Etichetta dell'atomo non può essere null o vuota");
            }
            if (value == null) {
                throw new IllegalArgumentException("Valore per l'atomo " + label + " non può essere null");
            }
            values.put(label, value);
            return this;
        }

        public Builder put(Formula atom, Boolean value) {
            if (atom == null || !atom.isAtomic()) {
                throw new InvalidFormulaException("Solo gli atomi possono ricevere un valore, ricevuto: " + atom);
            }
            return put(atom.getLabel(), value);
        }

        public Valuation build() {
            return new Valuation(new LinkedHashMap<>(values));
        }
    }

    //endregion

    //region INTERROGAZIONE

    /**
     * @param label etichetta dell'atomo
     * @return valore assegnato
     * @throws UnboundAtomException se l'atomo non è assegnato
     */
    public boolean valueOf(String label) {
        Boolean value = values.get(label);
        if (value == null) {
            throw new UnboundAtomException(label);
        }
        return value;
    }

    /**
     * @param atom formula atomica
     * @return valore assegnato all'etichetta dell'atomo
     * @throws UnboundAtomException se l'atomo non è assegnato
     */
    public boolean valueOf(Formula atom) {
        if (atom == null || !atom.isAtomic()) {
            throw new InvalidFormulaException("Solo gli atomi hanno un valore, ricevuto: " + atom);
        }
        return valueOf(atom.getLabel());
    }

    public boolean isBound(String label) {
        return values.containsKey(label);
    }

    /**
     * Verifica preventiva: true se ogni atomo della formula ha un valore.
     */
    public boolean covers(Formula formula) {
        for (Formula atom : formula.atoms()) {
            if (!isBound(atom.getLabel())) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return etichette assegnate, in ordine di inserimento
     */
    public Set<String> labels() {
        return values.keySet();
    }

    public int size() {
        return values.size();
    }

    //endregion

    //region CONVERSIONI

    /**
     * @return vista immutabile etichetta → valore, in ordine di inserimento
     */
    public Map<String, Boolean> asLabelMap() {
        return values;
    }

    /**
     * @return mappa immutabile atomo → valore, in ordine di inserimento
     */
    public Map<Formula, Boolean> asAtomMap() {
        Map<Formula, Boolean> atoms = new LinkedHashMap<>();
        for (Map.Entry<String, Boolean> entry : values.entrySet()) {
            atoms.put(Formula.atom(entry.getKey()), entry.getValue());
        }
        return Collections.unmodifiableMap(atoms);
    }

    //endregion

    //region UGUAGLIANZA E HASH

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (obj == null || getClass() != obj.getClass()) return false;

        Valuation other = (Valuation) obj;
        return values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    //endregion
}
