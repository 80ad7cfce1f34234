package org.proplogic.semantics;

import org.proplogic.formula.Formula;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.logging.Logger;

/**
 * ENUMERATORE DI VALUTAZIONI - Prodotto cartesiano di {true, false} sugli atomi
 *
 * Produce le 2^n valutazioni di n atomi in ordine deterministico: il primo atomo varia
 * più lentamente, l'ultimo più velocemente, e in ogni posizione true precede false.
 * La riga i assegna all'atomo j il valore true se il bit (n-1-j) di i è 0.
 *
 * Con due atomi P, Q l'ordine è: (T,T), (T,F), (F,T), (F,F).
 * Con zero atomi si produce esattamente una valutazione vuota.
 *
 * Il costo è esponenziale nel numero di atomi; l'indice di riga è un long,
 * quindi il limite superiore è {@value #MAX_ATOMS} atomi.
 */
public class ValuationEnumerator implements Iterator<Valuation> {

    private static final Logger LOGGER = Logger.getLogger(ValuationEnumerator.class.getName());

    /** Massimo numero di atomi rappresentabile con un indice di riga long */
    public static final int MAX_ATOMS = 62;

    /** Oltre questa soglia l'enumerazione viene segnalata come costosa */
    static final int COSTLY_ATOMS_THRESHOLD = 20;

    /** Etichette degli atomi nell'ordine delle colonne */
    private final List<String> labels;

    /** Numero totale di righe: 2^n */
    private final long rowCount;

    /** Indice della prossima riga da produrre */
    private long nextRow = 0;

    /**
     * @param atoms atomi da enumerare, nell'ordine delle colonne
     * @throws IllegalArgumentException se gli atomi superano {@value #MAX_ATOMS}
     *         o la lista contiene formule non atomiche
     */
    public ValuationEnumerator(List<Formula> atoms) {
        if (atoms == null) {
            throw new IllegalArgumentException("Lista degli atomi non può essere null");
        }
        if (atoms.size() > MAX_ATOMS) {
            throw new IllegalArgumentException("Enumerazione limitata a " + MAX_ATOMS
                    + " atomi, ricevuti: " + atoms.size());
        }

        List<String> collected = new ArrayList<>(atoms.size());
        for (Formula atom : atoms) {
            if (atom == null || !atom.isAtomic()) {
                throw new IllegalArgumentException("Elemento non atomico nella lista degli atomi: " + atom);
            }
            collected.add(atom.getLabel());
        }
        this.labels = List.copyOf(collected);
        this.rowCount = 1L << labels.size();

        if (labels.size() > COSTLY_ATOMS_THRESHOLD) {
            LOGGER.warning("Enumerazione di " + rowCount + " valutazioni per " + labels.size() + " atomi");
        } else {
            LOGGER.finest("Enumerazione di " + rowCount + " valutazioni su " + labels);
        }
    }

    /**
     * @return numero totale di valutazioni (2^n)
     */
    public long getRowCount() {
        return rowCount;
    }

    @Override
    public boolean hasNext() {
        return nextRow < rowCount;
    }

    @Override
    public Valuation next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Valutazioni esaurite dopo " + rowCount + " righe");
        }
        Valuation valuation = valuationAt(nextRow);
        nextRow++;
        return valuation;
    }

    /**
     * Valutazione della riga indicata, senza avanzare l'enumerazione.
     */
    Valuation valuationAt(long row) {
        int n = labels.size();
        Valuation.Builder builder = Valuation.builder();
        for (int j = 0; j < n; j++) {
            boolean value = ((row >>> (n - 1 - j)) & 1L) == 0L;
            builder.put(labels.get(j), value);
        }
        return builder.build();
    }
}
