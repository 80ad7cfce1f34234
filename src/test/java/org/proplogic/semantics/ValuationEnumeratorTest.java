package org.proplogic.semantics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.proplogic.formula.Formula;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

class ValuationEnumeratorTest {

    private static final Formula P = Formula.atom("P");
    private static final Formula Q = Formula.atom("Q");
    private static final Formula R = Formula.atom("R");

    private static List<Valuation> enumerate(List<Formula> atoms) {
        List<Valuation> valuations = new ArrayList<>();
        new ValuationEnumerator(atoms).forEachRemaining(valuations::add);
        return valuations;
    }

    @Test
    @DisplayName("Due atomi: il primo varia più lentamente, true prima di false")
    void testOrderWithTwoAtoms() {
        List<Valuation> valuations = enumerate(List.of(P, Q));

        assertEquals(List.of(
                Valuation.builder().put("P", true).put("Q", true).build(),
                Valuation.builder().put("P", true).put("Q", false).build(),
                Valuation.builder().put("P", false).put("Q", true).build(),
                Valuation.builder().put("P", false).put("Q", false).build()
        ), valuations);
    }

    @Test
    @DisplayName("2^n valutazioni distinte, la prima con tutti gli atomi veri")
    void testRowCount() {
        ValuationEnumerator enumerator = new ValuationEnumerator(List.of(P, Q, R));
        assertEquals(8, enumerator.getRowCount());

        List<Valuation> valuations = enumerate(List.of(P, Q, R));
        assertEquals(8, new HashSet<>(valuations).size());
        assertFalse(valuations.get(0).asLabelMap().containsValue(false));
        assertFalse(valuations.get(7).asLabelMap().containsValue(true));
    }

    @Test
    @DisplayName("Zero atomi: una sola valutazione vuota")
    void testNoAtoms() {
        List<Valuation> valuations = enumerate(List.of());

        assertEquals(1, valuations.size());
        assertEquals(0, valuations.get(0).size());
    }

    @Test
    @DisplayName("Esaurimento, limite di atomi e formule non atomiche")
    void testErrors() {
        ValuationEnumerator enumerator = new ValuationEnumerator(List.of(P));
        enumerator.next();
        enumerator.next();
        assertThrows(NoSuchElementException.class, enumerator::next);

        List<Formula> tooMany = new ArrayList<>(Collections.nCopies(ValuationEnumerator.MAX_ATOMS + 1, P));
        assertThrows(IllegalArgumentException.class, () -> new ValuationEnumerator(tooMany));
        assertThrows(IllegalArgumentException.class, () -> new ValuationEnumerator(List.of(P.negation())));
    }
}
