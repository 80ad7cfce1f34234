package org.proplogic.semantics;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.proplogic.formula.Formula;
import org.proplogic.formula.Symbols;
import org.proplogic.optionalfeatures.RandomFormulaGenerator;
import org.proplogic.support.Identities;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;
import static org.proplogic.semantics.SemanticAnalyzer.*;
import static org.proplogic.support.Atoms.P;
import static org.proplogic.support.Atoms.Q;
import static org.proplogic.support.Atoms.R;
import static org.proplogic.support.Atoms.S;
import static org.proplogic.support.Atoms.T;

class SemanticAnalyzerTest {

    private static List<Formula> sample;

    @BeforeAll
    static void setUp() {
        RandomFormulaGenerator generator = new RandomFormulaGenerator(new Random(20240601L));
        sample = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            sample.add(generator.generate(1 + i % 5, List.of("P", "Q", "R")));
        }
    }

    private static Valuation valuation(boolean p, boolean q) {
        return Valuation.builder().put("P", p).put("Q", q).build();
    }

    private static Valuation valuation(boolean p, boolean q, boolean r, boolean s, boolean t) {
        return Valuation.builder().put("P", p).put("Q", q).put("R", r).put("S", s).put("T", t).build();
    }

    /** Valori delle valutazioni, nell'ordine degli atomi */
    private static Set<List<Boolean>> valueTuples(List<Valuation> valuations) {
        Set<List<Boolean>> tuples = new HashSet<>();
        for (Valuation valuation : valuations) {
            tuples.add(List.copyOf(valuation.asLabelMap().values()));
        }
        return tuples;
    }

    @Nested
    @DisplayName("Valutazione")
    class EvaluationTests {

        @Test
        @DisplayName("Congiunzione")
        void testConjunction() {
            Formula formula = P.conjunction(Q);
            assertAll("P & Q",
                    () -> assertTrue(evaluate(formula, valuation(true, true))),
                    () -> assertFalse(evaluate(formula, valuation(true, false))),
                    () -> assertFalse(evaluate(formula, valuation(false, true))),
                    () -> assertFalse(evaluate(formula, valuation(false, false)))
            );
        }

        @Test
        @DisplayName("Disgiunzione e negazione")
        void testDisjunctionAndNegation() {
            Formula formula = P.disjunction(Q);
            assertAll("P | Q e ~P",
                    () -> assertTrue(evaluate(formula, valuation(true, false))),
                    () -> assertTrue(evaluate(formula, valuation(false, true))),
                    () -> assertFalse(evaluate(formula, valuation(false, false))),
                    () -> assertFalse(evaluate(P.negation(), Map.of("P", true))),
                    () -> assertTrue(evaluate(P.negation(), Map.of("P", false)))
            );
        }

        @Test
        @DisplayName("Implicazione e biimplicazione")
        void testImplicationAndBiconditional() {
            Formula implication = P.implication(Q);
            Formula biconditional = P.biconditional(Q);
            assertAll("P -> Q e P <-> Q",
                    () -> assertTrue(evaluate(implication, valuation(true, true))),
                    () -> assertFalse(evaluate(implication, valuation(true, false))),
                    () -> assertTrue(evaluate(implication, valuation(false, true))),
                    () -> assertTrue(evaluate(implication, valuation(false, false))),
                    () -> assertTrue(evaluate(biconditional, valuation(true, true))),
                    () -> assertFalse(evaluate(biconditional, valuation(true, false))),
                    () -> assertFalse(evaluate(biconditional, valuation(false, true))),
                    () -> assertTrue(evaluate(biconditional, valuation(false, false)))
            );
        }

        @Test
        @DisplayName("Formule composte su cinque atomi")
        void testComplexFormulas() {
            Formula second = P.conjunction(Q.disjunction(R)).negation().disjunction(S.conjunction(T));
            Formula third = P.conjunction(Q).conjunction(R)
                    .disjunction(P.negation().conjunction(Q.negation()).conjunction(R.negation()));
            Formula chain = P.implication(Q).implication(Q.implication(R))
                    .implication(R.implication(S)).implication(S.implication(T));

            assertAll("Formule composte",
                    () -> assertFalse(evaluate(second, valuation(true, true, false, false, true))),
                    () -> assertTrue(evaluate(second, valuation(false, false, true, true, false))),
                    () -> assertFalse(evaluate(second, valuation(true, false, true, true, false))),
                    () -> assertTrue(evaluate(third, Map.of("P", true, "Q", true, "R", true))),
                    () -> assertTrue(evaluate(third, Map.of("P", false, "Q", false, "R", false))),
                    () -> assertFalse(evaluate(third, Map.of("P", true, "Q", false, "R", true))),
                    () -> assertTrue(evaluate(chain, valuation(true, true, true, true, true))),
                    () -> assertFalse(evaluate(chain, valuation(false, true, false, true, false))),
                    () -> assertTrue(evaluate(chain, valuation(true, false, true, false, true)))
            );
        }

        @Test
        @DisplayName("Un atomo non assegnato solleva UnboundAtomException anche se irrilevante")
        void testUnboundAtom_ShouldThrow() {
            Formula formula = P.disjunction(R);
            UnboundAtomException exception = assertThrows(UnboundAtomException.class,
                    () -> evaluate(formula, Map.of("P", true)));
            assertEquals("R", exception.getLabel());
        }

        @Test
        @DisplayName("Atomi extra nella valutazione sono ignorati")
        void testExtraAtomsIgnored() {
            assertTrue(evaluate(P, valuation(true, false)));
        }
    }

    @Nested
    @DisplayName("Proprietà semantiche")
    class PropertyTests {

        @Test
        @DisplayName("Tautologie")
        void testIsTautology() {
            Formula excludedMiddle = P.disjunction(P.negation());
            assertAll("Tautologie",
                    () -> assertTrue(isTautology(excludedMiddle)),
                    () -> assertFalse(isContradiction(excludedMiddle)),
                    () -> assertTrue(isSatisfiable(excludedMiddle)),
                    () -> assertFalse(isFalsifiable(excludedMiddle)),
                    () -> assertTrue(isTautology(P.conjunction(Q).implication(P))),
                    () -> assertFalse(isTautology(P.conjunction(Q))),
                    () -> assertFalse(isTautology(P))
            );
        }

        @Test
        @DisplayName("Contraddizioni")
        void testIsContradiction() {
            Formula contradiction = P.conjunction(P.negation());
            assertAll("Contraddizioni",
                    () -> assertTrue(isContradiction(contradiction)),
                    () -> assertFalse(isSatisfiable(contradiction)),
                    () -> assertTrue(isFalsifiable(contradiction)),
                    () -> assertFalse(isContradiction(P.conjunction(Q).implication(R.conjunction(R.negation())))),
                    () -> assertFalse(isContradiction(P.disjunction(Q))),
                    () -> assertFalse(isContradiction(P))
            );
        }

        @Test
        @DisplayName("Formule contingenti: soddisfacibili e falsificabili")
        void testContingentFormulas() {
            assertAll("Contingenti",
                    () -> assertTrue(isSatisfiable(P.conjunction(Q))),
                    () -> assertTrue(isFalsifiable(P.conjunction(Q))),
                    () -> assertTrue(isSatisfiable(P.implication(Q))),
                    () -> assertTrue(isFalsifiable(P.implication(Q)))
            );
        }

        @Test
        @DisplayName("Valutazioni soddisfacenti")
        void testSatisfyingValuations() {
            assertAll("Soddisfacenti",
                    () -> assertEquals(Set.of(List.of(true, true)), valueTuples(satisfyingValuations(P.conjunction(Q)))),
                    () -> assertEquals(Set.of(List.of(true), List.of(false)),
                            valueTuples(satisfyingValuations(P.disjunction(P.negation())))),
                    () -> assertEquals(Set.of(List.of(true, true), List.of(false, true), List.of(false, false)),
                            valueTuples(satisfyingValuations(P.implication(Q)))),
                    () -> assertEquals(Set.of(List.of(false)), valueTuples(satisfyingValuations(P.implication(P.negation()))))
            );
        }

        @Test
        @DisplayName("Valutazioni falsificanti")
        void testFalsifyingValuations() {
            assertAll("Falsificanti",
                    () -> assertEquals(Set.of(List.of(true, false), List.of(false, true), List.of(false, false)),
                            valueTuples(falsifyingValuations(P.conjunction(Q)))),
                    () -> assertTrue(falsifyingValuations(P.disjunction(P.negation())).isEmpty()),
                    () -> assertEquals(Set.of(List.of(true, false)), valueTuples(falsifyingValuations(P.implication(Q)))),
                    () -> assertEquals(Set.of(List.of(true)), valueTuples(falsifyingValuations(P.implication(P.negation()))))
            );
        }

        @Test
        @DisplayName("Le valutazioni seguono l'ordine della tabella di verità")
        void testValuationOrder() {
            List<Valuation> falsifying = falsifyingValuations(P.conjunction(Q));
            assertEquals(List.of(valuation(true, false), valuation(false, true), valuation(false, false)), falsifying);
        }

        @Test
        @DisplayName("Equivalenze")
        void testIsEquivalent() {
            Formula implication = Identities.IMPLICATION;
            assertAll("Equivalenze",
                    () -> assertTrue(isEquivalent(Identities.DE_MORGAN_AND, implication)),
                    () -> assertTrue(isEquivalent(implication.getOperands().get(0), implication.getOperands().get(1))),
                    () -> assertTrue(isEquivalent(P.biconditional(Q), P.implication(Q).conjunction(Q.implication(P)))),
                    () -> assertTrue(isEquivalent(P, P)),
                    () -> assertTrue(isEquivalent(P, P.conjunction(Q.implication(Q)))),
                    () -> assertFalse(isEquivalent(P, P.disjunction(Q))),
                    () -> assertFalse(isEquivalent(P, Q)),
                    () -> assertFalse(isEquivalent(P.disjunction(Q), P))
            );
        }

        @Test
        @DisplayName("Tutte le identità classiche sono tautologie")
        void testIdentitiesAreTautologies() {
            for (Map.Entry<String, Formula> identity : Identities.all().entrySet()) {
                assertTrue(isTautology(identity.getValue()), identity.getKey() + " dovrebbe essere una tautologia");
            }
        }
    }

    @Nested
    @DisplayName("Leggi verificate su formule casuali")
    class RandomSampleTests {

        @Test
        @DisplayName("Commutatività, doppia negazione e De Morgan")
        void testLaws() {
            for (int i = 0; i + 1 < sample.size(); i++) {
                Formula f = sample.get(i);
                Formula g = sample.get(i + 1);

                assertTrue(isEquivalent(f.conjunction(g), g.conjunction(f)), "Commutatività per " + f + ", " + g);
                assertTrue(isEquivalent(f.negation().negation(), f), "Doppia negazione per " + f);
                assertTrue(isEquivalent(f.conjunction(g).negation(), f.negation().disjunction(g.negation())),
                        "De Morgan per " + f + ", " + g);
            }
        }

        @Test
        @DisplayName("Soddisfacenti + falsificanti = 2^n")
        void testValuationCountInvariant() {
            for (Formula f : sample) {
                long expected = 1L << f.atoms().size();
                assertEquals(expected, satisfyingValuations(f).size() + falsifyingValuations(f).size(),
                        "Conteggio per " + f);
                assertEquals(expected, TruthTable.of(f).getRowCount());
            }
        }

        @Test
        @DisplayName("L'equivalenza è riflessiva, simmetrica e transitiva")
        void testEquivalenceRelation() {
            for (Formula f : sample) {
                assertTrue(isEquivalent(f, f), "Riflessività per " + f);
            }
            for (Formula f : sample) {
                for (Formula g : sample) {
                    assertEquals(isEquivalent(f, g), isEquivalent(g, f), "Simmetria per " + f + ", " + g);
                }
            }
            List<Formula> subset = sample.subList(0, 15);
            for (Formula f : subset) {
                for (Formula g : subset) {
                    for (Formula h : subset) {
                        if (isEquivalent(f, g) && isEquivalent(g, h)) {
                            assertTrue(isEquivalent(f, h), "Transitività per " + f + ", " + g + ", " + h);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("Le proprietà non dipendono dai simboli attivi")
        void testIndependentOfSymbols() {
            Formula f = sample.get(sample.size() - 1);
            boolean tautology = isTautology(f);
            Symbols.setLatexSymbols();
            try {
                assertEquals(tautology, isTautology(f));
            } finally {
                Symbols.setUnicodeSymbols();
            }
        }
    }
}
