package org.forestsat.cnf;

import org.forestsat.support.ClauseSet;
import org.forestsat.support.SymbolTable;
import org.junit.Before;
import org.junit.Test;

import java.util.List;
import java.util.function.IntPredicate;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class GateLibraryTest {

    private SymbolTable symbols;
    private ClauseSet clauses;
    private GateLibrary gates;

    @Before
    public void setUp() {
        symbols = new SymbolTable();
        clauses = new ClauseSet();
        gates = new GateLibrary(symbols, clauses);
    }

    /** Valuta l'insieme di clausole sotto l'assegnamento codificato nei bit di mask (bit i = variabile i+1). */
    static boolean satisfied(List<List<Integer>> clauseList, int mask) {
        IntPredicate isTrue = v -> ((mask >> (v - 1)) & 1) == 1;
        for (List<Integer> clause : clauseList) {
            boolean any = false;
            for (int literal : clause) {
                if (literal > 0 ? isTrue.test(literal) : !isTrue.test(-literal)) {
                    any = true;
                    break;
                }
            }
            if (!any) {
                return false;
            }
        }
        return true;
    }

    private static boolean bit(int mask, int var) {
        return ((mask >> (var - 1)) & 1) == 1;
    }

    @Test
    public void andGateTruthTable() {
        int a = gates.variable("a");
        int b = gates.variable("b");
        int x = gates.andGate("x", a, b);
        assertThat(clauses.size(), is(3));

        for (int mask = 0; mask < 8; mask++) {
            boolean expected = bit(mask, x) == (bit(mask, a) && bit(mask, b));
            assertThat("mask " + mask, satisfied(clauses.clauses(), mask), is(expected));
        }
    }

    @Test
    public void xorGateTruthTable() {
        int a = gates.variable("a");
        int b = gates.variable("b");
        int x = gates.xorGate("x", a, b);
        assertThat(clauses.size(), is(4));

        for (int mask = 0; mask < 8; mask++) {
            boolean expected = bit(mask, x) == (bit(mask, a) ^ bit(mask, b));
            assertThat("mask " + mask, satisfied(clauses.clauses(), mask), is(expected));
        }
    }

    @Test
    public void exactlyOneAllowsOnlySingletons() {
        List<Integer> vars = List.of(gates.variable("c0"), gates.variable("c1"), gates.variable("c2"),
                gates.variable("c3"));
        gates.exactlyOne(vars);
        assertThat(clauses.size(), is(1 + 6));

        for (int mask = 0; mask < 16; mask++) {
            boolean expected = Integer.bitCount(mask) == 1;
            assertThat("mask " + mask, satisfied(clauses.clauses(), mask), is(expected));
        }
    }

    @Test
    public void exactlyOneOfNothingIsContradiction() {
        gates.exactlyOne(List.of());
        assertThat(clauses.hasEmptyClause(), is(true));
    }

    @Test
    public void guardedCardinality() {
        int g = gates.variable("g");
        List<Integer> vars = List.of(gates.variable("p1"), gates.variable("p2"), gates.variable("p3"));
        gates.atLeastOneWhen(g, vars);
        gates.atMostOneWhen(g, vars);

        for (int mask = 0; mask < 16; mask++) {
            int chosen = Integer.bitCount(mask >> 1);
            boolean expected = !bit(mask, g) || chosen == 1;
            assertThat("mask " + mask, satisfied(clauses.clauses(), mask), is(expected));
        }
    }

    @Test
    public void implicationAndEquivalence() {
        int a = gates.variable("a");
        int b = gates.variable("b");
        gates.implies(a, b);
        assertThat(clauses.clauses().get(0), contains(-a, b));

        gates.equivalent(a, b);
        for (int mask = 0; mask < 4; mask++) {
            assertThat(satisfied(clauses.clauses(), mask), is(bit(mask, a) == bit(mask, b)));
        }
    }

    @Test
    public void namedOutputsReuseVariables() {
        int a = gates.variable("a");
        int b = gates.variable("b");
        int x = gates.andGate("x", a, b);
        assertThat(gates.variable("x"), is(x));
        assertThat(symbols.nameOf(x), is("x"));
    }
}
