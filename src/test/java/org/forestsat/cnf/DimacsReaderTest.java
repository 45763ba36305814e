package org.forestsat.cnf;

import org.forestsat.forest.ColoredForestCnf;
import org.forestsat.forest.ColoredForestCompiler;
import org.forestsat.forest.ForestProblem;
import org.junit.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.startsWith;

public class DimacsReaderTest {

    @Test
    public void simple() {
        DimacsInstance instance = DimacsReader.parse("c simple test\nc heh\np cnf 3 2\n1 -3 0\n2 3 -1 0");
        assertThat(instance.numVars(), is(3));
        assertThat(instance.numClauses(), is(2));
        assertThat(instance.clauses().get(1), contains(2, 3, -1));
    }

    @Test
    public void clausesMaySpanLines() {
        DimacsInstance instance = DimacsReader.parse("p cnf 3 2\n1 2\n3 0 -1\n0\n");
        assertThat(instance.clauses(), contains(List.of(1, 2, 3), List.of(-1)));
    }

    @Test
    public void endMarkerStopsParsing() {
        DimacsInstance instance = DimacsReader.parse("p cnf 2 1\n1 2 0\n%\n0\n");
        assertThat(instance.numClauses(), is(1));
    }

    @Test
    public void emptyClauseSurvives() {
        DimacsInstance instance = DimacsReader.parse("p cnf 1 2\n1 0\n0\n");
        assertThat(instance.clauses().get(1), is(empty()));
    }

    @Test(expected = DimacsFormatException.class)
    public void literalOutOfBounds() {
        DimacsReader.parse("p cnf 3 2\n1 2 3 0\n2 3 4 0");
    }

    @Test(expected = DimacsFormatException.class)
    public void smallestIntegerLiteralIsOutOfBounds() {
        DimacsReader.parse("p cnf 3 1\n-2147483648 0\n");
    }

    @Test(expected = DimacsFormatException.class)
    public void tooManyClauses() {
        DimacsReader.parse("p cnf 3 2\n1 2 3 0\n2 3 -1 0\n-2 -3 0");
    }

    @Test(expected = DimacsFormatException.class)
    public void tooFewClauses() {
        DimacsReader.parse("p cnf 3 2\n1 2 3 0\n");
    }

    @Test(expected = DimacsFormatException.class)
    public void danglingClause() {
        DimacsReader.parse("p cnf 3 2\n1 2 3 0\n2 3 -1");
    }

    @Test(expected = DimacsFormatException.class)
    public void missingHeader() {
        DimacsReader.parse("1 2 0\n");
    }

    @Test(expected = DimacsFormatException.class)
    public void duplicateHeader() {
        DimacsReader.parse("p cnf 1 0\np cnf 1 0\n");
    }

    @Test
    public void errorsCarryLineNumbers() {
        try {
            DimacsReader.parse("p cnf 2 1\nc comment\n1 x 0\n");
            throw new AssertionError("attesa DimacsFormatException");
        } catch (DimacsFormatException e) {
            assertThat(e.getLineNumber(), is(3));
            assertThat(e.getMessage(), startsWith("Riga 3"));
        }
    }

    @Test
    public void compiledInstanceRoundTrips() {
        ForestProblem problem = ForestProblem.builder()
                .nodes("a", "b", "c", "d")
                .edge("a", "b").edge("b", "c").edge("c", "d").edge("a", "c")
                .root(0, "a").root(1, "d")
                .lowerBound("c", 1)
                .build();
        ColoredForestCnf cnf = new ColoredForestCompiler().compile(problem);

        DimacsInstance parsed = DimacsReader.parse(cnf.dimacs());
        assertThat(parsed.numVars(), is(cnf.numVars()));
        assertThat(multiset(parsed.clauses()), is(multiset(cnf.clauses())));
    }

    private static Map<List<Integer>, Integer> multiset(List<List<Integer>> clauses) {
        Map<List<Integer>, Integer> counts = new HashMap<>();
        for (List<Integer> clause : clauses) {
            List<Integer> sorted = new ArrayList<>(clause);
            sorted.sort(null);
            counts.merge(sorted, 1, Integer::sum);
        }
        return counts;
    }

    //region MODELLI

    @Test
    public void competitionModel() {
        SolverModel model = DimacsReader.parseModel("c by some solver\ns SATISFIABLE\nv 1 -2 3\nv -4 0\n");
        assertThat(model.isSatisfiable(), is(true));
        assertThat(model.trueVariables(), containsInAnyOrder(1, 3));
        assertThat(model.isTrue(2), is(false));
    }

    @Test
    public void minisatModel() {
        SolverModel model = DimacsReader.parseModel("SAT\n-1 2 -3 0\n");
        assertThat(model.trueVariables(), contains(2));
    }

    @Test
    public void bareLiteralsAreSatisfiable() {
        assertThat(DimacsReader.parseModel("1 2 0").isSatisfiable(), is(true));
    }

    @Test
    public void unsatisfiableModel() {
        assertThat(DimacsReader.parseModel("s UNSATISFIABLE\n"), is(SolverModel.unsatisfiable()));
        assertThat(DimacsReader.parseModel("UNSAT").isSatisfiable(), is(false));
    }

    @Test(expected = IllegalStateException.class)
    public void unsatisfiableModelHasNoAssignment() {
        DimacsReader.parseModel("UNSAT").isTrue(1);
    }

    @Test(expected = DimacsFormatException.class)
    public void literalAfterTerminator() {
        DimacsReader.parseModel("SAT\n1 0 2\n");
    }

    @Test(expected = DimacsFormatException.class)
    public void unsatWithLiterals() {
        DimacsReader.parseModel("UNSAT\n1 2 0\n");
    }

    @Test(expected = DimacsFormatException.class)
    public void emptyModel() {
        DimacsReader.parseModel("c nothing here\n");
    }

    //endregion
}
