package org.forestsat.forest;

import org.forestsat.forest.InvalidForestProblemException.Reason;
import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;

public class ForestValidationTest {

    private static Reason rejectionOf(ForestProblem.Builder builder) {
        try {
            new ColoredForestCompiler().compile(builder.build());
        } catch (InvalidForestProblemException e) {
            return e.getReason();
        }
        throw new AssertionError("attesa InvalidForestProblemException");
    }

    private static ForestProblem.Builder pair() {
        return ForestProblem.builder().nodes("a", "b").edge("a", "b").root(0, "a");
    }

    @Test
    public void emptyNodeSet() {
        assertThat(rejectionOf(ForestProblem.builder().root(0, "a")), is(Reason.EMPTY_NODE_SET));
    }

    @Test
    public void noActiveColors() {
        assertThat(rejectionOf(ForestProblem.builder().nodes("a").hint("a", ForestProblem.ANY_COLOR)),
                is(Reason.NO_ACTIVE_COLORS));
    }

    @Test
    public void negativeRootColor() {
        assertThat(rejectionOf(pair().root(-2, "b")), is(Reason.NEGATIVE_COLOR));
    }

    @Test
    public void hintedColorWithoutRoot() {
        assertThat(rejectionOf(pair().hint("b", 3)), is(Reason.MISSING_ROOT));
    }

    @Test
    public void rootNotAmongNodes() {
        assertThat(rejectionOf(pair().root(1, "z")), is(Reason.UNKNOWN_ROOT));
    }

    @Test
    public void edgeToUnknownNode() {
        assertThat(rejectionOf(pair().edge("a", "z")), is(Reason.UNKNOWN_EDGE_NODE));
    }

    @Test
    public void selfLoop() {
        assertThat(rejectionOf(pair().edge("b", "b")), is(Reason.SELF_LOOP));
    }

    @Test
    public void hintBelowMinusOne() {
        assertThat(rejectionOf(pair().hint("b", -2)), is(Reason.INVALID_COLOR_HINT));
    }

    @Test
    public void boundOnUnknownNode() {
        assertThat(rejectionOf(pair().lowerBound("z", 1)), is(Reason.UNKNOWN_BOUND_NODE));
    }

    @Test
    public void negativeBound() {
        assertThat(rejectionOf(pair().lowerBound("b", -1)), is(Reason.NEGATIVE_BOUND));
    }

    @Test
    public void validProblemPasses() {
        ColoredForestCnf cnf = new ColoredForestCompiler().compile(pair().hint("b", 0).lowerBound("b", 1).build());
        assertThat(cnf.hasEmptyClause(), is(false));
    }

    @Test(expected = IllegalArgumentException.class)
    public void nullProblemRejected() {
        new ColoredForestCompiler().compile(null);
    }
}
