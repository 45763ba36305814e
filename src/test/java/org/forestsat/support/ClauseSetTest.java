package org.forestsat.support;

import org.junit.Test;

import java.util.List;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class ClauseSetTest {

    @Test
    public void duplicateLiteralsCollapse() {
        ClauseSet set = new ClauseSet();
        assertThat(set.addClause(1, 2, 1, 2, 3), is(true));
        assertThat(set.clauses().get(0), contains(1, 2, 3));
    }

    @Test
    public void tautologyIsDiscarded() {
        ClauseSet set = new ClauseSet();
        set.addClause(1, 2);
        assertThat(set.addClause(3, -1, 1), is(false));
        assertThat(set.size(), is(1));
        assertThat(set.discardedTautologies(), is(1));
    }

    @Test
    public void emptyClauseIsTracked() {
        ClauseSet set = new ClauseSet();
        assertThat(set.hasEmptyClause(), is(false));
        set.addEmpty();
        assertThat(set.hasEmptyClause(), is(true));
        assertThat(set.clauses().get(0), is(empty()));
    }

    @Test
    public void listVariantMatchesVarargs() {
        ClauseSet set = new ClauseSet();
        set.addClause(List.of(-4, 5));
        set.addUnit(7);
        assertThat(set.clauses(), contains(List.of(-4, 5), List.of(7)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void zeroLiteralRejected() {
        new ClauseSet().addClause(1, 0, 2);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void clausesViewIsReadOnly() {
        ClauseSet set = new ClauseSet();
        set.addUnit(1);
        set.clauses().clear();
    }
}
