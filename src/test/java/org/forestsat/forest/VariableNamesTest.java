package org.forestsat.forest;

import org.junit.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;

public class VariableNamesTest {

    @Test
    public void plainIdsAreKeptAsIs() {
        assertThat(VariableNames.nodeId("a_1"), is("a_1"));
        assertThat(VariableNames.color("a", 0), is("col(a)=0"));
        assertThat(VariableNames.parent("b", "a"), is("par(b)->(a)"));
    }

    @Test
    public void otherIdsAreQuotedAndEscaped() {
        assertThat(VariableNames.nodeId("0,1"), is("\"0,1\""));
        assertThat(VariableNames.nodeId("x\"y\\z"), is("\"x\\\"y\\\\z\""));
        assertThat(VariableNames.nodeId(""), is("\"\""));
    }

    @Test
    public void joinedIdsDoNotCollide() {
        assertThat(VariableNames.parent("a)->(b", "c"), is(not(VariableNames.parent("a", "b)->(c"))));
        assertThat(VariableNames.keep("a", "b--c"), is(not(VariableNames.keep("a--b", "c"))));
        assertThat(VariableNames.incrementerTag("a", "b_to_c"), is(not(VariableNames.incrementerTag("a_to_b", "c"))));
        assertThat(VariableNames.color("\"a\"", 0), is(not(VariableNames.color("a", 0))));
    }

    @Test
    public void keepIgnoresOrientation() {
        assertThat(VariableNames.keep("b", "a"), is("keep(a--b)"));
        assertThat(new ForestEdge("b", "a").canonical(), is(new ForestEdge("a", "b")));
    }
}
