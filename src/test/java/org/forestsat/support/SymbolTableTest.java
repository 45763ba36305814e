package org.forestsat.support;

import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.is;

public class SymbolTableTest {

    @Test
    public void idsAreSequentialFromOne() {
        SymbolTable table = new SymbolTable();
        assertThat(table.intern("col(a)=0"), is(1));
        assertThat(table.intern("col(b)=0"), is(2));
        assertThat(table.intern("par(b)->(a)"), is(3));
        assertThat(table.size(), is(3));
    }

    @Test
    public void internIsIdempotent() {
        SymbolTable table = new SymbolTable();
        int first = table.intern("x");
        table.intern("y");
        assertThat(table.intern("x"), is(first));
        assertThat(table.size(), is(2));
    }

    @Test
    public void nameAndIdAreInverse() {
        SymbolTable table = new SymbolTable();
        for (String name : List.of("a", "b", "c", "d")) {
            table.intern(name);
        }
        for (Map.Entry<String, Integer> entry : table.varOf().entrySet()) {
            assertThat(table.nameOf(entry.getValue()), is(entry.getKey()));
        }
        assertThat(table.nameOf().keySet(), contains(1, 2, 3, 4));
        assertThat(table.nameOf().values(), contains("a", "b", "c", "d"));
    }

    @Test
    public void lookupDoesNotAllocate() {
        SymbolTable table = new SymbolTable();
        table.intern("a");
        assertThat(table.lookup("missing"), is(0));
        assertThat(table.contains("missing"), is(false));
        assertThat(table.size(), is(1));
    }

    @Test(expected = IllegalArgumentException.class)
    public void emptyNameRejected() {
        new SymbolTable().intern("");
    }

    @Test(expected = IllegalArgumentException.class)
    public void unknownIdRejected() {
        new SymbolTable().nameOf(1);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void exportedMapsAreReadOnly() {
        SymbolTable table = new SymbolTable();
        table.intern("a");
        table.varOf().put("b", 2);
    }
}
