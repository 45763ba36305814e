package org.forestsat.cnf;

import java.util.List;

/**
 * Istanza CNF letta da testo DIMACS: numero di variabili dichiarato e clausole in ordine.
 */
public record DimacsInstance(int numVars, List<List<Integer>> clauses) {

    public DimacsInstance {
        clauses = clauses.stream().map(List::copyOf).toList();
    }

    public int numClauses() {
        return clauses.size();
    }
}
