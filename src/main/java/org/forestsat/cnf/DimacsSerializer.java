package org.forestsat.cnf;

import java.util.List;

/**
 * SERIALIZZATORE DIMACS - Rendering testuale standard di un'istanza CNF
 *
 * FORMATO:
 * - header "p cnf <variabili> <clausole>"
 * - una riga per clausola: letterali separati da spazio, terminati da 0
 * - la clausola vuota e' la riga "0"
 *
 * Funzione pura della lista di clausole e del numero di variabili.
 */
public final class DimacsSerializer {

    /** Terminatore clausola nel formato DIMACS */
    public static final int CLAUSE_TERMINATOR = 0;

    private DimacsSerializer() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @param numVars numero di variabili dichiarato nell'header
     * @param clauses clausole in ordine di emissione
     * @return testo DIMACS terminato da newline
     */
    public static String toDimacs(int numVars, List<List<Integer>> clauses) {
        if (numVars < 0) {
            throw new IllegalArgumentException("Numero variabili negativo: " + numVars);
        }

        StringBuilder out = new StringBuilder();
        out.append("p cnf ").append(numVars).append(' ').append(clauses.size()).append('\n');
        for (List<Integer> clause : clauses) {
            for (int literal : clause) {
                out.append(literal).append(' ');
            }
            out.append(CLAUSE_TERMINATOR).append('\n');
        }
        return out.toString();
    }
}
