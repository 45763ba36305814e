package org.forestsat.forest;

import org.forestsat.support.CnfStatistics;

import java.util.List;
import java.util.Map;

/**
 * ISTANZA CNF COMPILATA - Output immutabile di una compilazione
 *
 * Contiene tutto cio' che serve al solutore esterno (testo DIMACS) e a chi ne
 * interpreta il risultato (tabelle dei simboli, variabili di distanza, metadati).
 *
 * Un'istanza con clausola vuota e' un risultato valido: il problema e'
 * insoddisfacibile per costruzione, non malformato.
 */
public final class ColoredForestCnf {

    private final int numVars;
    private final List<List<Integer>> clauses;
    private final Map<String, Integer> varOf;
    private final Map<Integer, String> nameOf;
    private final Map<String, List<Integer>> distanceVariables;
    private final String dimacs;
    private final EncodingMeta meta;
    private final boolean emptyClause;

    ColoredForestCnf(int numVars, List<List<Integer>> clauses, Map<String, Integer> varOf,
                     Map<Integer, String> nameOf, Map<String, List<Integer>> distanceVariables,
                     String dimacs, EncodingMeta meta, boolean emptyClause) {
        this.numVars = numVars;
        this.clauses = List.copyOf(clauses);
        this.varOf = varOf;
        this.nameOf = nameOf;
        this.distanceVariables = Map.copyOf(distanceVariables);
        this.dimacs = dimacs;
        this.meta = meta;
        this.emptyClause = emptyClause;
    }

    public int numVars() { return numVars; }

    /**
     * @return clausole in ordine di emissione, ciascuna come lista immutabile di letterali
     */
    public List<List<Integer>> clauses() { return clauses; }

    public Map<String, Integer> varOf() { return varOf; }
    public Map<Integer, String> nameOf() { return nameOf; }
    public String dimacs() { return dimacs; }
    public EncodingMeta meta() { return meta; }

    /**
     * @return true se l'istanza contiene la clausola vuota (UNSAT per costruzione)
     */
    public boolean hasEmptyClause() { return emptyClause; }

    /**
     * @param name nome simbolico della variabile
     * @return ID della variabile
     * @throws IllegalArgumentException se la variabile non esiste
     */
    public int variable(String name) {
        Integer id = varOf.get(name);
        if (id == null) {
            throw new IllegalArgumentException("Variabile sconosciuta: " + name);
        }
        return id;
    }

    /**
     * @return variabili di distanza del nodo, da interpretare con {@code meta().encoding()}
     */
    public List<Integer> distanceVariables(String node) {
        List<Integer> vars = distanceVariables.get(node);
        if (vars == null) {
            throw new IllegalArgumentException("Nodo sconosciuto: " + node);
        }
        return vars;
    }

    public CnfStatistics statistics() {
        return CnfStatistics.of(numVars, clauses, dimacs);
    }

    @Override
    public String toString() {
        return String.format("ColoredForestCnf[variabili=%d, clausole=%d, codifica=%s%s]",
                numVars, clauses.size(), meta.encoding(), emptyClause ? ", UNSAT per costruzione" : "");
    }
}
