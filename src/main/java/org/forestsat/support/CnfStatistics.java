package org.forestsat.support;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * STATISTICHE ISTANZA - Metriche dimensionali di un'istanza CNF compilata
 *
 * Raccoglie le grandezze utili per confrontare codifiche diverse dello stesso
 * problema (unaria contro binaria): variabili, clausole, letterali totali,
 * dimensione del testo DIMACS e distribuzione delle lunghezze di clausola.
 */
public final class CnfStatistics {

    //region METRICHE

    private final int variables;
    private final int clauses;
    private final long literals;
    private final int dimacsBytes;
    private final int longestClause;
    private final int unitClauses;
    private final int emptyClauses;

    /** lunghezza clausola → numero di clausole con quella lunghezza */
    private final Map<Integer, Integer> lengthDistribution;

    //endregion

    private CnfStatistics(int variables, int clauses, long literals, int dimacsBytes, int longestClause,
                          int unitClauses, int emptyClauses, Map<Integer, Integer> lengthDistribution) {
        this.variables = variables;
        this.clauses = clauses;
        this.literals = literals;
        this.dimacsBytes = dimacsBytes;
        this.longestClause = longestClause;
        this.unitClauses = unitClauses;
        this.emptyClauses = emptyClauses;
        this.lengthDistribution = lengthDistribution;
    }

    /**
     * Calcola le statistiche di un'istanza.
     *
     * @param numVars numero di variabili
     * @param clauseList clausole dell'istanza
     * @param dimacs testo DIMACS corrispondente (per la dimensione in byte)
     */
    public static CnfStatistics of(int numVars, List<List<Integer>> clauseList, String dimacs) {
        long literalCount = 0;
        int longest = 0;
        int units = 0;
        int empties = 0;
        Map<Integer, Integer> distribution = new TreeMap<>();

        for (List<Integer> clause : clauseList) {
            int size = clause.size();
            literalCount += size;
            longest = Math.max(longest, size);
            if (size == 1) units++;
            if (size == 0) empties++;
            distribution.merge(size, 1, Integer::sum);
        }

        return new CnfStatistics(numVars, clauseList.size(), literalCount,
                dimacs.getBytes(StandardCharsets.UTF_8).length, longest, units, empties,
                Map.copyOf(distribution));
    }

    //region INTERFACCIA PUBBLICA

    public int getVariables() { return variables; }
    public int getClauses() { return clauses; }
    public long getLiterals() { return literals; }
    public int getDimacsBytes() { return dimacsBytes; }
    public int getLongestClause() { return longestClause; }
    public int getUnitClauses() { return unitClauses; }
    public int getEmptyClauses() { return emptyClauses; }

    public Map<Integer, Integer> getLengthDistribution() {
        return new TreeMap<>(lengthDistribution);
    }

    /**
     * @return media letterali per clausola (0 per istanza senza clausole)
     */
    public double getAverageClauseLength() {
        return clauses == 0 ? 0.0 : (double) literals / clauses;
    }

    /**
     * Report testuale per l'output a riga di comando.
     */
    public String toReport() {
        StringBuilder report = new StringBuilder();
        report.append("=== STATISTICHE ISTANZA CNF ===\n");
        report.append("Variabili: ").append(variables).append("\n");
        report.append("Clausole: ").append(clauses).append("\n");
        report.append("Letterali totali: ").append(literals).append("\n");
        report.append(String.format("Lunghezza media clausola: %.2f%n", getAverageClauseLength()));
        report.append("Clausola più lunga: ").append(longestClause).append("\n");
        report.append("Clausole unitarie: ").append(unitClauses).append("\n");
        if (emptyClauses > 0) {
            report.append("Clausole vuote: ").append(emptyClauses).append(" (istanza UNSAT per costruzione)\n");
        }
        report.append("Dimensione DIMACS: ").append(dimacsBytes).append(" byte\n");
        report.append("Distribuzione lunghezze: ").append(getLengthDistribution()).append("\n");
        report.append("===============================\n");
        return report.toString();
    }

    @Override
    public String toString() {
        return String.format("CnfStatistics[vars=%d, clauses=%d, literals=%d, bytes=%d]",
                variables, clauses, literals, dimacsBytes);
    }

    //endregion
}
