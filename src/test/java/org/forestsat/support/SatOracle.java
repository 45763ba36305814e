package org.forestsat.support;

import org.forestsat.cnf.SolverModel;
import org.forestsat.forest.ColoredForestCnf;
import org.sat4j.core.VecInt;
import org.sat4j.minisat.SolverFactory;
import org.sat4j.specs.ContradictionException;
import org.sat4j.specs.ISolver;
import org.sat4j.specs.TimeoutException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Risolve le istanze generate con Sat4j, usato come solutore esterno di riferimento nei test.
 */
public final class SatOracle {

    private SatOracle() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    public static SolverModel solve(ColoredForestCnf cnf) {
        return solve(cnf.numVars(), cnf.clauses());
    }

    public static SolverModel solve(int numVars, List<List<Integer>> clauses) {
        List<SolverModel> models = enumerate(numVars, clauses, List.of(), 1);
        return models.isEmpty() ? SolverModel.unsatisfiable() : models.get(0);
    }

    public static boolean isSatisfiable(int numVars, List<List<Integer>> clauses) {
        return solve(numVars, clauses).isSatisfiable();
    }

    /**
     * Enumera modelli distinti rispetto alle variabili di proiezione, bloccando ogni
     * proiezione trovata. Con proiezione vuota restituisce al piu' un modello.
     *
     * @param limit numero massimo di modelli restituiti
     */
    public static List<SolverModel> enumerate(int numVars, List<List<Integer>> clauses,
                                              List<Integer> projection, int limit) {
        ISolver solver = SolverFactory.newDefault();
        solver.newVar(numVars);
        solver.setExpectedNumberOfClauses(clauses.size());

        List<SolverModel> models = new ArrayList<>();
        try {
            for (List<Integer> clause : clauses) {
                solver.addClause(toVec(clause));
            }
            while (models.size() < limit && solver.isSatisfiable()) {
                int[] model = solver.model();
                SolverModel found = SolverModel.satisfiable(Arrays.stream(model).boxed().collect(Collectors.toList()));
                models.add(found);
                if (projection.isEmpty()) {
                    break;
                }
                List<Integer> blocking = new ArrayList<>(projection.size());
                for (int v : projection) {
                    blocking.add(found.isTrue(v) ? -v : v);
                }
                solver.addClause(toVec(blocking));
            }
        } catch (ContradictionException e) {
            // conflitto a livello radice: nessun ulteriore modello
            return models;
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timeout del solutore di riferimento", e);
        }
        return models;
    }

    private static VecInt toVec(List<Integer> clause) {
        return new VecInt(clause.stream().mapToInt(Integer::intValue).toArray());
    }
}
