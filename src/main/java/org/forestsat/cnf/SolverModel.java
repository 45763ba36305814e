package org.forestsat.cnf;

import java.util.Collection;
import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * MODELLO DEL SOLUTORE - Esito di un solutore SAT esterno
 *
 * Contenitore immutabile:
 * • SAT: insieme delle variabili assegnate a vero (le altre sono false)
 * • UNSAT: nessun assegnamento
 *
 * Le variabili non menzionate dal solutore sono considerate false, come fanno
 * i solutori che omettono le variabili "don't care".
 */
public final class SolverModel {

    private static final SolverModel UNSATISFIABLE = new SolverModel(false, Set.of());

    private final boolean satisfiable;
    private final Set<Integer> trueVariables;

    private SolverModel(boolean satisfiable, Set<Integer> trueVariables) {
        this.satisfiable = satisfiable;
        this.trueVariables = trueVariables;
    }

    /**
     * Costruisce un modello SAT dai letterali con segno riportati dal solutore.
     *
     * @param literals letterali del modello; i positivi indicano variabili vere
     * @throws IllegalArgumentException se compare il letterale 0
     */
    public static SolverModel satisfiable(Collection<Integer> literals) {
        Set<Integer> positives = new TreeSet<>();
        for (int literal : literals) {
            if (literal == 0) {
                throw new IllegalArgumentException("Il letterale 0 non può far parte di un modello");
            }
            if (literal > 0) {
                positives.add(literal);
            }
        }
        return new SolverModel(true, Collections.unmodifiableSet(positives));
    }

    public static SolverModel unsatisfiable() {
        return UNSATISFIABLE;
    }

    public boolean isSatisfiable() {
        return satisfiable;
    }

    /**
     * @return true se la variabile e' vera nel modello
     * @throws IllegalStateException se il modello e' UNSAT
     */
    public boolean isTrue(int variable) {
        if (!satisfiable) {
            throw new IllegalStateException("Nessun assegnamento disponibile per un risultato UNSAT");
        }
        return trueVariables.contains(variable);
    }

    public Set<Integer> trueVariables() {
        return trueVariables;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SolverModel other)) return false;
        return satisfiable == other.satisfiable && trueVariables.equals(other.trueVariables);
    }

    @Override
    public int hashCode() {
        return Objects.hash(satisfiable, trueVariables);
    }

    @Override
    public String toString() {
        return satisfiable ? "SAT" + trueVariables : "UNSAT";
    }
}
