package org.forestsat.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * EMETTITORE DI CLAUSOLE - Accumulatore di clausole CNF normalizzate
 *
 * Ogni clausola e' un insieme (non multinsieme) di letterali con segno:
 * - valori positivi: variabile vera
 * - valori negativi: variabile falsa
 * - lo 0 non e' mai un letterale valido (terminatore DIMACS)
 *
 * NORMALIZZAZIONE IN INGRESSO:
 * - letterali ripetuti vengono fusi mantenendo l'ordine della prima occorrenza
 * - una clausola che contiene v e ¬v e' una tautologia e viene scartata
 * - la clausola vuota viene accettata: rende l'istanza insoddisfacibile per costruzione
 */
public class ClauseSet {

    private static final Logger LOGGER = Logger.getLogger(ClauseSet.class.getName());

    /** Clausole in ordine di emissione. */
    private final List<List<Integer>> clauses = new ArrayList<>();

    /** Numero di tautologie scartate, utile per le statistiche. */
    private int discardedTautologies;

    /** True dopo l'emissione di almeno una clausola vuota. */
    private boolean emptyClauseEmitted;

    //region EMISSIONE

    /**
     * Aggiunge la disgiunzione dei letterali dati.
     *
     * @param literals letterali con segno, mai 0
     * @return true se la clausola e' stata memorizzata, false se tautologica
     * @throws IllegalArgumentException se compare il letterale 0
     */
    public boolean addClause(int... literals) {
        Set<Integer> normalized = new LinkedHashSet<>();
        for (int literal : literals) {
            if (literal == 0) {
                throw new IllegalArgumentException("Il letterale 0 è riservato al terminatore DIMACS");
            }
            if (normalized.contains(-literal)) {
                discardedTautologies++;
                return false;
            }
            normalized.add(literal);
        }

        if (normalized.isEmpty()) {
            if (!emptyClauseEmitted) {
                LOGGER.fine("Clausola vuota emessa: istanza insoddisfacibile per costruzione");
            }
            emptyClauseEmitted = true;
        }

        clauses.add(List.copyOf(normalized));
        return true;
    }

    /**
     * Variante per clausole costruite dinamicamente.
     */
    public boolean addClause(List<Integer> literals) {
        return addClause(literals.stream().mapToInt(Integer::intValue).toArray());
    }

    /**
     * Clausola unitaria: forza il letterale a vero.
     */
    public void addUnit(int literal) {
        addClause(literal);
    }

    /**
     * Emette la clausola vuota, sempre falsa.
     */
    public void addEmpty() {
        addClause();
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return vista immutabile delle clausole in ordine di emissione
     */
    public List<List<Integer>> clauses() {
        return Collections.unmodifiableList(clauses);
    }

    public int size() {
        return clauses.size();
    }

    public int discardedTautologies() {
        return discardedTautologies;
    }

    public boolean hasEmptyClause() {
        return emptyClauseEmitted;
    }

    @Override
    public String toString() {
        return String.format("ClauseSet{clausole=%d, tautologie_scartate=%d}", clauses.size(), discardedTautologies);
    }

    //endregion
}
