package org.forestsat.support;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * TABELLA DEI SIMBOLI - Allocatore di variabili booleane con nome stabile
 *
 * Associa nomi simbolici leggibili ("col(n3)=2", "par(n3)->(n7)", "dist(n3)>=4")
 * a ID numerici DIMACS progressivi e viceversa. E' l'unico punto in cui nascono
 * nuove variabili: ogni altro componente le ottiene tramite {@link #intern(String)},
 * cosi' un modello restituito dal solutore e' sempre decodificabile per nome.
 *
 * INVARIANTI MANTENUTE:
 * - nome ↔ ID e' una biiezione
 * - gli ID partono da 1 e seguono l'ordine del primo intern
 * - nessuna variabile viene mai rimossa o rinumerata
 */
public class SymbolTable {

    private static final Logger LOGGER = Logger.getLogger(SymbolTable.class.getName());

    //region STRUTTURE DATI

    /** Mapping nome → ID, in ordine di creazione. */
    private final Map<String, Integer> variableMapping = new LinkedHashMap<>();

    /** Mapping inverso: posizione i contiene il nome della variabile i+1. */
    private final List<String> namesById = new ArrayList<>();

    //endregion

    //region ALLOCAZIONE

    /**
     * Restituisce l'ID della variabile con il nome dato, creandola alla prima richiesta.
     *
     * @param name nome simbolico (non vuoto)
     * @return ID numerico univoco, sempre ≥ 1
     * @throws IllegalArgumentException se il nome e' null o vuoto
     */
    public int intern(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Nome variabile non può essere null o vuoto");
        }

        return variableMapping.computeIfAbsent(name, newName -> {
            namesById.add(newName);
            int newId = namesById.size();
            LOGGER.finest("Nuova variabile mappata: " + newName + " → ID " + newId);
            return newId;
        });
    }

    /**
     * @return true se la variabile e' gia' stata allocata
     */
    public boolean contains(String name) {
        return variableMapping.containsKey(name);
    }

    /**
     * Cerca l'ID di una variabile esistente senza allocarla.
     *
     * @return ID della variabile oppure 0 se il nome non e' mai stato internato
     */
    public int lookup(String name) {
        Integer id = variableMapping.get(name);
        return id != null ? id : 0;
    }

    /**
     * @param id ID di variabile (≥ 1)
     * @return nome simbolico associato
     * @throws IllegalArgumentException se l'ID non e' mai stato assegnato
     */
    public String nameOf(int id) {
        if (id < 1 || id > namesById.size()) {
            throw new IllegalArgumentException("ID variabile sconosciuto: " + id);
        }
        return namesById.get(id - 1);
    }

    //endregion

    //region INTERFACCIA PUBBLICA

    /**
     * @return numero di variabili allocate (coincide con l'ID massimo)
     */
    public int size() {
        return namesById.size();
    }

    /**
     * @return copia immutabile del mapping nome → ID, in ordine di allocazione
     */
    public Map<String, Integer> varOf() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(variableMapping));
    }

    /**
     * @return copia immutabile del mapping ID → nome, in ordine crescente di ID
     */
    public Map<Integer, String> nameOf() {
        Map<Integer, String> inverse = new LinkedHashMap<>();
        for (int i = 0; i < namesById.size(); i++) {
            inverse.put(i + 1, namesById.get(i));
        }
        return Collections.unmodifiableMap(inverse);
    }

    @Override
    public String toString() {
        return String.format("SymbolTable{variabili=%d}", namesById.size());
    }

    //endregion
}
