package org.forestsat.forest;

import java.util.List;

/**
 * Rappresentazione booleana della distanza di ogni nodo dalla radice del suo colore.
 *
 * Un'istanza vive per una sola compilazione: alloca le proprie variabili tramite la
 * libreria di porte ricevuta alla creazione e non conserva stato tra compilazioni.
 */
interface DistanceEncoding {

    /**
     * Alloca le variabili di distanza del nodo ed emette i vincoli interni alla rappresentazione.
     */
    void declare(String node);

    /**
     * dist(node) = value.
     */
    void fixValue(String node, int value);

    /**
     * dist(node) ≤ k; con k negativo l'istanza diventa insoddisfacibile.
     */
    void capAtMost(String node, int k);

    /**
     * dist(node) ≥ d; oltre il massimo rappresentabile emette la clausola vuota.
     */
    void requireAtLeast(String node, int d);

    /**
     * guard → dist(node) ≥ 1.
     */
    void requirePositiveWhen(int guard, String node);

    /**
     * parentLiteral → dist(child) = dist(parent) + 1.
     */
    void linkParent(int parentLiteral, String child, String parent);

    /**
     * @return ID delle variabili di distanza del nodo, nell'ordine atteso da
     *         {@link DistanceEncodingKind#decode(List, java.util.function.IntPredicate)}
     */
    List<Integer> variablesOf(String node);

    /**
     * @return distanza massima rappresentabile
     */
    int maxRepresentable();

    /**
     * @return larghezza del vettore binario, 0 per la codifica unaria
     */
    int width();
}
