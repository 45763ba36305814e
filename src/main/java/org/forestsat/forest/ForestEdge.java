package org.forestsat.forest;

/**
 * Arco non orientato tra due nodi, nell'orientamento in cui e' stato dichiarato.
 */
public record ForestEdge(String u, String v) {

    public ForestEdge {
        if (u == null || v == null) {
            throw new IllegalArgumentException("Gli estremi di un arco non possono essere null");
        }
    }

    /**
     * @return lo stesso arco con gli estremi in ordine lessicografico; due archi
     *         non orientati coincidono se e solo se le forme canoniche sono uguali
     */
    public ForestEdge canonical() {
        return u.compareTo(v) <= 0 ? this : new ForestEdge(v, u);
    }

    public boolean isSelfLoop() {
        return u.equals(v);
    }

    @Override
    public String toString() {
        return "(" + u + "," + v + ")";
    }
}
