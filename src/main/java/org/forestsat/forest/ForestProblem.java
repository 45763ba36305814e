package org.forestsat.forest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * PROBLEMA DELLA FORESTA COLORATA - Descrizione di ingresso del compilatore
 *
 * COMPONENTI:
 * • nodi: identificatori univoci, in ordine di dichiarazione (i duplicati si fondono)
 * • archi: coppie non orientate, in ordine di dichiarazione
 * • radici: colore → nodo radice, obbligatoria per ogni colore attivo
 * • suggerimenti di colore: nodo → colore fisso, oppure -1 per "qualsiasi"
 * • limiti inferiori di distanza: (nodo, distanza minima dalla radice)
 *
 * L'oggetto e' immutabile e non viene validato alla costruzione: la validazione
 * avviene all'inizio della compilazione, prima dell'emissione di qualsiasi clausola.
 * Gli identificatori di nodo sono convertiti con {@link String#valueOf(Object)}.
 */
public final class ForestProblem {

    /** Suggerimento di colore che lascia il nodo libero. */
    public static final int ANY_COLOR = -1;

    private final List<String> nodes;
    private final List<ForestEdge> edges;
    private final Map<Integer, String> rootOfColor;
    private final Map<String, Integer> nodeColorHint;
    private final List<DistanceBound> distLowerBounds;

    private ForestProblem(Builder builder) {
        this.nodes = List.copyOf(builder.nodes);
        this.edges = List.copyOf(builder.edges);
        this.rootOfColor = Collections.unmodifiableMap(new LinkedHashMap<>(builder.rootOfColor));
        this.nodeColorHint = Collections.unmodifiableMap(new LinkedHashMap<>(builder.nodeColorHint));
        this.distLowerBounds = List.copyOf(builder.distLowerBounds);
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> getNodes() { return nodes; }
    public List<ForestEdge> getEdges() { return edges; }
    public Map<Integer, String> getRootOfColor() { return rootOfColor; }
    public Map<String, Integer> getNodeColorHint() { return nodeColorHint; }
    public List<DistanceBound> getDistLowerBounds() { return distLowerBounds; }

    @Override
    public String toString() {
        return String.format("ForestProblem[nodi=%d, archi=%d, colori=%s, limiti=%d]",
                nodes.size(), edges.size(), rootOfColor.keySet(), distLowerBounds.size());
    }

    /**
     * Costruttore incrementale del problema.
     */
    public static final class Builder {
        private final Set<String> nodes = new LinkedHashSet<>();
        private final List<ForestEdge> edges = new ArrayList<>();
        private final Map<Integer, String> rootOfColor = new LinkedHashMap<>();
        private final Map<String, Integer> nodeColorHint = new LinkedHashMap<>();
        private final List<DistanceBound> distLowerBounds = new ArrayList<>();

        private Builder() {
        }

        public Builder node(Object id) {
            nodes.add(String.valueOf(id));
            return this;
        }

        public Builder nodes(Object... ids) {
            for (Object id : ids) {
                node(id);
            }
            return this;
        }

        public Builder edge(Object u, Object v) {
            edges.add(new ForestEdge(String.valueOf(u), String.valueOf(v)));
            return this;
        }

        /**
         * Dichiara la radice di un colore; una seconda dichiarazione per lo stesso colore sostituisce la prima.
         */
        public Builder root(int color, Object node) {
            rootOfColor.put(color, String.valueOf(node));
            return this;
        }

        public Builder hint(Object node, int color) {
            nodeColorHint.put(String.valueOf(node), color);
            return this;
        }

        public Builder lowerBound(Object node, int minDistance) {
            distLowerBounds.add(new DistanceBound(String.valueOf(node), minDistance));
            return this;
        }

        public ForestProblem build() {
            return new ForestProblem(this);
        }
    }
}
