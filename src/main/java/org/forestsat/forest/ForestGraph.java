package org.forestsat.forest;

import org.forestsat.forest.InvalidForestProblemException.Reason;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * Vista validata e normalizzata di un {@link ForestProblem}: colori attivi ordinati,
 * archi senza duplicati, liste di adiacenza in ordine di dichiarazione.
 *
 * Esiste solo se la validazione e' passata; ogni errore viene segnalato con
 * {@link InvalidForestProblemException} prima che la compilazione tocchi le clausole.
 */
final class ForestGraph {

    private static final Logger LOGGER = Logger.getLogger(ForestGraph.class.getName());

    final List<String> nodes;
    final List<Integer> colors;
    final Map<Integer, String> rootOfColor;
    final List<ForestEdge> edges;
    final Map<String, List<String>> adjacency;
    final Map<String, Integer> fixedColor;
    final List<DistanceBound> lowerBounds;

    private ForestGraph(List<String> nodes, List<Integer> colors, Map<Integer, String> rootOfColor,
                        List<ForestEdge> edges, Map<String, List<String>> adjacency,
                        Map<String, Integer> fixedColor, List<DistanceBound> lowerBounds) {
        this.nodes = nodes;
        this.colors = colors;
        this.rootOfColor = rootOfColor;
        this.edges = edges;
        this.adjacency = adjacency;
        this.fixedColor = fixedColor;
        this.lowerBounds = lowerBounds;
    }

    int nodeCount() {
        return nodes.size();
    }

    String rootOf(int color) {
        return rootOfColor.get(color);
    }

    //region VALIDAZIONE

    /**
     * Valida il problema e costruisce la vista normalizzata.
     *
     * @throws InvalidForestProblemException alla prima condizione non valida
     */
    static ForestGraph validate(ForestProblem problem) {
        List<String> nodes = problem.getNodes();
        if (nodes.isEmpty()) {
            throw new InvalidForestProblemException(Reason.EMPTY_NODE_SET, "Nessun nodo");
        }
        Set<String> known = new HashSet<>(nodes);

        Set<Integer> colorSet = new TreeSet<>();
        for (Map.Entry<String, Integer> hint : problem.getNodeColorHint().entrySet()) {
            int c = hint.getValue();
            if (c < ForestProblem.ANY_COLOR) {
                throw new InvalidForestProblemException(Reason.INVALID_COLOR_HINT,
                        "nodeColorHint[" + hint.getKey() + "] deve essere -1 o un colore non negativo, trovato " + c);
            }
            if (!known.contains(hint.getKey())) {
                LOGGER.warning("Suggerimento di colore per nodo sconosciuto ignorato: " + hint.getKey());
                continue;
            }
            if (c >= 0) {
                colorSet.add(c);
            }
        }
        for (int c : problem.getRootOfColor().keySet()) {
            if (c < 0) {
                throw new InvalidForestProblemException(Reason.NEGATIVE_COLOR,
                        "Colore negativo in rootOfColor: " + c);
            }
            colorSet.add(c);
        }
        if (colorSet.isEmpty()) {
            throw new InvalidForestProblemException(Reason.NO_ACTIVE_COLORS,
                    "Nessun colore non negativo fornito (serve almeno un colore attivo)");
        }

        Map<Integer, String> roots = new LinkedHashMap<>();
        for (int c : colorSet) {
            String r = problem.getRootOfColor().get(c);
            if (r == null) {
                throw new InvalidForestProblemException(Reason.MISSING_ROOT,
                        "Radice mancante in rootOfColor per il colore " + c);
            }
            if (!known.contains(r)) {
                throw new InvalidForestProblemException(Reason.UNKNOWN_ROOT,
                        "La radice " + r + " del colore " + c + " non è tra i nodi");
            }
            roots.put(c, r);
        }

        Map<String, Set<String>> neighbours = new LinkedHashMap<>();
        for (String n : nodes) {
            neighbours.put(n, new LinkedHashSet<>());
        }
        List<ForestEdge> edges = new ArrayList<>();
        Set<ForestEdge> seen = new HashSet<>();
        for (ForestEdge e : problem.getEdges()) {
            if (!known.contains(e.u()) || !known.contains(e.v())) {
                throw new InvalidForestProblemException(Reason.UNKNOWN_EDGE_NODE,
                        "Arco con nodo sconosciuto: " + e);
            }
            if (e.isSelfLoop()) {
                throw new InvalidForestProblemException(Reason.SELF_LOOP,
                        "Cappio non ammesso sul nodo " + e.u());
            }
            if (!seen.add(e.canonical())) {
                LOGGER.warning("Arco duplicato fuso: " + e);
                continue;
            }
            edges.add(e);
            neighbours.get(e.u()).add(e.v());
            neighbours.get(e.v()).add(e.u());
        }

        Map<String, Integer> fixed = new LinkedHashMap<>();
        for (String n : nodes) {
            Integer c = problem.getNodeColorHint().get(n);
            if (c != null && c != ForestProblem.ANY_COLOR) {
                fixed.put(n, c);
            }
        }

        for (DistanceBound bound : problem.getDistLowerBounds()) {
            if (!known.contains(bound.node())) {
                throw new InvalidForestProblemException(Reason.UNKNOWN_BOUND_NODE,
                        "distLowerBounds fa riferimento al nodo sconosciuto " + bound.node());
            }
            if (bound.minDistance() < 0) {
                throw new InvalidForestProblemException(Reason.NEGATIVE_BOUND,
                        "La distanza minima deve essere non negativa per il nodo " + bound.node());
            }
        }

        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        neighbours.forEach((n, set) -> adjacency.put(n, List.copyOf(set)));

        return new ForestGraph(List.copyOf(nodes), List.copyOf(colorSet), Collections.unmodifiableMap(roots),
                List.copyOf(edges), Collections.unmodifiableMap(adjacency), Collections.unmodifiableMap(fixed),
                problem.getDistLowerBounds());
    }

    //endregion
}
