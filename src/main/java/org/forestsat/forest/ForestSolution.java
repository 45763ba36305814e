package org.forestsat.forest;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * FORESTA DECODIFICATA - Interpretazione di un modello SAT
 *
 * CONTENUTO:
 * • colore di ogni nodo
 * • padre di ogni nodo non radice
 * • distanza di ogni nodo dalla propria radice
 * • archi mantenuti (variabili keep vere)
 */
public final class ForestSolution {

    private final Map<String, Integer> colorOf;
    private final Map<String, String> parentOf;
    private final Map<String, Integer> distanceOf;
    private final List<ForestEdge> keptEdges;
    private final Map<Integer, String> rootOfColor;

    ForestSolution(Map<String, Integer> colorOf, Map<String, String> parentOf, Map<String, Integer> distanceOf,
                   List<ForestEdge> keptEdges, Map<Integer, String> rootOfColor) {
        this.colorOf = Collections.unmodifiableMap(new LinkedHashMap<>(colorOf));
        this.parentOf = Collections.unmodifiableMap(new LinkedHashMap<>(parentOf));
        this.distanceOf = Collections.unmodifiableMap(new LinkedHashMap<>(distanceOf));
        this.keptEdges = List.copyOf(keptEdges);
        this.rootOfColor = Map.copyOf(rootOfColor);
    }

    public List<ForestEdge> getKeptEdges() { return keptEdges; }
    public Map<Integer, String> getRootOfColor() { return rootOfColor; }

    public int colorOf(String node) {
        Integer c = colorOf.get(node);
        if (c == null) {
            throw new IllegalArgumentException("Nodo sconosciuto: " + node);
        }
        return c;
    }

    public int distanceOf(String node) {
        Integer d = distanceOf.get(node);
        if (d == null) {
            throw new IllegalArgumentException("Nodo sconosciuto: " + node);
        }
        return d;
    }

    /**
     * @return padre del nodo, oppure null se il nodo e' una radice
     */
    public String parentOf(String node) {
        return parentOf.get(node);
    }

    public boolean isRoot(String node) {
        Integer c = colorOf.get(node);
        return c != null && node.equals(rootOfColor.get(c));
    }

    /**
     * VERIFICA STRUTTURALE - Controlla che la soluzione sia davvero una foresta
     * ricoprente con radici designate.
     *
     * @throws IllegalStateException alla prima violazione trovata
     */
    public void checkForest() {
        int n = colorOf.size();

        for (Map.Entry<String, Integer> entry : colorOf.entrySet()) {
            String u = entry.getKey();
            int c = entry.getValue();

            if (isRoot(u)) {
                if (parentOf.containsKey(u)) {
                    throw new IllegalStateException("La radice " + u + " ha un padre: " + parentOf.get(u));
                }
                if (distanceOf(u) != 0) {
                    throw new IllegalStateException("La radice " + u + " ha distanza " + distanceOf(u));
                }
                continue;
            }

            String p = parentOf.get(u);
            if (p == null) {
                throw new IllegalStateException("Il nodo " + u + " non è radice ma non ha padre");
            }
            if (colorOf(p) != c) {
                throw new IllegalStateException("Il nodo " + u + " (colore " + c + ") ha padre " + p
                        + " di colore " + colorOf(p));
            }
            if (distanceOf(u) != distanceOf(p) + 1) {
                throw new IllegalStateException("dist(" + u + ")=" + distanceOf(u) + " ma dist(" + p + ")="
                        + distanceOf(p));
            }

            // la catena dei padri deve arrivare alla radice del colore entro N−1 passi
            Set<String> visited = new HashSet<>();
            String cur = u;
            int hops = 0;
            while (!isRoot(cur)) {
                if (!visited.add(cur) || hops > n - 1) {
                    throw new IllegalStateException("La catena dei padri da " + u + " non raggiunge la radice");
                }
                cur = parentOf.get(cur);
                hops++;
            }
            if (!cur.equals(rootOfColor.get(c))) {
                throw new IllegalStateException("La catena da " + u + " termina nella radice sbagliata " + cur);
            }
        }
    }

    /**
     * Rappresentazione testuale con un nodo per riga.
     */
    public String toReport() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, Integer> entry : colorOf.entrySet()) {
            String u = entry.getKey();
            sb.append(u).append(": colore=").append(entry.getValue())
                    .append(", distanza=").append(distanceOf.get(u))
                    .append(", padre=").append(isRoot(u) ? "-" : parentOf.get(u))
                    .append('\n');
        }
        sb.append("Archi mantenuti: ").append(keptEdges.size());
        return sb.toString();
    }

    @Override
    public String toString() {
        return "ForestSolution[colori=" + colorOf + ", padri=" + parentOf + ", distanze=" + distanceOf + "]";
    }
}
