package org.forestsat.forest;

import java.util.List;
import java.util.Map;

/**
 * Metadati della codifica, necessari per interpretare il modello del solutore.
 *
 * @param colors colori attivi in ordine crescente
 * @param kBits larghezza del vettore distanza binario (0 per la codifica unaria)
 * @param maxDistance distanza massima rappresentabile dalla codifica scelta
 * @param nodes nodi in ordine di dichiarazione
 * @param edges archi senza duplicati, in ordine di dichiarazione
 * @param rootOfColor colore → radice
 * @param encoding codifica delle distanze usata
 */
public record EncodingMeta(List<Integer> colors, int kBits, int maxDistance, List<String> nodes,
                           List<ForestEdge> edges, Map<Integer, String> rootOfColor,
                           DistanceEncodingKind encoding) {

    public EncodingMeta {
        colors = List.copyOf(colors);
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
        rootOfColor = Map.copyOf(rootOfColor);
    }
}
