package org.forestsat.forest;

import org.forestsat.cnf.SolverModel;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * DECODIFICATORE - Da modello del solutore a foresta
 *
 * Legge i valori delle variabili tramite i nomi simbolici dell'istanza compilata:
 * col(u)=c per i colori, par(u)->(v) per i padri, keep(..) per gli archi e le
 * variabili di distanza secondo la codifica registrata nei metadati.
 */
public final class ForestDecoder {

    private static final Logger LOGGER = Logger.getLogger(ForestDecoder.class.getName());

    private ForestDecoder() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    /**
     * @throws IllegalArgumentException se il modello e' UNSAT
     * @throws IllegalStateException se il modello non assegna esattamente un colore
     *                               o al piu' un padre a qualche nodo
     */
    public static ForestSolution decode(ColoredForestCnf cnf, SolverModel model) {
        if (!model.isSatisfiable()) {
            throw new IllegalArgumentException("Impossibile decodificare un risultato UNSAT");
        }
        EncodingMeta meta = cnf.meta();

        Map<String, Integer> colorOf = new LinkedHashMap<>();
        for (String u : meta.nodes()) {
            Integer chosen = null;
            for (int c : meta.colors()) {
                if (model.isTrue(cnf.variable(VariableNames.color(u, c)))) {
                    if (chosen != null) {
                        throw new IllegalStateException("Il nodo " + u + " ha più colori: " + chosen + ", " + c);
                    }
                    chosen = c;
                }
            }
            if (chosen == null) {
                throw new IllegalStateException("Il nodo " + u + " non ha colore");
            }
            colorOf.put(u, chosen);
        }

        Map<String, String> parentOf = new LinkedHashMap<>();
        List<ForestEdge> kept = new ArrayList<>();
        for (ForestEdge e : meta.edges()) {
            if (model.isTrue(cnf.variable(VariableNames.keep(e.u(), e.v())))) {
                kept.add(e);
            }
            assignParent(parentOf, e.u(), e.v(), model.isTrue(cnf.variable(VariableNames.parent(e.u(), e.v()))));
            assignParent(parentOf, e.v(), e.u(), model.isTrue(cnf.variable(VariableNames.parent(e.v(), e.u()))));
        }

        Map<String, Integer> distanceOf = new LinkedHashMap<>();
        for (String u : meta.nodes()) {
            distanceOf.put(u, meta.encoding().decode(cnf.distanceVariables(u), model::isTrue));
        }

        LOGGER.fine("Modello decodificato: " + kept.size() + " archi mantenuti su " + meta.edges().size());
        return new ForestSolution(colorOf, parentOf, distanceOf, kept, meta.rootOfColor());
    }

    private static void assignParent(Map<String, String> parentOf, String child, String parent, boolean isSet) {
        if (!isSet) {
            return;
        }
        String previous = parentOf.putIfAbsent(child, parent);
        if (previous != null) {
            throw new IllegalStateException("Il nodo " + child + " ha più padri: " + previous + ", " + parent);
        }
    }
}
