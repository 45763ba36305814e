package org.forestsat.forest;

import org.forestsat.cnf.DimacsSerializer;
import org.forestsat.cnf.GateLibrary;
import org.forestsat.support.ClauseSet;
import org.forestsat.support.SymbolTable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * COMPILATORE FORESTA COLORATA - Da problema su grafo a istanza CNF
 *
 * Traduce "partiziona i nodi in classi di colore, ognuna un albero ricoprente
 * radicato nel nodo designato, con distanze minime richieste" in clausole CNF.
 *
 * PIPELINE DI COMPILAZIONE:
 * 1. Validazione completa dell'ingresso (nessuna clausola prima dell'esito)
 * 2. Variabili di distanza per ogni nodo
 * 3. Esattamente un colore per nodo, piu' i colori fissati dai suggerimenti
 * 4. Radici: colore forzato e distanza 0
 * 5. Tetto globale dist ≤ N−1 (esclude artefatti di overflow/ciclo)
 * 6. Per ogni arco: keep ↔ (par(u→v) ∨ par(v→u)), archi antiparalleli vietati,
 *    estremi dello stesso colore
 * 7. Per ogni arco orientato: coerenza di colore e dist(figlio) = dist(padre) + 1
 * 8. Per ogni nodo non radice e colore: esattamente un padre, distanza ≥ 1
 * 9. Limiti inferiori di distanza
 * 10. Serializzazione DIMACS
 *
 * Il compilatore non ha stato tra chiamate: ogni compilazione costruisce tabella
 * dei simboli ed emettitore propri, quindi compilazioni distinte possono girare
 * in parallelo senza coordinamento.
 */
public class ColoredForestCompiler {

    private static final Logger LOGGER = Logger.getLogger(ColoredForestCompiler.class.getName());

    private final CompilerOptions options;

    public ColoredForestCompiler() {
        this(CompilerOptions.defaults());
    }

    public ColoredForestCompiler(CompilerOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("Opzioni del compilatore non possono essere null");
        }
        this.options = options;
    }

    /**
     * METODO PRINCIPALE - Compila il problema in un'istanza CNF indipendente.
     *
     * @param problem descrizione del problema
     * @return istanza compilata, eventualmente con clausola vuota se UNSAT per costruzione
     * @throws InvalidForestProblemException se la descrizione e' malformata
     */
    public ColoredForestCnf compile(ForestProblem problem) {
        if (problem == null) {
            throw new IllegalArgumentException("Problema non può essere null");
        }

        ForestGraph graph = ForestGraph.validate(problem);
        LOGGER.info("=== AVVIO COMPILAZIONE FORESTA COLORATA === nodi=" + graph.nodeCount()
                + ", archi=" + graph.edges.size() + ", colori=" + graph.colors
                + ", codifica=" + options.encoding());

        Compilation compilation = new Compilation(graph, options.encoding());
        ColoredForestCnf result = compilation.run();

        LOGGER.info("Compilazione completata: " + result.numVars() + " variabili, "
                + result.clauses().size() + " clausole"
                + (result.hasEmptyClause() ? " (UNSAT per costruzione)" : ""));
        return result;
    }

    /**
     * Stato di una singola compilazione.
     */
    private static final class Compilation {

        private final ForestGraph graph;
        private final DistanceEncodingKind kind;
        private final SymbolTable symbols = new SymbolTable();
        private final ClauseSet clauses = new ClauseSet();
        private final GateLibrary gates = new GateLibrary(symbols, clauses);
        private final DistanceEncoding distances;

        Compilation(ForestGraph graph, DistanceEncodingKind kind) {
            this.graph = graph;
            this.kind = kind;
            this.distances = kind.newEncoding(gates, graph.nodeCount());
        }

        ColoredForestCnf run() {
            for (String u : graph.nodes) {
                distances.declare(u);
            }

            emitColorAssignment();
            emitRoots();
            emitDistanceCap();
            emitEdgeLinkage();
            emitParentPropagation();
            emitParentChoice();
            emitLowerBounds();

            return buildResult();
        }

        //region VARIABILI

        private int col(String u, int c) {
            return gates.variable(VariableNames.color(u, c));
        }

        private int par(String u, String v) {
            return gates.variable(VariableNames.parent(u, v));
        }

        private int keep(String u, String v) {
            return gates.variable(VariableNames.keep(u, v));
        }

        //endregion

        //region VINCOLI

        /**
         * Ogni nodo ha esattamente un colore attivo; i suggerimenti lo fissano.
         */
        private void emitColorAssignment() {
            for (String u : graph.nodes) {
                List<Integer> colorLits = new ArrayList<>(graph.colors.size());
                for (int c : graph.colors) {
                    colorLits.add(col(u, c));
                }
                gates.exactlyOne(colorLits);

                Integer hinted = graph.fixedColor.get(u);
                if (hinted != null) {
                    gates.unit(col(u, hinted));
                }
            }
            LOGGER.fine("Vincoli di colore emessi: " + clauses.size() + " clausole");
        }

        private void emitRoots() {
            for (int c : graph.colors) {
                String r = graph.rootOf(c);
                gates.unit(col(r, c));
                distances.fixValue(r, 0);
            }
        }

        /**
         * dist(u) ≤ N−1 per ogni nodo.
         */
        private void emitDistanceCap() {
            int cap = graph.nodeCount() - 1;
            for (String u : graph.nodes) {
                distances.capAtMost(u, cap);
            }
        }

        private void emitEdgeLinkage() {
            for (ForestEdge e : graph.edges) {
                String u = e.u();
                String v = e.v();
                int k = keep(u, v);
                int puv = par(u, v);
                int pvu = par(v, u);

                // due archi padre opposti formerebbero un 2-ciclo
                gates.clause(-puv, -pvu);

                gates.implies(puv, k);
                gates.implies(pvu, k);
                gates.clause(-k, puv, pvu);

                for (int c : graph.colors) {
                    int cu = col(u, c);
                    int cv = col(v, c);
                    gates.clause(-k, -cu, cv);
                    gates.clause(-k, -cv, cu);
                }
            }
            LOGGER.fine("Vincoli keep/padre emessi per " + graph.edges.size() + " archi");
        }

        private void emitParentPropagation() {
            for (String u : graph.nodes) {
                for (String v : graph.adjacency.get(u)) {
                    int p = par(u, v);
                    for (int c : graph.colors) {
                        int cu = col(u, c);
                        int cv = col(v, c);
                        gates.clause(-p, -cu, cv);
                        gates.clause(-p, -cv, cu);
                    }
                    distances.linkParent(p, u, v);
                }
            }
        }

        /**
         * Le radici non hanno padre; ogni altro nodo del colore ne sceglie esattamente uno.
         */
        private void emitParentChoice() {
            for (String u : graph.nodes) {
                List<String> neighbours = graph.adjacency.get(u);

                for (int c : graph.colors) {
                    String root = graph.rootOf(c);
                    int cu = col(u, c);

                    if (u.equals(root)) {
                        for (String v : neighbours) {
                            gates.unit(-par(u, v));
                        }
                        continue;
                    }

                    if (neighbours.isEmpty()) {
                        // nodo isolato: non puo' appartenere a un albero che non radica
                        gates.unit(-cu);
                        continue;
                    }

                    List<Integer> parentLits = new ArrayList<>(neighbours.size());
                    for (String v : neighbours) {
                        parentLits.add(par(u, v));
                    }
                    gates.atLeastOneWhen(cu, parentLits);
                    gates.atMostOneWhen(cu, parentLits);
                    distances.requirePositiveWhen(cu, u);
                }
            }
        }

        private void emitLowerBounds() {
            for (DistanceBound bound : graph.lowerBounds) {
                if (bound.minDistance() > distances.maxRepresentable()) {
                    LOGGER.info("Limite dist(" + bound.node() + ") ≥ " + bound.minDistance()
                            + " oltre il massimo rappresentabile " + distances.maxRepresentable());
                }
                distances.requireAtLeast(bound.node(), bound.minDistance());
            }
        }

        //endregion

        private ColoredForestCnf buildResult() {
            Map<String, List<Integer>> distanceVars = new LinkedHashMap<>();
            for (String u : graph.nodes) {
                distanceVars.put(u, distances.variablesOf(u));
            }

            EncodingMeta meta = new EncodingMeta(graph.colors, distances.width(), distances.maxRepresentable(),
                    graph.nodes, graph.edges, graph.rootOfColor, kind);

            String dimacs = DimacsSerializer.toDimacs(symbols.size(), clauses.clauses());

            return new ColoredForestCnf(symbols.size(), clauses.clauses(), symbols.varOf(), symbols.nameOf(),
                    distanceVars, dimacs, meta, clauses.hasEmptyClause());
        }
    }
}
