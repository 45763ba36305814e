package org.forestsat.forest;

import org.forestsat.cnf.GateLibrary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CODIFICA UNARIA - Distanze come catena monotona di soglie
 *
 * Per ogni nodo u e ogni d = 1..N esiste la variabile ge(u,d) ↔ "dist(u) ≥ d",
 * vincolata dalla catena ge(u,d) → ge(u,d−1). La distanza vale il numero di soglie vere.
 *
 * RELAZIONE PADRE-FIGLIO (p = "v e' il padre di u"):
 * • p → ge(u,1)
 * • p ∧ ge(v,d) → ge(u,d+1)      per d = 1..N−1
 * • p ∧ ge(u,d+1) → ge(v,d)      per d = 1..N−1
 * • p → ¬ge(v,N)
 * Insieme: dist(u) ≥ d+1 ⟺ dist(v) ≥ d, cioe' dist(u) = dist(v) + 1, senza sommatori.
 *
 * La soglia ge(u,N) esiste solo per il tetto globale, che la forza a falso:
 * la distanza massima rappresentabile e' quindi N−1.
 */
final class UnaryDistanceEncoding implements DistanceEncoding {

    private final GateLibrary gates;
    private final int levels;

    /** nodo → soglie, indice d−1 per la soglia d */
    private final Map<String, int[]> thresholds = new HashMap<>();

    UnaryDistanceEncoding(GateLibrary gates, int nodeCount) {
        this.gates = gates;
        this.levels = nodeCount;
    }

    private int ge(String node, int d) {
        int[] chain = thresholds.get(node);
        if (chain == null) {
            throw new IllegalStateException("Distanza non dichiarata per il nodo " + node);
        }
        return chain[d - 1];
    }

    @Override
    public void declare(String node) {
        int[] chain = new int[levels];
        for (int d = 1; d <= levels; d++) {
            chain[d - 1] = gates.variable(VariableNames.distanceAtLeast(node, d));
        }
        thresholds.put(node, chain);

        for (int d = 2; d <= levels; d++) {
            gates.implies(chain[d - 1], chain[d - 2]);
        }
    }

    @Override
    public void fixValue(String node, int value) {
        if (value < 0 || value > levels) {
            gates.contradiction();
            return;
        }
        for (int d = 1; d <= levels; d++) {
            int threshold = ge(node, d);
            gates.unit(d <= value ? threshold : -threshold);
        }
    }

    @Override
    public void capAtMost(String node, int k) {
        if (k < 0) {
            gates.contradiction();
            return;
        }
        if (k < levels) {
            gates.unit(-ge(node, k + 1));
        }
    }

    @Override
    public void requireAtLeast(String node, int d) {
        if (d <= 0) {
            return;
        }
        if (d > maxRepresentable()) {
            gates.contradiction();
            return;
        }
        gates.unit(ge(node, d));
    }

    @Override
    public void requirePositiveWhen(int guard, String node) {
        gates.implies(guard, ge(node, 1));
    }

    @Override
    public void linkParent(int parentLiteral, String child, String parent) {
        gates.implies(parentLiteral, ge(child, 1));
        for (int d = 1; d < levels; d++) {
            gates.clause(-parentLiteral, -ge(parent, d), ge(child, d + 1));
            gates.clause(-parentLiteral, -ge(child, d + 1), ge(parent, d));
        }
        gates.clause(-parentLiteral, -ge(parent, levels));
    }

    @Override
    public List<Integer> variablesOf(String node) {
        List<Integer> vars = new ArrayList<>(levels);
        for (int d = 1; d <= levels; d++) {
            vars.add(ge(node, d));
        }
        return vars;
    }

    @Override
    public int maxRepresentable() {
        return levels - 1;
    }

    @Override
    public int width() {
        return 0;
    }
}
