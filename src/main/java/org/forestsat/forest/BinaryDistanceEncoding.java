package org.forestsat.forest;

import org.forestsat.cnf.BitVectorArithmetic;
import org.forestsat.cnf.GateLibrary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * CODIFICA BINARIA - Distanze come vettori di kBits bit
 *
 * kBits e' il minimo k con 2^k > N, quindi N−1+1 non va mai in overflow
 * finche' vale il tetto globale dist ≤ N−1.
 *
 * RELAZIONE PADRE-FIGLIO (p = "v e' il padre di u"):
 * un incrementatore dedicato calcola distPlus1 = dist(v) + 1 e
 * p → (dist(u)[i] ↔ distPlus1[i]) per ogni bit.
 */
final class BinaryDistanceEncoding implements DistanceEncoding {

    private final GateLibrary gates;
    private final BitVectorArithmetic arithmetic;
    private final int kBits;

    private final Map<String, int[]> bits = new HashMap<>();

    BinaryDistanceEncoding(GateLibrary gates, int nodeCount) {
        this.gates = gates;
        this.arithmetic = new BitVectorArithmetic(gates);
        this.kBits = BitVectorArithmetic.widthFor(nodeCount);
    }

    private int[] bitsOf(String node) {
        int[] vector = bits.get(node);
        if (vector == null) {
            throw new IllegalStateException("Distanza non dichiarata per il nodo " + node);
        }
        return vector;
    }

    @Override
    public void declare(String node) {
        int[] vector = new int[kBits];
        for (int i = 0; i < kBits; i++) {
            vector[i] = gates.variable(VariableNames.distanceBit(node, i));
        }
        bits.put(node, vector);
    }

    @Override
    public void fixValue(String node, int value) {
        arithmetic.equalConst(bitsOf(node), value);
    }

    @Override
    public void capAtMost(String node, int k) {
        arithmetic.leConst(bitsOf(node), k, VariableNames.capTag(node, k));
    }

    @Override
    public void requireAtLeast(String node, int d) {
        if (d > maxRepresentable()) {
            gates.contradiction();
            return;
        }
        arithmetic.geConst(bitsOf(node), d, VariableNames.lowerBoundTag(node, d));
    }

    @Override
    public void requirePositiveWhen(int guard, String node) {
        // almeno un bit acceso: dist ≠ 0
        int[] vector = bitsOf(node);
        List<Integer> clause = new ArrayList<>(vector.length + 1);
        clause.add(-guard);
        for (int b : vector) {
            clause.add(b);
        }
        gates.clause(clause);
    }

    @Override
    public void linkParent(int parentLiteral, String child, String parent) {
        int[] dv = bitsOf(parent);
        int[] du = bitsOf(child);

        int[] plus = new int[kBits];
        for (int i = 0; i < kBits; i++) {
            plus[i] = gates.variable(VariableNames.incrementBit(parent, child, i));
        }
        arithmetic.plusOne(plus, dv, VariableNames.incrementerTag(parent, child));

        for (int i = 0; i < kBits; i++) {
            gates.clause(-parentLiteral, du[i], -plus[i]);
            gates.clause(-parentLiteral, -du[i], plus[i]);
        }
    }

    @Override
    public List<Integer> variablesOf(String node) {
        List<Integer> vars = new ArrayList<>(kBits);
        for (int b : bitsOf(node)) {
            vars.add(b);
        }
        return vars;
    }

    @Override
    public int maxRepresentable() {
        return BitVectorArithmetic.maxValue(kBits);
    }

    @Override
    public int width() {
        return kBits;
    }
}
