package org.forestsat.cnf;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * ARITMETICA SU VETTORI DI BIT - Comparatori e incrementatore a larghezza fissa
 *
 * I vettori sono array di ID di variabile in ordine LSB-first: bits[0] e' il bit
 * meno significativo. Tutte le costruzioni sono lineari nella larghezza.
 *
 * COMPARATORI CON COSTANTE (bits ≥ c, bits ≤ K):
 * 1. Catena di uguaglianza dal bit piu' significativo verso il basso:
 *    eqAbove[i] ↔ (bits sopra la posizione i coincidono con quelli della costante)
 *    eqAbove[msb] e' sempre vero (nessun bit sopra il msb)
 * 2. Testimoni del "primo bit diverso":
 *    - minore:   ltTerm[i] ↔ eqAbove[i] ∧ c_i=1 ∧ ¬bits[i]
 *    - maggiore: gtTerm[i] ↔ eqAbove[i] ∧ K_i=0 ∧ bits[i]
 * 3. lt (risp. gt) ↔ OR dei testimoni, poi si impone ¬lt (risp. ¬gt).
 *
 * INCREMENTO (+1): sommatore ripple-carry con riporto iniziale fisso a 1.
 *
 * Ogni chiamata riceve un tag che deve essere univoco: da esso derivano i nomi
 * delle variabili ausiliarie, che altrimenti collidono tra invocazioni diverse.
 */
public class BitVectorArithmetic {

    private static final Logger LOGGER = Logger.getLogger(BitVectorArithmetic.class.getName());

    /** Larghezza massima supportata: il valore massimo deve stare in un int. */
    public static final int MAX_WIDTH = 30;

    private final GateLibrary gates;

    public BitVectorArithmetic(GateLibrary gates) {
        this.gates = gates;
    }

    /**
     * @return valore massimo rappresentabile con la larghezza data (2^w − 1)
     */
    public static int maxValue(int width) {
        if (width < 1 || width > MAX_WIDTH) {
            throw new IllegalArgumentException("Larghezza vettore non supportata: " + width);
        }
        return (1 << width) - 1;
    }

    /**
     * @return numero minimo di bit k tale che 2^k > n
     */
    public static int widthFor(int n) {
        int k = 0;
        while ((1L << k) <= n) {
            k++;
        }
        return Math.max(k, 1);
    }

    //region UGUAGLIANZA

    /**
     * Fissa ogni bit al valore corrispondente della costante con clausole unitarie.
     * Una costante fuori dal range rappresentabile rende l'istanza insoddisfacibile.
     */
    public void equalConst(int[] bits, int value) {
        if (value < 0 || value > maxValue(bits.length)) {
            LOGGER.fine("Costante " + value + " non rappresentabile su " + bits.length + " bit");
            gates.contradiction();
            return;
        }
        for (int i = 0; i < bits.length; i++) {
            gates.unit(bit(value, i) ? bits[i] : -bits[i]);
        }
    }

    //endregion

    //region COMPARATORI

    /**
     * Impone bits ≥ c costruendo lt = (bits < c) e asserendo ¬lt.
     * Con c ≤ 0 il vincolo e' sempre vero; con c oltre il massimo e' sempre falso.
     */
    public void geConst(int[] bits, int c, String tag) {
        int maxVal = maxValue(bits.length);
        if (c <= 0) {
            return;
        }
        if (c > maxVal) {
            gates.contradiction();
            return;
        }

        int[] eqAbove = equalityChain(bits, c, "eqAbove_ge_" + tag);

        List<Integer> ltTerms = new ArrayList<>();
        for (int i = bits.length - 1; i >= 0; i--) {
            if (bit(c, i)) {
                // primo bit diverso in i con c_i=1 e bits_i=0
                int t = gates.variable("ltTerm_" + tag + "_" + i);
                ltTerms.add(t);
                gates.clause(-t, eqAbove[i]);
                gates.clause(-t, -bits[i]);
                gates.clause(-eqAbove[i], bits[i], t);
            }
        }

        int lt = orOfWitnesses("lt_" + tag, ltTerms);
        gates.unit(-lt);
    }

    /**
     * Impone bits ≤ K costruendo gt = (bits > K) e asserendo ¬gt.
     * Con K ≥ massimo il vincolo e' sempre vero; con K negativo e' sempre falso.
     */
    public void leConst(int[] bits, int k, String tag) {
        int maxVal = maxValue(bits.length);
        if (k < 0) {
            gates.contradiction();
            return;
        }
        if (k >= maxVal) {
            return;
        }

        int[] eqAbove = equalityChain(bits, k, "eqAbove_le_" + tag);

        List<Integer> gtTerms = new ArrayList<>();
        for (int i = bits.length - 1; i >= 0; i--) {
            if (!bit(k, i)) {
                // primo bit diverso in i con K_i=0 e bits_i=1
                int t = gates.variable("gtTerm_" + tag + "_" + i);
                gtTerms.add(t);
                gates.clause(-t, eqAbove[i]);
                gates.clause(-t, bits[i]);
                gates.clause(-eqAbove[i], -bits[i], t);
            }
        }

        int gt = orOfWitnesses("gt_" + tag, gtTerms);
        gates.unit(-gt);
    }

    /**
     * Costruisce eqAbove[i] ↔ (bits[msb..i+1] == c[msb..i+1]) per ogni posizione.
     */
    private int[] equalityChain(int[] bits, int c, String prefix) {
        int msb = bits.length - 1;
        int[] eqAbove = new int[bits.length];

        eqAbove[msb] = gates.variable(prefix + "_" + msb);
        gates.unit(eqAbove[msb]);

        for (int i = msb - 1; i >= 0; i--) {
            int eq = gates.variable(prefix + "_" + i);
            int next = eqAbove[i + 1];
            int match = bit(c, i + 1) ? bits[i + 1] : -bits[i + 1];
            eqAbove[i] = eq;

            gates.clause(-eq, next);
            gates.clause(-eq, match);
            gates.clause(-next, -match, eq);
        }
        return eqAbove;
    }

    /**
     * w ↔ OR(terms); con lista vuota w e' forzata a falso.
     */
    private int orOfWitnesses(String name, List<Integer> terms) {
        int w = gates.variable(name);
        if (terms.isEmpty()) {
            gates.unit(-w);
            return w;
        }
        for (int t : terms) {
            gates.implies(t, w);
        }
        List<Integer> back = new ArrayList<>(terms.size() + 1);
        back.add(-w);
        back.addAll(terms);
        gates.clause(back);
        return w;
    }

    //endregion

    //region INCREMENTO

    /**
     * Vincola outBits = inBits + 1 (modulo 2^w) con un ripple-carry:
     * sum[i] = in[i] ⊕ carry[i], carry[i+1] = in[i] ∧ carry[i], out[i] ↔ sum[i].
     *
     * @throws IllegalArgumentException se le larghezze non coincidono
     */
    public void plusOne(int[] outBits, int[] inBits, String tag) {
        if (outBits.length != inBits.length) {
            throw new IllegalArgumentException("Larghezze diverse in plusOne: "
                    + outBits.length + " vs " + inBits.length);
        }

        int carry = gates.variable("carry_" + tag + "_0");
        gates.unit(carry);

        for (int i = 0; i < inBits.length; i++) {
            int sum = gates.xorGate("sum_" + tag + "_" + i, inBits[i], carry);
            gates.equivalent(outBits[i], sum);
            carry = gates.andGate("carry_" + tag + "_" + (i + 1), inBits[i], carry);
        }
    }

    //endregion

    private static boolean bit(int value, int position) {
        return ((value >> position) & 1) == 1;
    }
}
