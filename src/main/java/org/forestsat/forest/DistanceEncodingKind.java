package org.forestsat.forest;

import org.forestsat.cnf.GateLibrary;

import java.util.List;
import java.util.Locale;
import java.util.function.IntPredicate;

/**
 * Strategie disponibili per codificare le distanze.
 *
 * UNARY (predefinita): catena monotona di soglie "dist ≥ d", vincoli tra padre e
 * figlio espressi come implicazioni corte.
 * BINARY: vettore di ceil(log2(N+1)) bit con comparatori e incrementatore.
 */
public enum DistanceEncodingKind {

    UNARY {
        @Override
        DistanceEncoding newEncoding(GateLibrary gates, int nodeCount) {
            return new UnaryDistanceEncoding(gates, nodeCount);
        }

        @Override
        public int decode(List<Integer> variables, IntPredicate isTrue) {
            int distance = 0;
            for (int v : variables) {
                if (!isTrue.test(v)) {
                    break;
                }
                distance++;
            }
            return distance;
        }
    },

    BINARY {
        @Override
        DistanceEncoding newEncoding(GateLibrary gates, int nodeCount) {
            return new BinaryDistanceEncoding(gates, nodeCount);
        }

        @Override
        public int decode(List<Integer> variables, IntPredicate isTrue) {
            int distance = 0;
            for (int i = 0; i < variables.size(); i++) {
                if (isTrue.test(variables.get(i))) {
                    distance |= 1 << i;
                }
            }
            return distance;
        }
    };

    abstract DistanceEncoding newEncoding(GateLibrary gates, int nodeCount);

    /**
     * Ricostruisce il valore di una distanza dalle sue variabili.
     *
     * @param variables variabili del nodo (soglie d=1..N per UNARY, bit LSB-first per BINARY)
     * @param isTrue valore di verità di ciascuna variabile nel modello
     */
    public abstract int decode(List<Integer> variables, IntPredicate isTrue);

    /**
     * Interpreta il nome usato sulla riga di comando ("unary", "binary").
     *
     * @throws IllegalArgumentException per nomi sconosciuti
     */
    public static DistanceEncodingKind fromFlag(String flag) {
        try {
            return valueOf(flag.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Codifica distanze non supportata: " + flag
                    + ". Supportate: unary, binary", e);
        }
    }
}
