package org.forestsat.forest;

import java.util.regex.Pattern;

/**
 * Convenzione di nomi per le variabili del problema della foresta colorata.
 *
 * I nomi sono parte del contratto di decodifica: chi legge il modello del solutore
 * ritrova le variabili tramite questi stessi nomi nella tabella dei simboli.
 *
 * Gli identificatori dei nodi entrano nei nomi tramite {@link #nodeId(String)}:
 * quelli fatti solo di lettere, cifre e '_' restano invariati, gli altri vengono
 * racchiusi tra virgolette con '\' e '"' preceduti da '\'. Due nodi distinti non
 * producono mai lo stesso nome.
 */
public final class VariableNames {

    private VariableNames() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    private static final Pattern PLAIN_ID = Pattern.compile("[A-Za-z0-9_]+");

    /**
     * Forma dell'identificatore di nodo usata dentro i nomi delle variabili.
     */
    public static String nodeId(String node) {
        if (PLAIN_ID.matcher(node).matches()) {
            return node;
        }
        StringBuilder sb = new StringBuilder(node.length() + 2).append('"');
        for (int i = 0; i < node.length(); i++) {
            char ch = node.charAt(i);
            if (ch == '"' || ch == '\\') {
                sb.append('\\');
            }
            sb.append(ch);
        }
        return sb.append('"').toString();
    }

    /** "il nodo u ha colore c" */
    public static String color(String u, int c) {
        return "col(" + nodeId(u) + ")=" + c;
    }

    /** "v e' il padre di u" (arco orientato figlio → padre) */
    public static String parent(String u, String v) {
        return "par(" + nodeId(u) + ")->(" + nodeId(v) + ")";
    }

    /** "l'arco non orientato {u,v} fa parte della foresta" */
    public static String keep(String u, String v) {
        ForestEdge canonical = new ForestEdge(u, v).canonical();
        return "keep(" + nodeId(canonical.u()) + "--" + nodeId(canonical.v()) + ")";
    }

    /** bit i (LSB = 0) della distanza binaria di u */
    public static String distanceBit(String u, int i) {
        return "dist(" + nodeId(u) + ")_b" + i;
    }

    /** soglia unaria "dist(u) ≥ d" */
    public static String distanceAtLeast(String u, int d) {
        return "dist(" + nodeId(u) + ")>=" + d;
    }

    /** bit i di dist(parent) + 1 calcolato per il figlio child */
    public static String incrementBit(String parent, String child, int i) {
        return "distPlus1(" + nodeId(parent) + ")->(" + nodeId(child) + ")_b" + i;
    }

    //region TAG DEI CIRCUITI ARITMETICI

    /** incrementatore dedicato alla coppia padre → figlio */
    public static String incrementerTag(String parent, String child) {
        return "plus1(" + nodeId(parent) + ")->(" + nodeId(child) + ")";
    }

    /** comparatore del tetto dist(u) ≤ k */
    public static String capTag(String u, int k) {
        return "cap(" + nodeId(u) + ")<=" + k;
    }

    /** comparatore del limite inferiore dist(u) ≥ d */
    public static String lowerBoundTag(String u, int d) {
        return "min(" + nodeId(u) + ")>=" + d;
    }

    //endregion
}
