package org.forestsat.problem;

/**
 * Errore sintattico nel file di descrizione del problema.
 */
public class ProblemSyntaxException extends IllegalArgumentException {

    private final int line;
    private final int column;

    public ProblemSyntaxException(int line, int column, String message) {
        super("Riga " + line + ":" + column + " - " + message);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
