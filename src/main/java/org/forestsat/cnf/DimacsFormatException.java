package org.forestsat.cnf;

/**
 * Testo DIMACS o modello del solutore malformato.
 */
public class DimacsFormatException extends IllegalArgumentException {

    private final int lineNumber;

    public DimacsFormatException(String message, int lineNumber) {
        super("Riga " + lineNumber + ": " + message);
        this.lineNumber = lineNumber;
    }

    /**
     * @return riga (1-based) in cui e' stato rilevato l'errore
     */
    public int getLineNumber() {
        return lineNumber;
    }
}
