package org.forestsat.forest;

/**
 * Descrizione del problema rifiutata dal compilatore prima di emettere clausole.
 *
 * Da non confondere con un'istanza insoddisfacibile per costruzione, che e' un
 * risultato normale della compilazione (clausola vuota nell'output).
 */
public class InvalidForestProblemException extends IllegalArgumentException {

    /**
     * Condizione di errore rilevata durante la validazione.
     */
    public enum Reason {
        EMPTY_NODE_SET,
        NO_ACTIVE_COLORS,
        NEGATIVE_COLOR,
        MISSING_ROOT,
        UNKNOWN_ROOT,
        UNKNOWN_EDGE_NODE,
        SELF_LOOP,
        INVALID_COLOR_HINT,
        UNKNOWN_BOUND_NODE,
        NEGATIVE_BOUND
    }

    private final Reason reason;

    public InvalidForestProblemException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
