package org.forestsat.cnf;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * LETTORE DIMACS - Parsing di istanze CNF e modelli prodotti dai solutori
 *
 * FORMATO ISTANZA:
 * - righe "c ..." di commento, ignorate
 * - header "p cnf <variabili> <clausole>" prima di qualsiasi clausola
 * - clausole come sequenze di letterali terminate da 0, anche su piu' righe
 * - riga "%" (terminatore SATLIB): fine del contenuto utile
 *
 * FORMATO MODELLO (due dialetti accettati):
 * - competizione SAT: "s SATISFIABLE" / "s UNSATISFIABLE" e righe "v l1 l2 ... 0"
 * - MiniSat: "SAT" / "UNSAT" seguito dalla lista di letterali terminata da 0
 */
public final class DimacsReader {

    private static final Logger LOGGER = Logger.getLogger(DimacsReader.class.getName());

    /** Carattere commento nel formato DIMACS */
    private static final String COMMENT_PREFIX = "c";

    /** Prefisso header problema nel formato DIMACS */
    private static final String PROBLEM_PREFIX = "p";

    /** Terminatore SATLIB */
    private static final String END_MARKER = "%";

    private DimacsReader() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //region ISTANZE CNF

    /**
     * Legge un'istanza CNF in formato DIMACS.
     *
     * @param text contenuto del file
     * @return istanza con clausole nell'ordine del testo
     * @throws DimacsFormatException se header, letterali o conteggi non sono coerenti
     */
    public static DimacsInstance parse(String text) {
        String[] lines = text.split("\\R", -1);

        int declaredVars = -1;
        int declaredClauses = -1;
        List<List<Integer>> clauses = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        int lastLine = 0;

        for (int index = 0; index < lines.length; index++) {
            int lineNumber = index + 1;
            String line = lines[index].trim();
            lastLine = lineNumber;

            if (line.isEmpty() || isComment(line)) {
                continue;
            }
            if (line.startsWith(END_MARKER)) {
                break;
            }
            if (line.startsWith(PROBLEM_PREFIX)) {
                if (declaredVars >= 0) {
                    throw new DimacsFormatException("header duplicato", lineNumber);
                }
                int[] header = parseHeader(line, lineNumber);
                declaredVars = header[0];
                declaredClauses = header[1];
                continue;
            }
            if (declaredVars < 0) {
                throw new DimacsFormatException("clausola prima dell'header 'p cnf'", lineNumber);
            }

            for (String token : line.split("\\s+")) {
                int literal = parseInt(token, lineNumber);
                if (literal == DimacsSerializer.CLAUSE_TERMINATOR) {
                    clauses.add(current);
                    current = new ArrayList<>();
                    if (clauses.size() > declaredClauses) {
                        throw new DimacsFormatException("più clausole delle " + declaredClauses + " dichiarate",
                                lineNumber);
                    }
                } else {
                    if (literal < -declaredVars || literal > declaredVars) {
                        throw new DimacsFormatException("letterale " + literal + " oltre le "
                                + declaredVars + " variabili dichiarate", lineNumber);
                    }
                    current.add(literal);
                }
            }
        }

        if (declaredVars < 0) {
            throw new DimacsFormatException("header 'p cnf' mancante", lastLine);
        }
        if (!current.isEmpty()) {
            throw new DimacsFormatException("clausola finale senza terminatore 0", lastLine);
        }
        if (clauses.size() != declaredClauses) {
            throw new DimacsFormatException("dichiarate " + declaredClauses + " clausole, trovate "
                    + clauses.size(), lastLine);
        }

        LOGGER.fine("Istanza DIMACS letta: " + declaredVars + " variabili, " + clauses.size() + " clausole");
        return new DimacsInstance(declaredVars, clauses);
    }

    private static int[] parseHeader(String line, int lineNumber) {
        String[] tokens = line.split("\\s+");
        if (tokens.length != 4 || !"cnf".equals(tokens[1])) {
            throw new DimacsFormatException("header non valido: '" + line + "'", lineNumber);
        }
        int vars = parseInt(tokens[2], lineNumber);
        int clauseCount = parseInt(tokens[3], lineNumber);
        if (vars < 0 || clauseCount < 0) {
            throw new DimacsFormatException("valori negativi nell'header", lineNumber);
        }
        return new int[]{vars, clauseCount};
    }

    //endregion

    //region MODELLI DEL SOLUTORE

    /**
     * Legge l'output di un solutore: stato SAT/UNSAT e letterali del modello.
     * Un testo con soli letterali (senza riga di stato) e' considerato SAT.
     *
     * @throws DimacsFormatException se il testo e' vuoto, contraddittorio o non numerico
     */
    public static SolverModel parseModel(String text) {
        String[] lines = text.split("\\R", -1);

        Boolean status = null;
        List<Integer> literals = new ArrayList<>();
        boolean terminated = false;
        int lastLine = 0;

        for (int index = 0; index < lines.length; index++) {
            int lineNumber = index + 1;
            String line = lines[index].trim();
            lastLine = lineNumber;

            if (line.isEmpty() || isComment(line)) {
                continue;
            }

            switch (line) {
                case "s SATISFIABLE", "SAT", "SATISFIABLE" -> {
                    status = Boolean.TRUE;
                    continue;
                }
                case "s UNSATISFIABLE", "UNSAT", "UNSATISFIABLE" -> {
                    status = Boolean.FALSE;
                    continue;
                }
                default -> {
                    // letterali
                }
            }

            String payload = line.startsWith("v ") || line.equals("v") ? line.substring(1).trim() : line;
            if (payload.isEmpty()) {
                continue;
            }
            for (String token : payload.split("\\s+")) {
                int literal = parseInt(token, lineNumber);
                if (literal == 0) {
                    terminated = true;
                } else if (terminated) {
                    throw new DimacsFormatException("letterale dopo il terminatore 0 del modello", lineNumber);
                } else {
                    literals.add(literal);
                }
            }
        }

        if (Boolean.FALSE.equals(status)) {
            if (!literals.isEmpty()) {
                throw new DimacsFormatException("modello UNSAT con letterali assegnati", lastLine);
            }
            return SolverModel.unsatisfiable();
        }
        if (status == null && literals.isEmpty()) {
            throw new DimacsFormatException("nessuno stato e nessun letterale nel modello", lastLine);
        }
        return SolverModel.satisfiable(literals);
    }

    //endregion

    private static boolean isComment(String line) {
        return line.equals(COMMENT_PREFIX) || line.startsWith(COMMENT_PREFIX + " ");
    }

    private static int parseInt(String token, int lineNumber) {
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new DimacsFormatException("token non numerico '" + token + "'", lineNumber);
        }
    }
}
