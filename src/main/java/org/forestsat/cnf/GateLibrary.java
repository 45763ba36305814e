package org.forestsat.cnf;

import org.forestsat.support.ClauseSet;
import org.forestsat.support.SymbolTable;

import java.util.ArrayList;
import java.util.List;

/**
 * LIBRERIA DI PORTE BOOLEANE - Codifiche di Tseitin sopra l'emettitore di clausole
 *
 * Fornisce i mattoni con cui il compilatore esprime i vincoli:
 * - implicazione a → b:           (¬a ∨ b)
 * - equivalenza a ↔ b:            (¬a ∨ b) ∧ (a ∨ ¬b)
 * - esattamente uno di N:         (l1 ∨ ... ∨ ln) ∧ coppie (¬li ∨ ¬lj)
 * - porta AND x ↔ (a ∧ b):        (¬x ∨ a) ∧ (¬x ∨ b) ∧ (¬a ∨ ¬b ∨ x)
 * - porta XOR x ↔ (a ⊕ b):        quattro clausole, una per combinazione di polarità
 *
 * Le variabili ausiliarie delle porte vengono create tramite la tabella dei simboli
 * con un nome scelto dal chiamante: il nome deve essere univoco per punto di chiamata,
 * altrimenti due porte scollegate finirebbero per condividere la stessa uscita.
 */
public class GateLibrary {

    private final SymbolTable symbols;
    private final ClauseSet clauses;

    public GateLibrary(SymbolTable symbols, ClauseSet clauses) {
        if (symbols == null || clauses == null) {
            throw new IllegalArgumentException("Tabella simboli ed emettitore non possono essere null");
        }
        this.symbols = symbols;
        this.clauses = clauses;
    }

    //region VARIABILI E CLAUSOLE ELEMENTARI

    /**
     * @return ID della variabile con il nome dato (creata se nuova)
     */
    public int variable(String name) {
        return symbols.intern(name);
    }

    public void clause(int... literals) {
        clauses.addClause(literals);
    }

    public void clause(List<Integer> literals) {
        clauses.addClause(literals);
    }

    public void unit(int literal) {
        clauses.addUnit(literal);
    }

    /**
     * Emette la clausola vuota: l'istanza diventa insoddisfacibile per costruzione.
     */
    public void contradiction() {
        clauses.addEmpty();
    }

    //endregion

    //region IMPLICAZIONI E CARDINALITÀ

    public void implies(int a, int b) {
        clauses.addClause(-a, b);
    }

    public void equivalent(int a, int b) {
        clauses.addClause(-a, b);
        clauses.addClause(a, -b);
    }

    /**
     * Al più uno dei letterali e' vero, codifica a coppie: O(n²) clausole binarie.
     */
    public void atMostOne(List<Integer> literals) {
        for (int i = 0; i < literals.size(); i++) {
            for (int j = i + 1; j < literals.size(); j++) {
                clauses.addClause(-literals.get(i), -literals.get(j));
            }
        }
    }

    /**
     * Al più uno dei letterali e' vero quando la guardia e' vera.
     */
    public void atMostOneWhen(int guard, List<Integer> literals) {
        for (int i = 0; i < literals.size(); i++) {
            for (int j = i + 1; j < literals.size(); j++) {
                clauses.addClause(-guard, -literals.get(i), -literals.get(j));
            }
        }
    }

    /**
     * Almeno uno dei letterali e' vero quando la guardia e' vera.
     */
    public void atLeastOneWhen(int guard, List<Integer> literals) {
        List<Integer> clause = new ArrayList<>(literals.size() + 1);
        clause.add(-guard);
        clause.addAll(literals);
        clauses.addClause(clause);
    }

    /**
     * Esattamente uno: disgiunzione completa piu' esclusione a coppie.
     * Con lista vuota produce la clausola vuota.
     */
    public void exactlyOne(List<Integer> literals) {
        clauses.addClause(literals);
        atMostOne(literals);
    }

    //endregion

    //region PORTE DI TSEITIN

    /**
     * Vincola x ↔ (a ∧ b).
     */
    public void andGate(int x, int a, int b) {
        clauses.addClause(-x, a);
        clauses.addClause(-x, b);
        clauses.addClause(-a, -b, x);
    }

    /**
     * Crea l'uscita con il nome dato e la vincola a (a ∧ b).
     *
     * @return ID della variabile di uscita
     */
    public int andGate(String outputName, int a, int b) {
        int x = symbols.intern(outputName);
        andGate(x, a, b);
        return x;
    }

    /**
     * Vincola x ↔ (a ⊕ b).
     */
    public void xorGate(int x, int a, int b) {
        clauses.addClause(-a, -b, -x);
        clauses.addClause(a, b, -x);
        clauses.addClause(a, -b, x);
        clauses.addClause(-a, b, x);
    }

    /**
     * Crea l'uscita con il nome dato e la vincola a (a ⊕ b).
     *
     * @return ID della variabile di uscita
     */
    public int xorGate(String outputName, int a, int b) {
        int x = symbols.intern(outputName);
        xorGate(x, a, b);
        return x;
    }

    //endregion
}
