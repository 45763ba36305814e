package org.forestsat.problem;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;
import org.forestsat.antlr.ForestProblemBaseVisitor;
import org.forestsat.antlr.ForestProblemLexer;
import org.forestsat.antlr.ForestProblemParser;
import org.forestsat.antlr.ForestProblemParser.BoundDeclContext;
import org.forestsat.antlr.ForestProblemParser.EdgeDeclContext;
import org.forestsat.antlr.ForestProblemParser.HintDeclContext;
import org.forestsat.antlr.ForestProblemParser.IdentContext;
import org.forestsat.antlr.ForestProblemParser.NodeDeclContext;
import org.forestsat.antlr.ForestProblemParser.ProblemContext;
import org.forestsat.antlr.ForestProblemParser.RootDeclContext;
import org.forestsat.antlr.ForestProblemParser.SignedIntContext;
import org.forestsat.forest.ForestProblem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * LETTORE FILE PROBLEMA - Da testo a {@link ForestProblem}
 *
 * Pipeline ANTLR: testo → lexer → token → parser → albero sintattico → visitor.
 * Il visitor accumula le dichiarazioni in un {@link ForestProblem.Builder};
 * gli errori sintattici interrompono subito la lettura con {@link ProblemSyntaxException}.
 *
 * La validazione semantica (radici mancanti, nodi sconosciuti, ...) non avviene
 * qui ma nel compilatore.
 */
public class ForestProblemReader extends ForestProblemBaseVisitor<Void> {

    private static final Logger LOGGER = Logger.getLogger(ForestProblemReader.class.getName());

    private final ForestProblem.Builder builder = ForestProblem.builder();
    private int statements;

    private ForestProblemReader() {
    }

    //region PUNTO DI INGRESSO

    /**
     * @param text contenuto del file di problema
     * @return problema descritto (non ancora validato)
     * @throws ProblemSyntaxException per errori lessicali o sintattici
     */
    public static ForestProblem read(String text) {
        ForestProblemLexer lexer = new ForestProblemLexer(CharStreams.fromString(text));
        lexer.removeErrorListeners();
        lexer.addErrorListener(ThrowingErrorListener.INSTANCE);

        ForestProblemParser parser = new ForestProblemParser(new CommonTokenStream(lexer));
        parser.removeErrorListeners();
        parser.addErrorListener(ThrowingErrorListener.INSTANCE);

        ProblemContext tree = parser.problem();

        ForestProblemReader reader = new ForestProblemReader();
        reader.visit(tree);
        LOGGER.fine("Lette " + reader.statements + " dichiarazioni");
        return reader.builder.build();
    }

    /**
     * Legge un file di problema in UTF-8.
     */
    public static ForestProblem readFile(Path path) throws IOException {
        LOGGER.info("Lettura problema da " + path);
        return read(Files.readString(path, StandardCharsets.UTF_8));
    }

    //endregion

    //region DICHIARAZIONI

    @Override
    public Void visitNodeDecl(NodeDeclContext ctx) {
        for (IdentContext id : ctx.ident()) {
            builder.node(identifier(id));
        }
        statements++;
        return null;
    }

    @Override
    public Void visitEdgeDecl(EdgeDeclContext ctx) {
        builder.edge(identifier(ctx.ident(0)), identifier(ctx.ident(1)));
        statements++;
        return null;
    }

    @Override
    public Void visitRootDecl(RootDeclContext ctx) {
        builder.root(integer(ctx.INT().getSymbol(), ctx.INT().getText()), identifier(ctx.ident()));
        statements++;
        return null;
    }

    @Override
    public Void visitHintDecl(HintDeclContext ctx) {
        builder.hint(identifier(ctx.ident()), signedInteger(ctx.signedInt()));
        statements++;
        return null;
    }

    @Override
    public Void visitBoundDecl(BoundDeclContext ctx) {
        builder.lowerBound(identifier(ctx.ident()), signedInteger(ctx.signedInt()));
        statements++;
        return null;
    }

    //endregion

    //region TERMINALI

    private static String identifier(IdentContext ctx) {
        if (ctx.STRING() != null) {
            String quoted = ctx.STRING().getText();
            return quoted.substring(1, quoted.length() - 1);
        }
        return ctx.getText();
    }

    private static int signedInteger(SignedIntContext ctx) {
        String digits = ctx.INT().getText();
        return integer(ctx.getStart(), ctx.MINUS() != null ? "-" + digits : digits);
    }

    private static int integer(Token at, String text) {
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new ProblemSyntaxException(at.getLine(), at.getCharPositionInLine(),
                    "intero fuori intervallo: " + text);
        }
    }

    //endregion

    /**
     * Trasforma il primo errore di ANTLR in eccezione invece di stamparlo su stderr.
     */
    private static final class ThrowingErrorListener extends BaseErrorListener {

        static final ThrowingErrorListener INSTANCE = new ThrowingErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ProblemSyntaxException(line, charPositionInLine, msg);
        }
    }
}
