package org.forestsat;

import org.forestsat.cnf.DimacsReader;
import org.forestsat.cnf.SolverModel;
import org.forestsat.forest.ColoredForestCnf;
import org.forestsat.forest.ColoredForestCompiler;
import org.forestsat.forest.CompilerOptions;
import org.forestsat.forest.DistanceEncodingKind;
import org.forestsat.forest.ForestDecoder;
import org.forestsat.forest.ForestProblem;
import org.forestsat.forest.ForestSolution;
import org.forestsat.forest.InvalidForestProblemException;
import org.forestsat.problem.ForestProblemReader;
import org.forestsat.problem.ProblemSyntaxException;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * COMPILATORE SAT PER FORESTE COLORATE
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: descrizione del problema (nodi, archi, radici, suggerimenti, limiti)
 * 2. PARSING: grammatica ANTLR del file di problema
 * 3. COMPILAZIONE: vincoli di foresta colorata in CNF
 * 4. OUTPUT: file DIMACS per un solutore esterno + file .map con i nomi delle variabili
 * 5. DECODIFICA (facoltativa): modello del solutore → colori, padri, distanze
 *
 * MODALITÀ OPERATIVE:
 * - Compilazione (-f [-o]): scrive il DIMACS su file o su standard output
 * - Decodifica (-f -m): compila e interpreta il modello prodotto dal solutore
 * - Codifica distanze configurabile (-enc=unary|binary)
 * - Statistiche dell'istanza (-stats)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String OUTPUT_PARAM = "-o";
    private static final String MODEL_PARAM = "-m";
    private static final String ENCODING_PARAM = "-enc=";
    private static final String STATS_PARAM = "-stats";

    private static final String CNF_EXTENSION = ".cnf";
    private static final String MAP_EXTENSION = ".map";

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }

    /**
     * Esegue l'applicazione senza terminare la JVM.
     *
     * @param args parametri linea di comando
     * @return codice di uscita (0 successo, 1 errore)
     */
    static int run(String[] args) {
        if (args.length == 0) {
            System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return 1;
        }

        CompilerConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return 1;
        }
        if (config == null) {
            return 0; // help mostrato
        }

        try {
            executePipeline(config);
            return 0;
        } catch (ProblemSyntaxException e) {
            System.out.println("[E] Errore di sintassi nel problema: " + e.getMessage());
        } catch (InvalidForestProblemException e) {
            System.out.println("[E] Problema non valido (" + e.getReason() + "): " + e.getMessage());
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            System.out.println("[E] " + e.getMessage());
            LOGGER.log(Level.SEVERE, "Elaborazione fallita", e);
        }
        return 1;
    }

    private static void executePipeline(CompilerConfiguration config) throws IOException {
        ForestProblem problem = ForestProblemReader.readFile(Paths.get(config.inputPath));
        System.out.println("[I] Problema letto: " + problem);

        ColoredForestCnf cnf = new ColoredForestCompiler(config.options).compile(problem);
        System.out.println("[I] Istanza compilata: " + cnf);
        if (cnf.hasEmptyClause()) {
            System.out.println("[I] L'istanza contiene la clausola vuota: insoddisfacibile per costruzione");
        }

        if (config.printStats) {
            System.out.println(cnf.statistics().toReport());
        }

        if (config.modelPath != null) {
            decodeModel(cnf, config.modelPath);
        } else if (config.outputPath != null) {
            writeOutputs(cnf, Paths.get(config.outputPath));
        } else {
            System.out.print(cnf.dimacs());
        }
    }

    //endregion

    //region OUTPUT

    private static void writeOutputs(ColoredForestCnf cnf, Path cnfPath) throws IOException {
        Path parent = cnfPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(cnfPath, cnf.dimacs(), StandardCharsets.UTF_8);
        System.out.println("[I] DIMACS scritto in " + cnfPath);

        Path mapPath = mapPathFor(cnfPath);
        Files.writeString(mapPath, symbolMap(cnf), StandardCharsets.UTF_8);
        System.out.println("[I] Mappa delle variabili scritta in " + mapPath);
    }

    /**
     * "out.cnf" → "out.map"; altri nomi ricevono il suffisso ".map".
     */
    static Path mapPathFor(Path cnfPath) {
        String name = cnfPath.getFileName().toString();
        String base = name.toLowerCase().endsWith(CNF_EXTENSION)
                ? name.substring(0, name.length() - CNF_EXTENSION.length())
                : name;
        return cnfPath.resolveSibling(base + MAP_EXTENSION);
    }

    /**
     * Una riga "id nome" per variabile, in ordine di ID.
     */
    static String symbolMap(ColoredForestCnf cnf) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<Integer, String> entry : cnf.nameOf().entrySet()) {
            sb.append(entry.getKey()).append(' ').append(entry.getValue()).append('\n');
        }
        return sb.toString();
    }

    private static void decodeModel(ColoredForestCnf cnf, String modelPath) throws IOException {
        SolverModel model = DimacsReader.parseModel(Files.readString(Paths.get(modelPath), StandardCharsets.UTF_8));
        if (!model.isSatisfiable()) {
            System.out.println("[I] Il solutore riporta UNSAT: nessuna foresta colorata esiste");
            return;
        }

        ForestSolution solution = ForestDecoder.decode(cnf, model);
        solution.checkForest();
        System.out.println("\n-->> FORESTA DECODIFICATA <<--");
        System.out.println(solution.toReport());
        System.out.println("==============================");
    }

    //endregion

    //region HELP

    private static void printApplicationHelp() {
        System.out.println("""

                -->> COMPILATORE SAT PER FORESTE COLORATE <<--

                UTILIZZO:
                  java -jar forest-sat.jar -f <problema> [-o <out.cnf>] [-enc=unary|binary] [-stats]
                  java -jar forest-sat.jar -f <problema> -m <modello> [-enc=unary|binary]

                PARAMETRI:
                  -h                 Mostra questo help
                  -f <file>          File di descrizione del problema
                  -o <file>          File DIMACS di output (scrive anche il file .map accanto)
                  -m <file>          Modello del solutore da decodificare
                  -enc=<codifica>    Codifica delle distanze: unary (predefinita) o binary
                  -stats             Stampa statistiche dell'istanza compilata

                FORMATO DEL PROBLEMA:
                  node a b c         dichiara i nodi
                  edge a b           arco non orientato
                  root 0 a           radice del colore 0
                  hint b 1           colore fissato (-1 = qualsiasi)
                  mindist c 2        distanza minima dalla radice
                  # commento
                """);
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static class CompilerConfiguration {
        final String inputPath;
        final String outputPath;
        final String modelPath;
        final CompilerOptions options;
        final boolean printStats;

        CompilerConfiguration(String inputPath, String outputPath, String modelPath,
                              CompilerOptions options, boolean printStats) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.modelPath = modelPath;
            this.options = options;
            this.printStats = printStats;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    private static class ArgumentParser {

        /**
         * @return configurazione validata, oppure null se e' stato richiesto l'help
         * @throws IllegalArgumentException se i parametri non sono validi
         */
        CompilerConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            String modelPath = null;
            CompilerOptions options = CompilerOptions.defaults();
            boolean printStats = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case FILE_PARAM -> {
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                    }
                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "file output");
                    case MODEL_PARAM -> {
                        modelPath = getNextArgument(args, ++i, "file modello");
                        validateFileExists(modelPath);
                    }
                    case STATS_PARAM -> printStats = true;
                    default -> {
                        if (args[i].startsWith(ENCODING_PARAM)) {
                            String kind = args[i].substring(ENCODING_PARAM.length());
                            options = options.withEncoding(DistanceEncodingKind.fromFlag(kind));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null) {
                throw new IllegalArgumentException("Specificare il file del problema con -f");
            }
            if (outputPath != null && modelPath != null) {
                throw new IllegalArgumentException("-o e -m non possono essere usati insieme");
            }
            return new CompilerConfiguration(inputPath, outputPath, modelPath, options, printStats);
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] +
                        " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }
    }

    //endregion
}
