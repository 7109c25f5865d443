package org.basi;

import org.basi.operators.OperatorBasis;
import org.basi.syntax.Formula;
import org.basi.syntax.FormulaParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * CONVERTITORE DI BASI PER FORMULE PROPOSIZIONALI
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: formula da linea di comando (-e) o file con una formula per riga (-f)
 * 2. PARSING: notazione infissa -> albero Formula (ANTLR)
 * 3. CONVERSIONE: riscrittura in una o in tutte le basi supportate
 * 4. OUTPUT: formule convertite con numero di nodi e profondità, su console
 *    e opzionalmente in una directory (un file per base)
 *
 * BASI DISPONIBILI (-b=<base>):
 * - not-and-or, not-and, nand, implies-not, implies-false
 * - all: tutte le basi (default)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String EXPRESSION_PARAM = "-e";
    private static final String FILE_PARAM = "-f";
    private static final String OUTPUT_PARAM = "-o";
    private static final String BASIS_PARAM = "-b=";
    private static final String BASIS_ALL = "all";

    /** Prefisso delle righe di commento nei file di input */
    private static final String COMMENT_PREFIX = "#";

    /** Configurazione java.util.logging caricata dal classpath */
    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /** Codici di uscita */
    static final int EXIT_SUCCESS = 0;
    static final int EXIT_FAILURE = 1;

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale dell'applicazione.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        int exitCode = run(args, System.out);
        if (exitCode != EXIT_SUCCESS) {
            System.exit(exitCode);
        }
    }

    /**
     * Esegue l'intera pipeline e restituisce il codice di uscita.
     *
     * FLUSSO ESECUZIONE:
     * 1. Parsing e validazione parametri linea di comando
     * 2. Lettura delle formule da convertire
     * 3. Conversione in ogni base richiesta e stampa dei risultati
     * 4. Scrittura opzionale dei risultati su file
     *
     * @param args parametri linea di comando
     * @param out destinazione dei messaggi per l'utente
     * @return 0 se tutto è andato a buon fine, 1 altrimenti
     */
    static int run(String[] args, PrintStream out) {
        out.println("---> AVVIO CONVERTITORE DI BASI <---");

        try {
            if (args.length == 0) {
                out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return EXIT_FAILURE;
            }

            ConversionConfiguration config = new ArgumentParser(out).parse(args);
            if (config == null) return EXIT_SUCCESS; // Help mostrato

            executeMainPipeline(config, out);
            return EXIT_SUCCESS;

        } catch (IllegalArgumentException | IOException e) {
            return handleGlobalError(e, out);
        } finally {
            out.println("---> FINE ESECUZIONE CONVERTITORE DI BASI <---");
        }
    }

    /**
     * Registra l'errore e fornisce feedback all'utente.
     *
     * @param e eccezione che ha interrotto l'elaborazione
     * @return codice di uscita di errore
     */
    private static int handleGlobalError(Exception e, PrintStream out) {
        LOGGER.log(Level.FINE, "Elaborazione interrotta", e);
        out.println("[E] " + e.getMessage());
        return EXIT_FAILURE;
    }

    /**
     * Carica la configurazione di logging dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream input = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (input != null) {
                LogManager.getLogManager().readConfiguration(input);
            }
        } catch (IOException e) {
            System.out.println("[W] Configurazione logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region PIPELINE CONVERSIONE FORMULE

    private static void executeMainPipeline(ConversionConfiguration config, PrintStream out) throws IOException {
        List<Formula> formulas = new ArrayList<>();
        for (String formulaText : config.formulaTexts) {
            formulas.add(FormulaParser.parse(formulaText));
        }
        out.println("[I] Formule da convertire: " + formulas.size());

        for (OperatorBasis basis : config.bases) {
            List<Formula> converted = convertAll(formulas, basis, out);
            if (config.outputPath != null) {
                writeResults(config.outputPath, basis, converted, out);
            }
        }
    }

    /**
     * Converte tutte le formule in una base e stampa i risultati.
     */
    private static List<Formula> convertAll(List<Formula> formulas, OperatorBasis basis, PrintStream out) {
        out.println("[I] Base " + basis.getSymbol() + " " + basis.getAllowedTypes());

        List<Formula> converted = new ArrayList<>();
        for (Formula formula : formulas) {
            Formula result = basis.convert(formula);
            converted.add(result);
            out.println(String.format("    %s => %s (nodi=%d, profondità=%d)",
                    formula, result, result.countNodes(), result.calculateDepth()));
        }

        LOGGER.fine("Base " + basis.getSymbol() + ": convertite " + converted.size() + " formule");
        return converted;
    }

    /**
     * Scrive le formule convertite in {@code <directory>/<base>.txt}, una per riga.
     */
    private static void writeResults(String outputPath, OperatorBasis basis,
                                     List<Formula> converted, PrintStream out) throws IOException {
        Path directory = Paths.get(outputPath);
        Files.createDirectories(directory);

        List<String> lines = new ArrayList<>();
        for (Formula formula : converted) {
            lines.add(formula.toString());
        }

        Path target = directory.resolve(basis.getSymbol() + ".txt");
        Files.write(target, lines);
        out.println("[I] Risultati salvati in: " + target);
    }

    //endregion

    //region CLASSI DI SUPPORTO

    /**
     * Configurazione validata dell'esecuzione.
     */
    static final class ConversionConfiguration {
        final List<String> formulaTexts;
        final List<OperatorBasis> bases;
        final String outputPath;

        ConversionConfiguration(List<String> formulaTexts, List<OperatorBasis> bases, String outputPath) {
            this.formulaTexts = Collections.unmodifiableList(formulaTexts);
            this.bases = Collections.unmodifiableList(bases);
            this.outputPath = outputPath;
        }
    }

    /**
     * Parser dei parametri linea di comando.
     */
    static final class ArgumentParser {

        private final PrintStream out;

        ArgumentParser(PrintStream out) {
            this.out = out;
        }

        /**
         * PARAMETRI SUPPORTATI:
         * -h: Mostra help e termina
         * -e <formula>: formula singola (esclusivo con -f)
         * -f <file>: file con una formula per riga (esclusivo con -e)
         * -b=<base>: base di destinazione o "all" (default)
         * -o <dir>: directory di output
         *
         * @param args parametri da linea comando
         * @return configurazione validata (null se help richiesto)
         * @throws IllegalArgumentException se parametri non validi
         * @throws IOException se il file di input non è leggibile
         */
        ConversionConfiguration parse(String[] args) throws IOException {
            List<String> formulaTexts = null;
            List<OperatorBasis> bases = Arrays.asList(OperatorBasis.values());
            boolean basisSelected = false;
            String outputPath = null;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }

                    case EXPRESSION_PARAM -> {
                        validateSingleInput(formulaTexts);
                        formulaTexts = List.of(getNextArgument(args, ++i, "formula"));
                    }

                    case FILE_PARAM -> {
                        validateSingleInput(formulaTexts);
                        formulaTexts = readFormulasFromFile(getNextArgument(args, ++i, "file"));
                    }

                    case OUTPUT_PARAM -> outputPath = getNextArgument(args, ++i, "directory output");

                    default -> {
                        if (args[i].startsWith(BASIS_PARAM)) {
                            if (basisSelected) {
                                LOGGER.warning("Parametro -b ripetuto: vale l'ultimo, " + args[i]);
                                out.println("[W] Parametro -b ripetuto, uso " + args[i]);
                            }
                            bases = parseBases(args[i].substring(BASIS_PARAM.length()));
                            basisSelected = true;
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (formulaTexts == null) {
                throw new IllegalArgumentException("Specificare una formula (-e) o un file (-f)");
            }
            if (formulaTexts.isEmpty()) {
                throw new IllegalArgumentException("Nessuna formula trovata nell'input");
            }

            return new ConversionConfiguration(new ArrayList<>(formulaTexts), new ArrayList<>(bases), outputPath);
        }

        private List<OperatorBasis> parseBases(String value) {
            if (BASIS_ALL.equalsIgnoreCase(value.trim())) {
                return Arrays.asList(OperatorBasis.values());
            }
            return List.of(OperatorBasis.fromSymbol(value));
        }

        private void validateSingleInput(List<String> formulaTexts) {
            if (formulaTexts != null) {
                throw new IllegalArgumentException("Parametri -e e -f mutuamente esclusivi");
            }
        }

        private String getNextArgument(String[] args, int index, String description) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Valore mancante per parametro: " + description);
            }
            return args[index];
        }

        /**
         * Legge le formule da file, ignorando righe vuote e commenti.
         */
        private List<String> readFormulasFromFile(String filePath) throws IOException {
            Path path = Paths.get(filePath);
            if (!Files.isRegularFile(path)) {
                throw new IOException("File non esistente: " + filePath);
            }

            List<String> formulas = new ArrayList<>();
            for (String line : Files.readAllLines(path)) {
                String trimmed = line.trim();
                if (!trimmed.isEmpty() && !trimmed.startsWith(COMMENT_PREFIX)) {
                    formulas.add(trimmed);
                }
            }
            out.println("[I] Formule lette da " + filePath + ": " + formulas.size());
            return formulas;
        }

        private void printApplicationHelp() {
            out.println("Uso: java -jar convertitore-basi.jar [opzioni]");
            out.println("  -h                 mostra questo messaggio");
            out.println("  -e <formula>       converte la formula indicata, es. \"~(x<->y)\"");
            out.println("  -f <file>          converte le formule del file, una per riga");
            out.println("  -b=<base>          not-and-or, not-and, nand, implies-not, implies-false, all");
            out.println("  -o <directory>     salva i risultati, un file per base");
        }
    }

    //endregion
}
