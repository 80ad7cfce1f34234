package org.proplogic;

import org.proplogic.formula.Formula;
import org.proplogic.formula.SymbolTable;
import org.proplogic.formula.Symbols;
import org.proplogic.optionalfeatures.RandomFormulaGenerator;
import org.proplogic.semantics.SemanticAnalyzer;
import org.proplogic.semantics.TruthTable;
import org.proplogic.support.Identities;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LOGICA PROPOSIZIONALE - Front end a riga di comando
 *
 * MODALITÀ OPERATIVE:
 * - Generazione (-gen=random &lt;altezza&gt;): formule casuali con proprietà semantiche
 * - Identità (-identities): verifica che le identità classiche siano tautologie
 *
 * OPZIONI:
 * - Numero di formule (-n &lt;numero&gt;)
 * - Etichette degli atomi (-atoms=P,Q,R)
 * - Seme della sorgente casuale (-seed &lt;long&gt;)
 * - Notazione di output (-fmt=unicode|utf|ascii|latex|tikz)
 * - Tabella di verità (-table, oppure -table=full per le colonne intermedie)
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String GEN_PARAM = "-gen=";
    private static final String COUNT_PARAM = "-n";
    private static final String ATOMS_PARAM = "-atoms=";
    private static final String SEED_PARAM = "-seed";
    private static final String FORMAT_PARAM = "-fmt=";
    private static final String TABLE_PARAM = "-table";
    private static final String FULL_TABLE_PARAM = "-table=full";
    private static final String IDENTITIES_PARAM = "-identities";

    /**
     * Tipi di generazione e notazioni disponibili
     * */
    private static final String GEN_RANDOM = "random";
    private static final List<String> FORMATS = List.of("unicode", "utf", "ascii", "latex", "tikz");

    /**
     * Valori di default e limiti
     * */
    private static final int DEFAULT_HEIGHT = 3;
    private static final int MAX_HEIGHT = 12;
    private static final int DEFAULT_COUNT = 1;
    private static final int MAX_COUNT = 100;

    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        try {
            if (args.length == 0) {
                System.out.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
                return;
            }

            CliConfiguration config = parseAndValidateArguments(args);
            if (config == null) return; // Help mostrato o errore

            System.out.print(run(config));

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
            System.out.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            System.exit(1);
        }
    }

    /**
     * Esegue la modalità configurata e restituisce l'output testuale.
     */
    static String run(CliConfiguration config) {
        Symbols.set(config.symbols);
        StringBuilder out = new StringBuilder();

        if (config.identitiesMode) {
            for (Map.Entry<String, Formula> identity : Identities.all().entrySet()) {
                boolean tautology = SemanticAnalyzer.isTautology(identity.getValue());
                out.append(identity.getKey()).append(": ")
                        .append(render(identity.getValue(), config))
                        .append(tautology ? "  [tautologia]" : "  [NON tautologia]")
                        .append('\n');
            }
            return out.toString();
        }

        RandomFormulaGenerator generator = config.seed != null
                ? new RandomFormulaGenerator(new Random(config.seed))
                : new RandomFormulaGenerator();

        for (int i = 0; i < config.count; i++) {
            Formula formula = generator.generate(config.height, config.labels);
            out.append(render(formula, config)).append('\n');
            out.append(describe(formula)).append('\n');
            if (config.showTable) {
                out.append(TruthTable.of(formula, config.showIntermediate).format());
            }
            out.append('\n');
        }
        return out.toString();
    }

    private static String render(Formula formula, CliConfiguration config) {
        return config.tikz ? formula.toLatexTikz() : formula.toString();
    }

    private static String describe(Formula formula) {
        if (SemanticAnalyzer.isTautology(formula)) {
            return "Tautologia";
        }
        if (SemanticAnalyzer.isContradiction(formula)) {
            return "Contraddizione";
        }
        int satisfying = SemanticAnalyzer.satisfyingValuations(formula).size();
        return "Contingente: soddisfacibile e falsificabile (" + satisfying + "/"
                + (1L << formula.atoms().size()) + " valutazioni la rendono vera)";
    }

    //endregion

    //region PARSING E VALIDAZIONE PARAMETRI

    private static CliConfiguration parseAndValidateArguments(String[] args) {
        try {
            return new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.out.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.out.println("Usa -h per visualizzare l'help completo.");
            return null;
        }
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("USO: java -jar proplogic.jar [opzioni]");
        System.out.println();
        System.out.println("MODALITÀ:");
        System.out.println("  -gen=random <altezza>   Genera formule casuali (altezza 1-" + MAX_HEIGHT + ", default " + DEFAULT_HEIGHT + ")");
        System.out.println("  -identities             Verifica le identità classiche");
        System.out.println();
        System.out.println("OPZIONI:");
        System.out.println("  -n <numero>             Numero di formule da generare (1-" + MAX_COUNT + ", default " + DEFAULT_COUNT + ")");
        System.out.println("  -atoms=P,Q,R            Etichette degli atomi (default P..Z)");
        System.out.println("  -seed <long>            Seme per risultati riproducibili");
        System.out.println("  -fmt=<notazione>        unicode, utf, ascii, latex, tikz (default unicode)");
        System.out.println("  -table                  Stampa la tabella di verità");
        System.out.println("  -table=full             Tabella di verità con le sottoformule intermedie");
        System.out.println("  -h                      Mostra questo help");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata e immutabile della riga di comando.
     */
    static final class CliConfiguration {
        final boolean identitiesMode;
        final int height;
        final int count;
        final List<String> labels;
        final Long seed;
        final SymbolTable symbols;
        final boolean tikz;
        final boolean showTable;
        final boolean showIntermediate;

        CliConfiguration(boolean identitiesMode, int height, int count, List<String> labels, Long seed,
                         SymbolTable symbols, boolean tikz, boolean showTable, boolean showIntermediate) {
            this.identitiesMode = identitiesMode;
            this.height = height;
            this.count = count;
            this.labels = labels;
            this.seed = seed;
            this.symbols = symbols;
            this.tikz = tikz;
            this.showTable = showTable;
            this.showIntermediate = showIntermediate;
        }
    }

    /**
     * Parser sequenziale dei parametri: ogni flag viene validato appena letto.
     */
    static final class ArgumentParser {

        /**
         * @param args parametri da linea comando
         * @return configurazione validata (null se è stato richiesto l'help)
         * @throws IllegalArgumentException se parametri sintatticamente o semanticamente invalidi
         */
        CliConfiguration parse(String[] args) {
            boolean isGenerationMode = false;
            boolean isIdentitiesMode = false;
            int height = DEFAULT_HEIGHT;
            int count = DEFAULT_COUNT;
            List<String> labels = RandomFormulaGenerator.DEFAULT_LABELS;
            Long seed = null;
            String format = "unicode";
            boolean showTable = false;
            boolean showIntermediate = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case COUNT_PARAM -> count = parseBoundedInt(getNextArgument(args, ++i, "numero"), 1, MAX_COUNT, "Numero di formule");
                    case SEED_PARAM -> seed = parseSeed(getNextArgument(args, ++i, "seme"));
                    case TABLE_PARAM -> showTable = true;
                    case FULL_TABLE_PARAM -> {
                        showTable = true;
                        showIntermediate = true;
                    }
                    case IDENTITIES_PARAM -> {
                        validateExclusiveMode(isGenerationMode, "identità");
                        isIdentitiesMode = true;
                    }
                    default -> {
                        if (args[i].startsWith(GEN_PARAM)) {
                            validateExclusiveMode(isIdentitiesMode, "generazione");
                            String genType = args[i].substring(GEN_PARAM.length());
                            if (!GEN_RANDOM.equals(genType)) {
                                throw new IllegalArgumentException("Tipo generazione non supportato: " + genType
                                        + ". Supportati: " + GEN_RANDOM);
                            }
                            height = parseBoundedInt(getNextArgument(args, ++i, "altezza"), 1, MAX_HEIGHT, "Altezza");
                            isGenerationMode = true;
                        } else if (args[i].startsWith(ATOMS_PARAM)) {
                            labels = parseLabels(args[i].substring(ATOMS_PARAM.length()));
                        } else if (args[i].startsWith(FORMAT_PARAM)) {
                            format = args[i].substring(FORMAT_PARAM.length());
                            if (!FORMATS.contains(format)) {
                                throw new IllegalArgumentException("Notazione non supportata: " + format
                                        + ". Supportate: " + String.join(", ", FORMATS));
                            }
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (!isGenerationMode && !isIdentitiesMode) {
                throw new IllegalArgumentException("Specificare una modalità: -gen=random <altezza> oppure -identities");
            }

            return new CliConfiguration(isIdentitiesMode, height, count, labels, seed,
                    symbolsFor(format), "tikz".equals(format), showTable, showIntermediate);
        }

        private void validateExclusiveMode(boolean otherMode, String currentMode) {
            if (otherMode) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità");
            }
        }

        private String getNextArgument(String[] args, int index, String argumentType) {
            if (index >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[index - 1] + " richiede un valore (" + argumentType + ")");
            }
            return args[index];
        }

        private int parseBoundedInt(String value, int min, int max, String name) {
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(name + " non valido: " + value);
            }
            if (parsed < min || parsed > max) {
                throw new IllegalArgumentException(name + " deve essere tra " + min + " e " + max + ", ricevuto: " + parsed);
            }
            return parsed;
        }

        private Long parseSeed(String value) {
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Seme non valido: " + value);
            }
        }

        private List<String> parseLabels(String value) {
            List<String> labels = new ArrayList<>();
            for (String label : Arrays.asList(value.split(","))) {
                String trimmed = label.trim();
                if (!trimmed.isEmpty()) {
                    labels.add(trimmed);
                }
            }
            if (labels.isEmpty()) {
                throw new IllegalArgumentException("Lista di atomi vuota: " + value);
            }
            return List.copyOf(labels);
        }

        private SymbolTable symbolsFor(String format) {
            return switch (format) {
                case "utf" -> SymbolTable.UTF;
                case "ascii" -> SymbolTable.ASCII;
                case "latex", "tikz" -> SymbolTable.LATEX;
                default -> SymbolTable.UNICODE;
            };
        }
    }

    //endregion
}
