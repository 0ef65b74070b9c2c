package nl.nfi.djcnf.cli;

import nl.nfi.djcnf.cnf.CnfPipeline;
import nl.nfi.djcnf.cnf.CnfResult;
import nl.nfi.djcnf.cnf.CnfValidator;
import nl.nfi.djcnf.cnf.TransformationStep;
import nl.nfi.djcnf.common.Timers.TimedResult;
import nl.nfi.djcnf.common.ini.IniConfig;
import nl.nfi.djcnf.common.ini.IniSection;
import nl.nfi.djcnf.common.logger.LoggerConfigurator;
import nl.nfi.djcnf.generate.WordEnumerator;
import nl.nfi.djcnf.grammar.Grammar;
import nl.nfi.djcnf.grammar.GrammarException;
import nl.nfi.djcnf.grammar.GrammarParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.djcnf.common.Timers.time;
import static nl.nfi.djcnf.grammar.Symbols.EPSILON;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "dj_cnf", description = "Converts a context-free grammar to Chomsky Normal Form and lists the words it generates")
public class CnfConverterCli implements Callable<Integer> {

    static final int DEFAULT_MAX_LENGTH = 4;
    static final int DEFAULT_MAX_WORDS = 10;

    @Option(names = {"--grammar"}, description = "The grammar file to read, '-' for standard input", required = true)
    private String grammarPath;

    @Option(names = {"--start"}, description = "The start symbol (defaults to the left-hand side of the first rule)")
    private String start;

    @Option(names = {"--output"}, description = "The file to write the results to")
    private String outputPath = "-";

    @Option(names = {"--steps"}, description = "Show the grammar after every transformation step")
    private Boolean showSteps;

    @Option(names = {"--words"}, description = "List the words generated by the grammar instead of converting it")
    private boolean listWords = false;

    @Option(names = {"--validate"}, description = "Check whether the grammar is already in strict Chomsky Normal Form")
    private boolean validate = false;

    @Option(names = {"--max_length"}, description = "Maximum length of the listed words")
    private Integer maxLength;

    @Option(names = {"--max_words"}, description = "Maximum number of listed words")
    private Integer maxWords;

    @Option(names = {"--config"}, description = "INI file with defaults for the options above")
    private String configPath;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    private final InputStream stdin;
    private final PrintStream stdout;

    public CnfConverterCli() {
        this(System.in, System.out);
    }

    CnfConverterCli(final InputStream stdin, final PrintStream stdout) {
        this.stdin = stdin;
        this.stdout = stdout;
    }

    @Override
    public Integer call() throws Exception {
        // must be set before the first logger is created
        if (logPath != null) {
            System.setProperty(LoggerConfigurator.LOG_DIRECTORY_PROPERTY, logPath);
        }
        final Logger log = LoggerFactory.getLogger(CnfConverterCli.class);

        try {
            final Settings settings = Settings.resolve(
                    configPath == null ? IniConfig.empty() : IniConfig.loadFrom(Paths.get(configPath)),
                    maxLength, maxWords, showSteps
            );
            log.info("Processing grammar {}: {}", grammarPath, settings);

            final Grammar grammar = readGrammar();
            if (outputPath.equals("-")) {
                run(grammar, settings, stdout, log);
                stdout.flush();
                return ExitCode.OK;
            }
            try (final PrintStream output = new PrintStream(new BufferedOutputStream(new FileOutputStream(Paths.get(outputPath).toFile())), false, UTF_8)) {
                run(grammar, settings, output, log);
            }
        }
        catch (final GrammarException e) {
            log.warn("Invalid grammar", e);
            System.err.println("Invalid grammar: " + e.getMessage());
            return ExitCode.USAGE;
        }
        catch (final IllegalArgumentException e) {
            log.warn("Invalid arguments", e);
            System.err.println("Invalid arguments: " + e.getMessage());
            return ExitCode.USAGE;
        }
        catch (final Throwable t) {
            log.error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }

        return ExitCode.OK;
    }

    private Grammar readGrammar() throws IOException {
        final Grammar grammar = grammarPath.equals("-")
                ? GrammarParser.parse(new String(stdin.readAllBytes(), UTF_8))
                : GrammarParser.parse(Paths.get(grammarPath));
        return start == null ? grammar : GrammarParser.withStart(grammar, start);
    }

    private void run(final Grammar grammar, final Settings settings, final PrintStream output, final Logger log) {
        if (validate) {
            final List<String> violations = CnfValidator.violations(grammar, grammar.start());
            output.println(violations.isEmpty() ? "Grammar is in strict Chomsky Normal Form" : "Grammar is not in strict Chomsky Normal Form:");
            violations.forEach(violation -> output.println("  " + violation));
            return;
        }

        if (listWords) {
            final TimedResult<Set<String>> words = time(() -> WordEnumerator.generateWords(grammar, grammar.start(), settings.maxLength(), settings.maxWords()));
            log.info("Generated {} words in {} ms", words.value().size(), words.duration().toMillis());
            if (words.value().isEmpty()) {
                output.println("No words generated with the given limits.");
            }
            words.value().forEach(word -> output.println(word.isEmpty() ? EPSILON : word));
            return;
        }

        final CnfResult result = CnfPipeline.toCnf(grammar);
        if (settings.showSteps()) {
            for (final TransformationStep step : result.steps()) {
                output.println("--- " + step.title());
                output.println(step.snapshot());
            }
        } else {
            output.println(result.formatted());
        }
    }

    // command line options win over the config file, which wins over the built-in defaults
    record Settings(int maxLength, int maxWords, boolean showSteps) {

        static final String ENUMERATION_SECTION = "ENUMERATION";
        static final String OUTPUT_SECTION = "OUTPUT";

        static Settings resolve(final IniConfig config, final Integer maxLength, final Integer maxWords, final Boolean showSteps) {
            int configuredMaxLength = DEFAULT_MAX_LENGTH;
            int configuredMaxWords = DEFAULT_MAX_WORDS;
            if (config.hasSection(ENUMERATION_SECTION)) {
                final IniSection section = config.getSection(ENUMERATION_SECTION);
                if (section.hasKey("max_length")) {
                    configuredMaxLength = section.getInt("max_length");
                }
                if (section.hasKey("max_words")) {
                    configuredMaxWords = section.getInt("max_words");
                }
            }

            return new Settings(
                    maxLength != null ? maxLength : configuredMaxLength,
                    maxWords != null ? maxWords : configuredMaxWords,
                    showSteps != null ? showSteps : config.getBoolean(OUTPUT_SECTION, "show_steps", false)
            );
        }
    }
}
