package nl.nfi.djcyk.recognize;

import nl.nfi.djcyk.common.logger.LoggerConfigurator;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import static java.nio.charset.StandardCharsets.UTF_8;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "cyk_parser", description = "Decide whether sentences belong to the language of a context-free grammar")
public class RecognizerCli implements Callable<Integer> {

    @Option(names = {"--grammar"}, description = "Grammar file (.ini) or compiled language (.cyk), defaults to the bundled English grammar")
    private String grammarPath;

    @Option(names = {"--sentence"}, description = "Sentence to parse, may be repeated")
    private List<String> sentences = new ArrayList<>();

    @Option(names = {"--examples"}, description = "Parse the example sentences of the grammar and compare with their expected outcome")
    private boolean runExamples = false;

    @Option(names = {"--vocabulary"}, description = "Show the words of the grammar per category")
    private boolean showVocabulary = false;

    @Option(names = {"--print_grammar"}, description = "Show the grammar as loaded")
    private boolean showGrammar = false;

    @Option(names = {"--print_cnf"}, description = "Show the grammar in Chomsky Normal Form")
    private boolean showCnf = false;

    @Option(names = {"--interactive"}, description = "Read sentences from standard input (default when no other action is given)")
    private boolean interactive = false;

    @Option(names = {"--no_trees"}, description = "Do not print parse trees of accepted sentences")
    private boolean hideTrees = false;

    @Option(names = {"--thread_count"}, description = "Fill chart cells of the same span length with <count> threads")
    private int threadCount = 1;

    @Option(names = {"--log_directory_path"}, description = "Directory where to store live and archived log files")
    private String logPath;

    private final InputStream input;
    private final PrintStream output;

    public RecognizerCli() {
        this(System.in, System.out);
    }

    public RecognizerCli(final InputStream input, final PrintStream output) {
        this.input = input;
        this.output = output;
    }

    @Override
    public Integer call() throws Exception {
        if (logPath != null) {
            System.setProperty(LoggerConfigurator.LOG_DIRECTORY_PROPERTY, logPath);
        }

        try {
            final Language language = grammarPath == null
                    ? Language.loadDefault()
                    : Language.loadFrom(Paths.get(grammarPath));
            final SentenceRecognizer recognizer = SentenceRecognizer.forLanguage(language).threadCount(threadCount);
            final boolean showTrees = !hideTrees;

            int exitCode = ExitCode.OK;
            if (showVocabulary) {
                recognizer.showVocabulary(output);
            }
            if (showGrammar) {
                recognizer.showGrammar(output);
            }
            if (showCnf) {
                recognizer.showCnfGrammar(output);
            }
            for (final String sentence : sentences) {
                recognizer.writeRecognition(sentence, showTrees, output);
            }
            if (runExamples && recognizer.runExamples(showTrees, output) > 0) {
                exitCode = ExitCode.SOFTWARE;
            }

            final boolean anyAction = showVocabulary || showGrammar || showCnf || runExamples || !sentences.isEmpty();
            if (interactive || !anyAction) {
                recognizer.interactive(new BufferedReader(new InputStreamReader(input, UTF_8)), showTrees, output);
            }
            output.flush();
            return exitCode;
        }
        catch (final Throwable t) {
            LoggerFactory.getLogger(RecognizerCli.class).error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }
    }
}
