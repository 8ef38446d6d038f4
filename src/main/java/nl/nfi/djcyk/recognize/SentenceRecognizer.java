package nl.nfi.djcyk.recognize;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.common.Timers.TimedResult;
import nl.nfi.djcyk.cyk.CykParser;
import nl.nfi.djcyk.cyk.ParseResult;
import nl.nfi.djcyk.cyk.SentenceParser;
import nl.nfi.djcyk.cyk.ThreadedCykParser;
import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.tree.TreeBuilder;
import nl.nfi.djcyk.tree.TreePrinter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static nl.nfi.djcyk.common.Formatting.toSeconds;
import static nl.nfi.djcyk.common.Timers.time;

public final class SentenceRecognizer {

    private static final Logger LOG = LoggerFactory.getLogger(SentenceRecognizer.class);

    private static final String SEPARATOR = "-".repeat(70);
    private static final String EXIT_COMMAND = "exit";

    private final Language language;
    private final SentenceParser parser;
    private final Vocabulary vocabulary;

    private SentenceRecognizer(final Language language, final SentenceParser parser) {
        this.language = language;
        this.parser = parser;
        this.vocabulary = Vocabulary.of(language.grammar());
    }

    public static SentenceRecognizer forLanguage(final Path grammarPath) throws IOException {
        return forLanguage(Language.loadFrom(grammarPath));
    }

    public static SentenceRecognizer forLanguage(final Language language) {
        final boolean wasNormalized = language.isNormalized();
        final TimedResult<CnfGrammar> normalized = time(language::cnfGrammar);
        if (!wasNormalized) {
            LOG.info("Normalized language '{}' in {}", language.name(), normalized.duration());
        }
        return new SentenceRecognizer(language, CykParser.init(normalized.value()));
    }

    public SentenceRecognizer threadCount(final int threadCount) {
        if (threadCount == 1) {
            if (parser instanceof CykParser) {
                return this;
            }
            return new SentenceRecognizer(language, CykParser.init(language.cnfGrammar()));
        }
        return new SentenceRecognizer(language, ThreadedCykParser.init(language.cnfGrammar()).threadCount(threadCount));
    }

    public Language language() {
        return language;
    }

    public SentenceParser parser() {
        return parser;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    public Recognition recognize(final String sentence) {
        final List<String> tokens = Tokenizer.tokenize(sentence);
        final ParseResult result = parser.parse(tokens);
        return new Recognition(sentence, tokens, result, TreeBuilder.buildTree(result));
    }

    public Recognition writeRecognition(final String sentence, final boolean showTree, final PrintStream output) {
        final Recognition recognition = recognize(sentence);
        output.printf("Sentence: %s%n", sentence);
        writeOutcome(recognition, showTree, output);
        return recognition;
    }

    private void writeOutcome(final Recognition recognition, final boolean showTree, final PrintStream output) {
        output.printf("Result: %s%n", recognition.accepted() ? "ACCEPTED" : "REJECTED");
        output.printf("Time: %s%n", toSeconds(recognition.result().elapsed()));

        if (recognition.accepted()) {
            if (showTree) {
                output.println("Parse tree:");
                output.print(TreePrinter.indented(recognition.tree()));
            }
            return;
        }

        final List<String> unknownWords = vocabulary.unknownWords(recognition.tokens());
        if (recognition.tokens().isEmpty()) {
            output.println("Reason: empty sentence");
        } else if (!unknownWords.isEmpty()) {
            output.printf("Reason: unknown words %s%n", String.join(", ", unknownWords));
        } else {
            output.println("Reason: no derivation from the start symbol");
        }
    }

    public void showVocabulary(final PrintStream output) {
        output.printf("Vocabulary of '%s'%n", language.name());
        for (final Map.Entry<NonTerminal, List<String>> category : vocabulary.categories().entrySet()) {
            output.printf("  %s: %s%n", category.getKey(), String.join(", ", category.getValue()));
        }
    }

    public void showGrammar(final PrintStream output) {
        output.printf("Grammar of '%s', start symbol %s%n", language.name(), language.grammar().start());
        language.grammar().formatRules(false).forEach(line -> output.printf("  %s%n", line));
    }

    public void showCnfGrammar(final PrintStream output) {
        final CnfGrammar cnfGrammar = parser.grammar();
        output.printf("Chomsky Normal Form of '%s', start symbol %s%n", language.name(), cnfGrammar.start());
        cnfGrammar.grammar().formatRules(true).forEach(line -> output.printf("  %s%n", line));
    }

    // returns the number of examples whose outcome differs from the expectation
    public int runExamples(final boolean showTrees, final PrintStream output) {
        final List<ExampleSentence> examples = language.examples();
        int mismatches = 0;
        for (int i = 0; i < examples.size(); i++) {
            final ExampleSentence example = examples.get(i);
            output.printf("[Example %d] %s%n", i + 1, example.sentence());
            output.printf("Expected: %s%n", example.expectedAccepted() ? "ACCEPTED" : "REJECTED");

            final Recognition recognition = recognize(example.sentence());
            writeOutcome(recognition, showTrees, output);
            if (recognition.accepted() != example.expectedAccepted()) {
                mismatches++;
                output.println("!! Outcome differs from expectation");
                LOG.warn("Example '{}' expected accepted={} but was accepted={}", example.sentence(), example.expectedAccepted(), recognition.accepted());
            }
            output.println(SEPARATOR);
        }
        output.printf("%d of %d examples as expected%n", examples.size() - mismatches, examples.size());
        return mismatches;
    }

    // reads sentences until an empty line, "exit" or end of input, returns the number of sentences parsed
    public int interactive(final BufferedReader input, final boolean showTrees, final PrintStream output) throws IOException {
        output.printf("Enter sentences for '%s', an empty line or '%s' stops%n", language.name(), EXIT_COMMAND);
        int count = 0;
        while (true) {
            output.printf("#%d> ", count + 1);
            output.flush();
            final String line = input.readLine();
            if (line == null || line.isBlank() || line.strip().equalsIgnoreCase(EXIT_COMMAND)) {
                break;
            }
            count++;
            writeRecognition(line.strip(), showTrees, output);
            output.println(SEPARATOR);
        }
        output.printf("%nSentences parsed: %d%n", count);
        return count;
    }
}
