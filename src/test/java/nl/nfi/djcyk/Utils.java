package nl.nfi.djcyk;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.cnf.CnfNormalizer;
import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Grammars;
import nl.nfi.djcyk.recognize.Tokenizer;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static java.nio.charset.StandardCharsets.UTF_8;

public final class Utils {

    public static final Path TEST_RESOURCES_PATH = Paths.get("src/test/resources").toAbsolutePath();

    // the bundled English grammar, written out in rule notation
    public static final Map<String, List<String>> ENGLISH_RULES = englishRules();

    private Utils() {
    }

    public static Path grammarPath(final String name) {
        return TEST_RESOURCES_PATH.resolve("grammars").resolve(name);
    }

    // rules given as "A", "B C | 'x'", "B", "'y'", ...
    public static Grammar grammar(final String start, final String... rules) {
        final Map<String, List<String>> parsed = new LinkedHashMap<>();
        for (int i = 0; i < rules.length; i += 2) {
            parsed.put(rules[i], List.of(rules[i + 1].split("\\|", -1)));
        }
        return Grammars.fromRules(start, parsed);
    }

    public static Grammar english() {
        return Grammars.fromRules("S", ENGLISH_RULES);
    }

    public static CnfGrammar englishCnf() {
        return CnfNormalizer.normalize(english());
    }

    public static List<String> tokens(final String sentence) {
        return Tokenizer.tokenize(sentence);
    }

    public static String capture(final Consumer<PrintStream> writer) {
        final ByteArrayOutputStream output = new ByteArrayOutputStream();
        try (final PrintStream stream = new PrintStream(output, true, UTF_8)) {
            writer.accept(stream);
        }
        return output.toString(UTF_8);
    }

    private static Map<String, List<String>> englishRules() {
        final Map<String, List<String>> rules = new LinkedHashMap<>();
        rules.put("S", List.of("NP VP"));
        rules.put("VP", List.of("VP PP", "V NP", "'cooks'", "'drinks'", "'eats'", "'cuts'"));
        rules.put("PP", List.of("P NP"));
        rules.put("NP", List.of("Det N", "'he'", "'she'"));
        rules.put("V", List.of("'cooks'", "'drinks'", "'eats'", "'cuts'"));
        rules.put("P", List.of("'in'", "'with'"));
        rules.put("N", List.of("'cat'", "'dog'", "'beer'", "'cake'", "'juice'", "'meat'", "'soup'", "'fork'", "'knife'", "'oven'", "'spoon'"));
        rules.put("Det", List.of("'a'", "'the'"));
        return rules;
    }
}
