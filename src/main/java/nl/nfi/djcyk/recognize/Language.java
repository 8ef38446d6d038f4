package nl.nfi.djcyk.recognize;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.cnf.CnfNormalizer;
import nl.nfi.djcyk.common.ini.IniConfig;
import nl.nfi.djcyk.common.ini.IniSection;
import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.Grammars;
import nl.nfi.djcyk.grammar.MalformedGrammarException;
import nl.nfi.djcyk.serialize.LanguageCodec;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static java.nio.file.Files.exists;

// a named grammar with its example sentences, loaded from an INI grammar file or a compiled .cyk file
public final class Language {

    public static final String COMPILED_EXTENSION = ".cyk";

    static final String DEFAULT_RESOURCE = "/grammars/english.ini";

    private static final String LANGUAGE_SECTION = "LANGUAGE";
    private static final String RULES_SECTION = "RULES";
    private static final String EXAMPLES_SECTION = "EXAMPLES";

    private final String name;
    private final String description;
    private final Grammar grammar;
    private final List<ExampleSentence> examples;

    private CnfGrammar cnfGrammar;

    private Language(final String name, final String description, final Grammar grammar, final List<ExampleSentence> examples, final CnfGrammar cnfGrammar) {
        this.name = name;
        this.description = description;
        this.grammar = grammar;
        this.examples = List.copyOf(examples);
        this.cnfGrammar = cnfGrammar;
    }

    public static Language create(final String name, final String description, final Grammar grammar, final List<ExampleSentence> examples) {
        return new Language(name, description, grammar, examples, null);
    }

    public static Language compiled(final String name, final String description, final Grammar grammar, final List<ExampleSentence> examples, final CnfGrammar cnfGrammar) {
        return new Language(name, description, grammar, examples, cnfGrammar);
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Grammar grammar() {
        return grammar;
    }

    public List<ExampleSentence> examples() {
        return examples;
    }

    public synchronized boolean isNormalized() {
        return cnfGrammar != null;
    }

    // normalizes on first use
    public synchronized CnfGrammar cnfGrammar() {
        if (cnfGrammar == null) {
            cnfGrammar = CnfNormalizer.normalize(grammar);
        }
        return cnfGrammar;
    }

    public static Language loadFrom(final Path path) throws IOException {
        if (!exists(path)) {
            throw new IllegalArgumentException("Grammar path does not exist: %s".formatted(path));
        }
        // compiled languages are already normalized
        if (path.getFileName().toString().endsWith(COMPILED_EXTENSION)) {
            try (final LanguageCodec.Decoder decoder = LanguageCodec.forInput(path)) {
                return decoder.read();
            }
        }
        return fromIni(IniConfig.loadFrom(path), path.toString());
    }

    public static Language loadDefault() throws IOException {
        try (final InputStream input = Language.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (input == null) {
                throw new IllegalStateException("Bundled grammar missing: %s".formatted(DEFAULT_RESOURCE));
            }
            return fromIni(IniConfig.loadFrom(input), DEFAULT_RESOURCE);
        }
    }

    static Language fromIni(final IniConfig ini, final String origin) {
        for (final String section : List.of(LANGUAGE_SECTION, RULES_SECTION)) {
            if (!ini.hasSection(section)) {
                throw new MalformedGrammarException("Grammar file %s has no [%s] section".formatted(origin, section));
            }
        }

        try {
            final IniSection language = ini.getSection(LANGUAGE_SECTION);
            final IniSection rules = ini.getSection(RULES_SECTION);

            final Map<String, List<String>> productions = new LinkedHashMap<>();
            for (final String nonTerminal : rules.keys()) {
                productions.put(nonTerminal, rules.getStringList(nonTerminal));
            }
            final Grammar grammar = Grammars.fromRules(language.getString("start"), productions);

            final List<ExampleSentence> examples = new ArrayList<>();
            if (ini.hasSection(EXAMPLES_SECTION)) {
                final IniSection section = ini.getSection(EXAMPLES_SECTION);
                if (section.hasKey("accepted")) {
                    section.getStringList("accepted").forEach(sentence -> examples.add(new ExampleSentence(sentence, true)));
                }
                if (section.hasKey("rejected")) {
                    section.getStringList("rejected").forEach(sentence -> examples.add(new ExampleSentence(sentence, false)));
                }
            }

            return create(language.getString("name", "unnamed"), language.getString("description", ""), grammar, examples);
        } catch (final MalformedGrammarException e) {
            throw e;
        } catch (final IllegalArgumentException e) {
            throw new MalformedGrammarException("Invalid grammar file %s: %s".formatted(origin, e.getMessage()), e);
        }
    }
}
