package nl.nfi.djcyk.serialize;

import nl.nfi.djcyk.cnf.CnfGrammar;
import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.recognize.ExampleSentence;
import nl.nfi.djcyk.recognize.Language;
import nl.nfi.djcyk.serialize.common.JreTypeCodec;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.FileInputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;
import java.util.List;

import static nl.nfi.djcyk.serialize.LanguageCodec.Decoder;
import static nl.nfi.djcyk.serialize.LanguageCodec.Encoder;

/**
 * Binary form of a {@link Language}: the grammar as written, its normal form and its example sentences.
 * Loading a compiled language skips normalization.
 */
public abstract sealed class LanguageCodec implements Closeable permits Encoder, Decoder {

    private static final String MAGIC = "cyk";

    public static Encoder forOutput(final OutputStream output) {
        return new Encoder(JreTypeCodec.forOutput(output));
    }

    public static Encoder forOutput(final Path path) throws IOException {
        return new Encoder(JreTypeCodec.forOutput(new BufferedOutputStream(new FileOutputStream(path.toFile()))));
    }

    public static Decoder forInput(final Path path) throws IOException {
        return new Decoder(JreTypeCodec.forInput(new BufferedInputStream(new FileInputStream(path.toFile()))));
    }

    public static Decoder forInput(final InputStream input) {
        return new Decoder(JreTypeCodec.forInput(input));
    }

    public static final class Encoder extends LanguageCodec {

        private final JreTypeCodec.Encoder encoder;

        private Encoder(final JreTypeCodec.Encoder encoder) {
            this.encoder = encoder;
        }

        public void write(final Language language) throws IOException {
            encoder.writeString(MAGIC);
            encoder.writeString(Config.SERIALIZED_FORMAT_VERSION);

            encoder.writeString(language.name());
            encoder.writeString(language.description());

            GrammarCodec.encodeUsing(encoder).write(language.grammar());

            final CnfGrammar cnfGrammar = language.cnfGrammar();
            encoder.writeString(cnfGrammar.sourceStart().name());
            GrammarCodec.encodeUsing(encoder).write(cnfGrammar.grammar());

            encoder.writeList(language.examples(), example -> {
                encoder.writeString(example.sentence());
                encoder.writeBoolean(example.expectedAccepted());
            });
            encoder.flush();
        }

        @Override
        public void close() throws IOException {
            encoder.close();
        }
    }

    public static final class Decoder extends LanguageCodec {

        private final JreTypeCodec.Decoder decoder;

        private Decoder(final JreTypeCodec.Decoder decoder) {
            this.decoder = decoder;
        }

        public Language read() throws IOException {
            final String magic = decoder.readString();
            if (!magic.equals(MAGIC)) {
                throw new UnsupportedOperationException("Not a compiled language: %s".formatted(magic));
            }

            final String version = decoder.readString();
            if (!version.equals(Config.SERIALIZED_FORMAT_VERSION)) {
                throw new UnsupportedOperationException("Unsupported format version: %s".formatted(version));
            }

            final String name = decoder.readString();
            final String description = decoder.readString();
            final Grammar grammar = GrammarCodec.decodeUsing(decoder).read();

            final NonTerminal sourceStart = new NonTerminal(decoder.readString());
            final CnfGrammar cnfGrammar = new CnfGrammar(GrammarCodec.decodeUsing(decoder).read(), sourceStart);

            final List<ExampleSentence> examples = decoder.readList(() -> new ExampleSentence(decoder.readString(), decoder.readBoolean()));
            return Language.compiled(name, description, grammar, examples, cnfGrammar);
        }

        @Override
        public void close() throws IOException {
            decoder.close();
        }
    }
}
