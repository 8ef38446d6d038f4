package nl.nfi.djcyk.serialize;

import nl.nfi.djcyk.grammar.Grammar;
import nl.nfi.djcyk.grammar.NonTerminal;
import nl.nfi.djcyk.grammar.Production;
import nl.nfi.djcyk.grammar.Symbol;
import nl.nfi.djcyk.grammar.Terminal;
import nl.nfi.djcyk.serialize.common.JreTypeCodec;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static nl.nfi.djcyk.serialize.GrammarCodec.Decoder;
import static nl.nfi.djcyk.serialize.GrammarCodec.Encoder;

sealed class GrammarCodec permits Encoder, Decoder {

    private static final byte TERMINAL = 0;
    private static final byte NON_TERMINAL = 1;

    public static Encoder encodeUsing(final JreTypeCodec.Encoder encoder) {
        return new Encoder(encoder);
    }

    public static Decoder decodeUsing(final JreTypeCodec.Decoder decoder) {
        return new Decoder(decoder);
    }

    public static final class Encoder extends GrammarCodec {

        private final JreTypeCodec.Encoder encoder;

        private Encoder(final JreTypeCodec.Encoder encoder) {
            this.encoder = encoder;
        }

        public void write(final Grammar grammar) throws IOException {
            encoder.writeString(grammar.start().name());
            encoder.writeMap(grammar.rules(),
                    nonTerminal -> encoder.writeString(nonTerminal.name()),
                    productions -> encoder.writeList(productions,
                            production -> encoder.writeList(production.symbols(), this::writeSymbol)));
        }

        private void writeSymbol(final Symbol symbol) throws IOException {
            encoder.writeByte(symbol instanceof Terminal ? TERMINAL : NON_TERMINAL);
            encoder.writeString(symbol.text());
        }
    }

    public static final class Decoder extends GrammarCodec {

        private final JreTypeCodec.Decoder decoder;

        private Decoder(final JreTypeCodec.Decoder decoder) {
            this.decoder = decoder;
        }

        public Grammar read() throws IOException {
            final NonTerminal start = new NonTerminal(decoder.readString());
            final Map<NonTerminal, List<Production>> rules = decoder.readMap(
                    () -> new NonTerminal(decoder.readString()),
                    () -> decoder.readList(() -> new Production(decoder.readList(this::readSymbol))));
            return Grammar.create(start, rules);
        }

        private Symbol readSymbol() throws IOException {
            final byte tag = decoder.readByte();
            final String text = decoder.readString();
            return switch (tag) {
                case TERMINAL -> new Terminal(text);
                case NON_TERMINAL -> new NonTerminal(text);
                default -> throw new IOException("Unknown symbol tag: %d".formatted(tag));
            };
        }
    }
}
