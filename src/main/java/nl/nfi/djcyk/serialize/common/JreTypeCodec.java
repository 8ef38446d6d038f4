package nl.nfi.djcyk.serialize.common;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import static java.nio.charset.StandardCharsets.UTF_8;
import static nl.nfi.djcyk.serialize.common.JreTypeCodec.Decoder;
import static nl.nfi.djcyk.serialize.common.JreTypeCodec.Encoder;

// varint and length prefixed UTF-8 building blocks of the binary formats
public abstract sealed class JreTypeCodec implements Closeable permits Encoder, Decoder {

    public static Encoder forOutput(final OutputStream output) {
        return new Encoder(output);
    }

    public static Decoder forInput(final InputStream input) {
        return new Decoder(input);
    }

    public static final class Encoder extends JreTypeCodec {

        private final OutputStream output;

        Encoder(final OutputStream output) {
            this.output = output;
        }

        public void writeString(final String value) throws IOException {
            final byte[] bytes = value.getBytes(UTF_8);
            writeVarInt(bytes.length);
            output.write(bytes);
        }

        public void writeByte(final byte value) throws IOException {
            output.write(value);
        }

        public void writeBoolean(final boolean value) throws IOException {
            output.write(value ? 1 : 0);
        }

        public void writeVarInt(final int value) throws IOException {
            if (value < 0) {
                throw new IllegalArgumentException("Negative varint: %d".formatted(value));
            }
            int bits = value;
            while ((bits & ~0x7f) != 0) {
                output.write(bits & 0x7f | 0x80);
                bits >>>= 7;
            }
            output.write(bits);
        }

        public <T> void writeList(final List<T> values, final DelegateWriter<T> valueWriter) throws IOException {
            writeVarInt(values.size());
            for (final T value : values) {
                valueWriter.write(value);
            }
        }

        public <K, V> void writeMap(final Map<K, V> values, final DelegateWriter<K> keyWriter, final DelegateWriter<V> valueWriter) throws IOException {
            writeVarInt(values.size());
            for (final Entry<K, V> entry : values.entrySet()) {
                keyWriter.write(entry.getKey());
                valueWriter.write(entry.getValue());
            }
        }

        public void flush() throws IOException {
            output.flush();
        }

        @Override
        public void close() throws IOException {
            output.close();
        }
    }

    public static final class Decoder extends JreTypeCodec {

        private final InputStream input;

        Decoder(final InputStream input) {
            this.input = input;
        }

        public String readString() throws IOException {
            final int length = readVarInt();
            final byte[] bytes = input.readNBytes(length);
            if (bytes.length != length) {
                throw new EOFException("Expected %d bytes of string data, got %d".formatted(length, bytes.length));
            }
            return new String(bytes, UTF_8);
        }

        public byte readByte() throws IOException {
            return (byte) readUnsignedByte();
        }

        public boolean readBoolean() throws IOException {
            final int value = readUnsignedByte();
            if (value > 1) {
                throw new IOException("Invalid boolean value: %d".formatted(value));
            }
            return value == 1;
        }

        public int readUnsignedByte() throws IOException {
            final int read = input.read();
            if (read == -1) {
                throw new EOFException("End of stream reached");
            }
            return read;
        }

        public int readVarInt() throws IOException {
            int value = 0;
            for (int shift = 0; shift < 32; shift += 7) {
                final int b = readUnsignedByte();
                value |= (b & 0x7f) << shift;
                if ((b & 0x80) == 0) {
                    return value;
                }
            }
            throw new IOException("Varint too long");
        }

        public <T> List<T> readList(final DelegateReader<T> valueReader) throws IOException {
            final int size = readVarInt();
            final List<T> values = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                values.add(valueReader.read());
            }
            return values;
        }

        public <K, V> Map<K, V> readMap(final DelegateReader<K> keyReader, final DelegateReader<V> valueReader) throws IOException {
            final int size = readVarInt();
            final Map<K, V> values = new LinkedHashMap<>(size);
            for (int i = 0; i < size; i++) {
                values.put(keyReader.read(), valueReader.read());
            }
            return values;
        }

        @Override
        public void close() throws IOException {
            input.close();
        }
    }
}
