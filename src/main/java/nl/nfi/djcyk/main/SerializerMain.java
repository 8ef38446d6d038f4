package nl.nfi.djcyk.main;

import nl.nfi.djcyk.serialize.LanguageSerializerCli;
import picocli.CommandLine;

public final class SerializerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new LanguageSerializerCli()).execute(args);
        System.exit(exitCode);
    }
}
