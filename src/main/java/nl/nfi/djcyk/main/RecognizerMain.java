package nl.nfi.djcyk.main;

import nl.nfi.djcyk.recognize.RecognizerCli;
import picocli.CommandLine;

public final class RecognizerMain {

    public static void main(final String... args) {
        final int exitCode = new CommandLine(new RecognizerCli()).execute(args);
        System.exit(exitCode);
    }
}
