package nl.nfi.djcyk.serialize;

import nl.nfi.djcyk.recognize.Language;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.Callable;

import static java.nio.file.Files.size;
import static nl.nfi.djcyk.common.Formatting.toHumanReadableSize;
import static picocli.CommandLine.Command;
import static picocli.CommandLine.ExitCode;
import static picocli.CommandLine.Option;

@Command(name = "cyk_serializer", description = "Compile a grammar file into a binary language with its normal form")
public class LanguageSerializerCli implements Callable<Integer> {

    private static final Logger LOG = LoggerFactory.getLogger(LanguageSerializerCli.class);

    @Option(names = {"--input"}, description = "The grammar file to compile", required = true)
    private String inputPath;

    @Option(names = {"--output"}, description = "The file to write the compiled language to (defaults to [inputPath].cyk)")
    private String outputPath = null;

    @Override
    public Integer call() throws Exception {
        final Path output = Paths.get(this.outputPath == null
                ? inputPath + Language.COMPILED_EXTENSION
                : this.outputPath);

        try {
            final Language language = Language.loadFrom(Paths.get(inputPath));
            try (final LanguageCodec.Encoder encoder = LanguageCodec.forOutput(output)) {
                encoder.write(language);
            }
            LOG.info("Compiled language {} to {} ({})", language.name(), output, toHumanReadableSize(size(output)));
            return ExitCode.OK;
        }
        catch (final Throwable t) {
            LOG.error("Fatal error", t);
            System.err.println("Fatal error: " + t.getMessage());
            return ExitCode.SOFTWARE;
        }
    }
}
