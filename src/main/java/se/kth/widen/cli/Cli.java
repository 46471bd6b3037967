package se.kth.widen.cli;

import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.concurrent.Callable;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import se.kth.widen.conflict.ConflictRegionParser;
import se.kth.widen.expand.ConflictExpander;
import se.kth.widen.syntax.LanguageId;
import se.kth.widen.util.LazyLogger;
import se.kth.widen.util.LineBasedMerge;
import se.kth.widen.util.Pair;

/**
 * Command line interface for widening conflict markers.
 *
 * @author Simon Larsén
 */
public class Cli {
    private static final LazyLogger LOGGER = new LazyLogger(Cli.class);

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Widen()).execute(args);
        System.exit(exitCode);
    }

    @CommandLine.Command(
            name = "widen",
            mixinStandardHelpOptions = true,
            description = "Widen merge conflict markers to syntactic boundaries.",
            versionProvider = WidenVersionProvider.class,
            subcommands = {Expand.class, Merge.class})
    static class Widen implements Runnable {
        @CommandLine.Spec CommandLine.Model.CommandSpec spec;

        @Override
        public void run() {
            throw new CommandLine.ParameterException(
                    spec.commandLine(), "Missing required subcommand");
        }
    }

    /** Options shared by the subcommands. */
    abstract static class WidenCommand implements Callable<Integer> {
        @CommandLine.Option(
                names = {"-l", "--language"},
                description =
                        "Language of the input, e.g. java. Detected from the file extension if"
                                + " omitted.")
        String language;

        @CommandLine.Option(
                names = {"-o", "--output"},
                description = "Path to the output file. Existing files are overwritten.")
        File out;

        @CommandLine.Option(
                names = {"--logging"},
                description = "Enable logging output")
        boolean logging;

        @CommandLine.Spec CommandLine.Model.CommandSpec spec;

        LanguageId resolveLanguage(Path input) {
            if (language != null) {
                return LanguageId.of(language);
            }
            return LanguageId.fromFileName(input.getFileName().toString())
                    .orElseThrow(
                            () ->
                                    new CommandLine.ParameterException(
                                            spec.commandLine(),
                                            "Cannot detect the language of "
                                                    + input
                                                    + ", use --language"));
        }

        int writeResult(String content) throws IOException {
            if (out != null) {
                LOGGER.info(() -> "Writing result to " + out);
                Files.write(
                        out.toPath(),
                        content.getBytes(StandardCharsets.UTF_8),
                        StandardOpenOption.CREATE,
                        StandardOpenOption.WRITE,
                        StandardOpenOption.TRUNCATE_EXISTING);
            } else {
                System.out.print(content);
            }
            return ConflictRegionParser.countConflicts(content) % 127;
        }

        void configureLogging() {
            if (logging) {
                setLogLevel("DEBUG");
            }
        }
    }

    @CommandLine.Command(
            name = "expand",
            mixinStandardHelpOptions = true,
            description = "Widen the conflict markers of a conflicted file.")
    static class Expand extends WidenCommand {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "FILE",
                description = "Path to a file with conflict markers")
        File file;

        @Override
        public Integer call() throws IOException {
            configureLogging();
            Path path = file.toPath();
            LanguageId lang = resolveLanguage(path);

            String content = read(path);
            String expanded = new ConflictExpander().expandConflicts(content, lang);
            return writeResult(expanded);
        }
    }

    @CommandLine.Command(
            name = "merge",
            mixinStandardHelpOptions = true,
            description =
                    "Merge three revisions line by line, then widen the markers of the conflicts.")
    static class Merge extends WidenCommand {
        @CommandLine.Parameters(
                index = "0",
                paramLabel = "LEFT",
                description = "Path to the left revision")
        File left;

        @CommandLine.Parameters(
                index = "1",
                paramLabel = "BASE",
                description = "Path to the base revision")
        File base;

        @CommandLine.Parameters(
                index = "2",
                paramLabel = "RIGHT",
                description = "Path to the right revision")
        File right;

        @Override
        public Integer call() throws IOException {
            configureLogging();
            long start = System.nanoTime();
            LanguageId lang = resolveLanguage(left.toPath());

            Pair<String, Integer> merged =
                    LineBasedMerge.merge(
                            read(base.toPath()), read(left.toPath()), read(right.toPath()));
            String expanded = merged.first;
            if (merged.second > 0) {
                expanded = new ConflictExpander().expandConflicts(merged.first, lang);
            }

            LOGGER.info(
                    () ->
                            "Total time elapsed: "
                                    + (double) (System.nanoTime() - start) / 1e9
                                    + " seconds");
            return writeResult(expanded);
        }
    }

    static String read(Path path) throws IOException {
        return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    }

    private static void setLogLevel(String level) {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        JoranConfigurator jc = new JoranConfigurator();
        jc.setContext(context);
        context.reset();
        context.putProperty("root-level", level);
        try {
            jc.doConfigure(
                    Objects.requireNonNull(Cli.class.getClassLoader().getResource("logback.xml")));
        } catch (JoranException e) {
            LOGGER.error(() -> "Failed to set log level");
        }
    }
}
