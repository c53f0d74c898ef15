package com.openworkout.owf.tools;

import com.openworkout.owf.Owf;
import com.openworkout.owf.Version;
import com.openworkout.owf.ast.Document;
import com.openworkout.owf.loader.LoaderException;
import com.openworkout.owf.loader.LoaderMessage;
import com.openworkout.owf.loader.LoaderResult;
import com.openworkout.owf.loader.OwfLoader;
import com.openworkout.owf.resolve.OwfResolveException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command-line front end: loads each file, optionally resolves it, and prints an outline, the
 * canonical text or a JSON tree.
 */
public final class OwfCli {
    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE =
            "Usage: owf [--resolve] [--var NAME=VALUE]... [--dump | --json] <file>...";

    private enum Output {
        OUTLINE,
        DUMP,
        JSON
    }

    private record Options(
            boolean resolve, Map<String, String> variables, Output output, List<Path> files) {}

    private static final class UsageException extends Exception {
        UsageException(String message) {
            super(message);
        }
    }

    private OwfCli() {}

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        for (String arg : args) {
            if ("--version".equals(arg)) {
                out.println("owf " + Version.RUNTIME);
                return EXIT_OK;
            }
            if ("--help".equals(arg) || "-h".equals(arg)) {
                out.println(USAGE);
                return EXIT_OK;
            }
        }
        Options options;
        try {
            options = parseOptions(args);
        } catch (UsageException e) {
            err.println("owf: " + e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        OwfLoader loader = new OwfLoader();
        for (Path file : options.files()) {
            Document document;
            try {
                LoaderResult result = loader.load(file);
                for (LoaderMessage message : result.getMessages()) {
                    err.println(message);
                }
                document = result.getDocument();
                if (options.resolve()) {
                    Map<String, String> variables = new LinkedHashMap<>(document.getMetadata());
                    variables.putAll(options.variables());
                    document = Owf.resolve(document, variables);
                }
            } catch (LoaderException | OwfResolveException e) {
                err.println("Error: " + e.getMessage());
                return EXIT_FAILURE;
            }
            switch (options.output()) {
                case DUMP -> out.print(Owf.dumps(document));
                case JSON -> out.println(AstJsonWriter.write(document));
                case OUTLINE -> new OutlinePrinter(out).print(document);
            }
        }
        return EXIT_OK;
    }

    private static Options parseOptions(String[] args) throws UsageException {
        boolean resolve = false;
        Map<String, String> variables = new LinkedHashMap<>();
        Output output = Output.OUTLINE;
        List<Path> files = new ArrayList<>();
        boolean optionsDone = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (optionsDone || !arg.startsWith("--")) {
                files.add(Path.of(arg));
                continue;
            }
            switch (arg) {
                case "--" -> optionsDone = true;
                case "--resolve" -> resolve = true;
                case "--var" -> {
                    if (i + 1 >= args.length) {
                        throw new UsageException("--var needs NAME=VALUE");
                    }
                    addVariable(variables, args[++i]);
                }
                case "--dump", "--json" -> {
                    Output requested = "--dump".equals(arg) ? Output.DUMP : Output.JSON;
                    if (output != Output.OUTLINE && output != requested) {
                        throw new UsageException("--dump and --json are mutually exclusive");
                    }
                    output = requested;
                }
                default -> {
                    if (arg.startsWith("--var=")) {
                        addVariable(variables, arg.substring("--var=".length()));
                    } else {
                        throw new UsageException("Unknown option: " + arg);
                    }
                }
            }
        }
        if (files.isEmpty()) {
            throw new UsageException("No input files");
        }
        return new Options(resolve, variables, output, files);
    }

    private static void addVariable(Map<String, String> variables, String assignment)
            throws UsageException {
        int eq = assignment.indexOf('=');
        if (eq <= 0 || eq == assignment.length() - 1) {
            throw new UsageException("Invalid --var '" + assignment + "', expected NAME=VALUE");
        }
        variables.put(assignment.substring(0, eq).trim(), assignment.substring(eq + 1).trim());
    }
}
