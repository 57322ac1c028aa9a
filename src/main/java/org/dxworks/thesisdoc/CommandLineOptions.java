package org.dxworks.thesisdoc;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parsed command line: {@code <input.md> [-o|--output <file>] [--header <text>]
 * [--config <file>] [--no-pandoc]}.
 */
public class CommandLineOptions {

    private final Path input;
    private final Path output;
    private final String header;
    private final Path config;
    private final boolean pandocEnabled;

    private CommandLineOptions(Path input, Path output, String header, Path config, boolean pandocEnabled) {
        this.input = input;
        this.output = output;
        this.header = header;
        this.config = config;
        this.pandocEnabled = pandocEnabled;
    }

    public static CommandLineOptions parse(String[] args) {
        Path input = null;
        Path output = null;
        String header = null;
        Path config = null;
        boolean pandocEnabled = true;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "-o", "--output" -> output = Paths.get(valueOf(args, ++i, arg));
                case "--header" -> header = valueOf(args, ++i, arg);
                case "--config" -> config = Paths.get(valueOf(args, ++i, arg));
                case "--no-pandoc" -> pandocEnabled = false;
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    if (input != null) {
                        throw new IllegalArgumentException("Unexpected argument: " + arg);
                    }
                    input = Paths.get(arg);
                }
            }
        }

        if (input == null) {
            throw new IllegalArgumentException("Missing input Markdown file");
        }
        return new CommandLineOptions(input, output, header, config, pandocEnabled);
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }

    public Path getInput() {
        return input;
    }

    /** Null when the output should be derived from the input name. */
    public Path getOutput() {
        return output;
    }

    public String getHeader() {
        return header;
    }

    public Path getConfig() {
        return config;
    }

    public boolean isPandocEnabled() {
        return pandocEnabled;
    }
}
