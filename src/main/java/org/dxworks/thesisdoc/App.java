package org.dxworks.thesisdoc;

import org.dxworks.thesisdoc.convert.ExecutableLocator;
import org.dxworks.thesisdoc.convert.FallbackConverter;
import org.dxworks.thesisdoc.convert.LibreOfficeConverter;
import org.dxworks.thesisdoc.convert.PandocConverter;
import org.dxworks.thesisdoc.style.StyleConfig;
import org.dxworks.thesisdoc.style.StyleConfigLoader;
import org.dxworks.thesisdoc.style.StyleResolver;
import org.dxworks.thesisdoc.style.StyleSheet;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

public class App {

    public static final int EXIT_OK = 0;
    public static final int EXIT_CONVERSION_FAILED = 1;
    public static final int EXIT_USAGE = 2;
    public static final int EXIT_DOC_EXPORT_FAILED = 3;

    public static void main(String[] args) {
        System.exit(run(args, System.out, System.err, new ExecutableLocator()));
    }

    public static int run(String[] args, PrintStream out, PrintStream err, ExecutableLocator locator) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (IllegalArgumentException e) {
            err.println("Error: " + e.getMessage());
            printUsage(err);
            return EXIT_USAGE;
        }

        Path input = options.getInput().toAbsolutePath();
        if (!Files.isRegularFile(input)) {
            err.println("Error: Input file does not exist: " + input);
            return EXIT_USAGE;
        }

        Path output = options.getOutput() != null
                ? options.getOutput().toAbsolutePath()
                : OutputFormatDetector.withExtension(input, OutputFormat.DOCX);
        Optional<OutputFormat> formatOpt = OutputFormatDetector.detectFormat(output);
        if (formatOpt.isEmpty()) {
            err.println("Error: Only .docx or .doc output is supported: " + output);
            return EXIT_USAGE;
        }
        OutputFormat format = formatOpt.get();
        Path docxTarget = format == OutputFormat.DOCX ? output : OutputFormatDetector.withExtension(output, OutputFormat.DOCX);

        Optional<StyleConfig> config = new StyleConfigLoader(err).load(options.getConfig());
        StyleSheet styleSheet = StyleResolver.resolve(config.orElse(null));

        out.println("Converting " + input.getFileName() + "...");
        boolean converted = false;
        if (options.isPandocEnabled()) {
            converted = new PandocConverter(styleSheet, options.getHeader(), locator, err).convert(input, docxTarget);
        }
        if (!converted) {
            try {
                new FallbackConverter(styleSheet, options.getHeader()).convert(input, docxTarget);
            } catch (IOException | RuntimeException e) {
                err.println("Fallback conversion failed: " + e.getMessage());
                return EXIT_CONVERSION_FAILED;
            }
        }

        if (format == OutputFormat.DOC) {
            // The intermediate .docx is kept next to the .doc
            if (!new LibreOfficeConverter(locator, err).convertToDoc(docxTarget, output)) {
                err.println("The .docx file was generated, but the .doc export failed (requires LibreOffice)");
                return EXIT_DOC_EXPORT_FAILED;
            }
        }

        out.println("Conversion complete: " + (format == OutputFormat.DOC ? output : docxTarget));
        return EXIT_OK;
    }

    private static void printUsage(PrintStream err) {
        err.println("Usage: java -jar thesisdoc.jar <input.md> [-o <output.docx|output.doc>] [--header <text>] [--config <style.yml|style.json>] [--no-pandoc]");
        err.println("  <input.md>:     Markdown file to convert");
        err.println("  -o, --output:   Output file, defaults to <input>.docx next to the input");
        err.println("  --header:       Page header text, overrides the header text of the config");
        err.println("  --config:       Style configuration (YAML or JSON)");
        err.println("  --no-pandoc:    Always use the built-in renderer");
    }
}
