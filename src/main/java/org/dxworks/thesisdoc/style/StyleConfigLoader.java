package org.dxworks.thesisdoc.style;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Reads a {@link StyleConfig} from a YAML ({@code .yml}, {@code .yaml}) or JSON
 * file. Problems are reported as warnings and yield an empty result, so the
 * caller continues with the built-in defaults.
 */
public class StyleConfigLoader {

    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private final PrintStream warnings;

    public StyleConfigLoader() {
        this(System.err);
    }

    public StyleConfigLoader(PrintStream warnings) {
        this.warnings = warnings;
    }

    public Optional<StyleConfig> load(Path configPath) {
        if (configPath == null) {
            return Optional.empty();
        }
        Path absolutePath = configPath.toAbsolutePath();
        if (!Files.exists(absolutePath)) {
            warnings.println("Config file not found: " + absolutePath);
            return Optional.empty();
        }

        try {
            String content = Files.readString(absolutePath, StandardCharsets.UTF_8);
            if (content.isBlank()) {
                return Optional.of(StyleConfig.empty());
            }
            StyleConfig config = mapperFor(absolutePath).readValue(content, StyleConfig.class);
            return Optional.of(config != null ? config : StyleConfig.empty());
        } catch (IOException e) {
            warnings.println("Failed to read config: " + e.getMessage());
            return Optional.empty();
        }
    }

    static boolean isYaml(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return fileName.endsWith(".yml") || fileName.endsWith(".yaml");
    }

    private static ObjectMapper mapperFor(Path path) {
        return isYaml(path) ? YAML_MAPPER : JSON_MAPPER;
    }
}
