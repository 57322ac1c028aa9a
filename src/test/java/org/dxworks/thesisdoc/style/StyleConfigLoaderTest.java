package org.dxworks.thesisdoc.style;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class StyleConfigLoaderTest {

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream warnings = new ByteArrayOutputStream();
    private final StyleConfigLoader loader = new StyleConfigLoader(new PrintStream(warnings, true, StandardCharsets.UTF_8));

    @Test
    void load_Yaml() throws IOException {
        Path config = write("style.yml", String.join("\n",
                "page:",
                "  width_mm: 200",
                "normal:",
                "  chinese: KaiTi",
                "  line_spacing_pt: 22",
                "headings:",
                "  \"Heading 1\":",
                "    size_pt: 18",
                "    align: LEFT",
                "header:",
                "  text: 本科毕业论文",
                ""));

        StyleConfig loaded = loader.load(config).orElseThrow();

        assertEquals(200.0, loaded.page.widthMm);
        assertNull(loaded.page.heightMm);
        assertEquals("KaiTi", loaded.normal.chinese);
        assertEquals(22.0, loaded.normal.lineSpacingPt);
        assertEquals(18.0, loaded.heading(1).sizePt);
        assertEquals("LEFT", loaded.heading(1).align);
        assertNull(loaded.heading(2));
        assertEquals("本科毕业论文", loaded.header.text);
        assertEquals("", warnings.toString(StandardCharsets.UTF_8));
    }

    @Test
    void load_Json() throws IOException {
        Path config = write("style.json",
                "{\"margins\": {\"top_mm\": 20, \"right_mm\": 20}, \"unknown\": true,"
                        + " \"headings\": {\"Heading 3\": {\"family\": \"KaiTi\", \"space_after_pt\": 6}}}");

        StyleConfig loaded = loader.load(config).orElseThrow();

        assertEquals(20.0, loaded.margins.topMm);
        assertEquals(20.0, loaded.margins.rightMm);
        assertNull(loaded.margins.leftMm);
        assertEquals("KaiTi", loaded.heading(3).family);
        assertEquals(6.0, loaded.heading(3).spaceAfterPt);
    }

    @Test
    void load_YamlExtensionIsCaseInsensitive() throws IOException {
        Path config = write("STYLE.YAML", "normal:\n  size_pt: 10.5\n");

        assertEquals(10.5, loader.load(config).orElseThrow().normal.sizePt);
    }

    @Test
    void load_EmptyFileIsEmptyConfig() throws IOException {
        Path config = write("empty.yml", "");

        StyleConfig loaded = loader.load(config).orElseThrow();

        assertNull(loaded.page);
        assertNull(loaded.normal);
    }

    @Test
    void load_MissingFileWarnsAndReturnsEmpty() {
        Optional<StyleConfig> loaded = loader.load(tempDir.resolve("missing.yml"));

        assertFalse(loaded.isPresent());
        assertTrue(warnings.toString(StandardCharsets.UTF_8).startsWith("Config file not found:"));
    }

    @Test
    void load_MalformedJsonWarnsAndReturnsEmpty() throws IOException {
        Path config = write("broken.json", "{\"page\": ");

        Optional<StyleConfig> loaded = loader.load(config);

        assertFalse(loaded.isPresent());
        assertTrue(warnings.toString(StandardCharsets.UTF_8).startsWith("Failed to read config:"));
    }

    @Test
    void load_NullPathReturnsEmptyWithoutWarning() {
        assertFalse(loader.load(null).isPresent());
        assertEquals("", warnings.toString(StandardCharsets.UTF_8));
    }

    @Test
    void loadedConfigResolvesWithDefaults() throws IOException {
        Path config = write("partial.yml", "normal:\n  western: Arial\n");

        StyleSheet sheet = StyleResolver.resolve(loader.load(config).orElse(null));

        assertEquals("Arial", sheet.getBody().getWesternFont());
        assertEquals("SimSun", sheet.getBody().getChineseFont());
        assertEquals(16, sheet.getHeading(1).getSizePt());
    }

    private Path write(String fileName, String content) throws IOException {
        Path file = tempDir.resolve(fileName);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
