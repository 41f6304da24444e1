package com.panorama.converter.parser;

import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.parser.exception.ParseException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class ConfigTreeLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigTreeLoader loader = new ConfigTreeLoader();

    @Test
    void testLoadsElementsAttributesAndText() {
        ConfigNode root = parse("""
                <config version="10.1.0">
                  <shared>
                    <address>
                      <entry name="web">
                        <ip-netmask> 10.0.0.1/32 </ip-netmask>
                        <!-- comment -->
                      </entry>
                    </address>
                  </shared>
                </config>
                """);

        assertThat(root.getTag()).isEqualTo("config");
        assertThat(root.getAttribute("version")).isEqualTo("10.1.0");
        assertThat(root.getText()).isNull();

        ConfigNode entry = root.find("shared/address/entry").orElseThrow();
        assertThat(entry.getName()).isEqualTo("web");
        assertThat(entry.getChildren()).hasSize(1);
        assertThat(entry.findText("ip-netmask")).isEqualTo("10.0.0.1/32");
    }

    @Test
    void testMalformedDocumentRaisesParseException() {
        assertThatThrownBy(() -> parse("<config><shared></config>"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("test.xml")
                .satisfies(e -> assertThat(((ParseException) e).getLine()).isGreaterThan(0));
    }

    @Test
    void testMissingFileRaisesParseException() {
        Path missing = tempDir.resolve("missing.xml");

        assertThatThrownBy(() -> loader.load(missing))
                .isInstanceOf(ParseException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void testLoadFromPath() throws IOException {
        Path file = tempDir.resolve("export.xml");
        Files.writeString(file, "<config><devices/></config>");

        ConfigNode root = loader.load(file);

        assertThat(root.has("devices")).isTrue();
        assertThat(root.size()).isEqualTo(2);
    }

    @Test
    void testExternalEntitiesAreNotResolved() {
        String xml = """
                <?xml version="1.0"?>
                <!DOCTYPE config [<!ENTITY xxe SYSTEM "file:///etc/passwd">]>
                <config><description>&xxe;</description></config>
                """;

        assertThatThrownBy(() -> parse(xml)).isInstanceOf(ParseException.class);
    }

    private ConfigNode parse(String xml) {
        return loader.load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "test.xml");
    }
}
