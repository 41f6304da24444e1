package com.panorama.converter.resolver;

import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.parser.ConfigTreeLoader;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ScopeResolverTest {

    private static final String DOCUMENT = """
            <config>
              <devices>
                <entry name="localhost.localdomain">
                  <device-group>
                    <entry name="DG1">
                      <address>
                        <entry name="web"><id>12</id></entry>
                        <entry name="db"><ip-netmask>10.0.0.2/32</ip-netmask></entry>
                      </address>
                    </entry>
                  </device-group>
                </entry>
              </devices>
              <shared>
                <address>
                  <entry name="web"><ip-netmask>10.0.0.1/32</ip-netmask></entry>
                  <entry name="db"><ip-netmask>10.9.9.9/32</ip-netmask></entry>
                  <entry name="ghost"><id>7</id></entry>
                  <entry><ip-netmask>10.0.0.3/32</ip-netmask></entry>
                </address>
              </shared>
            </config>
            """;

    private final ScopeResolver resolver = new ScopeResolver();

    @Test
    void testFullDefinitionReplacesEarlierStub() {
        Catalog catalog = resolveAddresses(parse(DOCUMENT));

        NamedObject web = catalog.get("web").orElseThrow();
        assertThat(web.isStub()).isFalse();
        assertThat(web.getString("value")).isEqualTo("10.0.0.1/32");
    }

    @Test
    void testStubIsNeverKeptOverFullInReverseScanOrder() {
        ObjectType address = ObjectTypeRegistry.defaultRegistry().get(ObjectTypeRegistry.ADDRESS);
        List<String> reversed = List.of(".//shared/address/entry", ".//device-group/entry/address/entry");

        Catalog catalog = resolver.resolve(parse(DOCUMENT), address.toBuilder().clearScopePaths().scopePaths(reversed).build());

        assertThat(catalog.get("web").orElseThrow().isFull()).isTrue();
        assertThat(catalog.get("web").orElseThrow().getString("value")).isEqualTo("10.0.0.1/32");
    }

    @Test
    void testLastScannedFullDefinitionWins() {
        Catalog catalog = resolveAddresses(parse(DOCUMENT));

        // device-group scope is scanned first, shared second; the catch-all scan
        // revisits both in document order, where shared comes last
        assertThat(catalog.get("db").orElseThrow().getString("value")).isEqualTo("10.9.9.9/32");
    }

    @Test
    void testStubOnlyNameIsRecorded() {
        Catalog catalog = resolveAddresses(parse(DOCUMENT));

        assertThat(catalog.get("ghost")).hasValueSatisfying(ghost -> {
            assertThat(ghost.isStub()).isTrue();
            assertThat(ghost.getFields()).isEmpty();
        });
        assertThat(catalog.stubCount()).isEqualTo(1);
    }

    @Test
    void testNamelessEntriesAreSkippedAndOrderIsFirstInsertion() {
        Catalog catalog = resolveAddresses(parse(DOCUMENT));

        assertThat(catalog.names()).containsExactly("web", "db", "ghost");
    }

    @Test
    void testResolutionIsDeterministic() {
        ConfigNode root = parse(DOCUMENT);

        ResolvedConfiguration first = resolver.resolveAll(root);
        ResolvedConfiguration second = resolver.resolveAll(root);

        assertThat(second).isEqualTo(first);
        assertThat(second.catalog(ObjectTypeRegistry.ADDRESS).names())
                .containsExactlyElementsOf(first.catalog(ObjectTypeRegistry.ADDRESS).names());
    }

    @Test
    void testGenericContractWithoutFields() {
        Catalog catalog = resolver.resolve(parse(DOCUMENT), "address",
                List.of(".//address/entry"), StubPredicates.identityOnly("ip-netmask"));

        assertThat(catalog.getType()).isEqualTo("address");
        assertThat(catalog.names()).containsExactly("web", "db", "ghost");
        assertThat(catalog.get("web").orElseThrow().getFields()).isEmpty();
    }

    @Test
    void testAbsentTypeYieldsEmptyCatalog() {
        ResolvedConfiguration resolved = resolver.resolveAll(parse("<config/>"));

        assertThat(resolved.catalog(ObjectTypeRegistry.SERVICE).isEmpty()).isTrue();
        assertThat(resolved.totalObjects()).isZero();
        assertThat(resolved.catalog("no-such-type").isEmpty()).isTrue();
    }

    private Catalog resolveAddresses(ConfigNode root) {
        return resolver.resolve(root, ObjectTypeRegistry.defaultRegistry().get(ObjectTypeRegistry.ADDRESS));
    }

    private static ConfigNode parse(String xml) {
        return new ConfigTreeLoader().load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "test.xml");
    }
}
