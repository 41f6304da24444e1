package com.panorama.converter.render;

import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.parser.ConfigTreeLoader;
import com.panorama.converter.resolver.ResolvedConfiguration;
import com.panorama.converter.resolver.ScopeResolver;
import com.panorama.converter.router.RouterDescriptor;
import com.panorama.converter.router.RouterKind;
import com.panorama.converter.router.StaticRoute;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.*;

class TerraformRendererTest {

    private final TerraformRenderer renderer = new TerraformRenderer();

    @Test
    void testRendersObjectFilesAndSkipsStubs() {
        ResolvedConfiguration resolved = new ScopeResolver().resolveAll(parse("""
                <config><shared>
                  <address>
                    <entry name="Web Server"><ip-netmask>10.0.0.1/32</ip-netmask><description>front "end"</description></entry>
                    <entry name="site"><fqdn>example.com</fqdn></entry>
                    <entry name="ghost"><id>3</id></entry>
                  </address>
                  <tag><entry name="prod"><color>color1</color></entry></tag>
                </shared></config>
                """));

        Map<String, GeneratedFile> files = byName(renderer.render(resolved, List.of()));

        assertThat(files).containsOnlyKeys("provider.tf", "variables.tf", "address_objects.tf", "tags.tf");

        String addresses = files.get("address_objects.tf").getContents();
        assertThat(addresses).contains("resource \"panos_address_object\" \"web_server\" {");
        assertThat(addresses).contains("  description = \"front \\\"end\\\"\"");
        assertThat(addresses).contains("  value = \"10.0.0.1/32\"");
        assertThat(addresses).contains("  type = \"fqdn\"");
        assertThat(addresses).doesNotContain("ghost");
        assertThat(files.get("address_objects.tf").getResourceCount()).isEqualTo(2);

        assertThat(files.get("tags.tf").getContents()).contains("  color = \"color1\"");
        assertThat(files.get("provider.tf").getContents()).contains("PaloAltoNetworks/panos");
    }

    @Test
    void testSameNamedRoutersGetSuffixedResources() {
        RouterDescriptor first = RouterDescriptor.builder().name("VR1").template("T1").kind(RouterKind.VIRTUAL)
                .interfaceName("e1")
                .staticRoute(StaticRoute.builder().name("default").destination("0.0.0.0/0")
                        .nexthopIp("192.0.2.1").metric("10").build())
                .build();
        RouterDescriptor second = RouterDescriptor.builder().name("VR1").template("T2").kind(RouterKind.LOGICAL)
                .interfaceName("f1")
                .staticRoute(StaticRoute.builder().name("to-lr").nexthopRouter("LR2").build())
                .build();

        GeneratedFile file = renderer.renderRouters(List.of(first, second));
        String contents = file.getContents();

        assertThat(contents).contains("resource \"panos_virtual_router\" \"vr1\" {");
        assertThat(contents).contains("resource \"panos_virtual_router\" \"vr1_2\" {");
        assertThat(contents).contains("resource \"panos_static_route_ipv4\" \"vr1_default\" {");
        assertThat(contents).contains("  virtual_router = panos_virtual_router.vr1_2.name");
        assertThat(contents).contains("  next_hop = \"192.0.2.1\"");
        assertThat(contents).contains("  metric = 10");
        assertThat(contents).contains("  interface = \"LR2\"");
        assertThat(contents).contains("# - 1 Logical Routers (advanced)");
        assertThat(file.getResourceCount()).isEqualTo(4);
    }

    @Test
    void testObjectNamesThatSanitizeAlikeGetDistinctResources() {
        ResolvedConfiguration resolved = new ScopeResolver().resolveAll(parse("""
                <config><shared><address>
                  <entry name="a-b"><ip-netmask>10.0.0.1/32</ip-netmask></entry>
                  <entry name="a_b"><ip-netmask>10.0.0.2/32</ip-netmask></entry>
                </address></shared></config>
                """));

        String addresses = byName(renderer.render(resolved, List.of())).get("address_objects.tf").getContents();

        assertThat(addresses).contains("resource \"panos_address_object\" \"a_b\" {");
        assertThat(addresses).contains("resource \"panos_address_object\" \"a_b_2\" {");
        assertThat(addresses).contains("  name = \"a-b\"").contains("  name = \"a_b\"");
    }

    @Test
    void testNonNumericMetricIsQuoted() {
        RouterDescriptor router = RouterDescriptor.builder().name("VR1").template("T1").kind(RouterKind.VIRTUAL)
                .staticRoute(StaticRoute.builder().name("r1").nexthopIp("192.0.2.1").metric("10\n}").build())
                .build();

        String contents = renderer.renderRouters(List.of(router)).getContents();

        assertThat(contents).contains("  metric = \"10\\n}\"");
    }

    @Test
    void testEmptyConfigurationRendersOnlyProviderAndVariables() {
        List<GeneratedFile> files = renderer.render(new ScopeResolver().resolveAll(parse("<config/>")), List.of());

        assertThat(files).extracting(GeneratedFile::getFileName).containsExactly("provider.tf", "variables.tf");
    }

    private static Map<String, GeneratedFile> byName(List<GeneratedFile> files) {
        return files.stream().collect(Collectors.toMap(GeneratedFile::getFileName, Function.identity()));
    }

    private static ConfigNode parse(String xml) {
        return new ConfigTreeLoader().load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "test.xml");
    }
}
