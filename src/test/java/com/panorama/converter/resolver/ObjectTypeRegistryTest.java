package com.panorama.converter.resolver;

import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.parser.ConfigTreeLoader;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class ObjectTypeRegistryTest {

    private final ScopeResolver resolver = new ScopeResolver();

    @Test
    void testTypeKeysAreUnique() {
        ObjectTypeRegistry registry = ObjectTypeRegistry.defaultRegistry();

        assertThat(registry.getTypes()).extracting(ObjectType::getKey).doesNotHaveDuplicates();
        assertThat(registry.find(ObjectTypeRegistry.IPSEC_CRYPTO_PROFILE)).isPresent();
        assertThatThrownBy(() -> registry.get("bogus")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testAddressFields() {
        ResolvedConfiguration resolved = resolver.resolveAll(parse("""
                <config><shared><address>
                  <entry name="range">
                    <ip-range>10.0.0.1-10.0.0.9</ip-range>
                    <description>pool</description>
                    <tag><member>prod</member><member>web</member></tag>
                  </entry>
                  <entry name="site"><fqdn>example.com</fqdn></entry>
                </address></shared></config>
                """));

        NamedObject range = resolved.catalog(ObjectTypeRegistry.ADDRESS).get("range").orElseThrow();
        assertThat(range.getString("type")).isEqualTo("ip-range");
        assertThat(range.getString("value")).isEqualTo("10.0.0.1-10.0.0.9");
        assertThat(range.getString("description")).isEqualTo("pool");
        assertThat(range.getList("tags")).containsExactly("prod", "web");

        NamedObject site = resolved.catalog(ObjectTypeRegistry.ADDRESS).get("site").orElseThrow();
        assertThat(site.getString("type")).isEqualTo("fqdn");
        assertThat(site.getList("tags")).isEmpty();
    }

    @Test
    void testServiceAndGroupFields() {
        ResolvedConfiguration resolved = resolver.resolveAll(parse("""
                <config><shared>
                  <service>
                    <entry name="https-alt">
                      <protocol><tcp><port>8443</port><source-port>1024-65535</source-port></tcp></protocol>
                    </entry>
                  </service>
                  <service-group>
                    <entry name="web-services"><members><member>https-alt</member><member>http</member></members></entry>
                  </service-group>
                  <address-group>
                    <entry name="dyn"><dynamic><filter>'prod' and 'web'</filter></dynamic></entry>
                  </address-group>
                </shared></config>
                """));

        NamedObject svc = resolved.catalog(ObjectTypeRegistry.SERVICE).get("https-alt").orElseThrow();
        assertThat(svc.getString("protocol")).isEqualTo("tcp");
        assertThat(svc.getString("port")).isEqualTo("8443");
        assertThat(svc.getString("source_port")).isEqualTo("1024-65535");

        assertThat(resolved.catalog(ObjectTypeRegistry.SERVICE_GROUP).get("web-services").orElseThrow()
                .getList("members")).containsExactly("https-alt", "http");
        assertThat(resolved.catalog(ObjectTypeRegistry.ADDRESS_GROUP).get("dyn").orElseThrow()
                .getString("dynamic_filter")).isEqualTo("'prod' and 'web'");
    }

    @Test
    void testSecurityRuleFieldsAndFlags() {
        ResolvedConfiguration resolved = resolver.resolveAll(parse("""
                <config><devices><entry name="localhost.localdomain"><device-group><entry name="DG1">
                  <pre-rulebase><security><rules>
                    <entry name="allow-web">
                      <from><member>trust</member></from>
                      <to><member>untrust</member></to>
                      <source><member>any</member></source>
                      <destination><member>web</member></destination>
                      <application><member>ssl</member></application>
                      <service><member>application-default</member></service>
                      <action>allow</action>
                      <log-end>yes</log-end>
                    </entry>
                  </rules></security></pre-rulebase>
                </entry></device-group></entry></devices></config>
                """));

        NamedObject rule = resolved.catalog(ObjectTypeRegistry.SECURITY_RULE).get("allow-web").orElseThrow();
        assertThat(rule.getList("source_zones")).containsExactly("trust");
        assertThat(rule.getList("destination_zones")).containsExactly("untrust");
        assertThat(rule.getString("action")).isEqualTo("allow");
        assertThat(rule.getBoolean("log_end")).isTrue();
        assertThat(rule.getBoolean("log_start")).isFalse();
        assertThat(rule.getBoolean("disabled")).isFalse();
    }

    @Test
    void testUnitInterfacesArePrefixedWithTheirKind() {
        ResolvedConfiguration resolved = resolver.resolveAll(parse("""
                <config><devices><entry name="localhost.localdomain"><network><interface>
                  <vlan><units><entry name="10"><ip><entry name="192.168.10.1/24"/></ip></entry></units></vlan>
                  <loopback><units><entry name="1"/></units></loopback>
                  <ethernet><entry name="ethernet1/1"><layer3><ip><entry name="10.1.1.1/24"/></ip></layer3></entry></ethernet>
                </interface></network></entry></devices></config>
                """));

        assertThat(resolved.catalog(ObjectTypeRegistry.VLAN_INTERFACE).names()).containsExactly("vlan.10");
        assertThat(resolved.catalog(ObjectTypeRegistry.VLAN_INTERFACE).get("vlan.10").orElseThrow()
                .getList("ip_addresses")).containsExactly("192.168.10.1/24");
        assertThat(resolved.catalog(ObjectTypeRegistry.LOOPBACK_INTERFACE).names()).containsExactly("loopback.1");

        NamedObject eth = resolved.catalog(ObjectTypeRegistry.ETHERNET_INTERFACE).get("ethernet1/1").orElseThrow();
        assertThat(eth.getString("mode")).isEqualTo("layer3");
        assertThat(eth.getList("ip_addresses")).containsExactly("10.1.1.1/24");
    }

    @Test
    void testVpnFields() {
        ResolvedConfiguration resolved = resolver.resolveAll(parse("""
                <config><devices><entry name="localhost.localdomain"><network>
                  <ike>
                    <gateway><entry name="gw1">
                      <protocol><ikev2><ike-crypto-profile>strong</ike-crypto-profile></ikev2></protocol>
                      <peer-address><ip>203.0.113.5</ip></peer-address>
                      <authentication><pre-shared-key><key>x</key></pre-shared-key></authentication>
                    </entry></gateway>
                  </ike>
                  <tunnel><ipsec><entry name="t1">
                    <tunnel-interface>tunnel.1</tunnel-interface>
                    <auto-key><ike-gateway><entry name="gw1"/></ike-gateway><ipsec-crypto-profile>esp-aes</ipsec-crypto-profile></auto-key>
                  </entry></ipsec></tunnel>
                </network></entry></devices></config>
                """));

        NamedObject gw = resolved.catalog(ObjectTypeRegistry.IKE_GATEWAY).get("gw1").orElseThrow();
        assertThat(gw.getString("version")).isEqualTo("ikev2");
        assertThat(gw.getString("ike_crypto_profile")).isEqualTo("strong");
        assertThat(gw.getString("peer_address")).isEqualTo("203.0.113.5");
        assertThat(gw.getString("peer_address_type")).isEqualTo("ip");
        assertThat(gw.getString("auth_type")).isEqualTo("pre-shared-key");

        NamedObject tunnel = resolved.catalog(ObjectTypeRegistry.IPSEC_TUNNEL).get("t1").orElseThrow();
        assertThat(tunnel.getString("type")).isEqualTo("auto-key");
        assertThat(tunnel.getString("ike_gateway")).isEqualTo("gw1");
        assertThat(tunnel.getString("ipsec_crypto_profile")).isEqualTo("esp-aes");
    }

    private static ConfigNode parse(String xml) {
        return new ConfigTreeLoader().load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "test.xml");
    }
}
