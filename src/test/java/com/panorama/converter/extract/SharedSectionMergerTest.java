package com.panorama.converter.extract;

import com.panorama.converter.model.ConfigNode;
import com.panorama.converter.parser.ConfigTreeLoader;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class SharedSectionMergerTest {

    private final SharedSectionMerger merger = new SharedSectionMerger();

    @Test
    void testDisjointEntriesAreBothKept() {
        ConfigNode merged = mergeAll("""
                <config>
                  <shared><address><entry name="A1"><ip-netmask>10.0.0.1/32</ip-netmask></entry></address></shared>
                  <devices><entry name="d"><shared><address><entry name="A2"><ip-netmask>10.0.0.2/32</ip-netmask></entry></address></shared></entry></devices>
                </config>
                """);

        assertThat(merged.children("address")).hasSize(1);
        assertThat(merged.findAll("address/entry")).extracting(ConfigNode::getName).containsExactly("A1", "A2");
    }

    @Test
    void testConflictingEntryKeepsFirstAdopted() {
        ConfigNode merged = mergeAll("""
                <config>
                  <shared><address><entry name="A1"><ip-netmask>10.0.0.1/32</ip-netmask></entry></address></shared>
                  <shared><address><entry name="A1"><ip-netmask>10.9.9.9/32</ip-netmask></entry></address></shared>
                </config>
                """);

        List<ConfigNode> entries = merged.findAll("address/entry");
        assertThat(entries).hasSize(1);
        assertThat(entries.get(0).findText("ip-netmask")).isEqualTo("10.0.0.1/32");
    }

    @Test
    void testFirstCategoryIsAdoptedInFullAndNewCategoriesAreAppended() {
        ConfigNode merged = mergeAll("""
                <config>
                  <shared>
                    <address><entry name="A1"/></address>
                    <tag><entry name="prod"><color>color1</color></entry></tag>
                  </shared>
                  <shared>
                    <service><entry name="S1"/></service>
                    <address><entry name="A2"/></address>
                  </shared>
                </config>
                """);

        assertThat(merged.getChildren()).extracting(ConfigNode::getTag).containsExactly("address", "tag", "service");
        assertThat(merged.find("tag/entry").orElseThrow().findText("color")).isEqualTo("color1");
    }

    @Test
    void testNestedContainersMergeRecursively() {
        ConfigNode merged = mergeAll("""
                <config>
                  <shared><profiles><virus><entry name="av-default"/></virus></profiles></shared>
                  <shared><profiles>
                    <virus><entry name="av-default"/><entry name="av-strict"/></virus>
                    <spyware><entry name="as-default"/></spyware>
                  </profiles></shared>
                </config>
                """);

        assertThat(merged.children("profiles")).hasSize(1);
        assertThat(merged.findAll("profiles/virus/entry")).extracting(ConfigNode::getName)
                .containsExactly("av-default", "av-strict");
        assertThat(merged.findAll("profiles/spyware/entry")).hasSize(1);
    }

    @Test
    void testNoSharedSectionYieldsEmpty() {
        assertThat(merger.mergeAll(parse("<config><devices/></config>"))).isEmpty();
    }

    @Test
    void testMergedContainersNeverHoldDuplicateNames() {
        ConfigNode merged = mergeAll("""
                <config>
                  <shared><address><entry name="A1"/><entry name="A1"/></address></shared>
                  <shared><address><entry name="A1"/><entry name="A3"/></address></shared>
                </config>
                """);

        assertThat(merged.findAll("address/entry")).extracting(ConfigNode::getName).containsExactly("A1", "A3");
    }

    @Test
    void testLaterValueOfAdoptedCategoryIsIgnored() {
        ConfigNode merged = mergeAll("""
                <config>
                  <shared>
                    <content-preview>yes</content-preview>
                    <address><entry name="A1"/></address>
                  </shared>
                  <shared><content-preview>no</content-preview></shared>
                </config>
                """);

        assertThat(merged.children("content-preview")).singleElement()
                .satisfies(n -> assertThat(n.getText()).isEqualTo("yes"));
        assertThat(merged.getChildren()).extracting(ConfigNode::getTag).containsExactly("content-preview", "address");
    }

    @Test
    void testMemberListsOfAdoptedContainerAreKept() {
        ConfigNode merged = mergeAll("""
                <config>
                  <shared><admin-role><member>alice</member><member>bob</member></admin-role></shared>
                  <shared><admin-role><member>carol</member></admin-role></shared>
                </config>
                """);

        assertThat(merged.findAll("admin-role/member")).extracting(ConfigNode::getText)
                .containsExactly("alice", "bob");
    }

    private ConfigNode mergeAll(String xml) {
        return merger.mergeAll(parse(xml)).orElseThrow();
    }

    private static ConfigNode parse(String xml) {
        return new ConfigTreeLoader().load(new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8)), "test.xml");
    }
}
