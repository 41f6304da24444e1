package com.panorama.converter.resolver;

import static com.panorama.converter.resolver.FieldExtractors.attribute;
import static com.panorama.converter.resolver.FieldExtractors.constant;
import static com.panorama.converter.resolver.FieldExtractors.entryNames;
import static com.panorama.converter.resolver.FieldExtractors.entryTextMap;
import static com.panorama.converter.resolver.FieldExtractors.firstPresent;
import static com.panorama.converter.resolver.FieldExtractors.flag;
import static com.panorama.converter.resolver.FieldExtractors.lastPresent;
import static com.panorama.converter.resolver.FieldExtractors.lastPresentText;
import static com.panorama.converter.resolver.FieldExtractors.members;
import static com.panorama.converter.resolver.FieldExtractors.optionalFlag;
import static com.panorama.converter.resolver.FieldExtractors.text;
import static com.panorama.converter.resolver.FieldExtractors.texts;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.panorama.converter.model.ConfigNode;

/**
 * Table of every object type the converter resolves.
 *
 * Each entry lists the scope paths (scan order), the stub rule and the fields
 * to read. Adding a type means adding a descriptor here, not writing a parser.
 */
public final class ObjectTypeRegistry {

    public static final String DEVICE_GROUP = "device-group";
    public static final String TAG = "tag";
    public static final String REGION = "region";
    public static final String CUSTOM_URL_CATEGORY = "custom-url-category";
    public static final String APPLICATION_GROUP = "application-group";
    public static final String APPLICATION_FILTER = "application-filter";
    public static final String EXTERNAL_LIST = "external-list";
    public static final String SCHEDULE = "schedule";
    public static final String ADDRESS = "address";
    public static final String ADDRESS_GROUP = "address-group";
    public static final String SERVICE = "service";
    public static final String SERVICE_GROUP = "service-group";
    public static final String SECURITY_RULE = "security-rule";
    public static final String NAT_RULE = "nat-rule";
    public static final String DECRYPTION_RULE = "decryption-rule";
    public static final String PBF_RULE = "pbf-rule";
    public static final String APPLICATION_OVERRIDE_RULE = "application-override-rule";
    public static final String ZONE = "zone";
    public static final String ETHERNET_INTERFACE = "ethernet-interface";
    public static final String VLAN_INTERFACE = "vlan-interface";
    public static final String LOOPBACK_INTERFACE = "loopback-interface";
    public static final String TUNNEL_INTERFACE = "tunnel-interface";
    public static final String AGGREGATE_INTERFACE = "aggregate-interface";
    public static final String AGGREGATE_SUBINTERFACE = "aggregate-subinterface";
    public static final String ANTIVIRUS_PROFILE = "antivirus-profile";
    public static final String VULNERABILITY_PROFILE = "vulnerability-profile";
    public static final String ANTI_SPYWARE_PROFILE = "anti-spyware-profile";
    public static final String URL_FILTERING_PROFILE = "url-filtering-profile";
    public static final String FILE_BLOCKING_PROFILE = "file-blocking-profile";
    public static final String WILDFIRE_ANALYSIS_PROFILE = "wildfire-analysis-profile";
    public static final String SECURITY_PROFILE_GROUP = "security-profile-group";
    public static final String ZONE_PROTECTION_PROFILE = "zone-protection-profile";
    public static final String LOG_FORWARDING_PROFILE = "log-forwarding-profile";
    public static final String QOS_PROFILE = "qos-profile";
    public static final String TUNNEL_MONITOR_PROFILE = "tunnel-monitor-profile";
    public static final String IKE_GATEWAY = "ike-gateway";
    public static final String IPSEC_TUNNEL = "ipsec-tunnel";
    public static final String IKE_CRYPTO_PROFILE = "ike-crypto-profile";
    public static final String IPSEC_CRYPTO_PROFILE = "ipsec-crypto-profile";

    private static final ObjectTypeRegistry DEFAULT = new ObjectTypeRegistry(defaultTypes());

    private final Map<String, ObjectType> types;

    public ObjectTypeRegistry(List<ObjectType> types) {
        Map<String, ObjectType> byKey = new LinkedHashMap<>();
        for (ObjectType type : types) {
            if (byKey.putIfAbsent(type.getKey(), type) != null) {
                throw new IllegalArgumentException("Duplicate object type: " + type.getKey());
            }
        }
        this.types = byKey;
    }

    public static ObjectTypeRegistry defaultRegistry() {
        return DEFAULT;
    }

    public List<ObjectType> getTypes() {
        return List.copyOf(types.values());
    }

    public Optional<ObjectType> find(String key) {
        return Optional.ofNullable(types.get(key));
    }

    public ObjectType get(String key) {
        return find(key).orElseThrow(() -> new IllegalArgumentException("Unknown object type: " + key));
    }

    // ---- scope path helpers ----

    /**
     * Device-group scope first, then shared, then anywhere in the document.
     */
    static List<String> inheritedObjectScopes(String category) {
        return List.of(
                ".//device-group/entry/" + category + "/entry",
                ".//shared/" + category + "/entry",
                ".//" + category + "/entry");
    }

    static List<String> globalThenDeviceGroup(String category) {
        return List.of(
                ".//" + category + "/entry",
                ".//device-group/entry/" + category + "/entry");
    }

    static List<String> globalDeviceGroupShared(String category) {
        return List.of(
                ".//" + category + "/entry",
                ".//device-group/entry/" + category + "/entry",
                ".//shared/" + category + "/entry");
    }

    static List<String> rulebase(String rulebase) {
        return List.of(
                ".//" + rulebase + "/rules/entry",
                ".//device-group/entry/pre-rulebase/" + rulebase + "/rules/entry",
                ".//device-group/entry/post-rulebase/" + rulebase + "/rules/entry");
    }

    static List<String> networkThenDevice(String networkPath) {
        return List.of(
                ".//network/" + networkPath,
                ".//devices/entry/network/" + networkPath);
    }

    // ---- type table ----

    private static List<ObjectType> defaultTypes() {
        List<ObjectType> types = new ArrayList<>();

        types.add(ObjectType.builder()
                .key(DEVICE_GROUP).label("device groups")
                .scopePath(".//device-group/entry")
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(TAG).label("tags")
                .scopePaths(globalThenDeviceGroup("tag"))
                .field("color", text("color"))
                .field("comments", text("comments"))
                .build());

        types.add(ObjectType.builder()
                .key(REGION).label("regions")
                .scopePaths(globalThenDeviceGroup("region"))
                .field("addresses", members("address"))
                .build());

        types.add(ObjectType.builder()
                .key(CUSTOM_URL_CATEGORY).label("custom URL categories")
                .scopePaths(globalThenDeviceGroup("custom-url-category"))
                .field("type", text("type"))
                .field("list", members("list"))
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(APPLICATION_GROUP).label("application groups")
                .scopePaths(globalThenDeviceGroup("application-group"))
                .field("members", members("members"))
                .build());

        types.add(ObjectType.builder()
                .key(APPLICATION_FILTER).label("application filters")
                .scopePaths(globalThenDeviceGroup("application-filter"))
                .field("category", members("category"))
                .field("subcategory", members("subcategory"))
                .field("technology", members("technology"))
                .field("risk", members("risk"))
                .field("evasive", text("evasive"))
                .field("excessive_bandwidth_use", text("excessive-bandwidth-use"))
                .field("prone_to_misuse", text("prone-to-misuse"))
                .field("is_saas", text("is-saas"))
                .field("transfers_files", text("transfers-files"))
                .field("tunnels_other_apps", text("tunnels-other-apps"))
                .field("used_by_malware", text("used-by-malware"))
                .build());

        types.add(ObjectType.builder()
                .key(EXTERNAL_LIST).label("external lists")
                .scopePaths(globalThenDeviceGroup("external-list"))
                .field("type", firstPresent("type", null, "ip", "domain", "url"))
                .field("url", ObjectTypeRegistry::externalListUrl)
                .field("recurring", ObjectTypeRegistry::externalListRecurring)
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(SCHEDULE).label("schedules")
                .scopePaths(globalThenDeviceGroup("schedule"))
                .field("schedule_type", lastPresent("schedule-type", "recurring", "non-recurring"))
                .field("recurring", entryNames("schedule-type/recurring/entry"))
                .build());

        types.add(ObjectType.builder()
                .key(ADDRESS).label("address objects")
                .scopePaths(inheritedObjectScopes("address"))
                .stubPredicate(StubPredicates.identityOnly("ip-netmask", "ip-range", "fqdn", "description"))
                .field("type", lastPresent("", "ip-netmask", "ip-range", "fqdn"))
                .field("value", lastPresentText("ip-netmask", "ip-range", "fqdn"))
                .field("description", text("description"))
                .field("tags", members("tag"))
                .build());

        types.add(ObjectType.builder()
                .key(ADDRESS_GROUP).label("address groups")
                .scopePaths(inheritedObjectScopes("address-group"))
                .stubPredicate(StubPredicates.identityOnly(".//static", ".//dynamic", "description"))
                .field("static_members", members("static"))
                .field("dynamic_filter", text(".//dynamic/filter"))
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(SERVICE).label("service objects")
                .scopePaths(inheritedObjectScopes("service"))
                .stubPredicate(StubPredicates.identityOnly("protocol", "description"))
                .field("protocol", firstPresent("protocol", null, "tcp", "udp"))
                .field("port", ObjectTypeRegistry::servicePort)
                .field("source_port", ObjectTypeRegistry::serviceSourcePort)
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(SERVICE_GROUP).label("service groups")
                .scopePaths(inheritedObjectScopes("service-group"))
                .stubPredicate(StubPredicates.identityOnly(".//members", "description"))
                .field("members", members("members"))
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(SECURITY_RULE).label("security rules")
                .scopePaths(rulebase("security"))
                .field("source_zones", members("from"))
                .field("source_addresses", members("source"))
                .field("destination_zones", members("to"))
                .field("destination_addresses", members("destination"))
                .field("applications", members("application"))
                .field("services", members("service"))
                .field("action", text("action"))
                .field("description", text("description"))
                .field("log_start", flag("log-start"))
                .field("log_end", flag("log-end"))
                .field("disabled", flag("disabled"))
                .build());

        types.add(ObjectType.builder()
                .key(NAT_RULE).label("NAT rules")
                .scopePaths(rulebase("nat"))
                .field("source_zones", members("from"))
                .field("destination_zone", text("to-interface"))
                .field("source_addresses", members("source"))
                .field("destination_addresses", members("destination"))
                .field("service", text("service"))
                .field("description", text("description"))
                .field("source_translation_type", entry ->
                        entry.has(".//source-translation/dynamic-ip-and-port//translated-address")
                                ? "dynamic-ip-and-port" : null)
                .field("source_translation_address",
                        texts(".//source-translation/dynamic-ip-and-port//translated-address/member"))
                .field("destination_translation_address", text(".//destination-translation/translated-address"))
                .field("destination_translation_port", text(".//destination-translation/translated-port"))
                .field("disabled", flag("disabled"))
                .build());

        types.add(ObjectType.builder()
                .key(DECRYPTION_RULE).label("decryption rules")
                .scopePaths(rulebase("decryption"))
                .field("uuid", attribute("uuid"))
                .field("source_zones", members("from"))
                .field("destination_zones", members("to"))
                .field("source_addresses", members("source"))
                .field("destination_addresses", members("destination"))
                .field("source_users", members("source-user"))
                .field("categories", members("category"))
                .field("services", members("service"))
                .field("action", text("action"))
                .field("type", firstPresent("type", null, "ssl-forward-proxy", "ssl-inbound-inspection", "ssh-proxy"))
                .field("profile", text("profile"))
                .field("description", text("description"))
                .field("disabled", flag("disabled"))
                .field("log_setting", text("log-setting"))
                .build());

        types.add(ObjectType.builder()
                .key(PBF_RULE).label("policy-based forwarding rules")
                .scopePaths(rulebase("pbf"))
                .field("uuid", attribute("uuid"))
                .field("description", text("description"))
                .field("disabled", flag("disabled"))
                .field("source_zones", texts("from//zone/member"))
                .field("source_addresses", members("source"))
                .field("source_users", members("source-user"))
                .field("destination_addresses", members("destination"))
                .field("applications", members("application"))
                .field("services", members("service"))
                .field("action", lastPresent("action", "forward", "discard", "no-pbf"))
                .field("nexthop_ip", text("action/forward/nexthop/ip-address"))
                .field("egress_interface", text("action/forward/egress-interface"))
                .field("enforce_symmetric_return", optionalFlag(".//enforce-symmetric-return/enabled"))
                .build());

        types.add(ObjectType.builder()
                .key(APPLICATION_OVERRIDE_RULE).label("application override rules")
                .scopePaths(rulebase("application-override"))
                .field("description", text("description"))
                .field("disabled", flag("disabled"))
                .field("source_zones", members("from"))
                .field("destination_zones", members("to"))
                .field("source_addresses", members("source"))
                .field("destination_addresses", members("destination"))
                .field("port", text("port"))
                .field("protocol", text("protocol"))
                .field("application", text("application"))
                .build());

        types.add(ObjectType.builder()
                .key(ZONE).label("zones")
                .scopePath(".//zone/entry")
                .scopePath(".//vsys/entry/zone/entry")
                .scopePath(".//devices/entry/vsys/entry/zone/entry")
                .field("type", firstPresent("network", null, "layer3", "layer2", "tap", "virtual-wire", "tunnel"))
                .field("interfaces", texts(".//network/*/member"))
                .field("zone_protection_profile", text(".//zone-protection-profile"))
                .build());

        types.add(ObjectType.builder()
                .key(ETHERNET_INTERFACE).label("ethernet interfaces")
                .scopePaths(networkThenDevice("interface/ethernet/entry"))
                .field("mode", firstPresent("", null,
                        "layer3", "layer2", "virtual-wire", "tap", "ha", "aggregate-group"))
                .field("ip_addresses", entryNames("layer3//ip/entry"))
                .field("ipv6_addresses", entryNames("layer3//ipv6/address/entry"))
                .field("management_profile", text("layer3/interface-management-profile"))
                .field("comment", text("comment"))
                .build());

        types.add(unitInterface(VLAN_INTERFACE, "VLAN interfaces", "vlan"));
        types.add(unitInterface(LOOPBACK_INTERFACE, "loopback interfaces", "loopback"));
        types.add(unitInterface(TUNNEL_INTERFACE, "tunnel interfaces", "tunnel"));

        types.add(ObjectType.builder()
                .key(AGGREGATE_INTERFACE).label("aggregate interfaces")
                .scopePaths(networkThenDevice("interface/aggregate-ethernet/entry"))
                .field("mode", firstPresent("", null, "layer3", "layer2"))
                .field("ip_addresses", entryNames("layer3/ip/entry"))
                .field("management_profile", text("layer3/interface-management-profile"))
                .field("units", entryNames("layer3//units/entry"))
                .field("comment", text("comment"))
                .build());

        types.add(ObjectType.builder()
                .key(AGGREGATE_SUBINTERFACE).label("aggregate subinterfaces")
                .scopePaths(networkThenDevice("interface/aggregate-ethernet/entry/layer3/units/entry"))
                .field("mode", constant("layer3"))
                .field("ip_addresses", entryNames(".//ip/entry"))
                .field("management_profile", text("interface-management-profile"))
                .field("tag", text("tag"))
                .field("comment", text("comment"))
                .build());

        types.add(securityProfile(ANTIVIRUS_PROFILE, "antivirus profiles", "virus"));
        types.add(securityProfile(VULNERABILITY_PROFILE, "vulnerability profiles", "vulnerability"));
        types.add(securityProfile(ANTI_SPYWARE_PROFILE, "anti-spyware profiles", "spyware"));
        types.add(securityProfile(URL_FILTERING_PROFILE, "URL filtering profiles", "url-filtering"));
        types.add(securityProfile(FILE_BLOCKING_PROFILE, "file blocking profiles", "file-blocking"));
        types.add(securityProfile(WILDFIRE_ANALYSIS_PROFILE, "WildFire analysis profiles", "wildfire-analysis"));

        types.add(ObjectType.builder()
                .key(SECURITY_PROFILE_GROUP).label("security profile groups")
                .scopePaths(globalDeviceGroupShared("profile-group"))
                .field("virus", members("virus"))
                .field("spyware", members("spyware"))
                .field("vulnerability", members("vulnerability"))
                .field("url_filtering", members("url-filtering"))
                .field("file_blocking", members("file-blocking"))
                .field("wildfire_analysis", members("wildfire-analysis"))
                .build());

        types.add(ObjectType.builder()
                .key(ZONE_PROTECTION_PROFILE).label("zone protection profiles")
                .scopePath(".//zone-protection-profile/entry")
                .scopePath(".//device-group/entry/zone-protection-profile/entry")
                .scopePath(".//network/profiles/zone-protection-profile/entry")
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(LOG_FORWARDING_PROFILE).label("log forwarding profiles")
                .scopePaths(globalDeviceGroupShared("log-settings/profiles"))
                .field("description", text("description"))
                .build());

        types.add(ObjectType.builder()
                .key(QOS_PROFILE).label("QoS profiles")
                .scopePath(".//qos/profile/entry")
                .scopePath(".//device-group/entry/qos/profile/entry")
                .scopePath(".//network/qos/profile/entry")
                .field("class_priorities", entryTextMap(".//class/entry", "priority"))
                .build());

        types.add(ObjectType.builder()
                .key(TUNNEL_MONITOR_PROFILE).label("tunnel monitor profiles")
                .scopePath(".//network/tunnel/global-protect-gateway/Default/tunnel-monitor/monitor-profile/entry")
                .scopePaths(networkThenDevice("tunnel-monitor/monitor-profile/entry"))
                .field("interval", text("interval"))
                .field("threshold", text("threshold"))
                .field("action", text("action"))
                .build());

        types.add(ObjectType.builder()
                .key(IKE_GATEWAY).label("IKE gateways")
                .scopePaths(networkThenDevice("ike/gateway/entry"))
                .field("version", firstPresent("protocol", "ikev1", "ikev1", "ikev2"))
                .field("ike_crypto_profile", ObjectTypeRegistry::ikeGatewayCryptoProfile)
                .field("peer_address", lastPresentText(".//peer-address/ip", ".//peer-address/fqdn"))
                .field("peer_address_type", lastPresent(".//peer-address", "ip", "fqdn"))
                .field("local_address", text(".//local-address/ip"))
                .field("local_address_interface", text(".//local-address/interface"))
                .field("auth_type", firstPresent("authentication", "pre-shared-key", "pre-shared-key", "certificate"))
                .field("certificate_profile", text("authentication/certificate/profile"))
                .field("local_id", text("local-id/id"))
                .field("peer_id", text("peer-id/id"))
                .build());

        types.add(ObjectType.builder()
                .key(IPSEC_TUNNEL).label("IPsec tunnels")
                .scopePaths(networkThenDevice("tunnel/ipsec/entry"))
                .field("tunnel_interface", text("tunnel-interface"))
                .field("type", entry -> entry.child("manual-key").isPresent() ? "manual-key" : "auto-key")
                .field("ike_gateway", entry -> entry.find("auto-key/ike-gateway/entry")
                        .map(ConfigNode::getName).orElse(null))
                .field("ipsec_crypto_profile", text("auto-key/ipsec-crypto-profile"))
                .field("proxy_ids", entryNames("auto-key//proxy-id/entry"))
                .build());

        types.add(ObjectType.builder()
                .key(IKE_CRYPTO_PROFILE).label("IKE crypto profiles")
                .scopePaths(networkThenDevice("ike/crypto-profiles/ike-crypto-profiles/entry"))
                .field("dh_groups", members("dh-group"))
                .field("authentications", members("authentication"))
                .field("encryptions", members("encryption"))
                .field("lifetime_hours", text("lifetime/hours"))
                .build());

        types.add(ObjectType.builder()
                .key(IPSEC_CRYPTO_PROFILE).label("IPsec crypto profiles")
                .scopePaths(networkThenDevice("ike/crypto-profiles/ipsec-crypto-profiles/entry"))
                .field("protocol", entry -> entry.child("ah").isPresent() ? "ah" : "esp")
                .field("encryptions", members("esp/encryption"))
                .field("authentications", entry -> entry.child("ah").isPresent()
                        ? FieldExtractors.collectTexts(entry, ".//ah/authentication/member")
                        : FieldExtractors.collectTexts(entry, ".//esp/authentication/member"))
                .field("dh_group", text("dh-group"))
                .field("lifetime_hours", text("lifetime/hours"))
                .field("lifetime_kb", text("lifetime/kilobytes"))
                .build());

        return types;
    }

    private static ObjectType unitInterface(String key, String label, String kind) {
        return ObjectType.builder()
                .key(key).label(label)
                .scopePaths(networkThenDevice("interface/" + kind + "/units/entry"))
                .nameTransform(name -> kind + "." + name)
                .field("mode", constant("layer3"))
                .field("ip_addresses", entryNames(".//ip/entry"))
                .field("ipv6_addresses", entryNames(".//ipv6/address/entry"))
                .field("management_profile", text("interface-management-profile"))
                .field("tag", text("tag"))
                .field("comment", text("comment"))
                .build();
    }

    private static ObjectType securityProfile(String key, String label, String category) {
        return ObjectType.builder()
                .key(key).label(label)
                .scopePaths(globalDeviceGroupShared("profiles/" + category))
                .field("description", text("description"))
                .build();
    }

    private static Object externalListUrl(ConfigNode entry) {
        for (String kind : List.of("ip", "domain", "url")) {
            if (entry.has("type/" + kind)) {
                return entry.findText("type/" + kind + "/url");
            }
        }
        return null;
    }

    private static Object externalListRecurring(ConfigNode entry) {
        Optional<ConfigNode> type = entry.child("type");
        if (type.isEmpty() || !type.get().hasChildren()) {
            return null;
        }
        for (String interval : List.of("hourly", "five-minute", "daily")) {
            if (type.get().has(".//recurring/" + interval)) {
                return interval;
            }
        }
        return null;
    }

    private static Object servicePort(ConfigNode entry) {
        for (String proto : List.of("tcp", "udp")) {
            if (entry.has("protocol/" + proto)) {
                return entry.findText("protocol/" + proto + "/port");
            }
        }
        return null;
    }

    private static Object serviceSourcePort(ConfigNode entry) {
        for (String proto : List.of("tcp", "udp")) {
            if (entry.has("protocol/" + proto)) {
                return entry.findText("protocol/" + proto + "/source-port");
            }
        }
        return null;
    }

    private static Object ikeGatewayCryptoProfile(ConfigNode entry) {
        for (String version : List.of("ikev1", "ikev2")) {
            if (entry.has("protocol/" + version)) {
                return entry.findText("protocol/" + version + "/ike-crypto-profile");
            }
        }
        return null;
    }
}
