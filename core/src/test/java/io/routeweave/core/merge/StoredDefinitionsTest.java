package io.routeweave.core.merge;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.routeweave.core.model.MiddlewareRecord;
import io.routeweave.core.model.ResourceStatus;
import io.routeweave.core.model.RoutingSnapshot;
import io.routeweave.core.model.ServiceRecord;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@DisplayName("StoredDefinitions")
class StoredDefinitionsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static ServiceRecord service(String id, String type, String config) throws Exception {
        return new ServiceRecord(id, id, type, MAPPER.readTree(config), "manual", ResourceStatus.ACTIVE);
    }

    @ParameterizedTest(name = "{0} {1} → {2}")
    @CsvSource(
            delimiter = ';',
            value = {
                "loadBalancer; {\"servers\":[{\"url\":\"http://10.0.0.1\"}]}; http",
                "loadBalancer; {\"servers\":[{\"address\":\"10.0.0.1:5432\"}]}; tcp",
                "loadBalancer; {\"servers\":[]}; http",
                "udpLoadBalancer; {\"servers\":[{\"address\":\"10.0.0.1:53\"}]}; udp",
                "loadBalancer; {\"protocol\":\"udp\",\"servers\":[{\"address\":\"10.0.0.1:53\"}]}; udp",
                "weighted; {\"services\":[]}; http"
            })
    void protocolOf(String type, String config, String expected) throws Exception {
        assertThat(StoredDefinitions.protocolOf(type, MAPPER.readTree(config))).isEqualTo(expected);
    }

    @Test
    @DisplayName("udp prefix dropped from the published type")
    void publishedUdpType() {
        assertThat(StoredDefinitions.publishedUdpType("udpLoadBalancer")).isEqualTo("loadBalancer");
        assertThat(StoredDefinitions.publishedUdpType("UDPWeighted")).isEqualTo("weighted");
        assertThat(StoredDefinitions.publishedUdpType("loadBalancer")).isEqualTo("loadBalancer");
        assertThat(StoredDefinitions.publishedUdpType("udp")).isEqualTo("loadBalancer");
        assertThat(StoredDefinitions.publishedUdpType("UDP")).isEqualTo("loadBalancer");
    }

    @Test
    @DisplayName("services land in the section their definition implies")
    void addServicesBySection() throws Exception {
        ObjectNode document = RoutingSnapshot.emptyDocument();

        StoredDefinitions.addServices(document, List.of(
                service("web", "loadBalancer", "{\"servers\":[{\"url\":\"http://10.0.0.1\"}]}"),
                service("db", "loadBalancer", "{\"servers\":[{\"address\":\"10.0.0.2:5432\"}]}"),
                service("dns", "udpLoadBalancer", "{\"protocol\":\"udp\",\"servers\":[{\"address\":\"10.0.0.3:53\"}]}")));

        assertThat(document.path("http").path("services").path("web").path("loadBalancer").isObject()).isTrue();
        assertThat(document.path("tcp").path("services").path("db").path("loadBalancer").isObject()).isTrue();
        JsonNode dns = document.path("udp").path("services").path("dns");
        assertThat(dns.path("loadBalancer").path("servers").size()).isEqualTo(1);
        assertThat(dns.path("loadBalancer").has("protocol")).isFalse();
    }

    @Test
    @DisplayName("a bare udp service type is published as a UDP load balancer")
    void bareUdpTypePublishedAsLoadBalancer() throws Exception {
        ObjectNode document = RoutingSnapshot.emptyDocument();

        StoredDefinitions.addServices(
                document, List.of(service("syslog", "udp", "{\"servers\":[{\"address\":\"10.0.0.4:514\"}]}")));

        JsonNode syslog = document.path("udp").path("services").path("syslog");
        assertThat(syslog.has("udp")).isFalse();
        assertThat(syslog.path("loadBalancer").path("servers").get(0).path("address").asText())
                .isEqualTo("10.0.0.4:514");
    }

    @Test
    @DisplayName("stored middlewares replace upstream ones of the same id")
    void middlewaresReplaceUpstream() throws Exception {
        ObjectNode document = RoutingSnapshot.ensureSections((ObjectNode) MAPPER.readTree(
                "{\"http\":{\"middlewares\":{\"auth\":{\"basicAuth\":{\"users\":[\"old\"]}},\"keep\":{\"compress\":{}}}}}"));

        StoredDefinitions.addMiddlewares(document, List.of(
                new MiddlewareRecord("auth", "auth", "basicAuth", MAPPER.readTree("{\"users\":[\"new\"]}"))));

        JsonNode middlewares = document.path("http").path("middlewares");
        assertThat(middlewares.path("auth").path("basicAuth").path("users").get(0).asText()).isEqualTo("new");
        assertThat(middlewares.has("keep")).isTrue();
    }
}
