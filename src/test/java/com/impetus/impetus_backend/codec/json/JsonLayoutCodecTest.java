package com.impetus.impetus_backend.codec.json;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.impetus.impetus_backend.CanvasTestSupport;
import com.impetus.impetus_backend.exception.LayoutFormatException;
import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.NodeType;
import com.impetus.impetus_backend.model.domain.PortType;
import com.impetus.impetus_backend.model.dto.LayoutDto;
import com.impetus.impetus_backend.model.dto.PortDefDto;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.impetus.impetus_backend.CanvasTestSupport.add;
import static com.impetus.impetus_backend.CanvasTestSupport.assertProxiesMatch;
import static com.impetus.impetus_backend.CanvasTestSupport.wire;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JSON layout codec")
class JsonLayoutCodecTest {

    private CanvasTestSupport support;
    private JsonLayoutCodec codec;

    @BeforeEach
    void setUp() {
        support = new CanvasTestSupport();
        codec = support.jsonCodec;
    }

    @Test
    @DisplayName("Legacy port shapes are read: bare names and type aliases")
    void legacyPorts() {
        LayoutDto dto = codec.read("""
                {
                  // written by an older editor
                  "version": 1,
                  "graph": {
                    "nodes": [
                      {
                        "id": "n1",
                        "title": "Old",
                        "addDataType": "ignored",
                        "inputs": ["In", {"name": "Flag", "type": "bool"}, {"name": "Wild", "type": "any"}],
                        "outputs": [{"name": "Out", "type": "Integer"}, {"name": "Byte", "bitLength": 8, "type": "any"},],
                      }
                    ],
                    "edges": []
                  }
                }
                """);

        List<PortDefDto> inputs = dto.graph().nodes().get(0).inputs();
        List<PortDefDto> outputs = dto.graph().nodes().get(0).outputs();
        assertThat(dto.version()).isEqualTo(1);
        assertThat(inputs).extracting(PortDefDto::name).containsExactly("In", "Flag", "Wild");
        assertThat(inputs).extracting(PortDefDto::bitLength).containsExactly(1, 1, PortType.ANY_LENGTH);
        assertThat(outputs).extracting(PortDefDto::bitLength).containsExactly(1, 8);
        assertThat(inputs.get(0).width()).isEqualTo(108);
    }

    @Test
    @DisplayName("Written documents use the canonical field names")
    void canonicalShape() throws Exception {
        Graph root = Graph.root();
        Node a = add(root, NodeType.MARSHALLER, "M", 5, 6);
        a.setMarshallerOutputType("Packet");
        a.addOutput("Pkt", PortType.user("Packet"));
        Node b = add(root, NodeType.END, "E", 300, 0);
        wire(root, a, "Out", b, "In1");

        JsonNode doc = new ObjectMapper().readTree(codec.write(support.mapper.toDto(root, 2)));

        assertThat(doc.path("version").asInt()).isEqualTo(2);
        JsonNode node = doc.path("graph").path("nodes").get(0);
        assertThat(node.path("type").asText()).isEqualTo("Marshaller");
        assertThat(node.path("w").asDouble()).isEqualTo(80);
        assertThat(node.path("marshallerOutputType").asText()).isEqualTo("Packet");
        assertThat(node.has("inner")).isFalse();
        assertThat(node.path("outputs").get(0).path("bitLength").asInt()).isEqualTo(2);
        assertThat(node.path("outputs").get(1).path("userType").asText()).isEqualTo("Packet");
        assertThat(node.path("outputs").get(1).has("bitLength")).isFalse();
        JsonNode edge = doc.path("graph").path("edges").get(0);
        assertThat(edge.path("from").path("node").asText()).isEqualTo(a.getId());
        assertThat(edge.path("from").path("side").asText()).isEqualTo("Output");
        assertThat(edge.path("to").path("port").asText()).isEqualTo("In1");
    }

    @Test
    @DisplayName("A grouped hierarchy survives write and read")
    void roundTrip() {
        Graph root = Graph.root();
        Node a = add(root, "A", 0, 0);
        Node b = add(root, "B", 250, 0);
        Node c = add(root, "C", 500, 0);
        wire(root, a, "Out", b, "In");
        wire(root, b, "Out", c, "In");
        Node grp = support.groupingService.group(root, List.of(b), "G1").orElseThrow();
        b.getInputs().get(0).setType(PortType.user("Packet"));
        support.proxySynchronizer.synchronize(grp);

        String json = codec.write(support.mapper.toDto(root, 2));
        Graph back = support.mapper.toGraph(codec.read(json));

        assertThat(back.getNodes()).extracting(Node::getTitle).containsExactly("A", "C", "G1");
        Node grpBack = back.findNode(grp.getId()).orElseThrow();
        assertThat(grpBack.getInner().getEdges()).hasSize(grp.getInner().getEdges().size());
        Node bBack = grpBack.getInner().findNode(b.getId()).orElseThrow();
        assertThat(bBack.getInputs().get(0).getType()).isEqualTo(PortType.user("Packet"));
        assertProxiesMatch(grpBack);
        assertThat(codec.write(support.mapper.toDto(back, 2))).isEqualTo(json);
    }

    @Test
    @DisplayName("Broken JSON is a format error")
    void invalidJson() {
        assertThatThrownBy(() -> codec.read("{\"version\": 2, \"graph\": {\"nodes\": [}"))
                .isInstanceOf(LayoutFormatException.class)
                .satisfies(e -> assertThat(((LayoutFormatException) e).getFormat()).isEqualTo("JSON"));
        assertThatThrownBy(() -> codec.read("null")).isInstanceOf(LayoutFormatException.class);
        assertThatThrownBy(() -> codec.read("{\"graph\": {\"nodes\": [{\"inputs\": [42]}]}}"))
                .isInstanceOf(LayoutFormatException.class);
    }
}
