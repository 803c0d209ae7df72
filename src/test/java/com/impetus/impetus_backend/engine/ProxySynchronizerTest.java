package com.impetus.impetus_backend.engine;

import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.NodeType;
import com.impetus.impetus_backend.model.domain.PortType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.impetus.impetus_backend.CanvasTestSupport.add;
import static com.impetus.impetus_backend.CanvasTestSupport.assertProxiesMatch;
import static com.impetus.impetus_backend.CanvasTestSupport.in;
import static com.impetus.impetus_backend.CanvasTestSupport.out;
import static com.impetus.impetus_backend.CanvasTestSupport.wire;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Proxy synchronization")
class ProxySynchronizerTest {

    private ProxySynchronizer synchronizer;
    private Graph root;
    private Node block;

    @BeforeEach
    void setUp() {
        synchronizer = new ProxySynchronizer();
        root = Graph.root();
        block = add(root, "Block", 0, 0);
        block.setInner(new Graph(root, block));
    }

    @Test
    @DisplayName("Creates one proxy per port with stable ids")
    void createsMissingProxies() {
        block.addOutput("Extra", PortType.bits(8));

        boolean changed = synchronizer.synchronize(block);

        assertThat(changed).isTrue();
        assertProxiesMatch(block);
        assertThat(block.getInner().findNode("inlet_0")).isPresent();
        assertThat(block.getInner().findNode("outlet_0")).isPresent();
        assertThat(block.getInner().findNode("outlet_1")).isPresent();
    }

    @Test
    @DisplayName("A second run changes nothing")
    void idempotent() {
        synchronizer.synchronize(block);
        int nodes = block.getInner().getNodes().size();

        assertThat(synchronizer.synchronize(block)).isFalse();
        assertThat(block.getInner().getNodes()).hasSize(nodes);
    }

    @Test
    @DisplayName("Renamed and retyped ports are restamped onto their proxies")
    void restampsNameAndType() {
        synchronizer.synchronize(block);
        in(block, "In").setName("Data");
        in(block, "Data").setType(PortType.bits(16));

        assertThat(synchronizer.synchronize(block)).isTrue();

        Node inlet = block.getInner().findNode("inlet_0").orElseThrow();
        assertThat(inlet.getTitle()).isEqualTo("Data");
        assertThat(inlet.getOutputs().get(0).getName()).isEqualTo("Data");
        assertThat(inlet.getOutputs().get(0).getType()).isEqualTo(PortType.bits(16));
        assertProxiesMatch(block);
    }

    @Test
    @DisplayName("Surplus proxies are removed together with their wires")
    void removesSurplusProxies() {
        block.addInput("Second", PortType.BIT);
        synchronizer.synchronize(block);
        Graph inner = block.getInner();
        Node sink = add(inner, "Sink", 300, 0);
        wire(inner, inner.findNode("inlet_1").orElseThrow(), "Second", sink, "In");

        block.removePort(in(block, "Second"));
        synchronizer.synchronize(block);

        assertThat(inner.findNode("inlet_1")).isEmpty();
        assertThat(inner.getEdges()).isEmpty();
        assertProxiesMatch(block);
    }

    @Test
    @DisplayName("Gapped and repeated indices from hand-edited files are repaired")
    void repairsMalformedIndices() {
        Graph inner = block.getInner();
        Node dupA = Node.proxyFor(in(block, "In"), true, 0);
        Node dupB = Node.proxyFor(in(block, "In"), true, 0);
        dupB.setId("inlet_0_copy");
        Node stray = Node.proxyFor(out(block, "Out"), false, 5);
        inner.getNodes().add(dupA);
        inner.getNodes().add(dupB);
        inner.getNodes().add(stray);

        synchronizer.synchronize(block);

        assertThat(inner.proxies(true)).hasSize(1);
        assertThat(inner.proxies(false)).extracting(Node::getProxyIndex).containsExactly(0);
        assertProxiesMatch(block);
        assertThat(synchronizer.synchronize(block)).isFalse();
    }

    @Test
    @DisplayName("Releasing a proxy shifts the later ones down and keeps their wires")
    void releaseProxyShiftsIndices() {
        block.addInput("B", PortType.BIT);
        block.addInput("C", PortType.BIT);
        synchronizer.synchronize(block);
        Graph inner = block.getInner();
        Node sink = Node.withDefaultPorts("Sink", 300, 0, NodeType.END);
        inner.getNodes().add(sink);
        wire(inner, inner.findNode("inlet_2").orElseThrow(), "C", sink, "In1");

        synchronizer.releaseProxy(block, true, 1);
        block.removePort(in(block, "B"));
        synchronizer.synchronize(block);

        Node cProxy = inner.findNode("inlet_1").orElseThrow();
        assertThat(cProxy.getOutputs().get(0).getName()).isEqualTo("C");
        assertThat(inner.getEdges()).singleElement()
                .satisfies(e -> assertThat(e.fromNode()).isSameAs(cProxy));
        assertProxiesMatch(block);
    }

    @Test
    @DisplayName("Whole-tree synchronization reaches nested composites")
    void synchronizeTree() {
        Graph inner = block.getInner();
        Node nested = add(inner, "Nested", 0, 0);
        nested.setInner(new Graph(inner, nested));

        synchronizer.synchronizeTree(root);

        assertProxiesMatch(block);
        assertProxiesMatch(nested);
    }
}
