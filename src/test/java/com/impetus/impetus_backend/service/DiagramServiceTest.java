package com.impetus.impetus_backend.service;

import com.impetus.impetus_backend.CanvasTestSupport;
import com.impetus.impetus_backend.codec.LayoutFormat;
import com.impetus.impetus_backend.exception.LayoutFormatException;
import com.impetus.impetus_backend.exception.NodeNotFoundException;
import com.impetus.impetus_backend.model.domain.Edge;
import com.impetus.impetus_backend.model.domain.Graph;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.NodeType;
import com.impetus.impetus_backend.model.domain.Port;
import com.impetus.impetus_backend.model.domain.PortSide;
import com.impetus.impetus_backend.model.domain.PortType;
import com.impetus.impetus_backend.model.dto.CanvasView;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.impetus.impetus_backend.CanvasTestSupport.assertProxiesMatch;
import static com.impetus.impetus_backend.CanvasTestSupport.in;
import static com.impetus.impetus_backend.CanvasTestSupport.out;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DiagramServiceTest {

    private CanvasTestSupport support;
    private DiagramService service;

    @BeforeEach
    void setUp() {
        support = new CanvasTestSupport();
        service = support.newDiagramService();
    }

    @Nested
    @DisplayName("Wiring")
    class Wiring {

        @Test
        @DisplayName("A bit output may feed an any-typed input")
        void constIntoEnd() {
            Node c = service.addNode(NodeType.CONST, "C", 0, 0);
            Node end = service.addNode(NodeType.END, "End", 300, 0);

            EditResult<Edge> result = service.connect(c.getId(), "Value", end.getId(), "In1");

            assertThat(result.accepted()).isTrue();
            assertThat(service.getCurrent().getEdges()).containsExactly(result.value());
        }

        @Test
        @DisplayName("Mismatched bit lengths are refused")
        void typeMismatch() {
            Node c = service.addNode(NodeType.CONST, "C", 0, 0);
            Node d = service.addNode(NodeType.DECISION, "D", 300, 0);

            EditResult<Edge> result = service.connect(c.getId(), "Value", d.getId(), "Input");

            assertThat(result.isRejected()).isTrue();
            assertThat(result.reason()).startsWith("Type mismatch");
            assertThat(service.getCurrent().getEdges()).isEmpty();
        }

        @Test
        @DisplayName("A second source replaces the wire into an input; the same pair is a no-op")
        void singleDriverPerInput() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            Node b = service.addNode(NodeType.REGULAR, "B", 0, 150);
            Node c = service.addNode(NodeType.REGULAR, "C", 300, 0);

            Edge first = service.connect(a.getId(), "Out", c.getId(), "In").value();
            Edge again = service.connect(a.getId(), "Out", c.getId(), "In").value();
            assertThat(again).isSameAs(first);
            assertThat(service.getCurrent().getEdges()).hasSize(1);

            service.connect(b.getId(), "Out", c.getId(), "In");
            assertThat(service.getCurrent().getEdges()).singleElement()
                    .satisfies(e -> assertThat(e.fromNode()).isSameAs(b));
        }

        @Test
        @DisplayName("Unknown ports and missing wires are reported as rejections")
        void rejections() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            Node b = service.addNode(NodeType.REGULAR, "B", 300, 0);

            assertThat(service.connect(a.getId(), "Nope", b.getId(), "In").isRejected()).isTrue();
            assertThat(service.disconnect(a.getId(), "Out", b.getId(), "In").isRejected()).isTrue();

            service.connect(a.getId(), "Out", b.getId(), "In");
            assertThat(service.disconnect(a.getId(), "Out", b.getId(), "In").accepted()).isTrue();
            assertThat(service.getCurrent().getEdges()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Nodes")
    class Nodes {

        @Test
        @DisplayName("Deleting a node removes its wires")
        void deleteCascades() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            Node b = service.addNode(NodeType.REGULAR, "B", 300, 0);
            service.connect(a.getId(), "Out", b.getId(), "In");

            assertThat(service.deleteNode(a.getId()).accepted()).isTrue();

            assertThat(service.getCurrent().getNodes()).containsExactly(b);
            assertThat(service.getCurrent().getEdges()).isEmpty();
        }

        @Test
        @DisplayName("Permanent nodes and proxies cannot be deleted")
        void protectedNodes() {
            Node start = service.addNode(NodeType.START, "Start", 0, 0);
            start.setPermanent(true);
            Node a = service.addNode(NodeType.REGULAR, "A", 300, 0);
            service.connect(start.getId(), "Out1", a.getId(), "In");
            service.select(List.of(a.getId()));
            Node grp = service.groupSelection("G").value();
            service.zoomInto(grp.getId());

            assertThat(service.deleteNode("inlet_0").isRejected()).isTrue();
            service.zoomOut();
            assertThat(service.deleteNode(start.getId()).isRejected()).isTrue();
            assertThat(service.getCurrent().getNodes()).contains(start);
        }

        @Test
        @DisplayName("A blank title falls back to the variant label")
        void defaultTitle() {
            Node n = service.addNode(NodeType.DECISION, "  ", 10, 20);

            assertThat(n.getTitle()).isEqualTo("Decision");
            assertThat(n.getInputs()).extracting(Port::getName).containsExactly("Input");
        }

        @Test
        @DisplayName("Only Const nodes take a value")
        void constValue() {
            Node c = service.addNode(NodeType.CONST, "C", 0, 0);
            Node r = service.addNode(NodeType.REGULAR, "R", 0, 0);

            assertThat(service.setConstValue(c.getId(), "0xFF").value().getConstValue()).isEqualTo("0xFF");
            assertThat(service.setConstValue(r.getId(), "1").isRejected()).isTrue();
        }

        @Test
        @DisplayName("A combined update is refused as a whole when one part is not allowed")
        void updateNodeIsAllOrNothing() {
            Node r = service.addNode(NodeType.REGULAR, "R", 0, 0);
            Node c = service.addNode(NodeType.CONST, "C", 0, 0);

            EditResult<Node> refused = service.updateNode(r.getId(), "Renamed", "5");

            assertThat(refused.isRejected()).isTrue();
            assertThat(r.getTitle()).isEqualTo("R");

            assertThat(service.updateNode(c.getId(), " Seed ", "9").accepted()).isTrue();
            assertThat(c.getTitle()).isEqualTo("Seed");
            assertThat(c.getConstValue()).isEqualTo("9");
            assertThat(service.renameNode(r.getId(), "Plain").value().getTitle()).isEqualTo("Plain");
        }

        @Test
        @DisplayName("Unknown ids raise NodeNotFoundException")
        void unknownNode() {
            assertThatThrownBy(() -> service.deleteNode("missing"))
                    .isInstanceOf(NodeNotFoundException.class)
                    .hasMessageContaining("missing");
        }

        @Test
        @DisplayName("Duplicating selects the copy")
        void duplicateSelectsCopy() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);

            Node copy = service.duplicateNode(a.getId()).value();

            assertThat(copy.getTitle()).isEqualTo("A Copy");
            assertThat(service.getSelection()).containsExactly(copy);
        }
    }

    @Nested
    @DisplayName("Ports")
    class Ports {

        private Node composite() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            service.select(List.of(a.getId()));
            return service.groupSelection("G").value();
        }

        @Test
        @DisplayName("Port edits on a composite keep its proxies in step")
        void proxiesFollowPortEdits() {
            Node grp = composite();

            service.addInputPort(grp.getId(), "X", PortType.bits(8));
            service.addOutputPort(grp.getId(), "Y", PortType.user("Packet"));
            assertProxiesMatch(grp);

            service.renamePort(grp.getId(), PortSide.INPUT, "X", "Data");
            assertProxiesMatch(grp);
            assertThat(grp.getInner().proxy(true, 0).orElseThrow().getTitle()).isEqualTo("Data");

            service.retypePort(grp.getId(), PortSide.INPUT, "Data", PortType.bits(16));
            assertProxiesMatch(grp);

            service.deletePort(grp.getId(), PortSide.OUTPUT, "Y");
            assertProxiesMatch(grp);
            assertThat(grp.getOutputs()).isEmpty();
        }

        @Test
        @DisplayName("Deleting an earlier input keeps later inner wires on their own port")
        void deleteShiftsProxies() {
            Node grp = composite();
            service.addInputPort(grp.getId(), "P", PortType.BIT);
            service.addInputPort(grp.getId(), "Q", PortType.BIT);
            Graph inner = grp.getInner();
            Node sink = Node.withDefaultPorts("Sink", 0, 0, NodeType.REGULAR);
            inner.getNodes().add(sink);
            Node qProxy = inner.proxy(true, 1).orElseThrow();
            inner.getEdges().add(new Edge(qProxy.getOutputs().get(0), in(sink, "In")));

            service.deletePort(grp.getId(), PortSide.INPUT, "P");

            assertProxiesMatch(grp);
            Edge kept = inner.incomingEdge(in(sink, "In")).orElseThrow();
            assertThat(kept.fromNode().getTitle()).isEqualTo("Q");
            assertThat(kept.fromNode().getProxyIndex()).isZero();
        }

        @Test
        @DisplayName("Duplicate port names are refused")
        void duplicateName() {
            Node n = service.addNode(NodeType.REGULAR, "N", 0, 0);

            Port added = service.addInputPort(n.getId(), "In", PortType.BIT).value();

            assertThat(added.getName()).isEqualTo("In1");
            assertThat(service.renamePort(n.getId(), PortSide.INPUT, "In1", "In").isRejected()).isTrue();
        }

        @Test
        @DisplayName("Retyping drops wires that no longer type-check")
        void retypePrunes() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            Node b = service.addNode(NodeType.REGULAR, "B", 300, 0);
            service.connect(a.getId(), "Out", b.getId(), "In");

            service.retypePort(b.getId(), PortSide.INPUT, "In", PortType.bits(4));

            assertThat(service.getCurrent().getEdges()).isEmpty();
        }

        @Test
        @DisplayName("Start and End grow numbered ports; other variants refuse")
        void growingPorts() {
            Node start = service.addNode(NodeType.START, "Start", 0, 0);
            Node end = service.addNode(NodeType.END, "End", 300, 0);
            Node r = service.addNode(NodeType.REGULAR, "R", 0, 200);

            assertThat(service.appendNextDefaultPort(start.getId()).value().getName()).isEqualTo("Out2");
            assertThat(service.appendNextDefaultPort(end.getId()).value().getType()).isEqualTo(PortType.ANY);
            assertThat(service.appendNextDefaultPort(r.getId()).isRejected()).isTrue();
        }
    }

    @Nested
    @DisplayName("Levels and documents")
    class Levels {

        @Test
        @DisplayName("Zooming tracks the trail and clears the selection both ways")
        void zoom() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            service.select(List.of(a.getId()));
            Node grp = service.groupSelection("Outer").value();

            service.zoomInto(grp.getId());
            CanvasView view = service.view();
            assertThat(view.level()).isEqualTo(1);
            assertThat(view.trail()).extracting(CanvasView.TrailEntry::title).containsExactly("Outer");
            assertThat(service.getCurrent().contains(a)).isTrue();

            service.zoomOut();
            assertThat(service.getLevel()).isZero();
            assertThat(service.getSelection()).isEmpty();
            assertThat(service.getCurrent().getNodes()).contains(grp);
            assertThat(service.zoomOut().isRejected()).isTrue();
        }

        @Test
        @DisplayName("Zooming into a plain node gives it an inner level with proxies")
        void zoomIntoPlainNode() {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);

            service.zoomInto(a.getId());

            assertThat(a.isComposite()).isTrue();
            assertProxiesMatch(a);
            assertThat(service.getCurrent()).isSameAs(a.getInner());
        }

        @Test
        @DisplayName("Grouping an empty selection is refused")
        void emptyGroup() {
            assertThat(service.groupSelection("G").isRejected()).isTrue();
        }

        @Test
        @DisplayName("Save then load restores the diagram at the top level")
        void saveAndLoad(@TempDir Path dir) {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            Node b = service.addNode(NodeType.REGULAR, "B", 300, 0);
            service.connect(a.getId(), "Out", b.getId(), "In");
            Path file = dir.resolve("saved.json");
            service.saveTo(file, null);
            service.newGraph();
            assertThat(service.getRoot().getNodes()).isEmpty();

            service.loadFrom(file);

            assertThat(service.getRoot().getNodes()).extracting(Node::getTitle).containsExactly("A", "B");
            assertThat(service.getRoot().getEdges()).hasSize(1);
            assertThat(service.getCurrent()).isSameAs(service.getRoot());
        }

        @Test
        @DisplayName("A failed load leaves the diagram untouched")
        void failedLoad(@TempDir Path dir) throws Exception {
            Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
            Graph before = service.getRoot();
            Path broken = dir.resolve("broken.bcanvas");
            Files.writeString(broken, "(schema ImpetusProject (blocks");

            assertThatThrownBy(() -> service.loadFrom(broken)).isInstanceOf(LayoutFormatException.class);

            assertThat(service.getRoot()).isSameAs(before);
            assertThat(service.getRoot().getNodes()).containsExactly(a);
        }

        @Test
        @DisplayName("Documents addressed by location are kept inside the layout directory")
        void documentsByLocation(@TempDir Path dir) {
            support.properties.setLayoutDir(dir.toString());
            service.addNode(NodeType.REGULAR, "A", 0, 0);

            Path saved = service.saveDocument("nested/a.layout", LayoutFormat.JSON);
            service.newGraph();
            service.loadDocument("nested/a.layout");

            assertThat(saved).isEqualTo(dir.toAbsolutePath().normalize().resolve("nested/a.layout"));
            assertThat(service.getRoot().getNodes()).extracting(Node::getTitle).containsExactly("A");
            assertThatThrownBy(() -> service.saveDocument("nested/../../out.bcanvas", null))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("layout directory");
        }

        @Test
        @DisplayName("Without an explicit format the extension decides")
        void formatFromExtension(@TempDir Path dir) throws Exception {
            service.addNode(NodeType.REGULAR, "A", 0, 0);
            Path json = dir.resolve("x.json");
            Path sexpr = dir.resolve("x.bcanvas");

            service.saveTo(json, null);
            service.saveTo(sexpr, null);

            assertThat(Files.readString(json)).startsWith("{");
            assertThat(Files.readString(sexpr)).startsWith("(schema");
        }
    }

    @Test
    @DisplayName("Wires on a node's outputs are visible through its ports")
    void outHelperSanity() {
        Node a = service.addNode(NodeType.REGULAR, "A", 0, 0);
        Node b = service.addNode(NodeType.REGULAR, "B", 300, 0);
        service.connect(out(a, "Out"), in(b, "In"));

        assertThat(service.getCurrent().incomingEdge(in(b, "In"))).isPresent();
    }
}
