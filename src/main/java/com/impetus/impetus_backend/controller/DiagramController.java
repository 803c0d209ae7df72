package com.impetus.impetus_backend.controller;

import com.impetus.impetus_backend.codec.LayoutFormat;
import com.impetus.impetus_backend.exception.LayoutFormatException;
import com.impetus.impetus_backend.exception.NodeNotFoundException;
import com.impetus.impetus_backend.model.domain.Edge;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.NodeType;
import com.impetus.impetus_backend.model.domain.Port;
import com.impetus.impetus_backend.model.domain.PortSide;
import com.impetus.impetus_backend.model.domain.PortType;
import com.impetus.impetus_backend.model.dto.AddNodeRequest;
import com.impetus.impetus_backend.model.dto.CanvasView;
import com.impetus.impetus_backend.model.dto.EdgeDto;
import com.impetus.impetus_backend.model.dto.EdgeRequest;
import com.impetus.impetus_backend.model.dto.FileRequest;
import com.impetus.impetus_backend.model.dto.GroupRequest;
import com.impetus.impetus_backend.model.dto.NodeUpdateRequest;
import com.impetus.impetus_backend.model.dto.PortRequest;
import com.impetus.impetus_backend.service.DiagramService;
import com.impetus.impetus_backend.service.EditResult;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

@Slf4j
@RestController
@RequestMapping("/api/canvas")
@RequiredArgsConstructor
public class DiagramController {

    private final DiagramService diagramService;

    @GetMapping
    public CanvasView getCanvas() {
        return diagramService.view();
    }

    // ── Nodes ──────────────────────────────────────────────────────────────────

    @PostMapping("/nodes")
    public ResponseEntity<?> addNode(@RequestBody AddNodeRequest req) {
        Node n = diagramService.addNode(NodeType.fromLabel(req.type()), req.title(),
                req.x() != null ? req.x() : 0, req.y() != null ? req.y() : 0);
        return ResponseEntity.status(HttpStatus.CREATED).body(diagramService.describe(n));
    }

    @DeleteMapping("/nodes/{nodeId}")
    public ResponseEntity<?> deleteNode(@PathVariable String nodeId) {
        return respond(diagramService.deleteNode(nodeId), n -> Map.of("deleted", n.getId()));
    }

    @PatchMapping("/nodes/{nodeId}")
    public ResponseEntity<?> updateNode(@PathVariable String nodeId, @RequestBody NodeUpdateRequest req) {
        return respond(diagramService.updateNode(nodeId, req.title(), req.constValue()), diagramService::describe);
    }

    @PostMapping("/nodes/{nodeId}/duplicate")
    public ResponseEntity<?> duplicateNode(@PathVariable String nodeId) {
        return respond(diagramService.duplicateNode(nodeId), diagramService::describe);
    }

    @PostMapping("/nodes/{nodeId}/zoom-in")
    public ResponseEntity<?> zoomInto(@PathVariable String nodeId) {
        return respond(diagramService.zoomInto(nodeId), g -> diagramService.view());
    }

    @PostMapping("/zoom-out")
    public ResponseEntity<?> zoomOut() {
        return respond(diagramService.zoomOut(), g -> diagramService.view());
    }

    // ── Ports ──────────────────────────────────────────────────────────────────

    @PostMapping("/nodes/{nodeId}/ports")
    public ResponseEntity<?> addPort(@PathVariable String nodeId, @RequestBody PortRequest req) {
        PortSide side = PortSide.fromLabel(req.side());
        return respond(diagramService.addPort(nodeId, side, req.name(), toPortType(req)), DiagramController::describePort);
    }

    @PostMapping("/nodes/{nodeId}/ports/next")
    public ResponseEntity<?> appendNextPort(@PathVariable String nodeId) {
        return respond(diagramService.appendNextDefaultPort(nodeId), DiagramController::describePort);
    }

    @PatchMapping("/nodes/{nodeId}/ports/{side}/{name}")
    public ResponseEntity<?> updatePort(@PathVariable String nodeId, @PathVariable String side,
                                        @PathVariable String name, @RequestBody PortRequest req) {
        PortSide portSide = PortSide.fromLabel(side);
        String currentName = name;
        if (req.name() != null && !req.name().equals(name)) {
            EditResult<Port> renamed = diagramService.renamePort(nodeId, portSide, name, req.name());
            if (renamed.isRejected()) return rejected(renamed);
            currentName = renamed.value().getName();
        }
        PortType type = toPortType(req);
        if (type != null) {
            EditResult<Port> retyped = diagramService.retypePort(nodeId, portSide, currentName, type);
            if (retyped.isRejected()) return rejected(retyped);
            return ResponseEntity.ok(describePort(retyped.value()));
        }
        Port p = diagramService.getNode(nodeId).findPort(portSide, currentName);
        if (p == null) return ResponseEntity.badRequest().body(Map.of("error", "No such port: " + currentName));
        return ResponseEntity.ok(describePort(p));
    }

    @DeleteMapping("/nodes/{nodeId}/ports/{side}/{name}")
    public ResponseEntity<?> deletePort(@PathVariable String nodeId, @PathVariable String side, @PathVariable String name) {
        return respond(diagramService.deletePort(nodeId, PortSide.fromLabel(side), name), p -> Map.of("deleted", p.getName()));
    }

    // ── Wires ──────────────────────────────────────────────────────────────────

    @PostMapping("/edges")
    public ResponseEntity<?> connect(@Valid @RequestBody EdgeRequest req) {
        return respond(diagramService.connect(req.fromNode(), req.fromPort(), req.toNode(), req.toPort()),
                DiagramController::describeEdge);
    }

    @DeleteMapping("/edges")
    public ResponseEntity<?> disconnect(@Valid @RequestBody EdgeRequest req) {
        return respond(diagramService.disconnect(req.fromNode(), req.fromPort(), req.toNode(), req.toPort()),
                DiagramController::describeEdge);
    }

    // ── Selection and grouping ─────────────────────────────────────────────────

    @PostMapping("/selection")
    public ResponseEntity<?> select(@RequestBody List<String> nodeIds) {
        List<Node> selected = diagramService.select(nodeIds);
        return ResponseEntity.ok(Map.of("selection", selected.stream().map(Node::getId).toList()));
    }

    @PostMapping("/group")
    public ResponseEntity<?> group(@RequestBody GroupRequest req) {
        if (req.nodeIds() != null) {
            diagramService.select(req.nodeIds());
        }
        return respond(diagramService.groupSelection(req.name()), diagramService::describe);
    }

    // ── Documents ──────────────────────────────────────────────────────────────

    @PostMapping("/new")
    public CanvasView newGraph() {
        diagramService.newGraph();
        return diagramService.view();
    }

    @PostMapping("/save")
    public ResponseEntity<?> save(@Valid @RequestBody FileRequest req) {
        Path path = diagramService.saveDocument(req.path(), parseFormat(req.format()));
        return ResponseEntity.ok(Map.of("saved", path.toString()));
    }

    @PostMapping("/load")
    public CanvasView load(@Valid @RequestBody FileRequest req) {
        diagramService.loadDocument(req.path());
        return diagramService.view();
    }

    // ── Error mapping ──────────────────────────────────────────────────────────

    @ExceptionHandler(NodeNotFoundException.class)
    public ResponseEntity<Map<String, String>> handleNotFound(NodeNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(LayoutFormatException.class)
    public ResponseEntity<Map<String, String>> handleFormat(LayoutFormatException ex) {
        log.warn("Rejected {} layout: {}", ex.getFormat(), ex.getMessage());
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, String>> handleBadArgument(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<Map<String, String>> handleIo(UncheckedIOException ex) {
        log.error("Layout file I/O failed: {}", ex.getMessage(), ex);
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    // ── Helpers ────────────────────────────────────────────────────────────────

    private static <T> ResponseEntity<?> respond(EditResult<T> result, Function<T, ?> body) {
        return result.accepted() ? ResponseEntity.ok(body.apply(result.value())) : rejected(result);
    }

    private static ResponseEntity<?> rejected(EditResult<?> result) {
        return ResponseEntity.badRequest().body(Map.of("error", result.reason()));
    }

    private static PortType toPortType(PortRequest req) {
        if (req.userType() != null && !req.userType().isBlank()) return PortType.user(req.userType().trim());
        if (req.bitLength() != null) return PortType.bits(req.bitLength());
        return null;
    }

    private static LayoutFormat parseFormat(String format) {
        return format == null || format.isBlank() ? null : LayoutFormat.valueOf(format.trim().toUpperCase(Locale.ROOT));
    }

    private static Map<String, Object> describePort(Port p) {
        return Map.of(
                "node", p.getOwner().getId(),
                "side", p.getSide().label(),
                "name", p.getName(),
                "type", p.getType().displayName(),
                "width", p.getWidth());
    }

    private static EdgeDto describeEdge(Edge e) {
        return EdgeDto.of(e.fromNode().getId(), e.fromPort().getName(), e.toNode().getId(), e.toPort().getName());
    }
}
