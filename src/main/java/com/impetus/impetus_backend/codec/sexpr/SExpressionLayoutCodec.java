package com.impetus.impetus_backend.codec.sexpr;

import com.impetus.impetus_backend.codec.LayoutCodec;
import com.impetus.impetus_backend.codec.LayoutFormat;
import com.impetus.impetus_backend.exception.LayoutFormatException;
import com.impetus.impetus_backend.model.domain.Node;
import com.impetus.impetus_backend.model.domain.Port;
import com.impetus.impetus_backend.model.dto.EdgeDto;
import com.impetus.impetus_backend.model.dto.LayoutDto;
import com.impetus.impetus_backend.model.dto.LayoutGraphDto;
import com.impetus.impetus_backend.model.dto.NodeDto;
import com.impetus.impetus_backend.model.dto.PortDefDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes the {@code (schema ImpetusProject ...)} document form.
 *
 * <pre>
 * (schema ImpetusProject
 *   (version "2")
 *   (blocks
 *     (view-offset 10 -20)
 *     (block "id" (title "A") (position 40 60) (inputs ("In1" [8])) (inner ...))
 *     (wires (a.Out1 -> b.In1))))
 * </pre>
 *
 * Every block field is written only when it differs from the value a reader assumes when the
 * field is missing.
 */
@Slf4j
@Component
public class SExpressionLayoutCodec implements LayoutCodec {

    private static final String FORMAT = SExprTokenizer.FORMAT;
    private static final String SCHEMA_NAME = "ImpetusProject";
    private static final String ARROW = "->";
    private static final String INDENT = "  ";

    @Override
    public LayoutFormat supportedFormat() {
        return LayoutFormat.SEXPR;
    }

    @Override
    public boolean recognizes(String content) {
        return content.startsWith("(") || content.startsWith(";;");
    }

    // ── Writing ────────────────────────────────────────────────────────────────

    @Override
    public String write(LayoutDto layout) {
        StringBuilder sb = new StringBuilder();
        sb.append("(schema ").append(SCHEMA_NAME).append('\n');
        sb.append(INDENT).append("(version ").append(quote(String.valueOf(layout.version()))).append(")\n");

        LayoutGraphDto graph = layout.graph();
        if (!graph.nodes().isEmpty() || !graph.edges().isEmpty() || graph.vx() != 0 || graph.vy() != 0) {
            sb.append(INDENT).append("(blocks\n");
            writeGraph(sb, graph, INDENT + INDENT);
            sb.append(INDENT).append(")\n");
        }
        sb.append(")\n");
        return sb.toString();
    }

    private void writeGraph(StringBuilder sb, LayoutGraphDto graph, String indent) {
        if (graph.vx() != 0 || graph.vy() != 0) {
            sb.append(indent).append("(view-offset ").append(number(graph.vx())).append(' ')
                    .append(number(graph.vy())).append(")\n");
        }
        for (NodeDto node : graph.nodes()) {
            writeBlock(sb, node, indent);
        }
        if (!graph.edges().isEmpty()) {
            sb.append(indent).append("(wires\n");
            for (EdgeDto e : graph.edges()) {
                sb.append(indent).append(INDENT).append('(')
                        .append(endpoint(e.from().nodeId(), e.from().port()))
                        .append(' ').append(ARROW).append(' ')
                        .append(endpoint(e.to().nodeId(), e.to().port()))
                        .append(")\n");
            }
            sb.append(indent).append(")\n");
        }
    }

    private void writeBlock(StringBuilder sb, NodeDto node, String indent) {
        String in = indent + INDENT;
        sb.append(indent).append("(block ").append(quote(node.id())).append('\n');

        if (!node.title().isEmpty()) {
            sb.append(in).append("(title ").append(quote(node.title())).append(")\n");
        }
        if (node.x() != 0 || node.y() != 0) {
            sb.append(in).append("(position ").append(number(node.x())).append(' ').append(number(node.y())).append(")\n");
        }
        if (node.w() != Node.DEFAULT_WIDTH || node.h() != Node.DEFAULT_HEIGHT) {
            sb.append(in).append("(size ").append(number(node.w())).append(' ').append(number(node.h())).append(")\n");
        }
        if (!NodeDto.DEFAULT_TYPE.equals(node.type())) {
            sb.append(in).append("(type ").append(quote(node.type())).append(")\n");
        }
        if (node.isPermanent()) {
            sb.append(in).append("(is-permanent true)\n");
        }
        if (!Node.DEFAULT_CONST_VALUE.equals(node.constValue())) {
            sb.append(in).append("(const-value ").append(quote(node.constValue())).append(")\n");
        }
        if (node.marshallerOutputType() != null && !node.marshallerOutputType().isEmpty()) {
            sb.append(in).append("(marshaller-output-type ").append(quote(node.marshallerOutputType())).append(")\n");
        }
        if (node.isProxy()) {
            sb.append(in).append("(is-proxy true)\n");
            sb.append(in).append("(proxy-is-inlet ").append(node.proxyIsInlet()).append(")\n");
            sb.append(in).append("(proxy-index ").append(node.proxyIndex()).append(")\n");
        }
        writePorts(sb, "inputs", node.inputs(), in);
        writePorts(sb, "outputs", node.outputs(), in);
        if (node.inner() != null) {
            sb.append(in).append("(inner\n");
            writeGraph(sb, node.inner(), in + INDENT);
            sb.append(in).append(")\n");
        }
        sb.append(indent).append(")\n");
    }

    private void writePorts(StringBuilder sb, String form, List<PortDefDto> ports, String indent) {
        if (ports.isEmpty()) return;
        sb.append(indent).append('(').append(form).append('\n');
        for (PortDefDto p : ports) {
            sb.append(indent).append(INDENT).append('(').append(quote(p.name()));
            if (p.userType() != null) {
                sb.append(" (user-type ").append(quote(p.userType())).append(')');
            } else if (p.bitLength() != 1) {
                sb.append(" [").append(p.bitLength()).append(']');
            }
            if (p.width() != Port.DEFAULT_WIDTH) {
                sb.append(" (width ").append(number(p.width())).append(')');
            }
            sb.append(")\n");
        }
        sb.append(indent).append(")\n");
    }

    private String quote(String s) {
        if (s.indexOf('"') >= 0) {
            log.warn("Double quote in '{}' cannot be written to an S-expression layout; replaced with a single quote", s);
            s = s.replace('"', '\'');
        }
        return '"' + s + '"';
    }

    /** Node ids and port names are written bare unless they would not survive tokenizing. */
    private String endpoint(String nodeId, String port) {
        String ref = nodeId + "." + port;
        return needsQuoting(ref) ? quote(ref) : ref;
    }

    private static boolean needsQuoting(String s) {
        if (s.isEmpty() || s.equals(ARROW)) return true;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '"' || c == '[' || c == ';') return true;
        }
        return false;
    }

    static String number(double v) {
        if (!Double.isFinite(v)) {
            throw new IllegalArgumentException("Cannot write non-finite coordinate " + v);
        }
        if (v == Math.rint(v) && Math.abs(v) < 1e15) {
            return Long.toString((long) v);
        }
        return BigDecimal.valueOf(v).stripTrailingZeros().toPlainString();
    }

    // ── Reading ────────────────────────────────────────────────────────────────

    @Override
    public LayoutDto read(String content) {
        SExpr doc = SExprParser.parse(content);
        if (!doc.isForm("schema", 1)) {
            throw new LayoutFormatException(FORMAT, "Document must start with (schema ...)");
        }

        Integer version = null;
        LayoutGraphDto graph = LayoutGraphDto.empty();
        for (int i = 1; i < doc.size(); i++) {
            SExpr item = doc.item(i);
            if (item.isForm("version", 2)) {
                version = parseInt(item.item(1).value(), null);
            } else if (item.isForm("blocks", 1)) {
                graph = readGraph(item);
            }
        }
        return new LayoutDto(version, graph);
    }

    private LayoutGraphDto readGraph(SExpr blocks) {
        List<NodeDto> nodes = new ArrayList<>();
        List<EdgeDto> edges = new ArrayList<>();
        Double vx = null;
        Double vy = null;

        for (int i = 1; i < blocks.size(); i++) {
            SExpr item = blocks.item(i);
            if (item.isForm("view-offset", 3)) {
                vx = parseDouble(item.item(1).value(), vx);
                vy = parseDouble(item.item(2).value(), vy);
            } else if (item.isForm("block", 2)) {
                nodes.add(readBlock(item));
            } else if (item.isForm("wires", 1)) {
                for (int w = 1; w < item.size(); w++) {
                    EdgeDto edge = readWire(item.item(w));
                    if (edge != null) edges.add(edge);
                }
            } else {
                log.debug("Skipping unknown blocks entry {}", item.head());
            }
        }
        return new LayoutGraphDto(nodes, edges, vx, vy);
    }

    private NodeDto readBlock(SExpr block) {
        NodeDto.NodeDtoBuilder b = NodeDto.builder().id(block.item(1).value());
        for (int i = 2; i < block.size(); i++) {
            SExpr field = block.item(i);
            String name = field.head();
            if (name == null) continue;
            switch (name) {
                case "title" -> b.title(stringArg(field));
                case "position" -> {
                    if (field.size() >= 3) {
                        b.x(parseDouble(field.item(1).value(), null));
                        b.y(parseDouble(field.item(2).value(), null));
                    }
                }
                case "size" -> {
                    if (field.size() >= 3) {
                        b.w(parseDouble(field.item(1).value(), null));
                        b.h(parseDouble(field.item(2).value(), null));
                    }
                }
                case "type" -> b.type(stringArg(field));
                case "is-permanent" -> b.isPermanent("true".equals(stringArg(field)));
                case "const-value" -> b.constValue(stringArg(field));
                case "marshaller-output-type" -> b.marshallerOutputType(stringArg(field));
                case "is-proxy" -> b.isProxy("true".equals(stringArg(field)));
                case "proxy-is-inlet" -> b.proxyIsInlet("true".equals(stringArg(field)));
                case "proxy-index" -> b.proxyIndex(parseInt(stringArg(field), null));
                case "inputs" -> b.inputs(readPorts(field));
                case "outputs" -> b.outputs(readPorts(field));
                case "inner" -> b.inner(readGraph(field));
                default -> log.debug("Skipping unknown block field {}", name);
            }
        }
        return b.build();
    }

    private List<PortDefDto> readPorts(SExpr ports) {
        List<PortDefDto> result = new ArrayList<>();
        for (int i = 1; i < ports.size(); i++) {
            SExpr entry = ports.item(i);
            if (!entry.isList() || entry.size() < 1 || !entry.item(0).isAtom()) continue;

            String portName = entry.item(0).value();
            Integer bitLength = null;
            String userType = null;
            Double width = null;
            for (int j = 1; j < entry.size(); j++) {
                SExpr part = entry.item(j);
                if (part.kind() == SExpr.Kind.BRACKET) {
                    bitLength = parseInt(part.value(), bitLength);
                } else if (part.isForm("user-type", 2)) {
                    userType = part.item(1).value();
                } else if (part.isForm("width", 2)) {
                    width = parseDouble(part.item(1).value(), width);
                }
            }
            result.add(new PortDefDto(portName, bitLength, userType, width));
        }
        return result;
    }

    private EdgeDto readWire(SExpr wire) {
        if (!wire.isList()) return null;
        String from;
        String to;
        if (wire.size() == 3 && wire.item(1).isAtom() && ARROW.equals(wire.item(1).value())) {
            from = wire.item(0).value();
            to = wire.item(2).value();
        } else if (wire.size() == 1 && wire.item(0).isAtom() && wire.item(0).value().contains(" " + ARROW + " ")) {
            String[] sides = wire.item(0).value().split(" " + ARROW + " ", 2);
            from = sides[0].trim();
            to = sides[1].trim();
        } else {
            log.debug("Skipping malformed wire entry");
            return null;
        }

        int fromDot = from.indexOf('.');
        int toDot = to.indexOf('.');
        if (fromDot <= 0 || toDot <= 0) {
            log.debug("Skipping wire {} -> {} without node.port endpoints", from, to);
            return null;
        }
        return EdgeDto.of(from.substring(0, fromDot), from.substring(fromDot + 1),
                to.substring(0, toDot), to.substring(toDot + 1));
    }

    private static String stringArg(SExpr field) {
        return field.size() >= 2 && field.item(1).isAtom() ? field.item(1).value() : null;
    }

    private static Integer parseInt(String s, Integer fallback) {
        if (s == null) return fallback;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-integer value '{}'", s);
            return fallback;
        }
    }

    private static Double parseDouble(String s, Double fallback) {
        if (s == null) return fallback;
        try {
            return Double.parseDouble(s.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric value '{}'", s);
            return fallback;
        }
    }
}
