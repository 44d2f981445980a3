package nl.bytesoflife.circuitsync.source;

import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.parser.SExpressions;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * Writes a circuit description in the JSON layout {@link JsonCircuitReader} reads. Nets whose
 * scope and direction are inferred are written as plain connection lists; the others as objects
 * with {@code scope}, {@code direction} and {@code connections}.
 */
public class JsonCircuitWriter {

    private static final String INDENT = "  ";

    public void write(CircuitDescription circuit, Path file) throws IOException {
        Files.writeString(file, write(circuit), StandardCharsets.UTF_8);
    }

    public String write(CircuitDescription circuit) {
        StringBuilder json = new StringBuilder();
        writeCircuit(json, circuit, 0);
        json.append('\n');
        return json.toString();
    }

    private void writeCircuit(StringBuilder json, CircuitDescription circuit, int depth) {
        String pad = INDENT.repeat(depth + 1);
        json.append("{\n");
        json.append(pad).append("\"name\": ").append(quote(circuit.name())).append(",\n");

        json.append(pad).append("\"components\": {");
        List<ComponentSpec> components = circuit.components();
        for (int i = 0; i < components.size(); i++) {
            json.append(i == 0 ? "\n" : ",\n").append(pad).append(INDENT);
            writeComponent(json, components.get(i));
        }
        json.append(components.isEmpty() ? "},\n" : "\n" + pad + "},\n");

        json.append(pad).append("\"nets\": {");
        List<NetSpec> nets = circuit.nets();
        for (int i = 0; i < nets.size(); i++) {
            json.append(i == 0 ? "\n" : ",\n").append(pad).append(INDENT);
            writeNet(json, nets.get(i));
        }
        json.append(nets.isEmpty() ? "},\n" : "\n" + pad + "},\n");

        json.append(pad).append("\"subcircuits\": [");
        List<? extends CircuitDescription> subcircuits = circuit.subcircuits();
        for (int i = 0; i < subcircuits.size(); i++) {
            json.append(i == 0 ? "\n" : ",\n").append(pad).append(INDENT);
            writeCircuit(json, subcircuits.get(i), depth + 2);
        }
        json.append(subcircuits.isEmpty() ? "]\n" : "\n" + pad + "]\n");
        json.append(INDENT.repeat(depth)).append('}');
    }

    private static void writeComponent(StringBuilder json, ComponentSpec component) {
        json.append(quote(component.reference())).append(": {");
        json.append("\"symbol\": ").append(quote(component.libId()));
        json.append(", \"value\": ").append(quote(component.value()));
        if (!component.footprint().isEmpty()) {
            json.append(", \"footprint\": ").append(quote(component.footprint()));
        }
        if (component.token() != null) {
            json.append(", \"token\": ").append(quote(component.token()));
        }
        if (component.hasPlacement()) {
            json.append(", \"position\": [")
                    .append(SExpressions.formatNumber(component.position().x())).append(", ")
                    .append(SExpressions.formatNumber(component.position().y())).append(']');
            json.append(", \"rotation\": ").append(component.rotation() == null ? 0 : component.rotation());
        }
        json.append('}');
    }

    private static void writeNet(StringBuilder json, NetSpec net) {
        json.append(quote(net.name())).append(": ");
        boolean plain = net.scope() == null && net.direction() == null;
        if (!plain) {
            json.append('{');
            String separator = "";
            if (net.scope() != null) {
                json.append("\"scope\": ").append(quote(scopeName(net.scope())));
                separator = ", ";
            }
            if (net.direction() != null) {
                json.append(separator).append("\"direction\": ").append(quote(net.direction().getKicadShape()));
                separator = ", ";
            }
            json.append(separator).append("\"connections\": ");
        }
        json.append('[');
        for (int i = 0; i < net.connections().size(); i++) {
            ConnectionSpec connection = net.connections().get(i);
            if (i > 0) json.append(", ");
            json.append("{\"component\": ").append(quote(connection.reference()))
                    .append(", \"pin\": {\"number\": ").append(quote(connection.pin())).append("}}");
        }
        json.append(']');
        if (!plain) json.append('}');
    }

    private static String scopeName(NetScope scope) {
        return scope == NetScope.GLOBAL_POWER ? "global" : scope.name().toLowerCase(Locale.ROOT);
    }

    private static String quote(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder("\"");
        for (char c : s.toCharArray()) {
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 32) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
