package nl.bytesoflife.circuitsync.source;

import nl.bytesoflife.circuitsync.CircuitSyncException;
import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.Pin;
import nl.bytesoflife.circuitsync.model.PinType;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.parser.JsonParser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static nl.bytesoflife.circuitsync.parser.JsonParser.asList;
import static nl.bytesoflife.circuitsync.parser.JsonParser.asObject;
import static nl.bytesoflife.circuitsync.parser.JsonParser.asString;

/**
 * Reads a resolved circuit from its JSON export:
 * <pre>
 * {
 *   "name": "root",
 *   "components": {"R1": {"symbol": "Device:R", "value": "10k", "footprint": "...",
 *                         "token": "...", "position": [x, y], "rotation": 0, "pins": [...]}},
 *   "nets": {"VIN": [{"component": "R1", "pin": {"number": "1"}}],
 *            "DATA": {"scope": "hierarchical", "direction": "input", "connections": [...]}},
 *   "subcircuits": [ ... ]
 * }
 * </pre>
 */
public class JsonCircuitReader {

    private final JsonParser parser = new JsonParser();

    public Circuit read(Path file) throws IOException {
        return read(Files.readString(file, StandardCharsets.UTF_8));
    }

    public Circuit read(String json) {
        Map<String, Object> root;
        try {
            root = parser.parseObject(json);
        } catch (IllegalArgumentException e) {
            throw new CircuitSyncException("Invalid circuit description: " + e.getMessage(), e);
        }
        return readCircuit(root, "root");
    }

    private Circuit readCircuit(Map<String, Object> json, String defaultName) {
        String name = json.containsKey("name") ? asString(json.get("name")) : defaultName;
        Circuit.Builder builder = Circuit.builder(name);

        for (Map.Entry<String, Object> entry : asObject(json.get("components")).entrySet()) {
            builder.component(readComponent(entry.getKey(), asObject(entry.getValue())));
        }
        for (Map.Entry<String, Object> entry : asObject(json.get("nets")).entrySet()) {
            builder.net(readNet(entry.getKey(), entry.getValue()));
        }
        int index = 1;
        for (Object sub : asList(json.get("subcircuits"))) {
            builder.subcircuit(readCircuit(asObject(sub), name + "_" + index++));
        }
        return builder.build();
    }

    private ComponentSpec readComponent(String reference, Map<String, Object> json) {
        String ref = json.containsKey("ref") ? asString(json.get("ref")) : reference;
        String symbol = asString(json.get("symbol"));
        if (symbol == null || symbol.isEmpty()) {
            throw new CircuitSyncException("Component " + ref + " has no symbol");
        }
        Position position = readPosition(json.get("position"));
        Integer rotation = json.containsKey("rotation") ? (int) JsonParser.toDouble(json.get("rotation")) : null;
        if (position != null && rotation == null) {
            rotation = 0;
        }

        List<Pin> pins = new ArrayList<>();
        for (Object pin : asList(json.get("pins"))) {
            Map<String, Object> p = asObject(pin);
            String number = asString(p.get("number"));
            if (number == null) continue;
            String pinName = p.containsKey("name") ? asString(p.get("name")) : "";
            pins.add(new Pin(number, pinName, PinType.fromKicadName(asString(p.get("type"))),
                    (int) JsonParser.toDouble(p.getOrDefault("unit", 0))));
        }
        return new ComponentSpec(ref, symbol, asString(json.get("value")), asString(json.get("footprint")),
                asString(json.get("token")), position, rotation, pins);
    }

    private static Position readPosition(Object value) {
        if (value == null) return null;
        List<Object> list = asList(value);
        if (list.size() >= 2) {
            return new Position(JsonParser.toDouble(list.get(0)), JsonParser.toDouble(list.get(1)));
        }
        Map<String, Object> object = asObject(value);
        if (object.containsKey("x") && object.containsKey("y")) {
            return new Position(JsonParser.toDouble(object.get("x")), JsonParser.toDouble(object.get("y")));
        }
        return null;
    }

    private NetSpec readNet(String name, Object json) {
        NetScope scope = null;
        PortDirection direction = null;
        List<Object> connections;
        if (json instanceof List) {
            connections = asList(json);
        } else {
            Map<String, Object> object = asObject(json);
            scope = NetScope.fromName(asString(object.get("scope")));
            String dir = asString(object.get("direction"));
            direction = dir == null ? null : PortDirection.fromKicadShape(dir);
            connections = asList(object.get("connections"));
        }
        List<ConnectionSpec> specs = new ArrayList<>();
        for (Object connection : connections) {
            specs.add(readConnection(name, connection));
        }
        return new NetSpec(name, scope, direction, specs);
    }

    private static ConnectionSpec readConnection(String netName, Object json) {
        if (json instanceof String s) {
            return ConnectionSpec.parse(s);
        }
        Map<String, Object> object = asObject(json);
        String component = asString(object.get("component"));
        Object pin = object.get("pin");
        String number = pin instanceof Map ? asString(asObject(pin).get("number")) : asString(pin);
        if (component == null || number == null) {
            throw new CircuitSyncException("Net " + netName + " has an incomplete connection: " + json);
        }
        if (pin instanceof Number n && n.doubleValue() == Math.rint(n.doubleValue())) {
            number = Long.toString(n.longValue());
        }
        return new ConnectionSpec(component, number);
    }
}
