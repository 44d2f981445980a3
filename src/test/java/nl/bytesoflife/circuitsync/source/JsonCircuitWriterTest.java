package nl.bytesoflife.circuitsync.source;

import nl.bytesoflife.circuitsync.model.NetScope;
import nl.bytesoflife.circuitsync.model.PortDirection;
import nl.bytesoflife.circuitsync.model.Position;
import nl.bytesoflife.circuitsync.parser.JsonParser;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonCircuitWriterTest {

    private final JsonCircuitWriter writer = new JsonCircuitWriter();

    private static Circuit sensorBoard() {
        Circuit sensor = Circuit.builder("sensor")
                .component(ComponentSpec.of("R10", "Device:R", "1k").withToken("t-10")
                        .at(new Position(76.2, 50.8), 90))
                .net(NetSpec.of("SDA", "R10.1").withScope(NetScope.HIERARCHICAL).withDirection(PortDirection.OUTPUT))
                .net("GND", "R10.2")
                .build();
        return Circuit.builder("board")
                .component(ComponentSpec.of("R1", "Device:R", "4\"7k").withFootprint("Resistor_SMD:R_0603"))
                .net("SDA", "R1.2")
                .net(NetSpec.of("VBUS", "R1.1").withScope(NetScope.GLOBAL_POWER))
                .subcircuit(sensor)
                .build();
    }

    @Test
    void readerGetsBackWhatWasWritten() {
        Circuit board = sensorBoard();

        assertEquals(board, new JsonCircuitReader().read(writer.write(board)));
    }

    @Test
    void writesReaderLayout() {
        Map<String, Object> json = new JsonParser().parseObject(writer.write(sensorBoard()));

        assertEquals("board", json.get("name"));
        Map<String, Object> r1 = JsonParser.asObject(JsonParser.asObject(json.get("components")).get("R1"));
        assertEquals("Device:R", r1.get("symbol"));
        assertEquals("4\"7k", r1.get("value"));
        assertFalse(r1.containsKey("position"), "no placement was asked for");

        Map<String, Object> nets = JsonParser.asObject(json.get("nets"));
        assertInstanceOf(List.class, nets.get("SDA"));
        assertEquals("global", JsonParser.asObject(nets.get("VBUS")).get("scope"));

        Map<String, Object> sensor = JsonParser.asObject(JsonParser.asList(json.get("subcircuits")).get(0));
        Map<String, Object> sda = JsonParser.asObject(JsonParser.asObject(sensor.get("nets")).get("SDA"));
        assertEquals("hierarchical", sda.get("scope"));
        assertEquals("output", sda.get("direction"));
        Map<String, Object> r10 = JsonParser.asObject(JsonParser.asObject(sensor.get("components")).get("R10"));
        assertEquals(List.of(76.2, 50.8), r10.get("position"));
        assertEquals(90, r10.get("rotation"));
    }

    @Test
    void emptyCircuitIsValidJson() {
        String json = writer.write(Circuit.builder("empty").build());

        Circuit read = new JsonCircuitReader().read(json);
        assertEquals("empty", read.name());
        assertTrue(read.components().isEmpty());
        assertTrue(read.subcircuits().isEmpty());
    }
}
