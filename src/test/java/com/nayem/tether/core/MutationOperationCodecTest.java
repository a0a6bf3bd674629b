package com.nayem.tether.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class MutationOperationCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final MutationOperationCodec codec = new MutationOperationCodec(mapper);

    @Test
    void writesWireFormat() throws Exception {
        Instant at = Instant.parse("2024-03-01T12:00:00Z");
        List<MutationOperation> operations = List.of(
                new MutationOperation.SetAttribute("age", IntNode.valueOf(30), at),
                new MutationOperation.RemoveAttribute("nickname", at),
                new MutationOperation.AddTags("loyalty", Set.of("vip")),
                new MutationOperation.SetTags("interests", Set.of()));

        JsonNode json = mapper.readTree(codec.write(operations));

        assertEquals(mapper.readTree("[" +
                "{\"action\":\"set\",\"attribute\":\"age\",\"value\":30,\"timestamp\":\"2024-03-01T12:00:00Z\"}," +
                "{\"action\":\"remove\",\"attribute\":\"nickname\",\"timestamp\":\"2024-03-01T12:00:00Z\"}," +
                "{\"action\":\"add\",\"group\":\"loyalty\",\"tags\":[\"vip\"]}," +
                "{\"action\":\"set\",\"group\":\"interests\",\"tags\":[]}]"), json);
    }

    @Test
    void readsOperationsWithoutTimestampAsEpoch() {
        List<MutationOperation> operations = codec.read(
                "[{\"action\":\"set\",\"attribute\":\"color\",\"value\":{\"r\":1}},"
                        + "{\"action\":\"remove\",\"group\":\"loyalty\",\"tags\":[\"gold\",\"gold\"]}]");

        MutationOperation.SetAttribute set = assertInstanceOf(MutationOperation.SetAttribute.class, operations.get(0));
        assertEquals(Instant.EPOCH, set.timestamp());
        assertEquals(1, set.value().get("r").intValue());
        assertEquals(new MutationOperation.RemoveTags("loyalty", Set.of("gold")), operations.get(1));
    }

    @Test
    void rejectsUnreadableRows() {
        assertThrows(IllegalArgumentException.class, () -> codec.read("{not json"));
        assertThrows(IllegalArgumentException.class, () -> codec.read("{\"action\":\"set\"}"));
        assertThrows(IllegalArgumentException.class, () -> codec.read("[{\"action\":\"toggle\",\"attribute\":\"x\"}]"));
        assertThrows(IllegalArgumentException.class, () -> codec.read("[{\"action\":\"add\",\"group\":\"g\"}]"));
        assertThrows(IllegalArgumentException.class, () -> codec.read("[{\"action\":\"add\",\"group\":\"g\",\"tags\":[]}]"));
        assertThrows(IllegalArgumentException.class,
                () -> codec.read("[{\"action\":\"remove\",\"attribute\":\"x\",\"timestamp\":\"yesterday\"}]"));
    }
}
