package com.eavstore.actions;

import com.eavstore.core.config.EavStoreConfig;
import com.eavstore.core.model.Entity;
import com.eavstore.core.schema.EavSchema;
import com.eavstore.core.store.EavDatabase;
import com.eavstore.core.store.EntityDao;
import com.eavstore.core.store.StaleEntityException;
import com.eavstore.core.value.AttrValue;
import com.eavstore.core.value.ValueCodec;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ActionProcessor.
 */
class ActionProcessorTest {

    @TempDir
    Path tempDir;

    private final ValueCodec codec = new ValueCodec();

    private Action action(String type, String paramsJson) throws Exception {
        return new Action(type, (ObjectNode) codec.getMapper().readTree(paramsJson));
    }

    private Path actionFile(String name, String... lines) throws Exception {
        Path file = tempDir.resolve(name);
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    @Nested
    @DisplayName("Dispatch")
    class DispatchTests {

        private RecordingEntities entities;
        private ActionProcessor processor;

        @BeforeEach
        void setUp() {
            entities = new RecordingEntities();
            processor = new ActionProcessor(entities, codec);
        }

        @Test
        @DisplayName("update_ent calls updateEnt with every param")
        void updateEnt() throws Exception {
            Optional<Entity> result = processor.executeAction(action("update_ent",
                "{\"key\":\"e1\",\"patches\":{\"a\":1},\"deletions\":[\"b\"],\"expected_modified\":9}"));

            assertTrue(result.isEmpty());
            assertEquals(List.of(new RecordingEntities.Call("updateEnt", "e1",
                Map.of("a", AttrValue.of(1)), List.of("b"), 9L)), entities.calls);
        }

        @Test
        @DisplayName("upsert_ent calls upsertEnt and returns its result")
        void upsertEnt() throws Exception {
            Optional<Entity> result = processor.executeAction(action("upsert_ent",
                "{\"ent_key\":\"e1\",\"attr_patches\":{\"a\":\"x\"}}"));

            assertEquals("e1", result.orElseThrow().key());
            assertEquals("upsertEnt", entities.calls.get(0).method());
            assertEquals(Map.of("a", AttrValue.of("x")), entities.calls.get(0).patches());
        }

        @Test
        @DisplayName("Unknown action type is rejected before any call")
        void unknownType() throws Exception {
            Action deleteAction = action("delete_ent", "{\"key\":\"e1\"}");

            InvalidActionException e = assertThrows(InvalidActionException.class,
                () -> processor.executeAction(deleteAction));

            assertTrue(e.getMessage().contains("delete_ent"));
            assertTrue(entities.calls.isEmpty());
        }

        @Test
        @DisplayName("Malformed params are rejected before any call")
        void malformedParams() throws Exception {
            Action noKey = action("upsert_ent", "{\"patches\":{}}");

            assertThrows(InvalidActionException.class, () -> processor.executeAction(noKey));
            assertTrue(entities.calls.isEmpty());
        }

        @Test
        @DisplayName("The first failure stops the replay")
        void stopsAtFirstFailure() throws Exception {
            entities.staleKey = "e2";
            List<Action> actions = List.of(
                action("upsert_ent", "{\"key\":\"e1\"}"),
                action("update_ent", "{\"key\":\"e2\",\"expected_modified\":1}"),
                action("upsert_ent", "{\"key\":\"e3\"}"));

            assertThrows(StaleEntityException.class, () -> processor.processActions(actions));

            assertEquals(1, entities.calls.size());
            assertEquals("e1", entities.calls.get(0).key());
        }
    }

    @Nested
    @DisplayName("Files")
    class FileTests {

        @Test
        @DisplayName("Blank lines are skipped and unknown fields ignored")
        void parsesFile() throws Exception {
            Path file = actionFile("a.ndjson",
                "{\"type\":\"upsert_ent\",\"params\":{\"key\":\"e1\"}}",
                "",
                "   ",
                "{\"type\":\"update_ent\",\"params\":{\"key\":\"e1\"},\"recorded_by\":\"test\"}");

            List<Action> actions = new ActionProcessor(new RecordingEntities()).parseActionFile(file);

            assertEquals(2, actions.size());
            assertEquals("upsert_ent", actions.get(0).type());
            assertEquals("e1", actions.get(1).params().get("key").asText());
        }

        @Test
        @DisplayName("Files are replayed in the given order")
        void filesInOrder() throws Exception {
            RecordingEntities entities = new RecordingEntities();
            Path first = actionFile("1.ndjson", "{\"type\":\"upsert_ent\",\"params\":{\"key\":\"a\"}}");
            Path second = actionFile("2.ndjson",
                "{\"type\":\"upsert_ent\",\"params\":{\"key\":\"b\"}}",
                "{\"type\":\"update_ent\",\"params\":{\"key\":\"a\"}}");

            List<List<Optional<Entity>>> results = new ActionProcessor(entities).processActionFiles(List.of(first, second));

            assertEquals(1, results.get(0).size());
            assertEquals(2, results.get(1).size());
            assertEquals(List.of("a", "b", "a"), entities.calls.stream().map(RecordingEntities.Call::key).toList());
        }
    }

    @Test
    @DisplayName("Replaying a log against a real store applies every action")
    void replayAgainstStore() throws Exception {
        EntityDao dao = new EntityDao(new EavDatabase(EavStoreConfig.forPath(tempDir.resolve("eav.db"))),
            EavSchema.standard());
        dao.ensureTables();
        Path log = actionFile("replay.ndjson",
            "{\"type\":\"upsert_ent\",\"params\":{\"key\":\"e1\",\"patches\":{\"a\":1,\"tags\":[\"x\"]}}}",
            "{\"type\":\"update_ent\",\"params\":{\"key\":\"e1\",\"patches\":{\"b\":2},\"deletions\":[\"a\"]}}",
            "{\"type\":\"upsert_ent\",\"params\":{\"key\":\"e1\",\"patches\":{\"c\":\"three\"}}}");

        List<Optional<Entity>> results = new ActionProcessor(dao).processActionFile(log);

        assertTrue(results.get(0).isPresent());
        assertTrue(results.get(1).isEmpty());
        assertTrue(results.get(2).isEmpty());
        Entity e1 = dao.getEnt("e1").orElseThrow();
        assertEquals(Map.of(
            "tags", AttrValue.list(AttrValue.of("x")),
            "b", AttrValue.of(2),
            "c", AttrValue.of("three")), e1.attrs());
    }
}
