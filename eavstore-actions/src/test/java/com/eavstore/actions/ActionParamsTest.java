package com.eavstore.actions;

import com.eavstore.core.value.AttrValue;
import com.eavstore.core.value.ValueCodec;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionParamsTest {

    private final ValueCodec codec = new ValueCodec();

    private Action action(String paramsJson) throws Exception {
        return new Action(ActionType.UPDATE_ENT.getValue(), (ObjectNode) codec.getMapper().readTree(paramsJson));
    }

    @Nested
    @DisplayName("Parsing")
    class ParsingTests {

        @Test
        @DisplayName("Reads key, patches, deletions and expected modified")
        void fullParams() throws Exception {
            ActionParams params = ActionParams.parse(action(
                "{\"key\":\"e1\",\"patches\":{\"a\":1,\"b\":\"x\",\"c\":[true]},"
                    + "\"deletions\":[\"d\"],\"expected_modified\":1700000000000}"), codec);

            assertEquals("e1", params.key());
            assertEquals(AttrValue.of(1), params.patches().get("a"));
            assertEquals(AttrValue.of("x"), params.patches().get("b"));
            assertEquals(AttrValue.list(AttrValue.of(true)), params.patches().get("c"));
            assertEquals(List.of("d"), params.deletions());
            assertEquals(1700000000000L, params.expectedModified());
        }

        @Test
        @DisplayName("Accepts the long parameter names")
        void aliases() throws Exception {
            ActionParams params = ActionParams.parse(action(
                "{\"ent_key\":\"e1\",\"attr_patches\":{\"a\":1},\"attr_deletions\":[\"b\"],\"ent_modified\":7}"), codec);

            assertEquals("e1", params.key());
            assertEquals(Map.of("a", AttrValue.of(1)), params.patches());
            assertEquals(List.of("b"), params.deletions());
            assertEquals(7L, params.expectedModified());
        }

        @Test
        @DisplayName("Only key is required")
        void minimal() throws Exception {
            ActionParams params = ActionParams.parse(action("{\"key\":\"e1\"}"), codec);

            assertTrue(params.patches().isEmpty());
            assertTrue(params.deletions().isEmpty());
            assertNull(params.expectedModified());
        }

        @Test
        @DisplayName("Malformed params are rejected")
        void malformed() {
            for (String json : List.of(
                "{}",
                "{\"key\":5}",
                "{\"key\":\"e1\",\"patches\":[1]}",
                "{\"key\":\"e1\",\"deletions\":\"a\"}",
                "{\"key\":\"e1\",\"deletions\":[1]}",
                "{\"key\":\"e1\",\"expected_modified\":\"5\"}",
                "{\"key\":\"e1\",\"expected_modified\":1.5}")) {
                assertThrows(InvalidActionException.class, () -> ActionParams.parse(action(json), codec), json);
            }
        }
    }

    @Test
    @DisplayName("JSON form parses back to the same params")
    void toJsonParsesBack() {
        Map<String, AttrValue> patches = new LinkedHashMap<>();
        patches.put("a", AttrValue.of(2.5));
        patches.put("b", AttrValue.nullValue());
        ActionParams params = new ActionParams("e1", patches, List.of("c"), 42L);

        ObjectNode json = params.toJson(codec);

        assertEquals(params, ActionParams.parse(Action.of(ActionType.UPSERT_ENT, json), codec));
    }
}
