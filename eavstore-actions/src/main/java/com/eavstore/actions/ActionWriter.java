package com.eavstore.actions;

import com.eavstore.core.value.ValueCodec;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes actions as newline-delimited JSON, one action per line.
 */
public class ActionWriter {

    private final Writer out;
    private final ObjectMapper mapper;

    public ActionWriter(Writer out) {
        this(out, ValueCodec.createMapper());
    }

    public ActionWriter(Writer out, ObjectMapper mapper) {
        this.out = out;
        this.mapper = mapper;
    }

    /**
     * Validate and write each action. Stops at the first invalid action; lines
     * already written stay written.
     *
     * @throws InvalidActionException if an action type is not replayable
     */
    public void writeActions(List<Action> actions) throws IOException {
        for (Action action : actions) {
            validateAction(action);
            out.write(mapper.writeValueAsString(action));
            out.write('\n');
        }
        out.flush();
    }

    public static void validateAction(Action action) {
        if (ActionType.fromValue(action.type()).isEmpty()) {
            throw new InvalidActionException("Unknown action type '" + action.type() + "'", action);
        }
    }

    /**
     * Write actions to a file, replacing its contents.
     */
    public static void writeActions(List<Action> actions, Path dest) throws IOException {
        try (Writer writer = Files.newBufferedWriter(dest, StandardCharsets.UTF_8)) {
            new ActionWriter(writer).writeActions(actions);
        }
    }
}
