package com.eavstore.actions;

import com.eavstore.core.model.Entity;
import com.eavstore.core.store.EntityOperations;
import com.eavstore.core.value.ValueCodec;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Replays action logs against the entity API.
 *
 * Actions run in file order, each in its own transaction; the first failure stops
 * the replay and earlier actions stay applied.
 */
public class ActionProcessor {

    private static final Logger log = LoggerFactory.getLogger(ActionProcessor.class);

    private final EntityOperations entities;
    private final ValueCodec codec;
    private final ObjectMapper mapper;
    private final Map<ActionType, ActionHandler> handlers = new EnumMap<>(ActionType.class);

    public ActionProcessor(EntityOperations entities) {
        this(entities, new ValueCodec());
    }

    public ActionProcessor(EntityOperations entities, ValueCodec codec) {
        this.entities = entities;
        this.codec = codec;
        this.mapper = codec.getMapper();

        handlers.put(ActionType.UPDATE_ENT, (ops, p) -> {
            ops.updateEnt(p.key(), p.patches(), p.deletions(), p.expectedModified());
            return Optional.empty();
        });
        handlers.put(ActionType.UPSERT_ENT, (ops, p) -> ops.upsertEnt(p.key(), p.patches(), p.deletions()));
    }

    public List<List<Optional<Entity>>> processActionFiles(List<Path> actionFiles) throws IOException, SQLException {
        List<List<Optional<Entity>>> results = new ArrayList<>(actionFiles.size());
        for (Path file : actionFiles) {
            results.add(processActionFile(file));
        }
        return results;
    }

    public List<Optional<Entity>> processActionFile(Path actionFile) throws IOException, SQLException {
        List<Action> actions = parseActionFile(actionFile);
        log.info("Replaying {} actions from {}", actions.size(), actionFile);
        return processActions(actions);
    }

    /**
     * Read one action per non-blank line.
     */
    public List<Action> parseActionFile(Path actionFile) throws IOException {
        List<Action> actions = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(actionFile, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                line = line.strip();
                if (!line.isEmpty()) {
                    actions.add(mapper.readValue(line, Action.class));
                }
            }
        }
        return actions;
    }

    public List<Optional<Entity>> processActions(List<Action> actions) throws SQLException {
        List<Optional<Entity>> results = new ArrayList<>(actions.size());
        for (Action action : actions) {
            results.add(executeAction(action));
        }
        return results;
    }

    public Optional<Entity> executeAction(Action action) throws SQLException {
        ActionHandler handler = handlerFor(action);
        ActionParams params = ActionParams.parse(action, codec);
        log.debug("Executing {} on {}", action.type(), params.key());
        return handler.apply(entities, params);
    }

    /**
     * @throws InvalidActionException if the action type has no handler
     */
    public ActionHandler handlerFor(Action action) {
        return ActionType.fromValue(action.type())
            .map(handlers::get)
            .orElseThrow(() -> new InvalidActionException("Unknown action type '" + action.type() + "'", action));
    }
}
