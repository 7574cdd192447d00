package com.nowqueue.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Factory for reading task records from a JSON export.
 * Accepts either a top-level array or an object with a "tasks" array.
 * Timestamps may be ISO instants, offset or local date-times (read as UTC), or plain dates.
 */
public class TaskSnapshotFactory {

    private static final Logger log = LoggerFactory.getLogger(TaskSnapshotFactory.class);

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parse tasks from a JSON string.
     *
     * @param json JSON export
     * @return Parsed tasks in document order
     */
    public static List<Task> parse(String json) {
        try {
            return fromTree(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid task JSON: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Parse tasks from a JSON stream.
     */
    public static List<Task> parse(InputStream inputStream) throws IOException {
        return fromTree(objectMapper.readTree(inputStream));
    }

    private static List<Task> fromTree(JsonNode root) {
        if (root == null || root.isNull() || root.isMissingNode()) {
            return List.of();
        }
        JsonNode array = root.isArray() ? root : root.path("tasks");
        if (!array.isArray()) {
            throw new IllegalArgumentException("Task JSON must be an array or contain a 'tasks' array");
        }

        List<Task> tasks = new ArrayList<>();
        for (JsonNode node : array) {
            tasks.add(toTask(node));
        }

        Set<String> ids = new HashSet<>();
        tasks.forEach(t -> ids.add(t.id()));
        for (Task task : tasks) {
            for (String dep : task.dependsOn()) {
                if (!ids.contains(dep)) {
                    log.warn("Task {} depends on unknown task {}, dependency ignored", task.id(), dep);
                }
            }
        }
        log.debug("Parsed {} tasks from JSON", tasks.size());
        return tasks;
    }

    private static Task toTask(JsonNode node) {
        String id = text(node, "id");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task without id: " + node);
        }

        List<String> deps = new ArrayList<>();
        JsonNode depsNode = node.has("depends_on") ? node.get("depends_on") : node.path("dependsOn");
        if (depsNode.isArray()) {
            depsNode.forEach(d -> deps.add(d.asText()));
        }

        String due = text(node, "due_at");
        if (due == null) {
            due = text(node, "due_date");
        }

        JsonNode weightNode = node.get("weight");
        double weight = weightNode == null || weightNode.isNull() ? Task.DEFAULT_WEIGHT : weightNode.asDouble();

        return Task.builder(id)
                .course(text(node, "course"))
                .title(text(node, "title"))
                .status(TaskStatus.parse(text(node, "status")))
                .dueAt(parseInstant(due))
                .estMinutes(node.path("est_minutes").asInt(0))
                .weight(weight)
                .category(text(node, "category"))
                .anchor(node.path("anchor").asBoolean(false))
                .dependsOn(deps)
                .createdAt(parseInstant(text(node, "created_at")))
                .updatedAt(parseInstant(text(node, "updated_at")))
                .build();
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            if (value.length() == 10) {
                return LocalDate.parse(value).atStartOfDay(ZoneOffset.UTC).toInstant();
            }
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME
                    .parseBest(value, OffsetDateTime::from, LocalDateTime::from);
            if (parsed instanceof OffsetDateTime offsetDateTime) {
                return offsetDateTime.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new IllegalArgumentException("Unrecognized timestamp: " + value, e);
        }
    }
}
