package io.giantt.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * A task node. Identity is {@link #id()}; every other field is replaced through the
 * {@code withX} copies, never mutated in place. Relation buckets are never empty: a bucket
 * whose last target is removed disappears from {@link #relations()}.
 */
public record Item(
        String id,
        String title,
        String description,
        Status status,
        Priority priority,
        CompoundDuration duration,
        List<String> charts,
        List<String> tags,
        Map<RelationType, List<String>> relations,
        List<TimeConstraint> timeConstraints,
        String userComment,
        String autoComment,
        boolean occlude
) {
    private static final Pattern ID_PATTERN = Pattern.compile("[A-Za-z0-9_]+");
    private static final Pattern TAG_PATTERN = Pattern.compile("[a-z0-9_]+");

    public Item {
        if (!isValidId(id)) {
            throw new IllegalArgumentException("Invalid item id: " + id);
        }
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        status = status == null ? Status.NOT_STARTED : status;
        priority = priority == null ? Priority.NEUTRAL : priority;
        duration = duration == null ? CompoundDuration.ZERO : duration;
        charts = charts == null ? List.of() : List.copyOf(charts);
        tags = tags == null ? List.of() : List.copyOf(tags);
        for (String tag : tags) {
            if (!isValidTag(tag)) {
                throw new IllegalArgumentException("Invalid tag '" + tag + "' on item " + id);
            }
        }
        relations = canonicalRelations(relations);
        timeConstraints = timeConstraints == null ? List.of() : List.copyOf(timeConstraints);
        userComment = blankToNull(userComment);
        autoComment = blankToNull(autoComment);
        requireSingleLine(userComment, "comment", id);
        requireSingleLine(autoComment, "auto comment", id);
        if (userComment != null && userComment.contains("###")) {
            throw new IllegalArgumentException("Comment on item " + id + " must not contain '###'");
        }
    }

    public static Item of(String id, String title, CompoundDuration duration) {
        return new Item(id, title, "", Status.NOT_STARTED, Priority.NEUTRAL, duration,
                List.of(), List.of(), Map.of(), List.of(), null, null, false);
    }

    public static boolean isValidId(String id) {
        return id != null && ID_PATTERN.matcher(id).matches();
    }

    public static boolean isValidTag(String tag) {
        return tag != null && TAG_PATTERN.matcher(tag).matches();
    }

    public List<String> targets(RelationType type) {
        return relations.getOrDefault(type, List.of());
    }

    public boolean relatesTo(RelationType type, String targetId) {
        return targets(type).contains(targetId);
    }

    public Item withTitle(String value) {
        return new Item(id, value, description, status, priority, duration, charts, tags, relations, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withDescription(String value) {
        return new Item(id, title, value, status, priority, duration, charts, tags, relations, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withStatus(Status value) {
        return new Item(id, title, description, value, priority, duration, charts, tags, relations, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withPriority(Priority value) {
        return new Item(id, title, description, status, value, duration, charts, tags, relations, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withDuration(CompoundDuration value) {
        return new Item(id, title, description, status, priority, value, charts, tags, relations, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withCharts(List<String> value) {
        return new Item(id, title, description, status, priority, duration, value, tags, relations, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withTags(List<String> value) {
        return new Item(id, title, description, status, priority, duration, charts, value, relations, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withRelations(Map<RelationType, List<String>> value) {
        return new Item(id, title, description, status, priority, duration, charts, tags, value, timeConstraints, userComment, autoComment, occlude);
    }

    public Item withTimeConstraints(List<TimeConstraint> value) {
        return new Item(id, title, description, status, priority, duration, charts, tags, relations, value, userComment, autoComment, occlude);
    }

    public Item withUserComment(String value) {
        return new Item(id, title, description, status, priority, duration, charts, tags, relations, timeConstraints, value, autoComment, occlude);
    }

    public Item withAutoComment(String value) {
        return new Item(id, title, description, status, priority, duration, charts, tags, relations, timeConstraints, userComment, value, occlude);
    }

    public Item withOcclude(boolean value) {
        return new Item(id, title, description, status, priority, duration, charts, tags, relations, timeConstraints, userComment, autoComment, value);
    }

    public Item withTarget(RelationType type, String targetId) {
        if (relatesTo(type, targetId)) {
            return this;
        }
        Map<RelationType, List<String>> copy = mutableRelations();
        copy.computeIfAbsent(type, ignored -> new ArrayList<>()).add(targetId);
        return withRelations(copy);
    }

    public Item withoutTarget(RelationType type, String targetId) {
        if (!relatesTo(type, targetId)) {
            return this;
        }
        Map<RelationType, List<String>> copy = mutableRelations();
        copy.get(type).remove(targetId);
        return withRelations(copy);
    }

    public Map<RelationType, List<String>> mutableRelations() {
        Map<RelationType, List<String>> copy = new EnumMap<>(RelationType.class);
        for (Map.Entry<RelationType, List<String>> entry : relations.entrySet()) {
            copy.put(entry.getKey(), new ArrayList<>(entry.getValue()));
        }
        return copy;
    }

    private static Map<RelationType, List<String>> canonicalRelations(Map<RelationType, List<String>> raw) {
        Map<RelationType, List<String>> out = new EnumMap<>(RelationType.class);
        if (raw != null) {
            for (Map.Entry<RelationType, List<String>> entry : raw.entrySet()) {
                if (entry.getKey() == null || entry.getValue() == null) {
                    continue;
                }
                LinkedHashSet<String> targets = new LinkedHashSet<>();
                for (String target : entry.getValue()) {
                    if (target != null && !target.isBlank()) {
                        targets.add(target);
                    }
                }
                if (!targets.isEmpty()) {
                    out.put(entry.getKey(), List.copyOf(targets));
                }
            }
        }
        return Collections.unmodifiableMap(out);
    }

    private static void requireSingleLine(String value, String what, String id) {
        if (value != null && (value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0)) {
            throw new IllegalArgumentException("The " + what + " on item " + id + " must be a single line");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
