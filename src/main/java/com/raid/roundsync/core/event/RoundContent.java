package com.raid.roundsync.core.event;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raid.roundsync.core.canonical.CanonicalJson;
import com.raid.roundsync.core.canonical.ContentHasher;
import com.raid.roundsync.core.model.CourseSnapshot;
import com.raid.roundsync.core.model.HoleDefinition;

/**
 * JSON shapes hashed into course and rules identifiers, and carried as the content of a round
 * initiation event.
 *
 * <pre>
 * course:     {"course_name", "hole_count", "holes": [{"handicap_index", "hole_number", "par"}], "tee_set"}
 * rules:      {"format": "stroke_play"}
 * initiation: {"course_snapshot": course, "rules_template": rules}
 * </pre>
 */
public final class RoundContent {

    public static final String STROKE_PLAY = "stroke_play";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private RoundContent() {
    }

    public static ObjectNode courseNode(String courseName, String teeSetName, List<HoleDefinition> holes) {
        ObjectNode course = NODES.objectNode();
        course.put("course_name", courseName);
        course.put("tee_set", teeSetName);
        course.put("hole_count", holes.size());
        ArrayNode arr = course.putArray("holes");
        for (HoleDefinition h : sortedHoles(holes)) {
            ObjectNode hole = arr.addObject();
            hole.put("hole_number", h.holeNumber());
            hole.put("par", h.par());
            hole.putNull("handicap_index");
        }
        return course;
    }

    public static ObjectNode courseNode(CourseSnapshot course) {
        return courseNode(course.courseName(), course.teeSetName(), course.holes());
    }

    public static ObjectNode rulesNode() {
        ObjectNode rules = NODES.objectNode();
        rules.put("format", STROKE_PLAY);
        return rules;
    }

    public static String courseHash(String courseName, String teeSetName, List<HoleDefinition> holes) {
        return ContentHasher.hash(courseNode(courseName, teeSetName, holes));
    }

    public static String rulesHash() {
        return ContentHasher.hash(rulesNode());
    }

    public static String initiationContent(CourseSnapshot course) {
        ObjectNode content = NODES.objectNode();
        content.set("course_snapshot", courseNode(course));
        content.set("rules_template", rulesNode());
        return CanonicalJson.write(content);
    }

    /**
     * Reads the course part of initiation content back into a snapshot whose hash is recomputed
     * from what was received, never copied from a tag.
     */
    public static CourseSnapshot readCourse(JsonNode course) {
        if (course == null || !course.isObject()) {
            throw new IllegalArgumentException("course_snapshot missing");
        }
        String name = requireText(course, "course_name");
        String tee = requireText(course, "tee_set");
        JsonNode holesNode = course.get("holes");
        if (holesNode == null || !holesNode.isArray()) {
            throw new IllegalArgumentException("course_snapshot.holes missing");
        }
        List<HoleDefinition> holes = new ArrayList<>();
        for (JsonNode h : holesNode) {
            holes.add(new HoleDefinition(h.path("hole_number").asInt(-1), h.path("par").asInt(-1)));
        }
        JsonNode count = course.get("hole_count");
        if (count != null && count.asInt() != holes.size()) {
            throw new IllegalArgumentException("hole_count " + count.asInt() + " does not match " + holes.size() + " holes");
        }
        List<HoleDefinition> sorted = sortedHoles(holes);
        return new CourseSnapshot(ContentHasher.hash(course), name, tee, sorted);
    }

    static List<HoleDefinition> sortedHoles(List<HoleDefinition> holes) {
        List<HoleDefinition> sorted = new ArrayList<>(holes);
        sorted.sort(Comparator.comparingInt(HoleDefinition::holeNumber));
        return sorted;
    }

    private static String requireText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isTextual()) {
            throw new IllegalArgumentException(field + " missing");
        }
        return v.textValue();
    }
}
