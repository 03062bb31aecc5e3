package com.raid.roundsync.core.canonical;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.junit.Test;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

public class CanonicalJsonTest {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    @Test
    public void write_sortsKeysRegardlessOfInsertionOrder() {
        ObjectNode a = NODES.objectNode();
        a.put("tee_set", "Blue");
        a.put("course_name", "Pebble Creek");
        a.put("hole_count", 18);

        ObjectNode b = NODES.objectNode();
        b.put("hole_count", 18);
        b.put("course_name", "Pebble Creek");
        b.put("tee_set", "Blue");

        assertEquals("{\"course_name\":\"Pebble Creek\",\"hole_count\":18,\"tee_set\":\"Blue\"}", CanonicalJson.write(a));
        assertEquals(CanonicalJson.write(a), CanonicalJson.write(b));
        assertEquals(ContentHasher.hash(a), ContentHasher.hash(b));
    }

    @Test
    public void write_sortsNestedObjectsAndKeepsArrayOrder() {
        ObjectNode root = NODES.objectNode();
        ArrayNode holes = root.putArray("holes");
        holes.addObject().put("par", 4).put("hole_number", 1);
        holes.addObject().put("par", 3).put("hole_number", 2);

        assertEquals("{\"holes\":[{\"hole_number\":1,\"par\":4},{\"hole_number\":2,\"par\":3}]}",
                CanonicalJson.write(root));
    }

    @Test
    public void write_integralDoubleHasNoFraction() {
        ObjectNode node = NODES.objectNode();
        node.put("a", 4.0);
        node.put("b", 2.50);
        assertEquals("{\"a\":4,\"b\":2.5}", CanonicalJson.write(node));
    }

    @Test
    public void write_keepsNullsAndEscapesStrings() {
        ObjectNode node = NODES.objectNode();
        node.putNull("handicap_index");
        node.put("name", "O'Brien \"Links\"");
        assertEquals("{\"handicap_index\":null,\"name\":\"O'Brien \\\"Links\\\"\"}", CanonicalJson.write(node));
    }

    @Test(expected = IllegalArgumentException.class)
    public void write_rejectsNaN() {
        ObjectNode node = NODES.objectNode();
        node.put("x", Double.NaN);
        CanonicalJson.write(node);
    }

    @Test(expected = IllegalArgumentException.class)
    public void parse_rejectsMalformedJson() {
        CanonicalJson.parse("{\"a\":");
    }

    @Test
    public void hash_changesWithAnyField() {
        ObjectNode a = NODES.objectNode().put("course_name", "Pebble Creek");
        ObjectNode b = NODES.objectNode().put("course_name", "Pebble  Creek");
        assertNotEquals(ContentHasher.hash(a), ContentHasher.hash(b));
        assertEquals(64, ContentHasher.hash(a).length());
    }

    @Test
    public void sha256Hex_knownVector() {
        assertEquals("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad", ContentHasher.sha256Hex("abc"));
    }
}
