package com.pagescribe.extractor;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class RecordFlattenerTest {

    @Test
    void testNestedObjectsBecomeDotJoinedKeys() {
        Map<String, Object> age = new LinkedHashMap<>();
        age.put("num", 3);
        age.put("unit", "Aar");
        Map<String, Object> patient = new LinkedHashMap<>();
        patient.put("name", "Hans");
        patient.put("age", age);
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("file_name", "a.png");
        record.put("patient", patient);

        Map<String, Object> flat = RecordFlattener.flatten(record);

        assertEquals(List.of("file_name", "patient.name", "patient.age.num", "patient.age.unit"),
            new ArrayList<>(flat.keySet()));
        assertEquals(3, flat.get("patient.age.num"));
    }

    @Test
    void testListsAndNullsAreLeaves() {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("top", List.of("Croup", "-"));
        record.put("note", null);
        Map<String, Object> flat = RecordFlattener.flatten(record);
        assertEquals(List.of("Croup", "-"), flat.get("top"));
        assertTrue(flat.containsKey("note"));
        assertNull(flat.get("note"));
    }

    @Test
    void testEmptyNestedObjectBecomesNullLeaf() {
        Map<String, Object> record = new HashMap<>();
        record.put("sektion", new HashMap<>());
        Map<String, Object> flat = RecordFlattener.flatten(record);
        assertTrue(flat.containsKey("sektion"));
        assertNull(flat.get("sektion"));
    }
}
