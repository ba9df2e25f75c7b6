package com.deskmate.live2d;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class MotionOperationsTest {

    private static final String MANIFEST = "{\"FileReferences\":{\"Motions\":{"
        + "\"Idle\":[{\"File\":\"idle_a.motion3.json\"},{\"File\":\"idle_b.motion3.json\"}]}}}";

    private MotionOperations attach(OperationTable table, MotionIndex index) {
        CapabilityCache cache = new CapabilityCache();
        cache.attach(table);
        return new MotionOperations(cache, () -> index, new Random(1));
    }

    private MotionIndex index() throws Exception {
        return MotionIndex.fromManifest(new ObjectMapper().readTree(MANIFEST));
    }

    @Test
    void startMotionRetriesWithoutPriority() throws Exception {
        List<String> calls = new ArrayList<>();
        OperationTable table = new OperationTable()
            .register("StartMotion", 2, args -> calls.add(Arrays.toString(args)));

        assertTrue(attach(table, index()).startMotion("Idle", 1, 3));
        assertEquals(List.of("[Idle, 1]"), calls);
    }

    @Test
    void startMotionByNameUsesIndexedFile() throws Exception {
        List<String> calls = new ArrayList<>();
        OperationTable table = new OperationTable()
            .register("StartMotionByName", 2, args -> calls.add(args[0] + ":" + args[1]));

        MotionOperations motions = attach(table, index());
        assertTrue(motions.startMotion("Idle", 1, 3));
        assertFalse(motions.startMotion("Idle", 5, 3));
        assertEquals(List.of("Idle:idle_b.motion3.json"), calls);
    }

    @Test
    void failingBackendReportsNotStarted() throws Exception {
        OperationTable table = new OperationTable()
            .register("StartMotion", args -> {
                throw new IllegalArgumentException("no such group");
            });

        assertFalse(attach(table, index()).startMotion("Nope", 0, 3));
    }

    @Test
    void builtInRandomMotionIsPreferred() throws Exception {
        List<String> calls = new ArrayList<>();
        OperationTable table = new OperationTable()
            .register("StartRandomMotion", 1, args -> calls.add("random " + args[0]))
            .register("StartMotion", 3, args -> calls.add("start " + args[0]));

        assertTrue(attach(table, index()).startRandomMotion("Idle", 3));
        assertEquals(List.of("random Idle"), calls);
    }

    @Test
    void randomMotionFallsBackToIndex() throws Exception {
        List<Object[]> calls = new ArrayList<>();
        OperationTable table = new OperationTable().register("StartMotion", 3, calls::add);

        assertTrue(attach(table, index()).startRandomMotion(null, 2));
        assertEquals(1, calls.size());
        assertEquals("Idle", calls.get(0)[0]);
        assertEquals(2, calls.get(0)[2]);
    }

    @Test
    void randomMotionWithoutIndexTriesFirstMotionOfGroup() {
        List<Object[]> calls = new ArrayList<>();
        OperationTable table = new OperationTable().register("StartMotion", 3, calls::add);

        assertTrue(attach(table, MotionIndex.empty()).startRandomMotion("Idle", 3));
        assertEquals(0, calls.get(0)[1]);
        assertFalse(attach(table, MotionIndex.empty()).startRandomMotion(null, 3));
    }

    @Test
    void nothingHappensWithoutBackend() throws Exception {
        CapabilityCache detached = new CapabilityCache();
        MotionIndex idx = index();
        MotionOperations motions = new MotionOperations(detached, () -> idx, new Random());
        assertFalse(motions.startMotion("Idle", 0, 3));
        assertFalse(motions.startRandomMotion("Idle", 3));
    }
}
