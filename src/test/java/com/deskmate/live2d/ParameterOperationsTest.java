package com.deskmate.live2d;

import com.deskmate.models.ParameterTarget;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class ParameterOperationsTest {

    private ParameterOperations attach(OperationTable table) {
        CapabilityCache cache = new CapabilityCache();
        cache.attach(table);
        return new ParameterOperations(cache);
    }

    @Test
    void fallsBackToTwoArgumentSetterAndCachesIt() {
        List<String> calls = new ArrayList<>();
        OperationTable table = new OperationTable()
            .register("SetParamFloat", 2, args -> {
                calls.add("SetParamFloat" + args.length + ":" + args[0] + "=" + args[1]);
                return null;
            });
        ParameterOperations parameters = attach(table);

        assertTrue(parameters.set("ParamAngleX", 12.0, 0.5));
        assertTrue(parameters.set("ParamAngleY", 3.0, 0.5));

        assertEquals(List.of("SetParamFloat2:ParamAngleX=12.0", "SetParamFloat2:ParamAngleY=3.0"), calls);
    }

    @Test
    void prefersEarlierCandidateNames() {
        List<String> used = new ArrayList<>();
        OperationTable table = new OperationTable()
            .register("SetParam", 3, args -> used.add("SetParam"))
            .register("SetParameterValue", 3, args -> used.add("SetParameterValue"));

        attach(table).set("ParamEyeLOpen", 1.0, 1.0);

        assertEquals(List.of("SetParameterValue"), used);
    }

    @Test
    void probesEachOperationNameOnlyOnce() {
        AtomicInteger lookups = new AtomicInteger();
        OperationTable table = new OperationTable().register("UpdateParameter", 2, args -> null);
        ModelHandle counting = name -> {
            lookups.incrementAndGet();
            return table.lookup(name);
        };
        CapabilityCache cache = new CapabilityCache();
        cache.attach(counting);
        ParameterOperations parameters = new ParameterOperations(cache);

        assertTrue(parameters.set("A", 1.0, 1.0));
        int afterFirst = lookups.get();
        assertTrue(parameters.set("B", 1.0, 1.0));
        assertTrue(parameters.set("C", 1.0, 1.0));

        assertEquals(afterFirst, lookups.get());
        assertEquals(5, cache.probedCount());
    }

    @Test
    void backendExceptionStillCountsAsHandled() {
        AtomicInteger secondCandidate = new AtomicInteger();
        OperationTable table = new OperationTable()
            .register("SetParameterValue", args -> {
                throw new IllegalStateException("unknown parameter");
            })
            .register("SetParamFloat", args -> secondCandidate.incrementAndGet());

        assertTrue(attach(table).set("Missing", 1.0, 1.0));
        assertEquals(0, secondCandidate.get());
    }

    @Test
    void additiveUsesAddOperationWhenPresent() {
        Map<String, Double> values = new HashMap<>();
        values.put("ParamCheek", 0.25);
        OperationTable table = new OperationTable()
            .register("AddParameterValue", 2, args -> values.merge((String) args[0], (Double) args[1], Double::sum))
            .register("SetParameterValue", 3, args -> {
                fail("setter should not be used");
                return null;
            });

        attach(table).apply(List.of(new ParameterTarget("ParamCheek", 0.5)), 0.5, true);

        assertEquals(0.5, values.get("ParamCheek"), 1e-9);
    }

    @Test
    void additiveFallbackEqualsGetPlusBlendedDelta() {
        Map<String, Double> values = new HashMap<>();
        values.put("ParamMouthForm", 0.2);
        OperationTable table = new OperationTable()
            .register("GetParamFloat", 1, args -> values.getOrDefault((String) args[0], 0.0))
            .register("SetParameterValue", 3, args -> {
                assertEquals(1.0, ((Number) args[2]).doubleValue(), 1e-9);
                values.put((String) args[0], ((Number) args[1]).doubleValue());
                return null;
            });

        attach(table).apply(List.of(new ParameterTarget("ParamMouthForm", 0.6)), 0.5, true);

        assertEquals(0.2 + 0.6 * 0.5, values.get("ParamMouthForm"), 1e-9);
    }

    @Test
    void missingGetterReadsAsZero() {
        OperationTable table = new OperationTable();
        assertEquals(0.0, attach(table).get("Anything"));
    }

    @Test
    void noSetterMeansNothingApplied() {
        assertFalse(attach(new OperationTable()).apply(List.of(new ParameterTarget("X", 1.0)), 1.0, false));
    }
}
