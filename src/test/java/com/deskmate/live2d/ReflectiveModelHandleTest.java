package com.deskmate.live2d;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReflectiveModelHandleTest {

    public static class TwoArgBackend {
        final List<String> calls = new ArrayList<>();

        public void SetParamFloat(String id, float value) {
            calls.add(id + "=" + value);
        }

        public void StartMotion(String group, int index) {
            calls.add(group + "[" + index + "]");
        }

        public float GetParamFloat(String id) {
            return 0.75f;
        }

        public void Explode() {
            throw new IllegalStateException("boom");
        }
    }

    @Test
    void convertsNumbersToDeclaredParameterTypes() throws Exception {
        TwoArgBackend backend = new TwoArgBackend();
        ReflectiveModelHandle handle = new ReflectiveModelHandle(backend);

        handle.lookup("SetParamFloat").orElseThrow().invoke("ParamAngleX", 0.5);
        handle.lookup("StartMotion").orElseThrow().invoke("Idle", 2L);

        assertEquals(List.of("ParamAngleX=0.5", "Idle[2]"), backend.calls);
        assertEquals(0.75f, handle.lookup("GetParamFloat").orElseThrow().invoke("x"));
    }

    @Test
    void wrongArgumentCountIsAnArityMismatch() {
        ReflectiveModelHandle handle = new ReflectiveModelHandle(new TwoArgBackend());
        ModelOperation setter = handle.lookup("SetParamFloat").orElseThrow();

        assertThrows(ArityMismatchException.class, () -> setter.invoke("ParamAngleX", 0.5, 1.0));
    }

    @Test
    void backendExceptionsAreUnwrapped() {
        ReflectiveModelHandle handle = new ReflectiveModelHandle(new TwoArgBackend());
        ModelOperation explode = handle.lookup("Explode").orElseThrow();

        IllegalStateException e = assertThrows(IllegalStateException.class, () -> explode.invoke());
        assertEquals("boom", e.getMessage());
    }

    @Test
    void unknownOrObjectMethodsAreAbsent() {
        ReflectiveModelHandle handle = new ReflectiveModelHandle(new TwoArgBackend());

        assertTrue(handle.lookup("SetParameterValue").isEmpty());
        assertTrue(handle.lookup("hashCode").isEmpty());
    }

    @Test
    void parameterOperationsWorkThroughReflection() {
        TwoArgBackend backend = new TwoArgBackend();
        CapabilityCache cache = new CapabilityCache();
        cache.attach(new ReflectiveModelHandle(backend));
        ParameterOperations parameters = new ParameterOperations(cache);

        assertTrue(parameters.set("ParamEyeLOpen", 1.0, 0.3));
        assertEquals(List.of("ParamEyeLOpen=1.0"), backend.calls);
        assertEquals(0.75, parameters.get("ParamEyeLOpen"), 1e-6);
    }
}
