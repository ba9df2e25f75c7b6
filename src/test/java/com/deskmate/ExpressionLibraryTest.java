package com.deskmate;

import com.deskmate.live2d.AnimationController;
import com.deskmate.live2d.MotionIndex;
import com.deskmate.live2d.OperationTable;
import com.deskmate.settings.PreferencesStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionLibraryTest {

    @TempDir
    Path dataDir;

    private final Map<String, double[]> writes = new HashMap<>();

    private AnimationController animation() {
        AnimationController animation = new AnimationController(new ObjectMapper());
        animation.loadModel(new OperationTable().register("SetParameterValue", 3, args ->
            writes.put((String) args[0], new double[]{((Number) args[1]).doubleValue(), ((Number) args[2]).doubleValue()})),
            MotionIndex.empty());
        return animation;
    }

    @Test
    void defaultPresetsAreListed() {
        ExpressionLibrary library = new ExpressionLibrary(new PreferencesStore(dataDir), animation());

        assertTrue(library.listExpressions().containsAll(List.of("neutral", "happy", "sad", "angry", "excited")));
        assertEquals(0.7, library.get("happy").get("ParamMouthForm"), 1e-9);
        assertNull(library.get("missing"));
    }

    @Test
    void flatPresetsIgnoreNonNumericEntries() throws Exception {
        PreferencesStore store = new PreferencesStore(dataDir);
        Map<String, Object> flat = new LinkedHashMap<>();
        flat.put("description", "cheeky");
        flat.put("ParamCheek", 1);
        store.saveExpressions(Map.of("cheeky", flat));

        ExpressionLibrary library = new ExpressionLibrary(store, animation());

        assertEquals(Map.of("ParamCheek", 1.0), library.get("cheeky"));
    }

    @Test
    void applyExpressionPassesBlend() {
        ExpressionLibrary library = new ExpressionLibrary(new PreferencesStore(dataDir), animation());

        assertTrue(library.applyExpression("sad", 0.25, false));
        assertArrayEquals(new double[]{0.35, 0.25}, writes.get("ParamEyeLOpen"), 1e-9);
        assertFalse(library.applyExpression("nope", 1.0, false));
    }

    @Test
    void reloadPicksUpSavedPresets() throws Exception {
        PreferencesStore store = new PreferencesStore(dataDir);
        ExpressionLibrary library = new ExpressionLibrary(store, animation());
        assertNull(library.get("sleepy"));

        store.saveExpressions(Map.of("sleepy", Map.of("parameters", Map.of("ParamEyeLOpen", 0.1))));
        library.reload();

        assertEquals(0.1, library.get("sleepy").get("ParamEyeLOpen"), 1e-9);
    }

    @Test
    void snapshotIsAppliedAtFullWeight() {
        ExpressionLibrary library = new ExpressionLibrary(new PreferencesStore(dataDir), animation());

        assertTrue(library.applySnapshot(Map.of("ParamAngleZ", 4.0)));
        assertArrayEquals(new double[]{4.0, 1.0}, writes.get("ParamAngleZ"), 1e-9);
        assertFalse(library.applySnapshot(Map.of("label", "x")));
    }
}
