package com.deskmate.live2d;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ModelLoaderTest {

    @Test
    void defaultsToHeadlessModelAndPassesManifest() throws Exception {
        ModelHandle handle = new ModelLoader(null).load(Path.of("models", "haru.model3.json"));

        assertTrue(handle instanceof ReflectiveModelHandle);
        Object target = ((ReflectiveModelHandle) handle).getTarget();
        assertTrue(target instanceof HeadlessModel);
        assertTrue(((HeadlessModel) target).getManifest().endsWith("haru.model3.json"));
    }

    @Test
    void loadsNamedBackendClass() throws Exception {
        ModelHandle handle = new ModelLoader(HeadlessModel.class.getName()).load(null);
        assertTrue(handle.lookup("StartMotion").isPresent());
    }

    @Test
    void unknownBackendClassFails() {
        assertThrows(ClassNotFoundException.class, () -> new ModelLoader("com.example.NoSuchBackend").load(null));
    }
}
