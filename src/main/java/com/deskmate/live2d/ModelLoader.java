package com.deskmate.live2d;

import com.deskmate.AppLogger;

import java.lang.reflect.Constructor;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Instantiates the animation backend binding named in the configuration and loads a model
 * manifest into it. The binding class is resolved at runtime and only needs a public no-arg
 * constructor; the manifest is handed to its {@code LoadModelJson} operation when it has one.
 */
public class ModelLoader {

    private static final String COMPONENT = "ModelLoader";
    static final String LOAD_OPERATION = "LoadModelJson";

    private final String backendClass;

    public ModelLoader(String backendClass) {
        this.backendClass = backendClass;
    }

    public ModelHandle load(Path manifestPath) throws Exception {
        Object backend = instantiate();
        ReflectiveModelHandle handle = new ReflectiveModelHandle(backend);
        if (manifestPath != null) {
            Optional<ModelOperation> load = handle.lookup(LOAD_OPERATION);
            if (load.isPresent()) {
                load.get().invoke(manifestPath.toString());
            } else {
                AppLogger.warn(COMPONENT, handle.describe() + " has no " + LOAD_OPERATION + "; manifest not passed");
            }
        }
        AppLogger.info(COMPONENT, "Backend ready: " + handle.describe());
        return handle;
    }

    private Object instantiate() throws ReflectiveOperationException {
        if (backendClass == null || backendClass.isBlank()) {
            return new HeadlessModel();
        }
        Class<?> type = Class.forName(backendClass);
        Constructor<?> constructor = type.getConstructor();
        return constructor.newInstance();
    }
}
