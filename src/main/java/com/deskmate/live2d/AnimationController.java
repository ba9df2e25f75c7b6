package com.deskmate.live2d;

import com.deskmate.AppLogger;
import com.deskmate.models.ModelTransform;
import com.deskmate.models.MotionReference;
import com.deskmate.models.ParameterTarget;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.lang.reflect.Array;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Owns the loaded backend and everything probed from it. All calls are expected on the
 * animation thread; only the transform is read from other threads.
 */
public class AnimationController {

    public static final double MIN_SCALE = 0.1;
    public static final double MAX_SCALE = 5.0;

    public static final String HEAD_COLLIDER = "head";
    public static final String BODY_COLLIDER = "body";
    public static final String HEAD_TAP_GROUP = "Tap";
    public static final String BODY_TAP_GROUP = "Tap@Body";

    private static final String COMPONENT = "AnimationController";
    private static final String RELEASE = "Release";
    private static final String HIT_PART = "HitPart";
    private static final String IS_AREA_HIT = "IsAreaHit";

    private final ObjectMapper objectMapper;
    private final CapabilityCache capabilities = new CapabilityCache();
    private final ParameterOperations parameters;
    private final MotionOperations motions;
    private final ColliderRegistry colliders = new ColliderRegistry();
    private volatile MotionIndex motionIndex = MotionIndex.empty();

    private double offsetX = 0.0;
    private double offsetY = 0.0;
    private double scale = 1.0;

    public AnimationController(ObjectMapper objectMapper) {
        this(objectMapper, new Random());
    }

    public AnimationController(ObjectMapper objectMapper, Random random) {
        this.objectMapper = objectMapper != null ? objectMapper : new ObjectMapper();
        this.parameters = new ParameterOperations(capabilities);
        this.motions = new MotionOperations(capabilities, () -> motionIndex, random);
        colliders.addClickHandler(HEAD_COLLIDER, this::playTapMotion);
        colliders.addClickHandler(BODY_COLLIDER, this::playTapMotion);
    }

    /**
     * Attaches a backend and indexes the motions of its manifest. An unreadable manifest
     * leaves the model usable with an empty motion index.
     */
    public void loadModel(ModelHandle handle, Path manifestPath) {
        MotionIndex index = MotionIndex.empty();
        if (manifestPath != null) {
            try {
                index = MotionIndex.load(manifestPath, objectMapper);
            } catch (Exception e) {
                AppLogger.warn(COMPONENT, "Could not index motions from " + manifestPath + ": " + e.getMessage());
            }
        }
        loadModel(handle, index);
    }

    public void loadModel(ModelHandle handle, MotionIndex index) {
        capabilities.attach(handle);
        this.motionIndex = index != null ? index : MotionIndex.empty();
        colliders.replaceColliders(defaultColliders());
        AppLogger.info(COMPONENT, "Model attached (" + (handle != null ? handle.describe() : "none")
            + "), motion groups: " + motionIndex.groups().keySet());
    }

    public boolean isLoaded() {
        return capabilities.isAttached();
    }

    /**
     * One frame: push the transform, advance the model, draw it.
     */
    public void updateAndDraw() {
        if (!capabilities.isAttached()) {
            return;
        }
        ModelTransform transform = getTransform();
        call("SetPosition", (float) transform.getX(), (float) transform.getY());
        call("SetScale", (float) transform.getScale(), (float) transform.getScale());
        call("Update");
        call("Draw");
    }

    public void drag(double x, double y) {
        call("Drag", (float) x, (float) y);
    }

    public synchronized void setPosition(double x, double y) {
        this.offsetX = x;
        this.offsetY = y;
    }

    public synchronized void translate(double dx, double dy) {
        this.offsetX += dx;
        this.offsetY += dy;
    }

    public synchronized void setScale(double value) {
        this.scale = Math.max(MIN_SCALE, Math.min(MAX_SCALE, value));
    }

    public synchronized ModelTransform getTransform() {
        return new ModelTransform(offsetX, offsetY, scale);
    }

    public boolean applyParameters(List<ParameterTarget> targets, double blend, boolean additive) {
        return parameters.apply(targets, blend, additive);
    }

    public double getParameter(String id) {
        return parameters.get(id);
    }

    public boolean startMotion(String group, int index, int priority) {
        return motions.startMotion(group, index, priority);
    }

    public boolean startMotion(MotionReference reference, int priority) {
        return motions.startMotion(reference, priority);
    }

    public boolean startMotionByFile(String filePath, int priority) {
        return motions.startMotionByFile(filePath, priority);
    }

    public boolean startRandomMotion(String group, int priority) {
        return motions.startRandomMotion(group, priority);
    }

    public Optional<MotionReference> findMotion(String identifier) {
        return motionIndex.find(identifier);
    }

    public Map<String, List<String>> listMotions() {
        return motionIndex.groups();
    }

    public void registerCollider(Collider collider) {
        colliders.register(collider);
    }

    public boolean removeCollider(String name) {
        return colliders.remove(name);
    }

    public void clearColliders() {
        colliders.clear();
    }

    public List<Collider> listColliders() {
        return colliders.list();
    }

    public List<String> queryColliders(double x, double y) {
        return colliders.query(x, y, capabilities);
    }

    public void addClickHandler(String colliderName, ClickHandler handler) {
        colliders.addClickHandler(colliderName, handler);
    }

    public boolean removeClickHandler(String colliderName, ClickHandler handler) {
        return colliders.removeClickHandler(colliderName, handler);
    }

    /**
     * Routes a click to the handlers of every collider it hits. An empty result means the
     * click missed the model.
     */
    public List<String> onClick(double x, double y) {
        return colliders.dispatchClick(x, y, capabilities);
    }

    /**
     * Whether any drawable part lies under the point: {@code HitPart} when the backend has it,
     * otherwise {@code IsAreaHit} on the head area.
     */
    public boolean hitTest(double x, double y) {
        Optional<ModelOperation> hitPart = capabilities.operation(HIT_PART);
        if (hitPart.isPresent()) {
            Object parts = OperationCalls.query(HIT_PART, hitPart.get(), (float) x, (float) y);
            if (parts instanceof Collection) {
                return !((Collection<?>) parts).isEmpty();
            }
            if (parts != null && parts.getClass().isArray()) {
                return Array.getLength(parts) > 0;
            }
            return Boolean.TRUE.equals(parts);
        }
        return capabilities.operation(IS_AREA_HIT)
            .map(op -> OperationCalls.query(IS_AREA_HIT, op, "Head", (float) x, (float) y))
            .map(Boolean.TRUE::equals)
            .orElse(false);
    }

    /**
     * Releases backend resources and detaches. Runs on the animation thread like every other call.
     */
    public void dispose() {
        call(RELEASE);
        capabilities.attach(null);
        motionIndex = MotionIndex.empty();
        colliders.clear();
    }

    CapabilityCache capabilities() {
        return capabilities;
    }

    private void playTapMotion(String collider, double x, double y) {
        String group = HEAD_COLLIDER.equals(collider) ? HEAD_TAP_GROUP : BODY_TAP_GROUP;
        motions.startRandomMotion(group, MotionOperations.DEFAULT_PRIORITY);
    }

    private static List<Collider> defaultColliders() {
        return List.of(Collider.hitArea(HEAD_COLLIDER, "Head"), Collider.hitArea(BODY_COLLIDER, "Body"));
    }

    private void call(String operation, Object... args) {
        capabilities.operation(operation)
            .ifPresent(op -> OperationCalls.attempt(operation, op, args));
    }
}
