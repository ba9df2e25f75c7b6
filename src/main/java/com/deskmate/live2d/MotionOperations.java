package com.deskmate.live2d;

import com.deskmate.live2d.OperationCalls.Outcome;
import com.deskmate.models.MotionReference;

import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Motion playback against whichever motion API the backend exposes. Every method reports
 * whether the backend accepted the request; none of them falls back on its own.
 */
public class MotionOperations {

    public static final int DEFAULT_PRIORITY = 3;

    static final String START_MOTION = "StartMotion";
    static final String START_MOTION_BY_NAME = "StartMotionByName";
    static final String START_RANDOM_MOTION = "StartRandomMotion";

    private final CapabilityCache capabilities;
    private final Supplier<MotionIndex> motionIndex;
    private final Random random;

    public MotionOperations(CapabilityCache capabilities, Supplier<MotionIndex> motionIndex, Random random) {
        this.capabilities = capabilities;
        this.motionIndex = motionIndex;
        this.random = random != null ? random : new Random();
    }

    public boolean startMotion(String group, int index, int priority) {
        if (group == null || !capabilities.isAttached()) {
            return false;
        }
        int position = Math.max(0, index);

        Optional<ModelOperation> start = capabilities.operation(START_MOTION);
        if (start.isPresent()) {
            Outcome outcome = OperationCalls.attempt(START_MOTION, start.get(), group, position, priority);
            if (outcome == Outcome.ARITY_MISMATCH) {
                outcome = OperationCalls.attempt(START_MOTION, start.get(), group, position);
            }
            return outcome == Outcome.INVOKED;
        }

        Optional<ModelOperation> byName = capabilities.operation(START_MOTION_BY_NAME);
        if (byName.isPresent()) {
            List<String> files = motionIndex.get().motions(group);
            if (position < files.size()) {
                return OperationCalls.attempt(START_MOTION_BY_NAME, byName.get(),
                    group, files.get(position)) == Outcome.INVOKED;
            }
        }
        return false;
    }

    public boolean startMotion(MotionReference reference, int priority) {
        return reference != null && startMotion(reference.getGroup(), reference.getIndex(), priority);
    }

    public boolean startMotionByFile(String filePath, int priority) {
        Optional<MotionReference> reference = motionIndex.get().find(filePath);
        return reference.isPresent() && startMotion(reference.get(), priority);
    }

    /**
     * Random motion within {@code group}, or anywhere when {@code group} is null.
     * Uses the backend's own random pick when it has one, otherwise draws from the motion index.
     */
    public boolean startRandomMotion(String group, int priority) {
        if (!capabilities.isAttached()) {
            return false;
        }
        Optional<ModelOperation> builtIn = capabilities.operation(START_RANDOM_MOTION);
        if (builtIn.isPresent()) {
            Outcome outcome = group != null
                ? OperationCalls.attempt(START_RANDOM_MOTION, builtIn.get(), group, priority)
                : OperationCalls.attempt(START_RANDOM_MOTION, builtIn.get(), priority);
            if (outcome == Outcome.ARITY_MISMATCH) {
                outcome = group != null
                    ? OperationCalls.attempt(START_RANDOM_MOTION, builtIn.get(), group)
                    : OperationCalls.attempt(START_RANDOM_MOTION, builtIn.get());
            }
            if (outcome == Outcome.INVOKED) {
                return true;
            }
        }

        Optional<MotionReference> pick = motionIndex.get().randomMotion(group, random);
        if (pick.isPresent()) {
            return startMotion(pick.get(), priority);
        }
        return group != null && startMotion(group, 0, priority);
    }
}
