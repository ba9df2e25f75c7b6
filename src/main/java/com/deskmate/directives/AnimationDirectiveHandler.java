package com.deskmate.directives;

import com.deskmate.AppLogger;
import com.deskmate.ExpressionLibrary;
import com.deskmate.live2d.AnimationController;
import com.deskmate.live2d.MotionOperations;
import com.deskmate.models.Directive;
import com.deskmate.models.MotionReference;

import java.util.Map;
import java.util.Optional;

/**
 * Maps directive kinds onto animation controller calls. Unknown kinds are ignored.
 */
public class AnimationDirectiveHandler implements DirectiveHandler {

    private static final String COMPONENT = "AnimationDirectiveHandler";

    private final AnimationController animation;
    private final ExpressionLibrary expressions;

    public AnimationDirectiveHandler(AnimationController animation, ExpressionLibrary expressions) {
        this.animation = animation;
        this.expressions = expressions;
    }

    @Override
    public void handle(Directive directive) {
        switch (directive.normalizedKind()) {
            case "motion":
            case "start_motion":
            case "play_motion":
                playMotion(directive);
                break;
            case "expression":
            case "set_expression":
            case "face":
                applyExpression(directive);
                break;
            case "scale":
            case "set_scale":
                Double scale = asDouble(directive.first("value", "scale"));
                if (scale != null) {
                    animation.setScale(scale);
                }
                break;
            case "move":
            case "translate":
                animation.translate(doubleOr(directive.get("dx"), 0.0), doubleOr(directive.get("dy"), 0.0));
                break;
            case "position":
            case "set_position":
                animation.setPosition(doubleOr(directive.get("x"), 0.0), doubleOr(directive.get("y"), 0.0));
                break;
            case "look":
            case "drag":
                animation.drag(doubleOr(directive.get("x"), 0.0), doubleOr(directive.get("y"), 0.0));
                break;
            default:
                break;
        }
    }

    /**
     * Tries, in order: explicit group and index, motion file, identifier lookup (within the
     * requested group when one is given), then a random motion of the requested group, or of
     * any group when none was named.
     */
    boolean playMotion(Directive directive) {
        String group = asText(directive.get("group"));
        Integer index = asInt(directive.get("index"));
        int priority = intOr(directive.get("priority"), MotionOperations.DEFAULT_PRIORITY);

        if (group != null && index != null && animation.startMotion(group, index, priority)) {
            return true;
        }

        String file = asText(directive.first("file", "path", "motionFile"));
        if (file != null && animation.startMotionByFile(file, priority)) {
            return true;
        }

        String identifier = asText(directive.first("motion", "identifier", "name", "value"));
        if (identifier != null) {
            Optional<MotionReference> reference = animation.findMotion(identifier);
            if (reference.isPresent()
                && (group == null || group.equals(reference.get().getGroup()))
                && animation.startMotion(reference.get(), priority)) {
                return true;
            }
        }

        // A named group bounds the search; only an unnamed one may end in a global pick.
        boolean started = animation.startRandomMotion(group, priority);
        if (!started) {
            AppLogger.warn(COMPONENT, "No motion could be started for " + directive);
        }
        return started;
    }

    boolean applyExpression(Directive directive) {
        double blend = doubleOr(directive.first("blend", "weight"), 1.0);
        boolean additive = asBoolean(directive.get("additive"));
        String name = asText(directive.first("name", "value", "expression"));

        if (name != null && expressions != null && expressions.applyExpression(name, blend, additive)) {
            return true;
        }
        Object parameters = directive.get("parameters");
        if (parameters instanceof Map && expressions != null) {
            return expressions.applyParameters((Map<?, ?>) parameters, blend, additive);
        }
        AppLogger.warn(COMPONENT, "Unknown expression " + (name != null ? "'" + name + "'" : "(no name)")
            + " and no parameters to apply");
        return false;
    }

    static String asText(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static Double asDouble(Object value) {
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value instanceof String) {
            try {
                return Double.parseDouble(((String) value).trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    static Integer asInt(Object value) {
        Double number = asDouble(value);
        return number != null ? number.intValue() : null;
    }

    private static double doubleOr(Object value, double fallback) {
        Double number = asDouble(value);
        return number != null ? number : fallback;
    }

    private static int intOr(Object value, int fallback) {
        Integer number = asInt(value);
        return number != null ? number : fallback;
    }

    private static boolean asBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value instanceof String && Boolean.parseBoolean(((String) value).trim());
    }
}
