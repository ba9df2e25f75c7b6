package com.deskmate.settings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Built-in values for every preference file. Stored files are merged over these.
 */
public final class PreferenceDefaults {

    public static final Map<String, Object> USER_SETTINGS = buildUserSettings();
    public static final Map<String, Object> AI_PROMPTS = buildAiPrompts();
    public static final Map<String, Object> EXPRESSIONS = buildExpressions();

    private PreferenceDefaults() {
    }

    private static Map<String, Object> buildUserSettings() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("display_name", "Default user");
        map.put("api_url", "https://api.example.com/v1/chat");
        map.put("api_key", "");
        map.put("model", "gpt-4o-mini");
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Object> buildAiPrompts() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("system_prompt", "You are a lively desktop companion who keeps the user company "
            + "and makes every chat a little more fun.");
        map.put("greeting", "Hi there! I'm your desktop companion, ready to chat any time.");
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Object> buildExpressions() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("neutral", preset("Default face: eyes open, relaxed mouth.",
            1.0, 1.0, 0.0, 0.0, 0.0, 0.0, 0.2, null, null));
        map.put("happy", preset("Smiling: curved eyes, raised mouth corners.",
            0.9, 0.9, 1.0, 1.0, 0.65, 0.7, 0.4, null, null));
        map.put("sad", preset("A little gloomy: half-closed eyes, lowered mouth corners.",
            0.35, 0.35, -0.4, -0.4, -0.2, -0.5, 0.15, null, null));
        map.put("angry", preset("Angry: brows pressed down, tight mouth.",
            0.6, 0.6, -0.6, -0.6, 0.2, -0.3, 0.25, -0.7, -0.7));
        map.put("excited", preset("Surprised or excited: wide eyes, open mouth.",
            1.0, 1.0, 0.5, 0.5, 0.5, 0.9, 0.9, null, null));
        return Collections.unmodifiableMap(map);
    }

    private static Map<String, Object> preset(String description,
                                              double eyeLOpen, double eyeROpen,
                                              double eyeLSmile, double eyeRSmile,
                                              double cheek, double mouthForm, double mouthOpenY,
                                              Double browLForm, Double browRForm) {
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("ParamEyeLOpen", eyeLOpen);
        parameters.put("ParamEyeROpen", eyeROpen);
        parameters.put("ParamEyeLSmile", eyeLSmile);
        parameters.put("ParamEyeRSmile", eyeRSmile);
        if (browLForm != null) parameters.put("ParamBrowLForm", browLForm);
        if (browRForm != null) parameters.put("ParamBrowRForm", browRForm);
        parameters.put("ParamCheek", cheek);
        parameters.put("ParamMouthForm", mouthForm);
        parameters.put("ParamMouthOpenY", mouthOpenY);

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("description", description);
        entry.put("parameters", Collections.unmodifiableMap(parameters));
        return Collections.unmodifiableMap(entry);
    }
}
