package com.deskmate.live2d;

import com.deskmate.models.MotionReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

/**
 * Lookup from a motion file path, or its basename, to its group and position.
 * Built once per model load from the manifest's {@code FileReferences.Motions};
 * when identifiers collide the first registration wins.
 */
public class MotionIndex {

    private static final MotionIndex EMPTY = new MotionIndex(Collections.emptyMap(), Collections.emptyMap());

    private final Map<String, List<String>> groups;
    private final Map<String, MotionReference> lookup;

    private MotionIndex(Map<String, List<String>> groups, Map<String, MotionReference> lookup) {
        this.groups = groups;
        this.lookup = lookup;
    }

    public static MotionIndex empty() {
        return EMPTY;
    }

    public static MotionIndex load(Path manifestPath, ObjectMapper mapper) throws IOException {
        return fromManifest(mapper.readTree(manifestPath.toFile()));
    }

    public static MotionIndex fromManifest(JsonNode manifest) {
        if (manifest == null) {
            return EMPTY;
        }
        JsonNode motions = manifest.path("FileReferences").path("Motions");
        if (!motions.isObject()) {
            return EMPTY;
        }
        Map<String, List<String>> groups = new LinkedHashMap<>();
        Map<String, MotionReference> lookup = new HashMap<>();

        Iterator<Map.Entry<String, JsonNode>> fields = motions.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> group = fields.next();
            if (!group.getValue().isArray()) {
                continue;
            }
            List<String> files = new ArrayList<>();
            int index = 0;
            for (JsonNode entry : group.getValue()) {
                int position = index++;
                JsonNode file = entry.get("File");
                if (file == null || !file.isTextual()) {
                    continue;
                }
                String filePath = file.asText();
                files.add(filePath);
                MotionReference reference = new MotionReference(group.getKey(), position);
                lookup.putIfAbsent(filePath, reference);
                String base = basename(filePath);
                if (!base.isEmpty()) {
                    lookup.putIfAbsent(base, reference);
                }
            }
            if (!files.isEmpty()) {
                groups.put(group.getKey(), Collections.unmodifiableList(files));
            }
        }
        return new MotionIndex(Collections.unmodifiableMap(groups), Collections.unmodifiableMap(lookup));
    }

    public Optional<MotionReference> find(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(lookup.get(identifier));
    }

    public Map<String, List<String>> groups() {
        return groups;
    }

    public List<String> motions(String group) {
        List<String> files = groups.get(group);
        return files != null ? files : Collections.emptyList();
    }

    public boolean isEmpty() {
        return groups.isEmpty();
    }

    /**
     * A random motion in {@code group}, or in any group when {@code group} is null.
     */
    public Optional<MotionReference> randomMotion(String group, Random random) {
        if (group != null) {
            List<String> files = groups.get(group);
            if (files == null || files.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(new MotionReference(group, random.nextInt(files.size())));
        }
        if (groups.isEmpty()) {
            return Optional.empty();
        }
        List<String> names = new ArrayList<>(groups.keySet());
        return randomMotion(names.get(random.nextInt(names.size())), random);
    }

    static String basename(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
