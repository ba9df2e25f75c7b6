package com.deskmate.directives;

import com.deskmate.models.Directive;

import java.util.Collections;
import java.util.List;

public class ScanResult {
    private final String cleanedText;
    private final List<Directive> directives;

    public ScanResult(String cleanedText, List<Directive> directives) {
        this.cleanedText = cleanedText != null ? cleanedText : "";
        this.directives = directives != null ? List.copyOf(directives) : Collections.emptyList();
    }

    public static ScanResult empty() {
        return new ScanResult("", null);
    }

    public String getCleanedText() {
        return cleanedText;
    }

    public List<Directive> getDirectives() {
        return directives;
    }

    public boolean hasDirectives() {
        return !directives.isEmpty();
    }
}
