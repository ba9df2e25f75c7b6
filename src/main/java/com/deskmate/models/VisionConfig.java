package com.deskmate.models;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public class VisionConfig {

    private boolean enabled = false;
    @JsonProperty("capture_interval")
    private double captureInterval = 10.0;
    private Map<String, Integer> region;
    private Ocr ocr = new Ocr();
    @JsonProperty("max_history")
    private int maxHistory = 5;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public double getCaptureInterval() {
        return captureInterval;
    }

    public void setCaptureInterval(double captureInterval) {
        this.captureInterval = captureInterval;
    }

    /**
     * Capture interval in milliseconds; non-positive intervals fall back to 10 seconds.
     */
    public long captureIntervalMillis() {
        double seconds = captureInterval > 0 ? captureInterval : 10.0;
        return Math.max(1L, Math.round(seconds * 1000));
    }

    public Map<String, Integer> getRegion() {
        return region;
    }

    public void setRegion(Map<String, Integer> region) {
        this.region = region;
    }

    public Ocr getOcr() {
        return ocr;
    }

    public void setOcr(Ocr ocr) {
        this.ocr = ocr != null ? ocr : new Ocr();
    }

    public int getMaxHistory() {
        return maxHistory;
    }

    public void setMaxHistory(int maxHistory) {
        this.maxHistory = maxHistory;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Ocr {
        private boolean enabled = true;
        private String language = "chi_sim+eng";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }
    }
}
