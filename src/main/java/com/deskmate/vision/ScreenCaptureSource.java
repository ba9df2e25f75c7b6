package com.deskmate.vision;

import com.deskmate.models.VisionConfig;
import com.deskmate.models.VisionSnapshot;

/**
 * Produces one capture per call. Returns null when nothing could be captured.
 */
@FunctionalInterface
public interface ScreenCaptureSource {

    VisionSnapshot capture(VisionConfig config) throws Exception;
}
