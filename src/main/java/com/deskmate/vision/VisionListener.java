package com.deskmate.vision;

import com.deskmate.models.VisionSnapshot;

@FunctionalInterface
public interface VisionListener {

    void onSnapshot(VisionSnapshot snapshot);
}
