package com.deskmate.vision;

import com.deskmate.models.VisionConfig;
import com.deskmate.models.VisionSnapshot;

import javax.imageio.ImageIO;
import java.awt.GraphicsEnvironment;
import java.awt.Rectangle;
import java.awt.Robot;
import java.awt.Toolkit;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Captures the configured screen region with {@link Robot} and stores a JPEG preview
 * under the vision directory. No text recognition is done here, so snapshots carry
 * only the preview path and region metadata.
 */
public class RobotCaptureSource implements ScreenCaptureSource {

    private final Path visionDir;

    public RobotCaptureSource(Path visionDir) {
        this.visionDir = visionDir;
    }

    @Override
    public VisionSnapshot capture(VisionConfig config) throws Exception {
        if (GraphicsEnvironment.isHeadless()) {
            return null;
        }
        Rectangle area = resolveRegion(config.getRegion());
        BufferedImage image = new Robot().createScreenCapture(area);

        long now = System.currentTimeMillis();
        Files.createDirectories(visionDir);
        Path preview = visionDir.resolve("snapshot_" + now + ".jpg");
        BufferedImage rgb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        rgb.getGraphics().drawImage(image, 0, 0, null);
        String previewPath = ImageIO.write(rgb, "jpg", preview.toFile()) ? preview.toString() : null;

        Map<String, Object> meta = new LinkedHashMap<>();
        Map<String, Object> region = new LinkedHashMap<>();
        region.put("left", area.x);
        region.put("top", area.y);
        region.put("width", area.width);
        region.put("height", area.height);
        meta.put("region", region);
        meta.put("width", image.getWidth());
        meta.put("height", image.getHeight());
        return new VisionSnapshot(now / 1000.0, "", previewPath, meta);
    }

    static Rectangle resolveRegion(Map<String, Integer> region) {
        if (region != null && region.get("width") != null && region.get("height") != null) {
            return new Rectangle(
                region.getOrDefault("left", 0),
                region.getOrDefault("top", 0),
                region.get("width"),
                region.get("height"));
        }
        return new Rectangle(Toolkit.getDefaultToolkit().getScreenSize());
    }
}
