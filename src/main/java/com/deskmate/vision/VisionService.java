package com.deskmate.vision;

import com.deskmate.AppLogger;
import com.deskmate.models.VisionConfig;
import com.deskmate.models.VisionSnapshot;
import com.deskmate.settings.PreferencesStore;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Periodically captures the screen on its own daemon thread and publishes snapshots
 * to listeners. Captures only happen while the configuration is enabled; the loop
 * sleeps on a condition so {@link #stop()} wakes it immediately.
 */
public class VisionService {

    private static final String COMPONENT = "VisionService";
    static final long STOP_JOIN_MILLIS = 1500;

    private final PreferencesStore preferences;
    private final ScreenCaptureSource captureSource;
    private final List<VisionListener> listeners = new CopyOnWriteArrayList<>();
    private final Deque<VisionSnapshot> history = new ArrayDeque<>();
    private final ReentrantLock loopLock = new ReentrantLock();
    private final Condition wakeup = loopLock.newCondition();

    private volatile VisionConfig config;
    private volatile boolean stopRequested;
    private Thread thread;

    public VisionService(PreferencesStore preferences, ScreenCaptureSource captureSource) {
        this.preferences = preferences;
        this.captureSource = captureSource;
        this.config = preferences.loadVisionConfig();
    }

    public void registerListener(VisionListener listener) {
        if (listener != null && !listeners.contains(listener)) {
            listeners.add(listener);
        }
    }

    public void unregisterListener(VisionListener listener) {
        listeners.remove(listener);
    }

    public synchronized void start() {
        if (thread != null && thread.isAlive()) {
            return;
        }
        stopRequested = false;
        thread = new Thread(this::runLoop, "vision-loop");
        thread.setDaemon(true);
        thread.start();
        AppLogger.info(COMPONENT, "Started (enabled=" + config.isEnabled()
            + ", interval=" + config.captureIntervalMillis() + "ms)");
    }

    public synchronized void stop() {
        loopLock.lock();
        try {
            stopRequested = true;
            wakeup.signalAll();
        } finally {
            loopLock.unlock();
        }
        Thread current = thread;
        thread = null;
        if (current != null && current.isAlive()) {
            try {
                current.join(STOP_JOIN_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (current.isAlive()) {
                AppLogger.warn(COMPONENT, "Capture loop did not stop within " + STOP_JOIN_MILLIS + "ms");
            }
        }
    }

    public synchronized boolean isRunning() {
        return thread != null && thread.isAlive();
    }

    public void reloadConfig() {
        this.config = preferences.loadVisionConfig();
        loopLock.lock();
        try {
            wakeup.signalAll();
        } finally {
            loopLock.unlock();
        }
    }

    public VisionConfig getConfig() {
        return config;
    }

    /**
     * Publishes a synthetic snapshot as if it had just been captured.
     */
    public VisionSnapshot simulateDetection(String text, Map<String, Object> meta) {
        VisionSnapshot snapshot = new VisionSnapshot(System.currentTimeMillis() / 1000.0, text, null, meta);
        publish(snapshot);
        return snapshot;
    }

    public List<VisionSnapshot> getHistory() {
        synchronized (history) {
            return new ArrayList<>(history);
        }
    }

    private void runLoop() {
        while (!stopRequested) {
            VisionConfig current = config;
            if (current.isEnabled()) {
                captureOnce(current);
            }
            loopLock.lock();
            try {
                if (!stopRequested) {
                    wakeup.await(current.captureIntervalMillis(), TimeUnit.MILLISECONDS);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } finally {
                loopLock.unlock();
            }
        }
    }

    private void captureOnce(VisionConfig current) {
        try {
            VisionSnapshot snapshot = captureSource.capture(current);
            if (snapshot != null) {
                publish(snapshot);
            }
        } catch (Exception e) {
            AppLogger.warn(COMPONENT, "Capture failed: " + e.getMessage());
        }
    }

    private void publish(VisionSnapshot snapshot) {
        int limit = Math.max(1, config.getMaxHistory());
        synchronized (history) {
            history.addLast(snapshot);
            while (history.size() > limit) {
                history.removeFirst();
            }
        }
        for (VisionListener listener : listeners) {
            try {
                listener.onSnapshot(snapshot);
            } catch (Exception e) {
                AppLogger.warn(COMPONENT, "Listener failed: " + e.getMessage());
            }
        }
    }
}
