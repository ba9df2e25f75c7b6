package com.deskmate;

import com.deskmate.directives.DirectiveHandler;
import com.deskmate.models.ConversationTurn;
import com.deskmate.models.Directive;
import com.deskmate.models.ResponseStatus;
import com.deskmate.models.StructuredResponse;
import com.deskmate.models.VisionSnapshot;
import com.deskmate.providers.chat.ChatClient;
import com.deskmate.settings.PreferencesStore;
import com.deskmate.vision.VisionListener;
import com.deskmate.vision.VisionService;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the conversation history and routes directives to the registered handlers.
 * <p>
 * History, the pending directive queue and the cached settings share one lock; chat calls
 * are made outside it on a history snapshot. Directives from asynchronous producers
 * (vision, HTTP) wait in the pending queue until the animation thread drains them.
 */
public class ChatOrchestrator {

    public static final int DEFAULT_PENDING_LIMIT = 64;
    private static final String COMPONENT = "ChatOrchestrator";

    private final PreferencesStore preferences;
    private final ChatClient client;
    private final ExpressionLibrary expressions;
    private final int pendingLimit;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ConversationTurn> history = new ArrayList<>();
    private final Deque<Directive> pending = new ArrayDeque<>();
    private final List<DirectiveHandler> handlers = new CopyOnWriteArrayList<>();
    private final VisionListener visionListener = this::onVisionEvent;
    private final ExecutorService chatExecutor;

    private Map<String, Object> userSettings;
    private Map<String, Object> aiPrompts;
    private VisionService visionService;
    private double lastVisionTimestamp = 0.0;
    private volatile boolean closed = false;

    public ChatOrchestrator(PreferencesStore preferences, ChatClient client, ExpressionLibrary expressions) {
        this(preferences, client, expressions, DEFAULT_PENDING_LIMIT);
    }

    public ChatOrchestrator(PreferencesStore preferences, ChatClient client, ExpressionLibrary expressions,
                            int pendingLimit) {
        this.preferences = preferences;
        this.client = client;
        this.expressions = expressions;
        this.pendingLimit = pendingLimit > 0 ? pendingLimit : DEFAULT_PENDING_LIMIT;
        this.userSettings = preferences.loadUserSettings();
        this.aiPrompts = preferences.loadAiPrompts();
        this.client.updateConfig(userSettings, aiPrompts);
        this.chatExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "chat-worker");
            t.setDaemon(true);
            return t;
        });
    }

    public void reloadConfig() {
        VisionService vision;
        lock.lock();
        try {
            userSettings = preferences.loadUserSettings();
            aiPrompts = preferences.loadAiPrompts();
            client.updateConfig(userSettings, aiPrompts);
            vision = visionService;
        } finally {
            lock.unlock();
        }
        if (expressions != null) {
            expressions.reload();
        }
        if (vision != null) {
            vision.reloadConfig();
        }
        AppLogger.info(COMPONENT, "Configuration reloaded");
    }

    // ---- conversation ----

    /**
     * Blocking chat round trip. The user turn and the reply (or the local error text)
     * are appended once the call returns; nothing is appended after {@link #close()}.
     */
    public StructuredResponse sendUserMessage(String text) {
        List<ConversationTurn> snapshot = getHistory();
        StructuredResponse response = client.send(snapshot, text);
        if (closed) {
            AppLogger.info(COMPONENT, "Discarding reply received after close");
            return response;
        }
        lock.lock();
        try {
            history.add(ConversationTurn.user(text));
            history.add(ConversationTurn.assistant(response.getText()));
        } finally {
            lock.unlock();
        }
        if (response.getStatus() != ResponseStatus.OK) {
            AppLogger.warn(COMPONENT, "Chat reply status " + response.getStatus().getValue()
                + (response.getError() != null ? ": " + response.getError() : ""));
        }
        return response;
    }

    public CompletableFuture<StructuredResponse> sendUserMessageAsync(String text) {
        return CompletableFuture.supplyAsync(() -> sendUserMessage(text), chatExecutor);
    }

    public List<ConversationTurn> getHistory() {
        lock.lock();
        try {
            return new ArrayList<>(history);
        } finally {
            lock.unlock();
        }
    }

    public void resetHistory() {
        lock.lock();
        try {
            history.clear();
        } finally {
            lock.unlock();
        }
    }

    public String getGreeting() {
        Object greeting = getAiPrompts().get("greeting");
        return greeting != null ? greeting.toString() : "";
    }

    public Map<String, Object> getUserSettings() {
        lock.lock();
        try {
            return new LinkedHashMap<>(userSettings);
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Object> getAiPrompts() {
        lock.lock();
        try {
            return new LinkedHashMap<>(aiPrompts);
        } finally {
            lock.unlock();
        }
    }

    // ---- directives ----

    public void registerHandler(DirectiveHandler handler) {
        if (handler != null && !handlers.contains(handler)) {
            handlers.add(handler);
        }
    }

    public void unregisterHandler(DirectiveHandler handler) {
        handlers.remove(handler);
    }

    /**
     * Offers every directive to every handler; a failing handler does not stop the others.
     */
    public void applyDirectives(List<Directive> directives) {
        if (directives == null || directives.isEmpty()) {
            return;
        }
        for (Directive directive : directives) {
            for (DirectiveHandler handler : handlers) {
                try {
                    handler.handle(directive);
                } catch (Exception e) {
                    AppLogger.warn(COMPONENT, "Handler " + handler.getClass().getSimpleName()
                        + " failed on " + directive + ": " + e.getMessage());
                }
            }
        }
    }

    /**
     * Queues directives for the next flush. When the queue is full the oldest entries go.
     */
    public void enqueue(List<Directive> directives) {
        if (directives == null || directives.isEmpty()) {
            return;
        }
        int dropped = 0;
        lock.lock();
        try {
            for (Directive directive : directives) {
                if (pending.size() >= pendingLimit) {
                    pending.removeFirst();
                    dropped++;
                }
                pending.addLast(directive);
            }
        } finally {
            lock.unlock();
        }
        if (dropped > 0) {
            AppLogger.warn(COMPONENT, "Pending directive queue full; dropped " + dropped + " oldest");
        }
    }

    public List<Directive> drainPending() {
        lock.lock();
        try {
            if (pending.isEmpty()) {
                return Collections.emptyList();
            }
            List<Directive> drained = new ArrayList<>(pending);
            pending.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies whatever is pending, in arrival order. Runs on the animation thread.
     */
    public int flushPending() {
        List<Directive> drained = drainPending();
        applyDirectives(drained);
        return drained.size();
    }

    public int pendingCount() {
        lock.lock();
        try {
            return pending.size();
        } finally {
            lock.unlock();
        }
    }

    // ---- vision ----

    public void attachVisionService(VisionService service) {
        lock.lock();
        try {
            if (visionService == service) {
                return;
            }
            if (visionService != null) {
                visionService.unregisterListener(visionListener);
            }
            visionService = service;
            if (service != null) {
                service.registerListener(visionListener);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Turns a capture into a chat prompt. Empty captures and captures not newer than the
     * last accepted one are ignored. Directives of a successful reply are queued.
     */
    public void onVisionEvent(VisionSnapshot snapshot) {
        if (snapshot == null || closed) {
            return;
        }
        String text = snapshot.getText().trim();
        String previewPath = snapshot.getPreviewPath();
        if (text.isEmpty() && (previewPath == null || previewPath.isEmpty())) {
            return;
        }

        List<ConversationTurn> historySnapshot;
        lock.lock();
        try {
            double timestamp = snapshot.getTimestamp();
            if (timestamp > 0 && timestamp <= lastVisionTimestamp) {
                return;
            }
            lastVisionTimestamp = timestamp > 0 ? timestamp : System.currentTimeMillis() / 1000.0;
            historySnapshot = new ArrayList<>(history);
        } finally {
            lock.unlock();
        }

        String prompt = formatVisionPrompt(text, snapshot.getMeta(), previewPath);
        StructuredResponse response = client.send(historySnapshot, prompt);
        if (closed) {
            return;
        }

        lock.lock();
        try {
            history.add(ConversationTurn.system(prompt));
            if (!response.getText().isEmpty()) {
                history.add(ConversationTurn.assistant(response.getText()));
            }
        } finally {
            lock.unlock();
        }
        if (response.getStatus() == ResponseStatus.OK) {
            enqueue(response.getDirectives());
        }
    }

    static String formatVisionPrompt(String text, Map<String, Object> meta, String previewPath) {
        List<String> lines = new ArrayList<>();
        lines.add("[Vision capture]");
        if (text != null && !text.isEmpty()) {
            lines.add(text);
        }
        Object width = meta != null ? meta.get("width") : null;
        Object height = meta != null ? meta.get("height") : null;
        if (isPositive(width) && isPositive(height)) {
            lines.add("Region size: " + width + "x" + height);
        }
        if (previewPath != null && !previewPath.isEmpty()) {
            lines.add("Snapshot path: " + previewPath);
        }
        return String.join("\n", lines).trim();
    }

    private static boolean isPositive(Object value) {
        return value instanceof Number && ((Number) value).doubleValue() > 0;
    }

    public boolean isClosed() {
        return closed;
    }

    public void close() {
        closed = true;
        attachVisionService(null);
        chatExecutor.shutdownNow();
    }
}
