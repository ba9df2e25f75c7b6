package com.deskmate;

import com.deskmate.directives.InlineDirectiveScanner;
import com.deskmate.directives.ResponseNormalizer;
import com.deskmate.models.Directive;
import com.deskmate.providers.chat.ChatClient;
import com.deskmate.settings.PreferencesStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class DirectiveFlushSchedulerTest {

    @TempDir
    Path dataDir;

    private ChatOrchestrator orchestrator() {
        ObjectMapper mapper = new ObjectMapper();
        ChatClient client = new ChatClient(mapper, (url, payload, key) -> mapper.createObjectNode(),
            new ResponseNormalizer(mapper, new InlineDirectiveScanner(mapper)));
        return new ChatOrchestrator(new PreferencesStore(dataDir), client, null);
    }

    @Test
    void flushesOnTheAnimationThread() throws Exception {
        ChatOrchestrator orchestrator = orchestrator();
        ScheduledExecutorService executor = DirectiveFlushScheduler.newAnimationExecutor();
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch handled = new CountDownLatch(1);
        orchestrator.registerHandler(d -> {
            threadName.set(Thread.currentThread().getName());
            handled.countDown();
        });
        DirectiveFlushScheduler scheduler = new DirectiveFlushScheduler(orchestrator, executor, 20);
        try {
            scheduler.start();
            orchestrator.enqueue(List.of(new Directive("motion", Map.of())));

            assertTrue(handled.await(5, TimeUnit.SECONDS));
            assertEquals("animation-loop", threadName.get());
        } finally {
            scheduler.stop();
            executor.shutdownNow();
            orchestrator.close();
        }
    }

    @Test
    void runOnceCountsFlushedDirectives() {
        ChatOrchestrator orchestrator = orchestrator();
        ScheduledExecutorService executor = DirectiveFlushScheduler.newAnimationExecutor();
        try {
            DirectiveFlushScheduler scheduler = new DirectiveFlushScheduler(orchestrator, executor, 0);
            orchestrator.enqueue(List.of(new Directive("a", Map.of()), new Directive("b", Map.of())));

            scheduler.runOnce();

            assertEquals(2, scheduler.getFlushedTotal());
            assertTrue(scheduler.getLastRunAt() > 0);
            assertEquals(0, orchestrator.pendingCount());
        } finally {
            executor.shutdownNow();
            orchestrator.close();
        }
    }
}
