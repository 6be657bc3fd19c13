package com.di.countnova.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void clearMdc() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should carry the caller's MDC into another thread and clear it afterwards")
    void testWrapRunnable() throws InterruptedException {
        MDC.put("requestId", "req-1234");
        AtomicReference<String> inside = new AtomicReference<>();
        AtomicReference<String> after = new AtomicReference<>();

        Runnable task = MdcPropagation.wrapRunnable(() -> inside.set(MDC.get("requestId")));
        Thread thread = new Thread(() -> {
            task.run();
            after.set(MDC.get("requestId"));
        });
        thread.start();
        thread.join();

        assertEquals("req-1234", inside.get());
        assertNull(after.get());
    }

    @Test
    @DisplayName("Should name threads by prefix and mark them daemon")
    void testDaemonThreads() {
        var factory = MdcPropagation.daemonThreads("count-pipeline");
        Thread first = factory.newThread(() -> { });
        Thread second = factory.newThread(() -> { });

        assertEquals("count-pipeline-1", first.getName());
        assertEquals("count-pipeline-2", second.getName());
        assertTrue(first.isDaemon());
    }

    @Test
    @DisplayName("Should copy an empty MDC as an empty map")
    void testCopyEmpty() {
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }
}
