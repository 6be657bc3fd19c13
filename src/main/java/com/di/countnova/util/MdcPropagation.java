package com.di.countnova.util;

import org.slf4j.MDC;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Propagates SLF4J MDC (e.g. {@code requestId} from {@link com.di.countnova.config.MdcRequestFilter})
 * to pipeline threads so that logs from the producer and the workers are correlated with the
 * request that started the run.
 * <p>
 * MDC is thread-local; without propagation, logs from pooled threads do not contain the
 * request's correlation ID.
 * <p>
 * Usage: {@code executor.execute(MdcPropagation.wrapRunnable(() -> doWork()));}
 */
public final class MdcPropagation {

    private MdcPropagation() {
    }

    /**
     * Captures the current thread's MDC and returns a Runnable that, when run (e.g. on another thread),
     * sets that MDC for the duration of the task and clears it in {@code finally}.
     *
     * @param task the task to run in the child thread
     * @return a runnable that propagates MDC then runs the task
     */
    public static Runnable wrapRunnable(Runnable task) {
        Map<String, String> contextMap = copyMdc();
        return () -> {
            setMdc(contextMap);
            try {
                task.run();
            } finally {
                clearMdc(contextMap);
            }
        };
    }

    /**
     * Returns a copy of the current thread's MDC context map, or an empty map if none.
     *
     * @return copy of MDC context; never null
     */
    public static Map<String, String> copyMdc() {
        Map<String, String> map = MDC.getCopyOfContextMap();
        return map == null ? Collections.emptyMap() : map;
    }

    /**
     * Daemon thread factory naming threads {@code prefix-1}, {@code prefix-2}, ...
     */
    public static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static void setMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.forEach(MDC::put);
        }
    }

    private static void clearMdc(Map<String, String> contextMap) {
        if (contextMap != null && !contextMap.isEmpty()) {
            contextMap.keySet().forEach(MDC::remove);
        }
    }
}
