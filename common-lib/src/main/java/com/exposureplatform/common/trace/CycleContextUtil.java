package com.exposureplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.UUID;

/**
 * Carries the id of the current check cycle or upload through a reactive pipeline.
 * Check-cycle ids and upload ids are told apart by their prefix.
 *
 * <p>The Reactor Context holds the id. MDC is written only while a single log
 * statement runs, never left on the thread.
 *
 * <pre>
 *     return CycleContextUtil.withCycleId(pipeline, cycleId);
 * </pre>
 */
public final class CycleContextUtil {

    public static final String CYCLE_ID_KEY = "cycleId";

    static final String CHECK_PREFIX  = "check-";
    static final String UPLOAD_PREFIX = "upload-";

    private CycleContextUtil() {}

    /** Id for one check cycle; also travels in the exposure alert. */
    public static String newCheckCycleId() {
        return CHECK_PREFIX + UUID.randomUUID();
    }

    /** Id for one diagnosis upload attempt. */
    public static String newUploadId() {
        return UPLOAD_PREFIX + UUID.randomUUID();
    }

    /**
     * Stores {@code cycleId} in the Reactor Context of {@code mono}. Call at the end of
     * pipeline assembly so every upstream operator can read it.
     */
    public static <T> Mono<T> withCycleId(Mono<T> mono, String cycleId) {
        return mono.contextWrite(ctx -> ctx.put(CYCLE_ID_KEY, cycleId));
    }

    /**
     * @return the cycle id from the context, or {@code "unknown"}; never null
     */
    public static String getCycleId(ContextView ctx) {
        return ctx.getOrDefault(CYCLE_ID_KEY, "unknown");
    }

    /**
     * Runs {@code logAction} with {@code cycleId} in MDC, then removes it.
     */
    public static void withMdc(String cycleId, Runnable logAction) {
        MDC.put(CYCLE_ID_KEY, cycleId);
        try {
            logAction.run();
        } finally {
            MDC.remove(CYCLE_ID_KEY);
        }
    }
}
