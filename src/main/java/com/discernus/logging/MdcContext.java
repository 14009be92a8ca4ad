package com.discernus.logging;

import org.slf4j.MDC;

/**
 * MDC keys for run-scoped logging. Worker threads set them per stage and clear
 * them before returning to the pool.
 */
public final class MdcContext {
    public static final String RUN_ID = "runId";
    public static final String STAGE_ID = "stageId";

    private MdcContext() {
    }

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setStage(String runId, String stageId) {
        MDC.put(RUN_ID, runId);
        MDC.put(STAGE_ID, stageId);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(STAGE_ID);
    }
}
