package com.luxgrid.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Luxgrid-specific MDC keys for structured logging.
 * Worker threads do not inherit the MDC, so each worker sets its own keys.
 */
public final class MdcContext {

    public static final String RUN_ID = "runId";
    public static final String PHASE = "phase";
    public static final String JOB_ID = "jobId";
    public static final String VIEW_GROUP = "viewGroup";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setPhase(String runId, String phase) {
        MDC.put(RUN_ID, runId);
        MDC.put(PHASE, phase);
    }

    public static void setJob(String runId, String phase, String jobId) {
        setPhase(runId, phase);
        MDC.put(JOB_ID, jobId);
    }

    public static void setViewGroup(String runId, String viewGroup) {
        MDC.put(RUN_ID, runId);
        MDC.put(VIEW_GROUP, viewGroup);
    }

    public static void clearJob() {
        MDC.remove(JOB_ID);
        MDC.remove(VIEW_GROUP);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(PHASE);
        MDC.remove(JOB_ID);
        MDC.remove(VIEW_GROUP);
    }
}
