package com.warden.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Warden-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put("jobId", jobId);
    }

    public static void setJob(String jobId, String mode) {
        MDC.put("jobId", jobId);
        MDC.put("mode", mode);
    }

    public static void setRoutine(String routineId) {
        MDC.put("routineId", routineId);
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("mode");
        MDC.remove("routineId");
    }
}
