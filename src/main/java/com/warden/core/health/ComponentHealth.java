package com.warden.core.health;

import java.util.Collection;
import java.util.Map;

/**
 * Health of one orchestrator dependency, as reported by {@link HealthCheckService}.
 */
public record ComponentHealth(
    String component,
    Status status,
    String detail,
    Map<String, String> metadata
) {

    /** Ordered by severity: the overall status is the worst component status. */
    public enum Status {
        UP(200),
        DEGRADED(200),
        DOWN(503);

        private final int httpStatus;

        Status(int httpStatus) {
            this.httpStatus = httpStatus;
        }

        public int httpStatus() {
            return httpStatus;
        }

        Status worse(Status other) {
            return other.ordinal() > ordinal() ? other : this;
        }
    }

    public ComponentHealth {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public static ComponentHealth up(String component, String detail, Map<String, String> metadata) {
        return new ComponentHealth(component, Status.UP, detail, metadata);
    }

    public static ComponentHealth degraded(String component, String detail, Map<String, String> metadata) {
        return new ComponentHealth(component, Status.DEGRADED, detail, metadata);
    }

    public static ComponentHealth down(String component, String detail, Map<String, String> metadata) {
        return new ComponentHealth(component, Status.DOWN, detail, metadata);
    }

    /** DOWN when nothing was checked. */
    public static Status overall(Collection<ComponentHealth> components) {
        if (components.isEmpty()) {
            return Status.DOWN;
        }
        Status overall = Status.UP;
        for (ComponentHealth component : components) {
            overall = overall.worse(component.status());
        }
        return overall;
    }
}
