package com.warden.core.routines;

/**
 * What makes a routine fire. Only the fields of the active {@link #type()} are set.
 *
 * @param schedule      cron expression, 5 or 6 fields
 * @param pattern       regular expression matched against incoming event text
 * @param channel       optional channel scope for event triggers
 * @param webhookPath   path segment under {@code /api/v1/routines/webhook/}
 * @param webhookSecret optional shared secret expected in {@code X-Webhook-Secret}
 */
public record RoutineTrigger(
    TriggerType type,
    String schedule,
    String pattern,
    String channel,
    String webhookPath,
    String webhookSecret
) {

    public static RoutineTrigger cron(String schedule) {
        return new RoutineTrigger(TriggerType.CRON, schedule, null, null, null, null);
    }

    public static RoutineTrigger event(String pattern, String channel) {
        return new RoutineTrigger(TriggerType.EVENT, null, pattern, channel, null, null);
    }

    public static RoutineTrigger webhook(String path, String secret) {
        return new RoutineTrigger(TriggerType.WEBHOOK, null, null, null, path, secret);
    }

    public static RoutineTrigger manual() {
        return new RoutineTrigger(TriggerType.MANUAL, null, null, null, null, null);
    }

    /** One-line description for listings. */
    public String summary() {
        return switch (type) {
            case CRON -> "cron: " + schedule;
            case EVENT -> channel != null && !channel.isBlank()
                    ? "on " + channel + " /" + pattern + "/"
                    : "on /" + pattern + "/";
            case WEBHOOK -> "webhook: " + webhookPath;
            case MANUAL -> "manual only";
        };
    }
}
