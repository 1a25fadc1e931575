package com.sportsdata.application.event;

/**
 * Payloads published on the pipeline's event bus.
 */
public sealed interface PipelineEvent
    permits PipelineEvent.DataUpdated, PipelineEvent.PipelineError,
            PipelineEvent.ConnectionChanged, PipelineEvent.Lifecycle {

    /**
     * A value was fetched from upstream and cached.
     *
     * @param type data category, e.g. {@code game} or {@code odds}
     * @param id   identifier of the fetched entity
     */
    record DataUpdated(String type, String id, Object data) implements PipelineEvent {
    }

    /**
     * A background refresh failed.
     *
     * @param type    what failed, e.g. {@code live_odds_fetch}
     * @param context identifier being refreshed, or null for loop level failures
     */
    record PipelineError(String type, String context, Throwable error) implements PipelineEvent {
    }

    record ConnectionChanged(String source, boolean available, String reason) implements PipelineEvent {
    }

    /**
     * Cache, refresh and shutdown notifications. {@code failure} is only set for
     * {@code refresh:failed}.
     */
    record Lifecycle(Throwable failure) implements PipelineEvent {

        public static Lifecycle ok() {
            return new Lifecycle(null);
        }

        public static Lifecycle failed(Throwable failure) {
            return new Lifecycle(failure);
        }
    }
}
