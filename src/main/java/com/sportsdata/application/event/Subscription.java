package com.sportsdata.application.event;

/**
 * Handle returned by {@link EventBus#subscribe}. Cancelling it removes the listener.
 */
public interface Subscription {

    String topic();

    /**
     * @return true if the listener was still registered
     */
    boolean cancel();
}
