package com.sportsdata.application.pipeline;

import com.sportsdata.domain.model.GameData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps the ids the background jobs refresh: active events (odds loop) and live games
 * (game detail loop).
 */
public class ActiveEntityTracker {

    private static final Logger logger = LoggerFactory.getLogger(ActiveEntityTracker.class);

    private final Set<String> activeEvents = new LinkedHashSet<>();
    private final Set<String> liveGames = new LinkedHashSet<>();

    public synchronized void trackEvent(String eventId) {
        if (activeEvents.add(eventId)) {
            logger.debug("Tracking active event {}", eventId);
        }
    }

    /**
     * A live game is also an active event.
     */
    public synchronized void trackLiveGame(String gameId) {
        activeEvents.add(gameId);
        if (liveGames.add(gameId)) {
            logger.debug("Tracking live game {}", gameId);
        }
    }

    /**
     * @return true if the id was tracked in either set
     */
    public synchronized boolean untrack(String id) {
        boolean removed = activeEvents.remove(id);
        removed |= liveGames.remove(id);
        return removed;
    }

    /**
     * Updates tracking from a freshly fetched game. Scheduled games are active, live games are
     * active and live, finished or postponed games are dropped.
     */
    public synchronized void onGame(GameData game) {
        if (game == null || game.status() == null) {
            return;
        }
        switch (game.status()) {
            case LIVE -> trackLiveGame(game.id());
            case SCHEDULED -> {
                liveGames.remove(game.id());
                trackEvent(game.id());
            }
            case FINISHED, POSTPONED -> {
                if (untrack(game.id())) {
                    logger.debug("Stopped tracking {} ({})", game.id(), game.status());
                }
            }
        }
    }

    public synchronized List<String> activeEvents() {
        return List.copyOf(activeEvents);
    }

    public synchronized List<String> liveGames() {
        return List.copyOf(liveGames);
    }
}
