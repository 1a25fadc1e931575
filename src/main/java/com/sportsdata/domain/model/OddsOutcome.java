package com.sportsdata.domain.model;

import java.math.BigDecimal;

/**
 * Single priced outcome inside a bookmaker market.
 *
 * @param name  outcome label, e.g. team name, "Over"
 * @param price price in the configured odds format (american by default)
 * @param point handicap or total line, null for moneyline outcomes
 */
public record OddsOutcome(String name, BigDecimal price, BigDecimal point) {}
