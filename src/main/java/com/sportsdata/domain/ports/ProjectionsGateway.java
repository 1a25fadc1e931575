package com.sportsdata.domain.ports;

import com.sportsdata.domain.model.Projection;

import java.util.List;

/**
 * Port for daily-fantasy projections.
 */
public interface ProjectionsGateway extends UpstreamSource {

    List<Projection> fetchProjections();
}
