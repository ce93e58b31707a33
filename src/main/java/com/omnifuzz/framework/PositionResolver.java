package com.omnifuzz.framework;

import com.omnifuzz.model.Position;
import com.omnifuzz.model.RequestTemplate;

import java.util.List;

/**
 * Finds payload positions in a base request. Returned positions are sorted by
 * start and do not overlap.
 */
public interface PositionResolver {

    List<Position> resolvePositions(RequestTemplate template);
}
