package com.navcaddy.core.engine;

import com.navcaddy.core.model.Club;
import com.navcaddy.core.model.MissPattern;

import java.util.List;

/**
 * Read access to the player's recorded miss patterns.
 */
public interface MissPatternRepository {

    /**
     * @param club limit to patterns for this club plus club-independent ones; {@code null} for all
     */
    List<MissPattern> findPatterns(Club club);
}
