package com.navcaddy.core.engine;

import com.navcaddy.core.model.Club;
import com.navcaddy.core.model.ClubType;
import com.navcaddy.core.model.MissDirection;
import com.navcaddy.core.model.MissPattern;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryMissPatternRepositoryTest {

    private static final Club SEVEN_IRON = new Club("7-Iron", ClubType.IRON, 34, 150);
    private static final Club DRIVER = new Club("Driver", ClubType.DRIVER, 10.5, 250);

    private final InMemoryMissPatternRepository repository = new InMemoryMissPatternRepository();

    private static MissPattern pattern(MissDirection direction, Club club) {
        return new MissPattern(direction, club, 5, 0.7, null, Instant.parse("2026-04-20T10:00:00Z"));
    }

    @Test
    @DisplayName("club lookups include patterns that apply to every club")
    void filtersByClub() {
        var push = pattern(MissDirection.PUSH, SEVEN_IRON);
        var slice = pattern(MissDirection.SLICE, DRIVER);
        var fat = pattern(MissDirection.FAT, null);
        repository.save(push);
        repository.save(slice);
        repository.save(fat);

        assertEquals(List.of(push, fat), repository.findPatterns(SEVEN_IRON));
        assertEquals(3, repository.findPatterns(null).size());
    }

    @Test
    void clear() {
        repository.save(pattern(MissDirection.HOOK, DRIVER));
        repository.clear();

        assertTrue(repository.findPatterns(null).isEmpty());
    }
}
