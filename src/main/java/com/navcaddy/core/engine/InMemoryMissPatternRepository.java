package com.navcaddy.core.engine;

import com.navcaddy.core.model.Club;
import com.navcaddy.core.model.MissPattern;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

@Component
public class InMemoryMissPatternRepository implements MissPatternRepository {

    private final CopyOnWriteArrayList<MissPattern> patterns = new CopyOnWriteArrayList<>();

    public void save(MissPattern pattern) {
        patterns.add(Objects.requireNonNull(pattern, "pattern"));
    }

    @Override
    public List<MissPattern> findPatterns(Club club) {
        if (club == null) {
            return List.copyOf(patterns);
        }
        return patterns.stream()
                .filter(p -> p.club() == null || p.club().name().equals(club.name()))
                .toList();
    }

    public void clear() {
        patterns.clear();
    }
}
