package com.navcaddy.core.model;

import java.io.Serializable;

/**
 * Live state of the round being played.
 */
public record RoundState(
    String roundId,
    String courseName,
    int currentHole,
    int currentPar,
    int totalScore,
    int holesCompleted,
    CourseConditions conditions
) implements Serializable {

    public RoundState withHole(int hole, int par) {
        return new RoundState(roundId, courseName, hole, par, totalScore, holesCompleted, conditions);
    }

    public RoundState withScore(int score, int completed) {
        return new RoundState(roundId, courseName, currentHole, currentPar, score, completed, conditions);
    }

    public RoundState withConditions(CourseConditions updated) {
        return new RoundState(roundId, courseName, currentHole, currentPar, totalScore, holesCompleted, updated);
    }
}
