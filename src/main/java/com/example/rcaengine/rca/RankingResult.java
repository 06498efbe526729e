package com.example.rcaengine.rca;

import java.util.List;

/**
 * Output of one ranking pass.
 *
 * @param modelVersion null when the heuristic produced the scores
 */
public record RankingResult(String mode, Long modelVersion, List<RankedSuspect> suspects) {

    public static final String HEURISTIC = "heuristic";
    public static final String LEARNED = "learned";
}
