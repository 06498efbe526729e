package com.example.rcaengine.rca;

import com.example.rcaengine.domain.Evidence;

/**
 * A candidate with its evidence, score and 1-based rank.
 */
public record RankedSuspect(Candidate candidate, Evidence evidence, double score, int rank) {
}
