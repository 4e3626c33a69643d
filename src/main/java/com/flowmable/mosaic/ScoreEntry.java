package com.flowmable.mosaic;

/**
 * One candidate's cost at one grid cell.
 *
 * @param candidateIndex Index into the candidate list
 * @param score          Cost; lower is better
 */
public record ScoreEntry(int candidateIndex, double score) implements Comparable<ScoreEntry> {

    public ScoreEntry withPenalty(double penalty) {
        return new ScoreEntry(candidateIndex, score + penalty);
    }

    /** Ascending score; ties broken by candidate index. */
    @Override
    public int compareTo(ScoreEntry o) {
        int c = Double.compare(score, o.score);
        return c != 0 ? c : Integer.compare(candidateIndex, o.candidateIndex);
    }
}
