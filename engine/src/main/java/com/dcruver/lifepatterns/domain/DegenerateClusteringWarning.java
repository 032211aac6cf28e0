package com.dcruver.lifepatterns.domain;

/**
 * Non-fatal signal that fewer themes were built than requested because
 * the input has fewer distinct vectors than k.
 */
public record DegenerateClusteringWarning(int requestedK, int effectiveK, int distinctVectors) {

    public String message() {
        return String.format("Requested %d themes but only %d distinct day vectors exist; using k=%d",
            requestedK, distinctVectors, effectiveK);
    }
}
