package com.quarry.formula.preview;

/**
 * Live-preview lifecycle. The controller rests in IDLE, DEBOUNCING, EVALUATING or SETTLED;
 * SUPERSEDED marks a finished evaluation whose generation was no longer current.
 */
public enum PreviewState {
    IDLE,
    DEBOUNCING,
    EVALUATING,
    SETTLED,
    SUPERSEDED
}
