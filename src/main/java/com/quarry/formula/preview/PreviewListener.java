package com.quarry.formula.preview;

/**
 * Host callbacks from {@link LivePreviewController}. May be called from the scheduler thread or
 * from whichever thread completes an asynchronous function. Exceptions thrown here are logged
 * and otherwise ignored.
 */
public interface PreviewListener {

    default void onEvaluationStarted(long generation) {}

    /** The latest formula settled; the host should display this result. */
    default void onPreview(PreviewUpdate update) {}

    /** An evaluation finished after a newer edit; its result must not be shown. */
    default void onSuperseded(PreviewUpdate discarded) {}

    /** The text became blank; the host should clear the preview. */
    default void onCleared(long generation) {}
}
