package com.trustmail.rule;

/**
 * Optional observer of a retroactive run. Callbacks run on the run's own thread and must
 * not block.
 */
public interface RetroactiveProgressListener {

    RetroactiveProgressListener NONE = new RetroactiveProgressListener() {};

    default void onPageFetched(int pageNumber, int idsOnPage, int idsSoFar) {
    }

    default void onBatchCompleted(int batchNumber, int totalBatches, RetroactiveRunState state) {
    }
}
