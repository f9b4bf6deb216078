package com.trustmail.rule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Report of one retroactive run. Counters only grow while the run is in progress.
 */
public class RetroactiveRunState {

    private int totalFound;
    private int processedCount;
    private int errorCount;
    private final List<String> errors = new ArrayList<>();
    private boolean truncated;

    void setTotalFound(int totalFound) {
        this.totalFound = totalFound;
    }

    void addProcessed(int count) {
        processedCount += count;
    }

    void addError(String error) {
        errors.add(error);
        errorCount++;
    }

    void markTruncated() {
        truncated = true;
    }

    public int getTotalFound() { return totalFound; }
    public int getProcessedCount() { return processedCount; }
    public int getErrorCount() { return errorCount; }
    public List<String> getErrors() { return Collections.unmodifiableList(errors); }
    public boolean isTruncated() { return truncated; }

    @Override
    public String toString() {
        return "found=" + totalFound + ", processed=" + processedCount + ", errors=" + errorCount
                + (truncated ? ", truncated" : "");
    }
}
