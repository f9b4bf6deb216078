package com.trustmail.rule;

import java.util.ArrayList;
import java.util.List;

/**
 * Consecutive ids mutated together.
 */
public record BatchChunk(int index, List<String> ids) {

    public BatchChunk {
        ids = List.copyOf(ids);
    }

    public static List<BatchChunk> partition(List<String> ids, int batchSize) {
        List<BatchChunk> chunks = new ArrayList<>();
        for (int start = 0; start < ids.size(); start += batchSize) {
            chunks.add(new BatchChunk(chunks.size(), ids.subList(start, Math.min(start + batchSize, ids.size()))));
        }
        return chunks;
    }

    public int size() {
        return ids.size();
    }
}
