package com.example.lawrag.domain.port;

import java.util.List;

/**
 * Produces a grounded answer from ordered context blocks.
 */
public interface AnswerGenerator {

    /**
     * @param history optional prior conversation turns rendered as plain text, may be null
     */
    String generate(String query, List<ContextBlock> blocks, String history);

    String modelName();

    record ContextBlock(int index, String lawName, Integer articleNumber, String content) {
    }
}
