package com.example.lawrag.domain.port;

import com.example.lawrag.domain.model.SparseVector;
import java.util.List;

/**
 * Lexical encoder. Documents and queries are weighted differently, so there are two entry points.
 */
public interface SparseEncoder {

    SparseVector encode(String document);

    List<SparseVector> encodeBatch(List<String> documents);

    SparseVector encodeQuery(String query);

    String modelName();
}
