package com.example.lawrag.application.query;

import com.example.lawrag.application.pipeline.Pipeline;
import com.example.lawrag.application.pipeline.PipelineStep;
import com.example.lawrag.application.pipeline.StepResult;
import com.example.lawrag.application.query.step.AnswerGeneratorStep;
import com.example.lawrag.application.query.step.DualEncoderStep;
import com.example.lawrag.application.query.step.HybridRetrieverStep;
import com.example.lawrag.application.query.step.QueryPreprocessorStep;
import com.example.lawrag.application.query.step.RerankerStep;
import com.example.lawrag.application.query.step.ResponseFormatterStep;
import com.example.lawrag.domain.model.RetrievedChunk;
import com.example.lawrag.domain.port.AnswerGenerator;
import com.example.lawrag.domain.port.DenseEncoder;
import com.example.lawrag.domain.port.Reranker;
import com.example.lawrag.domain.port.SparseEncoder;
import com.example.lawrag.domain.port.VectorStore;
import com.example.lawrag.domain.port.VectorStore.SearchFilter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Question to grounded answer through a three-stage funnel: wide hybrid recall, cross-encoder
 * rerank, generation over the reranked articles.
 *
 * <p>Stages run in a fixed order with typed hand-offs; the context map only collects counters.
 * Any stage failure propagates to the caller.
 */
@Service
public class QueryPipeline {

    private static final Logger log = LoggerFactory.getLogger(QueryPipeline.class);

    public static final int STAGE_COUNT = 6;

    private final QueryPreprocessorStep preprocessor;
    private final DualEncoderStep dualEncoder;
    private final HybridRetrieverStep retriever;
    private final RerankerStep reranker;
    private final AnswerGeneratorStep generator;
    private final ResponseFormatterStep formatter;

    private final int prefetchLimit;
    private final int defaultTopK;

    public QueryPipeline(
            DenseEncoder denseEncoder,
            SparseEncoder sparseEncoder,
            VectorStore vectorStore,
            Reranker rerankerModel,
            AnswerGenerator answerGenerator,
            @Value("${lawrag.retrieval.prefetch-limit:25}") int prefetchLimit,
            @Value("${lawrag.retrieval.rerank-top-k:5}") int defaultTopK,
            @Value("${lawrag.generation.fallback-answer:لم أجد معلومات كافية للإجابة على سؤالك.}") String fallbackAnswer
    ) {
        if (prefetchLimit <= 0) {
            throw new IllegalArgumentException("prefetchLimit must be > 0");
        }
        if (defaultTopK <= 0) {
            throw new IllegalArgumentException("defaultTopK must be > 0");
        }
        this.preprocessor = new QueryPreprocessorStep();
        this.dualEncoder = new DualEncoderStep(denseEncoder, sparseEncoder);
        this.retriever = new HybridRetrieverStep(vectorStore);
        this.reranker = new RerankerStep(rerankerModel);
        this.generator = new AnswerGeneratorStep(answerGenerator, fallbackAnswer);
        this.formatter = new ResponseFormatterStep(denseEncoder.modelName(), rerankerModel.modelName(),
                answerGenerator.modelName());
        this.prefetchLimit = prefetchLimit;
        this.defaultTopK = defaultTopK;
    }

    public QueryOutput run(QueryInput input, String collection) {
        long t0 = System.nanoTime();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("country", input.country());
        context.put("law_types", input.lawTypes());
        context.put("session_id", input.sessionId());

        List<StepResult> stages = new ArrayList<>(STAGE_COUNT);
        int topK = input.topK() > 0 ? input.topK() : defaultTopK;

        NormalizedQuery query = invoke(preprocessor, input.question(), context, stages);
        EncodedQuery encoded = invoke(dualEncoder, query.normalized(), context, stages);

        SearchFilter filter = new SearchFilter(input.country(), input.lawTypes());
        List<RetrievedChunk> candidates = invoke(retriever,
                new RetrievalRequest(collection, encoded, filter, prefetchLimit), context, stages);
        List<RetrievedChunk> reranked = invoke(reranker,
                new RerankRequest(query.normalized(), candidates, topK), context, stages);
        String answer = invoke(generator,
                new GenerationRequest(query.raw(), reranked, input.history()), context, stages);

        Map<String, Long> timings = new LinkedHashMap<>();
        for (StepResult stage : stages) {
            timings.put(stage.name(), stage.durationMs());
        }
        long elapsedMs = (System.nanoTime() - t0) / 1_000_000;
        QueryOutput output = invoke(formatter,
                new FormatRequest(answer, reranked, candidates.size(), elapsedMs, STAGE_COUNT, timings),
                context, stages);

        log.info("event=query_done collection={} session={} retrieved={} reranked={} topK={} ms={}",
                collection, input.sessionId(), candidates.size(), reranked.size(), topK, elapsedMs);
        return output;
    }

    private static <I, O> O invoke(PipelineStep<I, O> step, I input, Map<String, Object> context,
                                   List<StepResult> stages) {
        Pipeline.Execution execution = Pipeline.execute(step, input, context);
        stages.add(execution.result());
        Exception failure = execution.failure();
        if (failure == null) {
            return (O) execution.output();
        }
        if (failure instanceof RuntimeException re) {
            throw re;
        }
        throw new IllegalStateException("Query stage failed: " + step.name(), failure);
    }
}
