package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingService;
import eu.virtualparadox.ragqa.rag.index.SearchBackend;
import eu.virtualparadox.ragqa.rag.index.SearchBackendException;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import eu.virtualparadox.ragqa.rag.index.model.SearchFilter;
import eu.virtualparadox.ragqa.rag.index.model.SearchHit;
import eu.virtualparadox.ragqa.rag.retriever.RetrievalException;
import eu.virtualparadox.ragqa.rag.retriever.model.FusedResult;
import eu.virtualparadox.ragqa.rag.retriever.model.Query;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalCandidate;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalMode;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.ragqa.rag.retriever.model.SourceMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Runs the four retrieval modes over a {@link SearchBackend}.
 * <ul>
 *   <li><b>vector</b>: kNN with {@code topK}</li>
 *   <li><b>keyword</b>: BM25 over the configured properties with {@code topK}</li>
 *   <li><b>hybrid</b>: backend-native combined scoring; runs as fusion when the backend has none</li>
 *   <li><b>fusion</b>: vector ({@code vectorTopK}) and keyword ({@code keywordTopK}) legs run
 *       concurrently, then merge via {@link ReciprocalRankFusion} capped at {@code mergeTopK}</li>
 * </ul>
 * Every backend call is bounded by {@code retrievalTimeout}, measured for the whole call. Any
 * failure inside a backend call surfaces as {@link RetrievalException} with kind BACKEND_UNAVAILABLE.
 * The engine keeps no state between calls.
 */
@Service
@Slf4j
public class RetrievalEngine implements RetrieverService {

    private final SearchBackend searchBackend;
    private final EmbeddingService embeddingService;
    private final ReciprocalRankFusion fusion;
    private final Executor executor;

    public RetrievalEngine(final SearchBackend searchBackend,
                           final EmbeddingService embeddingService,
                           final ReciprocalRankFusion fusion,
                           @Qualifier("pipelineExecutor") final Executor executor) {
        this.searchBackend = searchBackend;
        this.embeddingService = embeddingService;
        this.fusion = fusion;
        this.executor = executor;
    }

    @Override
    public RetrievalResult retrieve(final Query query, final RetrievalMode mode, final PipelineConfig config) {
        final long deadline = System.nanoTime() + config.getRetrievalTimeout().toNanos();
        final SearchFilter filter = SearchFilter.byDocument(config.getDocumentFilter());

        return switch (mode) {
            case VECTOR -> vector(encoded(query), config, filter, deadline);
            case KEYWORD -> keyword(query, config, filter, deadline);
            case HYBRID -> {
                if (searchBackend.supportsHybrid()) {
                    yield hybrid(encoded(query), config, filter, deadline);
                }
                log.info("Search backend has no native hybrid search, running fusion instead");
                yield fusion(encoded(query), config, filter, deadline);
            }
            case FUSION -> fusion(encoded(query), config, filter, deadline);
        };
    }

    private RetrievalResult vector(final Query query,
                                   final PipelineConfig config,
                                   final SearchFilter filter,
                                   final long deadline) {
        final List<SearchHit> hits = await(start(() -> searchBackend.vectorSearch(query.vector(), config.getTopK(), filter)), deadline);
        final List<RetrievalCandidate> candidates = toCandidates(hits, SourceMode.VECTOR);
        final List<FusedResult> results = resolve(candidates, config.getTopK(), deadline);
        log.info("[OK] Retrieved {}/{} hits mode=vector", results.size(), config.getTopK());
        return new RetrievalResult(RetrievalMode.VECTOR, candidates, results);
    }

    private RetrievalResult keyword(final Query query,
                                    final PipelineConfig config,
                                    final SearchFilter filter,
                                    final long deadline) {
        final List<SearchHit> hits = await(start(() -> searchBackend.keywordSearch(
                query.text(), config.effectiveKeywordProperties(), config.getTopK(), filter)), deadline);
        final List<RetrievalCandidate> candidates = toCandidates(hits, SourceMode.KEYWORD);
        final List<FusedResult> results = resolve(candidates, config.getTopK(), deadline);
        log.info("[OK] Retrieved {}/{} hits mode=keyword", results.size(), config.getTopK());
        return new RetrievalResult(RetrievalMode.KEYWORD, candidates, results);
    }

    private RetrievalResult hybrid(final Query query,
                                   final PipelineConfig config,
                                   final SearchFilter filter,
                                   final long deadline) {
        final List<SearchHit> hits = await(start(() -> searchBackend.hybridSearch(
                query.text(), query.vector(), config.effectiveKeywordProperties(), config.getTopK(),
                config.getHybridAlpha(), filter)), deadline);
        final List<RetrievalCandidate> candidates = toCandidates(hits, SourceMode.HYBRID);
        final List<FusedResult> results = resolve(candidates, config.getTopK(), deadline);
        log.info("[OK] Retrieved {}/{} hits mode=hybrid alpha={}", results.size(), config.getTopK(), config.getHybridAlpha());
        return new RetrievalResult(RetrievalMode.HYBRID, candidates, results);
    }

    private RetrievalResult fusion(final Query query,
                                   final PipelineConfig config,
                                   final SearchFilter filter,
                                   final long deadline) {
        final FutureTask<List<SearchHit>> vectorLeg = start(() ->
                searchBackend.vectorSearch(query.vector(), config.getVectorTopK(), filter));
        final FutureTask<List<SearchHit>> keywordLeg = start(() ->
                searchBackend.keywordSearch(query.text(), config.effectiveKeywordProperties(), config.getKeywordTopK(), filter));

        final List<SearchHit> vectorHits;
        final List<SearchHit> keywordHits;
        try {
            vectorHits = await(vectorLeg, deadline);
            keywordHits = await(keywordLeg, deadline);
        } finally {
            vectorLeg.cancel(true);
            keywordLeg.cancel(true);
        }

        final List<RetrievalCandidate> vectorCandidates = toCandidates(vectorHits, SourceMode.VECTOR);
        final List<RetrievalCandidate> keywordCandidates = toCandidates(keywordHits, SourceMode.KEYWORD);

        final List<ReciprocalRankFusion.FusedScore> merged =
                fusion.fuse(vectorCandidates, keywordCandidates, config.getRrfK(), config.getMergeTopK());

        final List<String> ids = merged.stream().map(ReciprocalRankFusion.FusedScore::chunkId).toList();
        final Map<String, Chunk> chunks = fetch(ids, deadline);

        final List<FusedResult> results = new ArrayList<>(merged.size());
        for (final ReciprocalRankFusion.FusedScore score : merged) {
            final Chunk chunk = chunks.get(score.chunkId());
            if (chunk == null) {
                log.warn("Chunk {} vanished from the index, dropping it", score.chunkId());
                continue;
            }
            results.add(new FusedResult(score.chunkId(), score.score(), chunk));
        }

        final List<RetrievalCandidate> candidates = new ArrayList<>(vectorCandidates);
        candidates.addAll(keywordCandidates);

        log.info("[OK] Retrieved vec={}/{}, kw={}/{}, merged={} mode=fusion",
                vectorHits.size(), config.getVectorTopK(), keywordHits.size(), config.getKeywordTopK(), results.size());
        return new RetrievalResult(RetrievalMode.FUSION, candidates, results);
    }

    private Query encoded(final Query query) {
        if (query.isEncoded()) {
            return query;
        }
        return query.withVector(embeddingService.embedQuery(query.text()));
    }

    private List<RetrievalCandidate> toCandidates(final List<SearchHit> hits, final SourceMode sourceMode) {
        final List<RetrievalCandidate> candidates = new ArrayList<>(hits.size());
        int rank = 1;
        for (final SearchHit hit : hits) {
            candidates.add(new RetrievalCandidate(hit.chunkId(), hit.score(), rank++, sourceMode));
        }
        return candidates;
    }

    /**
     * Single-leg modes: keep backend order, drop duplicate ids, cap at {@code limit}.
     */
    private List<FusedResult> resolve(final List<RetrievalCandidate> candidates, final int limit, final long deadline) {
        final LinkedHashSet<String> ids = new LinkedHashSet<>();
        for (final RetrievalCandidate c : candidates) {
            if (ids.size() >= limit) {
                break;
            }
            ids.add(c.chunkId());
        }
        final Map<String, Chunk> chunks = fetch(List.copyOf(ids), deadline);

        final List<FusedResult> results = new ArrayList<>(ids.size());
        for (final RetrievalCandidate c : candidates) {
            final Chunk chunk = chunks.remove(c.chunkId());
            if (chunk != null) {
                results.add(new FusedResult(c.chunkId(), c.score(), chunk));
            }
        }
        return results;
    }

    private Map<String, Chunk> fetch(final List<String> ids, final long deadline) {
        final List<Chunk> chunks = await(start(() -> searchBackend.fetchChunks(ids)), deadline);
        return chunks.stream().collect(Collectors.toMap(Chunk::chunkId, Function.identity(), (a, b) -> a, HashMap::new));
    }

    private <T> FutureTask<T> start(final Callable<T> call) {
        final FutureTask<T> task = new FutureTask<>(call);
        executor.execute(task);
        return task;
    }

    private <T> T await(final FutureTask<T> task, final long deadline) {
        try {
            return task.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (final TimeoutException e) {
            task.cancel(true);
            throw new RetrievalException(ErrorKind.BACKEND_UNAVAILABLE, "Search backend timed out", e);
        } catch (final InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Retrieval interrupted");
        } catch (final ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof SearchBackendException) {
                throw new RetrievalException(ErrorKind.BACKEND_UNAVAILABLE, cause.getMessage(), cause);
            }
            if (cause instanceof CancellationException cancelled) {
                throw cancelled;
            }
            throw new RetrievalException(ErrorKind.BACKEND_UNAVAILABLE, "Search backend call failed: " + cause, cause);
        }
    }
}
