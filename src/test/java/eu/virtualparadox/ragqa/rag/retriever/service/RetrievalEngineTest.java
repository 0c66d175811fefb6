package eu.virtualparadox.ragqa.rag.retriever.service;

import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingService;
import eu.virtualparadox.ragqa.rag.index.SearchBackendException;
import eu.virtualparadox.ragqa.rag.index.model.SearchFilter;
import eu.virtualparadox.ragqa.rag.index.model.SearchHit;
import eu.virtualparadox.ragqa.rag.retriever.RetrievalException;
import eu.virtualparadox.ragqa.rag.retriever.model.FusedResult;
import eu.virtualparadox.ragqa.rag.retriever.model.Query;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalCandidate;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalMode;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalResult;
import eu.virtualparadox.ragqa.rag.retriever.model.SourceMode;
import eu.virtualparadox.ragqa.support.StubSearchBackend;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.BrokenBarrierException;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static eu.virtualparadox.ragqa.support.StubSearchBackend.corpus;
import static eu.virtualparadox.ragqa.support.StubSearchBackend.ids;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RetrievalEngineTest {

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final AtomicInteger embedCalls = new AtomicInteger();
    private final EmbeddingService embedder = text -> {
        embedCalls.incrementAndGet();
        return new float[]{1f, 0f, 0f};
    };

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private RetrievalEngine engine(StubSearchBackend backend) {
        return new RetrievalEngine(backend, embedder, new ReciprocalRankFusion(), executor);
    }

    @Test
    @DisplayName("Fusion merges both legs, caps at mergeTopK and keeps per-leg candidates")
    void testFusion() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 30))
                .withVectorHits(ids(1, 20))
                .withKeywordHits(ids(20, 1));

        RetrievalResult result = engine(backend).retrieve(Query.of("total revenue"), RetrievalMode.FUSION, PipelineConfig.defaults());

        assertEquals(RetrievalMode.FUSION, result.mode());
        assertEquals(10, result.fused().size());
        assertEquals(40, result.candidates().size());
        assertThat(result.candidates()).extracting(RetrievalCandidate::sourceMode)
                .containsOnly(SourceMode.VECTOR, SourceMode.KEYWORD);
        assertThat(result.fused()).extracting(FusedResult::chunkId).doesNotHaveDuplicates();
        assertThat(result.fused()).extracting(FusedResult::fusedScore).isSortedAccordingTo((a, b) -> Double.compare(b, a));
        assertEquals(1, backend.vectorCalls.get());
        assertEquals(1, backend.keywordCalls.get());
    }

    @Test
    @DisplayName("Fusion order is deterministic")
    void testFusionDeterministic() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 30))
                .withVectorHits("c01", "c02", "c03", "c04")
                .withKeywordHits("c04", "c03", "c09");

        List<String> first = chunkIds(engine(backend).retrieve(Query.of("q"), RetrievalMode.FUSION, PipelineConfig.defaults()));
        List<String> second = chunkIds(engine(backend).retrieve(Query.of("q"), RetrievalMode.FUSION, PipelineConfig.defaults()));

        assertEquals(first, second);
        // c04: 1/64 + 1/61 beats c03: 1/63 + 1/62 beats c01: 1/61
        assertEquals(List.of("c04", "c03", "c01", "c02", "c09"), first);
    }

    @Test
    @DisplayName("Vector mode embeds the question and returns topK in backend order")
    void testVectorMode() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 30))
                .withVectorHits(ids(1, 20));
        PipelineConfig config = PipelineConfig.defaults().toBuilder().topK(3).build();

        RetrievalResult result = engine(backend).retrieve(Query.of("q"), RetrievalMode.VECTOR, config);

        assertEquals(List.of("c01", "c02", "c03"), chunkIds(result));
        assertEquals(1, embedCalls.get());
    }

    @Test
    @DisplayName("Keyword mode never calls the embedder")
    void testKeywordModeSkipsEmbedding() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 5))
                .withKeywordHits("c03", "c01");

        RetrievalResult result = engine(backend).retrieve(Query.of("q"), RetrievalMode.KEYWORD, PipelineConfig.defaults());

        assertEquals(List.of("c03", "c01"), chunkIds(result));
        assertEquals(0, embedCalls.get());
        assertEquals(0, backend.vectorCalls.get());
    }

    @Test
    @DisplayName("Hybrid runs as fusion when the backend has no native hybrid search")
    void testHybridFallsBackToFusion() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 5))
                .withVectorHits("c01", "c02")
                .withKeywordHits("c02", "c03");

        RetrievalResult result = engine(backend).retrieve(Query.of("q"), RetrievalMode.HYBRID, PipelineConfig.defaults());

        assertEquals(RetrievalMode.FUSION, result.mode());
        assertEquals(List.of("c02", "c01", "c03"), chunkIds(result));
    }

    @Test
    @DisplayName("Hybrid uses the native search and forwards alpha and the document filter")
    void testNativeHybrid() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 5))
                .withHybridHits("c05", "c04");
        PipelineConfig config = PipelineConfig.defaults().toBuilder().hybridAlpha(0.8).documentFilter("10-K").build();

        RetrievalResult result = engine(backend).retrieve(Query.of("q"), RetrievalMode.HYBRID, config);

        assertEquals(RetrievalMode.HYBRID, result.mode());
        assertEquals(List.of("c05", "c04"), chunkIds(result));
        assertEquals(0.8, backend.lastAlpha, 0.0);
        assertEquals("10-K", backend.lastFilter.docId());
        assertEquals(0, backend.vectorCalls.get());
    }

    @Test
    @DisplayName("Hits whose chunk cannot be fetched are dropped")
    void testMissingChunkDropped() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 2))
                .withVectorHits("c01", "ghost", "c02")
                .withKeywordHits();

        RetrievalResult result = engine(backend).retrieve(Query.of("q"), RetrievalMode.FUSION, PipelineConfig.defaults());

        assertEquals(List.of("c01", "c02"), chunkIds(result));
    }

    @Test
    @DisplayName("A slow backend fails with BACKEND_UNAVAILABLE after the retrieval timeout")
    void testTimeout() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 3))
                .withVectorHits("c01")
                .withKeywordHits("c02")
                .slow(Duration.ofSeconds(5));
        PipelineConfig config = PipelineConfig.defaults().toBuilder().retrievalTimeout(Duration.ofMillis(200)).build();

        long start = System.nanoTime();
        RetrievalException ex = assertThrows(RetrievalException.class,
                () -> engine(backend).retrieve(Query.of("q"), RetrievalMode.FUSION, config));

        assertEquals(ErrorKind.BACKEND_UNAVAILABLE, ex.getKind());
        assertThat(Duration.ofNanos(System.nanoTime() - start)).isLessThan(Duration.ofSeconds(3));
    }

    @Test
    @DisplayName("Backend errors surface as BACKEND_UNAVAILABLE")
    void testBackendFailure() {
        StubSearchBackend backend = new StubSearchBackend().withVectorHits("c01").failing();

        RetrievalException ex = assertThrows(RetrievalException.class,
                () -> engine(backend).retrieve(Query.of("q"), RetrievalMode.VECTOR, PipelineConfig.defaults()));

        assertEquals(ErrorKind.BACKEND_UNAVAILABLE, ex.getKind());
    }

    @Test
    @DisplayName("Unexpected backend exceptions surface as BACKEND_UNAVAILABLE")
    void testUnexpectedBackendException() {
        StubSearchBackend backend = new StubSearchBackend()
                .withVectorHits("c01")
                .withKeywordHits("c01")
                .failingWith(new IllegalStateException("maxClauseCount is set to 1024"));

        RetrievalException ex = assertThrows(RetrievalException.class,
                () -> engine(backend).retrieve(Query.of("q"), RetrievalMode.FUSION, PipelineConfig.defaults()));

        assertEquals(ErrorKind.BACKEND_UNAVAILABLE, ex.getKind());
        assertThat(ex).hasCauseInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Fusion legs are inside the backend at the same time")
    void testFusionLegsConcurrent() {
        CyclicBarrier bothLegs = new CyclicBarrier(2);
        StubSearchBackend backend = new StubSearchBackend() {
            @Override
            public List<SearchHit> vectorSearch(float[] vector, int topK, SearchFilter filter) {
                meet(bothLegs);
                return super.vectorSearch(vector, topK, filter);
            }

            @Override
            public List<SearchHit> keywordSearch(String text, List<String> properties, int topK, SearchFilter filter) {
                meet(bothLegs);
                return super.keywordSearch(text, properties, topK, filter);
            }
        }.withChunks(corpus("10-K", 4)).withVectorHits("c01", "c02").withKeywordHits("c03", "c04");

        RetrievalResult result = engine(backend).retrieve(Query.of("q"), RetrievalMode.FUSION, PipelineConfig.defaults());

        assertEquals(4, result.fused().size());
    }

    @Test
    @DisplayName("Both keyword paths search the configured properties")
    void testKeywordPropertiesForwarded() {
        StubSearchBackend backend = new StubSearchBackend()
                .withChunks(corpus("10-K", 2))
                .withHybridHits("c01");
        PipelineConfig config = PipelineConfig.defaults().toBuilder().keywordProperties(List.of("text")).build();

        engine(backend).retrieve(Query.of("q"), RetrievalMode.HYBRID, config);
        assertEquals(List.of("text"), backend.lastProperties);

        backend.lastProperties = null;
        engine(backend).retrieve(Query.of("q"), RetrievalMode.KEYWORD, config);
        assertEquals(List.of("text"), backend.lastProperties);
    }

    /** Waits for the other leg; a sequential engine never gets here twice in time. */
    private static void meet(CyclicBarrier barrier) {
        try {
            barrier.await(2, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchBackendException("interrupted");
        } catch (BrokenBarrierException | TimeoutException e) {
            throw new SearchBackendException("legs ran one after the other");
        }
    }

    private static List<String> chunkIds(RetrievalResult result) {
        return result.fused().stream().map(FusedResult::chunkId).toList();
    }
}
