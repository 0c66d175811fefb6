package eu.virtualparadox.ragqa.query.pipeline;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import eu.virtualparadox.ragqa.query.citation.SourceAttributionService;
import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.answer.Answer;
import eu.virtualparadox.ragqa.rag.answer.AnswerService;
import eu.virtualparadox.ragqa.rag.answer.CitationExtractor;
import eu.virtualparadox.ragqa.rag.answer.GenerationException;
import eu.virtualparadox.ragqa.rag.answer.GeneratorService;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingException;
import eu.virtualparadox.ragqa.rag.embed.EmbeddingService;
import eu.virtualparadox.ragqa.rag.index.LuceneSearchBackend;
import eu.virtualparadox.ragqa.rag.index.LuceneVectorIndexService;
import eu.virtualparadox.ragqa.rag.index.SearchBackend;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import eu.virtualparadox.ragqa.rag.rerank.judge.JudgeScoreParser;
import eu.virtualparadox.ragqa.rag.rerank.judge.JudgeService;
import eu.virtualparadox.ragqa.rag.rerank.judge.JudgeUnavailableException;
import eu.virtualparadox.ragqa.rag.rerank.service.LlmJudgeRerankService;
import eu.virtualparadox.ragqa.rag.retriever.model.RetrievalMode;
import eu.virtualparadox.ragqa.rag.retriever.service.ReciprocalRankFusion;
import eu.virtualparadox.ragqa.rag.retriever.service.RetrievalEngine;
import eu.virtualparadox.ragqa.support.StubSearchBackend;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static eu.virtualparadox.ragqa.support.StubSearchBackend.corpus;
import static eu.virtualparadox.ragqa.support.StubSearchBackend.ids;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the whole pipeline over deterministic stub adapters.
 */
class QueryPipelineTest {

    private static final String QUESTION = "What was total revenue in fiscal year 2023?";

    private final ExecutorService executor = Executors.newCachedThreadPool();
    private final AtomicInteger embedCalls = new AtomicInteger();
    private final AtomicInteger generatorCalls = new AtomicInteger();

    private EmbeddingService embedder = text -> {
        embedCalls.incrementAndGet();
        return new float[]{0.1f, 0.2f, 0.3f};
    };

    /** Scores chunk cNN with NN mod 10, so c09 and c19 lead. */
    private JudgeService judge = request -> {
        int n = Integer.parseInt(request.chunkText().replaceAll("\\D+", " ").trim().split(" ")[0]);
        return "{\"score\": " + (n % 10) + "}";
    };

    private GeneratorService generator = (question, context, config) -> {
        generatorCalls.incrementAndGet();
        return "Total revenue was 4.2 billion dollars [1], driven by services [2].";
    };

    @AfterEach
    void shutdown() {
        executor.shutdownNow();
    }

    private QueryPipeline pipeline(SearchBackend backend) {
        RetrievalEngine engine = new RetrievalEngine(backend, embedder, new ReciprocalRankFusion(), executor);
        LlmJudgeRerankService rerank = new LlmJudgeRerankService(judge, new JudgeScoreParser(), executor);
        AnswerService answers = new AnswerService(generator, new CitationExtractor(), new SourceAttributionService(), executor);
        return new QueryPipeline(embedder, engine, rerank, answers);
    }

    private static StubSearchBackend financeBackend() {
        return new StubSearchBackend()
                .withChunks(corpus("10-K-2023", 40))
                .withVectorHits(ids(1, 25))
                .withKeywordHits(ids(25, 1));
    }

    private static PipelineConfig scenarioConfig() {
        return PipelineConfig.defaults().toBuilder()
                .mode(RetrievalMode.FUSION)
                .vectorTopK(20).keywordTopK(20).mergeTopK(10).rrfK(60)
                .rerankEnabled(true).candidateCount(5)
                .build();
    }

    @Test
    @DisplayName("Fusion, rerank and generation produce an answer citing a subset of the reranked chunks")
    void testEndToEnd() {
        List<PipelineStage> stages = new CopyOnWriteArrayList<>();

        PipelineResult result = pipeline(financeBackend())
                .runQuery(QUESTION, scenarioConfig(), (runId, stage) -> stages.add(stage));

        assertTrue(result.isSuccess());
        assertFalse(result.isDegraded());
        assertEquals(List.of(PipelineStage.ENCODE, PipelineStage.RETRIEVE, PipelineStage.RERANK, PipelineStage.GENERATE), stages);

        List<String> reranked = result.ranking().stream().map(Chunk::chunkId).toList();
        assertEquals(5, reranked.size());

        Answer answer = result.answer();
        assertThat(answer.text()).isNotBlank();
        assertThat(answer.citations()).isNotEmpty().isSubsetOf(reranked);
        assertEquals(reranked.subList(0, 2), answer.citations());
        assertEquals(1, embedCalls.get());
    }

    @Test
    @DisplayName("Identical runs rank identically")
    void testDeterministic() {
        StubSearchBackend backend = financeBackend();

        PipelineResult first = pipeline(backend).runQuery(QUESTION, scenarioConfig());
        PipelineResult second = pipeline(backend).runQuery(QUESTION, scenarioConfig());

        assertEquals(first.ranking(), second.ranking());
        assertEquals(first.answer().citations(), second.answer().citations());
    }

    @Test
    @DisplayName("A backend that always times out fails the run at RETRIEVE with BACKEND_UNAVAILABLE")
    void testBackendOutage() {
        StubSearchBackend backend = financeBackend().slow(Duration.ofSeconds(10));
        PipelineConfig config = scenarioConfig().toBuilder().retrievalTimeout(Duration.ofMillis(200)).build();

        PipelineResult result = pipeline(backend).runQuery(QUESTION, config);

        assertFalse(result.isSuccess());
        assertNull(result.answer());
        assertEquals(PipelineStage.RETRIEVE, result.error().stage());
        assertEquals(ErrorKind.BACKEND_UNAVAILABLE, result.error().kind());
        assertFalse(result.error().partialRankingAvailable());
        assertEquals(0, generatorCalls.get());
    }

    @Test
    @DisplayName("Unparseable judge answers keep the fused order and the run reaches DONE")
    void testUnparseableJudge() {
        judge = request -> "very relevant!";

        PipelineResult result = pipeline(financeBackend()).runQuery(QUESTION, scenarioConfig());
        PipelineResult unranked = pipeline(financeBackend())
                .runQuery(QUESTION, scenarioConfig().toBuilder().rerankEnabled(false).build());

        assertTrue(result.isSuccess());
        assertFalse(result.isDegraded());
        assertEquals(unranked.ranking().subList(0, 5), result.ranking());
    }

    @Test
    @DisplayName("When every judge call fails the run continues on fused order, flagged as degraded")
    void testRerankUnavailable() {
        judge = request -> {
            throw new JudgeUnavailableException("judge down", null);
        };

        PipelineResult result = pipeline(financeBackend()).runQuery(QUESTION, scenarioConfig());

        assertTrue(result.isSuccess());
        assertTrue(result.isDegraded());
        assertThat(result.degradations()).singleElement().asString().startsWith("RERANK_UNAVAILABLE");
        assertEquals(10, result.ranking().size());
        assertNotNull(result.answer());
    }

    @Test
    @DisplayName("Rerank disabled skips the RERANK stage")
    void testRerankDisabled() {
        List<PipelineStage> stages = new CopyOnWriteArrayList<>();

        PipelineResult result = pipeline(financeBackend())
                .runQuery(QUESTION, scenarioConfig().toBuilder().rerankEnabled(false).build(), (id, stage) -> stages.add(stage));

        assertTrue(result.isSuccess());
        assertThat(stages).doesNotContain(PipelineStage.RERANK);
        assertEquals(10, result.ranking().size());
    }

    @Test
    @DisplayName("Keyword mode skips ENCODE and never embeds")
    void testKeywordSkipsEncode() {
        List<PipelineStage> stages = new CopyOnWriteArrayList<>();

        PipelineResult result = pipeline(financeBackend())
                .runQuery(QUESTION, scenarioConfig().toBuilder().mode(RetrievalMode.KEYWORD).build(), (id, stage) -> stages.add(stage));

        assertTrue(result.isSuccess());
        assertEquals(PipelineStage.RETRIEVE, stages.get(0));
        assertEquals(0, embedCalls.get());
    }

    @Test
    @DisplayName("Embedding failure fails the run at ENCODE")
    void testEmbeddingFailure() {
        embedder = text -> {
            throw new EmbeddingException("model not loaded", null);
        };

        PipelineResult result = pipeline(financeBackend()).runQuery(QUESTION, scenarioConfig());

        assertEquals(PipelineStage.ENCODE, result.error().stage());
        assertEquals(ErrorKind.EMBEDDING_UNAVAILABLE, result.error().kind());
    }

    @Test
    @DisplayName("Generation failure fails the run but reports the partial ranking")
    void testGenerationFailure() {
        generator = (question, context, config) -> {
            throw new GenerationException(ErrorKind.GENERATION_SERVICE_UNAVAILABLE, "model offline", null);
        };

        PipelineResult result = pipeline(financeBackend()).runQuery(QUESTION, scenarioConfig());

        assertFalse(result.isSuccess());
        assertNull(result.answer());
        assertEquals(PipelineStage.GENERATE, result.error().stage());
        assertEquals(ErrorKind.GENERATION_SERVICE_UNAVAILABLE, result.error().kind());
        assertTrue(result.error().partialRankingAvailable());
        assertEquals(5, result.ranking().size());
    }

    @Test
    @DisplayName("Empty retrieval answers with the no-information text without calling the generator")
    void testEmptyRetrieval() {
        StubSearchBackend empty = new StubSearchBackend().withVectorHits().withKeywordHits();

        PipelineResult result = pipeline(empty).runQuery(QUESTION, scenarioConfig());

        assertTrue(result.isSuccess());
        assertEquals(Answer.NO_INFORMATION, result.answer().text());
        assertTrue(result.answer().citations().isEmpty());
        assertEquals(0, generatorCalls.get());
    }

    @Test
    @DisplayName("An interrupted caller gets a CANCELLED failure")
    void testCancelled() {
        Thread.currentThread().interrupt();
        try {
            PipelineResult result = pipeline(financeBackend()).runQuery(QUESTION, scenarioConfig());

            assertEquals(ErrorKind.CANCELLED, result.error().kind());
            assertEquals(PipelineStage.ENCODE, result.error().stage());
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    @DisplayName("Interrupting a run blocked in the judge ends it CANCELLED and interrupts the judge")
    void testCancelledDuringRerank() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        judge = request -> block(started, interrupted);
        AtomicReference<PipelineResult> result = new AtomicReference<>();

        Thread run = runInBackground(pipeline(financeBackend()), scenarioConfig(), result);
        assertTrue(started.await(2, TimeUnit.SECONDS));
        run.interrupt();
        run.join(2_000);

        assertFalse(run.isAlive());
        assertEquals(ErrorKind.CANCELLED, result.get().error().kind());
        assertEquals(PipelineStage.RERANK, result.get().error().stage());
        assertNull(result.get().answer());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
        assertEquals(0, generatorCalls.get());
    }

    @Test
    @DisplayName("Interrupting a run blocked in the generator ends it CANCELLED and interrupts the generator")
    void testCancelledDuringGeneration() throws InterruptedException {
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch interrupted = new CountDownLatch(1);
        generator = (question, context, config) -> block(started, interrupted);
        AtomicReference<PipelineResult> result = new AtomicReference<>();

        Thread run = runInBackground(pipeline(financeBackend()), scenarioConfig(), result);
        assertTrue(started.await(2, TimeUnit.SECONDS));
        run.interrupt();
        run.join(2_000);

        assertFalse(run.isAlive());
        assertEquals(ErrorKind.CANCELLED, result.get().error().kind());
        assertEquals(PipelineStage.GENERATE, result.get().error().stage());
        assertTrue(result.get().error().partialRankingAvailable());
        assertTrue(interrupted.await(2, TimeUnit.SECONDS));
    }

    @Test
    @DisplayName("A question longer than the keyword clause limit still gets an answer from the Lucene index")
    void testLongQuestionOverLucene() throws IOException {
        StringBuilder question = new StringBuilder("What was total revenue");
        for (int i = 0; i < 400; i++) {
            question.append(" word").append(i);
        }
        try (ByteBuffersDirectory directory = new ByteBuffersDirectory();
             Analyzer analyzer = new StandardAnalyzer();
             IndexWriter writer = new IndexWriter(directory, new IndexWriterConfig(analyzer));
             SearcherManager searcherManager = new SearcherManager(writer, null)) {
            List<float[]> vectors = List.of(new float[]{1f, 1f, 0f}, new float[]{2f, 1f, 0f}, new float[]{3f, 1f, 0f},
                    new float[]{4f, 1f, 0f}, new float[]{5f, 1f, 0f});
            new LuceneVectorIndexService(writer, searcherManager).upsert("10-K-2023", corpus("10-K-2023", 5), vectors);

            PipelineResult result = pipeline(new LuceneSearchBackend(searcherManager, analyzer))
                    .runQuery(question.toString(), scenarioConfig());

            assertTrue(result.isSuccess());
            assertThat(result.answer().citations()).isNotEmpty();
        }
    }

    @Test
    @DisplayName("Stage transitions are logged at INFO with their duration")
    void testStageTransitionsLogged() {
        Logger logger = (Logger) LoggerFactory.getLogger(QueryPipeline.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            pipeline(financeBackend()).runQuery(QUESTION, scenarioConfig());
        } finally {
            logger.detachAppender(appender);
        }

        List<String> transitions = appender.list.stream()
                .filter(event -> event.getLevel() == Level.INFO)
                .map(ILoggingEvent::getFormattedMessage)
                .filter(message -> message.contains(" -> "))
                .toList();
        assertThat(transitions).hasSize(4);
        assertThat(transitions.get(0)).matches("\\[.+] ENCODE -> RETRIEVE in \\d+ ms");
        assertThat(transitions.get(3)).matches("\\[.+] GENERATE -> DONE in \\d+ ms");
    }

    @Test
    @DisplayName("Blank questions and invalid configs are rejected up front")
    void testValidation() {
        QueryPipeline pipeline = pipeline(financeBackend());

        assertThrows(IllegalArgumentException.class, () -> pipeline.runQuery("  ", scenarioConfig()));
        assertThrows(IllegalArgumentException.class,
                () -> pipeline.runQuery(QUESTION, scenarioConfig().toBuilder().mergeTopK(0).build()));
        assertEquals(0, embedCalls.get());
    }

    private static Thread runInBackground(QueryPipeline pipeline, PipelineConfig config, AtomicReference<PipelineResult> result) {
        Thread thread = new Thread(() -> result.set(pipeline.runQuery(QUESTION, config)), "query-under-test");
        thread.start();
        return thread;
    }

    /** Blocks until interrupted, then records the interruption. */
    private static String block(CountDownLatch started, CountDownLatch interrupted) {
        started.countDown();
        try {
            Thread.sleep(10_000);
            return "{\"score\": 1}";
        } catch (InterruptedException e) {
            interrupted.countDown();
            return "interrupted";
        }
    }
}
