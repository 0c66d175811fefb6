package eu.virtualparadox.ragqa.rag.rerank.service;

import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import eu.virtualparadox.ragqa.rag.rerank.judge.JudgeRequest;
import eu.virtualparadox.ragqa.rag.rerank.judge.JudgeScoreParser;
import eu.virtualparadox.ragqa.rag.rerank.judge.JudgeService;
import eu.virtualparadox.ragqa.rag.rerank.model.JudgeScore;
import eu.virtualparadox.ragqa.rag.rerank.model.RerankResult;
import eu.virtualparadox.ragqa.rag.retriever.model.FusedResult;
import eu.virtualparadox.ragqa.util.TokenUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Iterator;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Reranker that scores each candidate with an LLM judge.
 *
 * <h3>Policy</h3>
 * <ul>
 *   <li>Only the first {@code candidateCount} fused results are judged; the rest are not returned.</li>
 *   <li>One judge call per candidate, at most {@code judgeConcurrency} in flight, each bounded by
 *       {@code judgeTimeout}; the whole pass is bounded by {@code rerankTimeout}.</li>
 *   <li>Candidates with a usable score come first, by score descending (ties keep retrieval order);
 *       candidates whose answer was unreadable, or whose call failed, follow in retrieval order.</li>
 *   <li>Only when every call fails at service level does the pass fail with
 *       {@link RerankUnavailableException}.</li>
 * </ul>
 */
@Service
@Slf4j
public class LlmJudgeRerankService implements RerankService {

    private final JudgeService judgeService;
    private final JudgeScoreParser parser;
    private final Executor executor;

    public LlmJudgeRerankService(final JudgeService judgeService,
                                 final JudgeScoreParser parser,
                                 @Qualifier("pipelineExecutor") final Executor executor) {
        this.judgeService = judgeService;
        this.parser = parser;
        this.executor = executor;
    }

    @Override
    public List<RerankResult> rerank(final String question,
                                     final List<FusedResult> candidates,
                                     final PipelineConfig config) {
        if (candidates.isEmpty()) {
            return List.of();
        }
        final List<FusedResult> bounded = candidates.subList(0, Math.min(config.getCandidateCount(), candidates.size()));
        final Outcome[] outcomes = judgeAll(question, bounded, config);

        final List<RerankResult> scored = new ArrayList<>();
        final List<RerankResult> unscored = new ArrayList<>();
        int failed = 0;
        Throwable lastFailure = null;

        for (int i = 0; i < bounded.size(); i++) {
            final Chunk chunk = bounded.get(i).chunk();
            final Outcome outcome = outcomes[i];
            if (outcome.failure() != null) {
                failed++;
                lastFailure = outcome.failure();
                unscored.add(RerankResult.unscored(chunk));
            } else if (outcome.score().isParsed()) {
                scored.add(new RerankResult(chunk.chunkId(), outcome.score().value(), chunk));
            } else {
                log.debug("Judge answer for chunk {} is not a score: {}", chunk.chunkId(), outcome.score().raw());
                unscored.add(RerankResult.unscored(chunk));
            }
        }

        if (failed == bounded.size()) {
            throw new RerankUnavailableException("All " + failed + " judge calls failed", lastFailure);
        }

        scored.sort(Comparator.comparingDouble(RerankResult::relevanceScore).reversed());
        final List<RerankResult> ranked = new ArrayList<>(scored.size() + unscored.size());
        ranked.addAll(scored);
        ranked.addAll(unscored);

        log.info("[OK] Reranked {} candidates using LLM judge: scored={}, unparseable={}, failed={}",
                bounded.size(), scored.size(), unscored.size() - failed, failed);
        return List.copyOf(ranked);
    }

    /**
     * Dispatches the judge calls from the calling thread and waits for them.
     * <p>
     * A call holds its permit until its body returns, cancelled calls still unwinding included.
     * The per-call timeout runs from the moment the call starts on a worker. Overdue calls, and
     * every open call at the stage deadline or on interruption, are cancelled with interruption.
     */
    private Outcome[] judgeAll(final String question, final List<FusedResult> bounded, final PipelineConfig config) {
        final int size = bounded.size();
        final Outcome[] outcomes = new Outcome[size];
        final long deadline = System.nanoTime() + config.getRerankTimeout().toNanos();
        final long callTimeout = config.getJudgeTimeout().toNanos();
        final Semaphore permits = new Semaphore(config.getJudgeConcurrency());
        final BlockingQueue<JudgeCall> signals = new LinkedBlockingQueue<>();
        final List<JudgeCall> running = new ArrayList<>();

        int next = 0;
        int open = size;
        JudgeCall signal = null;
        try {
            while (open > 0) {
                for (; signal != null; signal = signals.poll()) {
                    if (signal.isDone() && outcomes[signal.index] == null) {
                        outcomes[signal.index] = signal.outcome();
                        running.remove(signal);
                        open--;
                    }
                }

                final long now = System.nanoTime();
                final boolean stageExpired = now - deadline >= 0;
                for (final Iterator<JudgeCall> it = running.iterator(); it.hasNext(); ) {
                    final JudgeCall call = it.next();
                    if (!call.isDone() && (stageExpired || call.isOverdue(now, callTimeout))) {
                        call.cancel(true);
                        it.remove();
                        outcomes[call.index] = new Outcome(null, new TimeoutException("Judge call timed out"));
                        open--;
                    }
                }
                if (stageExpired) {
                    for (; next < size; next++) {
                        outcomes[next] = new Outcome(null, new TimeoutException("Rerank pass timed out before the call started"));
                        open--;
                    }
                    break;
                }

                while (next < size && permits.tryAcquire()) {
                    final JudgeCall call = new JudgeCall(next, toRequest(question, bounded.get(next).chunk(), config.getExcerptMaxTokens()),
                            permits, signals);
                    next++;
                    try {
                        executor.execute(call.task);
                        running.add(call);
                    } catch (final RuntimeException e) {
                        call.cancel(false);
                        outcomes[call.index] = new Outcome(null, e);
                        open--;
                    }
                }
                if (open == 0) {
                    break;
                }
                signal = signals.poll(nextWakeUp(running, now, deadline, callTimeout) - now, TimeUnit.NANOSECONDS);
            }
        } catch (final InterruptedException e) {
            running.forEach(call -> call.cancel(true));
            Thread.currentThread().interrupt();
            throw new CancellationException("Rerank interrupted");
        }
        return outcomes;
    }

    private long nextWakeUp(final List<JudgeCall> running, final long now, final long deadline, final long callTimeout) {
        long wakeUp = deadline;
        for (final JudgeCall call : running) {
            final long expiry = call.started ? call.startedAt + callTimeout : now + callTimeout;
            if (expiry - wakeUp < 0) {
                wakeUp = expiry;
            }
        }
        return wakeUp;
    }

    private JudgeRequest toRequest(final String question, final Chunk chunk, final int excerptMaxTokens) {
        return new JudgeRequest(
                question,
                TokenUtil.truncate(chunk.text().strip(), excerptMaxTokens),
                chunk.summary().strip(),
                chunk.keywords(),
                chunk.sectionTitle().strip(),
                chunk.elementType().strip());
    }

    private record Outcome(JudgeScore score, Throwable failure) {
    }

    /**
     * One judge call. Its permit is released exactly once: by the body when it ran,
     * otherwise by the task's completion hook when it was cancelled before starting.
     * Both paths signal the dispatcher.
     */
    private final class JudgeCall implements Callable<JudgeScore> {

        private final int index;
        private final JudgeRequest request;
        private final Semaphore permits;
        private final BlockingQueue<JudgeCall> signals;
        private final AtomicBoolean claimed = new AtomicBoolean();
        private final FutureTask<JudgeScore> task;
        private volatile boolean started;
        private volatile long startedAt;

        private JudgeCall(final int index,
                          final JudgeRequest request,
                          final Semaphore permits,
                          final BlockingQueue<JudgeCall> signals) {
            this.index = index;
            this.request = request;
            this.permits = permits;
            this.signals = signals;
            this.task = new FutureTask<>(this) {
                @Override
                protected void done() {
                    if (claimed.compareAndSet(false, true)) {
                        permits.release();
                    }
                    signals.offer(JudgeCall.this);
                }
            };
        }

        @Override
        public JudgeScore call() {
            if (!claimed.compareAndSet(false, true)) {
                throw new CancellationException("Judge call cancelled before it started");
            }
            startedAt = System.nanoTime();
            started = true;
            try {
                return parser.parse(judgeService.score(request));
            } finally {
                permits.release();
                signals.offer(this);
            }
        }

        private boolean isDone() {
            return task.isDone();
        }

        private void cancel(final boolean interrupt) {
            task.cancel(interrupt);
        }

        private boolean isOverdue(final long now, final long timeout) {
            return started && now - startedAt >= timeout;
        }

        private Outcome outcome() {
            try {
                return new Outcome(task.get(), null);
            } catch (final ExecutionException e) {
                return new Outcome(null, e.getCause());
            } catch (final CancellationException e) {
                return new Outcome(null, e);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return new Outcome(null, e);
            }
        }
    }
}
