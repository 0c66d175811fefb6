package eu.virtualparadox.ragqa.query.question;

import eu.virtualparadox.ragqa.query.pipeline.PipelineResult;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory store of question jobs. Once a job reaches a terminal status it no longer changes.
 */
@Service
public class QuestionRegistry {

    private final AtomicLong counter;
    private final Map<Long, QuestionJob> jobs;

    public QuestionRegistry() {
        this.counter = new AtomicLong(0);
        this.jobs = new ConcurrentHashMap<>();
    }

    public QuestionJob createJob(String question) {
        long id = counter.incrementAndGet();
        QuestionJob job = new QuestionJob(id, question);
        jobs.put(id, job);
        return job;
    }

    public Optional<QuestionJob> getJob(long id) {
        return Optional.ofNullable(jobs.get(id));
    }

    public void attach(long id, Future<?> future) {
        jobs.computeIfPresent(id, (k, job) -> {
            job.setFuture(future);
            return job;
        });
    }

    /**
     * @return false when the job is unknown or already terminal
     */
    public boolean updateStatus(long id, EQuestionStatus status, PipelineResult result) {
        final boolean[] updated = {false};
        jobs.computeIfPresent(id, (k, job) -> {
            if (!job.getStatus().isTerminal()) {
                job.setStatus(status);
                if (result != null) job.setResult(result);
                updated[0] = true;
            }
            return job;
        });
        return updated[0];
    }

    /**
     * Marks the job cancelled and interrupts its run.
     *
     * @return false when the job is unknown or already terminal
     */
    public boolean cancel(long id) {
        final boolean cancelled = updateStatus(id, EQuestionStatus.CANCELLED, null);
        if (cancelled) {
            final Future<?> future = jobs.get(id).getFuture();
            if (future != null) {
                future.cancel(true);
            }
        }
        return cancelled;
    }
}
