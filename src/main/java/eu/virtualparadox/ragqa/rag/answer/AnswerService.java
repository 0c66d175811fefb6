package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.query.citation.SourceAttributionService;
import eu.virtualparadox.ragqa.rag.ErrorKind;
import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import eu.virtualparadox.ragqa.util.TokenUtil;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Generation stage: turns ranked supporting chunks into an attributed {@link Answer}.
 * <ol>
 *   <li>Assemble the context from the chunks in their incoming order, within
 *       {@code contextMaxChunks} and {@code contextMaxTokens}</li>
 *   <li>Call the {@link GeneratorService}, bounded by {@code generationTimeout}</li>
 *   <li>Extract citations and group them into sources</li>
 * </ol>
 * No answer is produced when the generator fails; the failure surfaces as {@link GenerationException}.
 */
@Service
@Slf4j
public class AnswerService {

    private final GeneratorService generatorService;
    private final CitationExtractor citationExtractor;
    private final SourceAttributionService sourceAttributionService;
    private final Executor executor;

    public AnswerService(final GeneratorService generatorService,
                         final CitationExtractor citationExtractor,
                         final SourceAttributionService sourceAttributionService,
                         @Qualifier("pipelineExecutor") final Executor executor) {
        this.generatorService = generatorService;
        this.citationExtractor = citationExtractor;
        this.sourceAttributionService = sourceAttributionService;
        this.executor = executor;
    }

    /**
     * @param question         user question
     * @param supportingChunks ranked chunks, best first
     * @param config           run settings
     * @return the answer; {@link Answer#noInformation()} when there is nothing to answer from
     * @throws GenerationException if the generator fails, times out or answers blank
     */
    public Answer generate(final String question, final List<Chunk> supportingChunks, final PipelineConfig config) {
        final List<Chunk> context = assembleContext(supportingChunks, config);
        if (context.isEmpty()) {
            log.warn("[WARN] No supporting chunks, answering without the generator");
            return Answer.noInformation();
        }

        final String text = complete(question, context, config);
        if (text.isBlank()) {
            throw new GenerationException(ErrorKind.EMPTY_COMPLETION, "Generator returned an empty answer", null);
        }

        final CitationExtractor.Citations citations = citationExtractor.extract(text, context);
        if (citations.inferred()) {
            log.info("Answer carries no references, citing all {} context chunks", context.size());
        }

        return new Answer(
                text.strip(),
                citations.cited().stream().map(Chunk::chunkId).toList(),
                sourceAttributionService.attribute(citations.cited()),
                citations.inferred(),
                context.stream().map(Chunk::chunkId).toList());
    }

    /**
     * Keeps incoming order; skips blank chunks; stops at the chunk or token budget.
     * A first chunk larger than the token budget is cut down instead of dropped.
     */
    List<Chunk> assembleContext(final List<Chunk> supportingChunks, final PipelineConfig config) {
        final List<Chunk> context = new ArrayList<>();
        int tokens = 0;
        for (final Chunk chunk : supportingChunks) {
            if (context.size() >= config.getContextMaxChunks()) {
                break;
            }
            if (chunk.text().isBlank()) {
                continue;
            }
            final int chunkTokens = TokenUtil.countTokens(chunk.text());
            if (tokens + chunkTokens > config.getContextMaxTokens()) {
                if (context.isEmpty()) {
                    context.add(withText(chunk, TokenUtil.truncate(chunk.text(), config.getContextMaxTokens())));
                }
                break;
            }
            context.add(chunk);
            tokens += chunkTokens;
        }
        return context;
    }

    private String complete(final String question, final List<Chunk> context, final PipelineConfig config) {
        final FutureTask<String> task = new FutureTask<>(() -> generatorService.complete(question, context, config));
        executor.execute(task);
        try {
            final String text = task.get(config.getGenerationTimeout().toMillis(), TimeUnit.MILLISECONDS);
            return text == null ? "" : text;
        } catch (final TimeoutException e) {
            task.cancel(true);
            throw new GenerationException(ErrorKind.GENERATION_SERVICE_UNAVAILABLE, "Generator timed out", e);
        } catch (final InterruptedException e) {
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("Generation interrupted");
        } catch (final ExecutionException e) {
            if (e.getCause() instanceof GenerationException generationException) {
                throw generationException;
            }
            throw new GenerationException(ErrorKind.GENERATION_SERVICE_UNAVAILABLE, "Generator failed", e.getCause());
        }
    }

    private Chunk withText(final Chunk chunk, final String text) {
        return new Chunk(chunk.chunkId(), chunk.docId(), text, chunk.pageStart(), chunk.pageEnd(),
                chunk.elementType(), chunk.sectionTitle(), chunk.keywords(), chunk.summary());
    }
}
