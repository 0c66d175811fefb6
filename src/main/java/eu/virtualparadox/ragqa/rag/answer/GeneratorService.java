package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.rag.config.PipelineConfig;
import eu.virtualparadox.ragqa.rag.index.model.Chunk;

import java.util.List;

/**
 * LLM answer synthesis from a question and ordered context.
 */
public interface GeneratorService {

    /**
     * @param question       user question
     * @param orderedContext context chunks, most relevant first; chunk {@code i} is cited as {@code [i+1]}
     * @param config         run settings (model id, temperature)
     * @return free-text answer, possibly with {@code [n]} citation markers
     * @throws GenerationException if the model cannot be reached or fails
     */
    String complete(String question, List<Chunk> orderedContext, PipelineConfig config);
}
