package eu.virtualparadox.ragqa.rag.rerank.judge;

/**
 * LLM relevance judge for one (question, candidate) pair.
 * <p>
 * The judge is an unreliable oracle: it returns its raw answer, which the rerank stage
 * parses. Implementations must be safe for concurrent calls.
 */
public interface JudgeService {

    /**
     * @param request question and candidate description
     * @return the judge's raw answer, expected to contain a score from 0 to 10
     * @throws JudgeUnavailableException if the judge model cannot be reached or fails
     */
    String score(JudgeRequest request);
}
