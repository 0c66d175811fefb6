package eu.virtualparadox.ragqa.rag;

/**
 * Failure categories surfaced by the pipeline stages.
 */
public enum ErrorKind {
    /** Question embedding could not be computed. */
    EMBEDDING_UNAVAILABLE,
    /** Search backend unreachable or timed out; fatal to the run. */
    BACKEND_UNAVAILABLE,
    /** Every judge call failed; the run degrades to the fused order. */
    RERANK_UNAVAILABLE,
    /** One judge answer could not be read as a score; absorbed per candidate. */
    MALFORMED_JUDGE_RESPONSE,
    /** Generator unreachable, failed or timed out; fatal to the run. */
    GENERATION_SERVICE_UNAVAILABLE,
    /** Generator answered with blank text; fatal to the run. */
    EMPTY_COMPLETION,
    /** The run was cancelled by its caller. */
    CANCELLED
}
