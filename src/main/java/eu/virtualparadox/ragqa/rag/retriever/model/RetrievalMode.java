package eu.virtualparadox.ragqa.rag.retriever.model;

public enum RetrievalMode {
    VECTOR,
    KEYWORD,
    HYBRID,
    FUSION;

    /**
     * @return whether this mode needs the question embedding
     */
    public boolean needsEmbedding() {
        return this != KEYWORD;
    }
}
