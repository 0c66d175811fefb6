package eu.virtualparadox.ragqa.rag.retriever.model;

public enum SourceMode {
    VECTOR,
    KEYWORD,
    /** Backend-native combined scoring. */
    HYBRID
}
