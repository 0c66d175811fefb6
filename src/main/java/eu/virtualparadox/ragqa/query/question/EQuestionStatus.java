package eu.virtualparadox.ragqa.query.question;

public enum EQuestionStatus {
    QUEUED,
    ENCODING,
    RETRIEVING,
    RERANKING,
    ANSWERING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
