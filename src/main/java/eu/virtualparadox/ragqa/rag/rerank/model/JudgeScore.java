package eu.virtualparadox.ragqa.rag.rerank.model;

/**
 * Outcome of reading one judge answer: either a score or the marker that the answer
 * could not be read.
 *
 * @param kind  parse outcome
 * @param value relevance score, meaningful only when parsed
 * @param raw   the judge answer as received
 */
public record JudgeScore(Kind kind, double value, String raw) {

    public enum Kind {
        PARSED,
        UNPARSEABLE
    }

    public static JudgeScore of(final double value, final String raw) {
        return new JudgeScore(Kind.PARSED, value, raw);
    }

    public static JudgeScore unparseable(final String raw) {
        return new JudgeScore(Kind.UNPARSEABLE, Double.NaN, raw);
    }

    public boolean isParsed() {
        return kind == Kind.PARSED;
    }
}
