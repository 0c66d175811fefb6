package eu.virtualparadox.ragqa.query.citation;

/**
 * Inclusive page range.
 */
public record PageSpan(int fromPage, int toPage) {

    public PageSpan {
        if (fromPage > toPage) {
            throw new IllegalArgumentException("Invalid page span: fromPage (" + fromPage + ") > toPage (" + toPage + ")");
        }
    }

    /**
     * @return whether {@code other} overlaps this span or starts right after it
     */
    public boolean touches(final PageSpan other) {
        return other.fromPage <= toPage + 1 && fromPage <= other.toPage + 1;
    }

    public PageSpan union(final PageSpan other) {
        return new PageSpan(Math.min(fromPage, other.fromPage), Math.max(toPage, other.toPage));
    }

    public String asString() {
        return fromPage == toPage ? String.valueOf(fromPage) : fromPage + "-" + toPage;
    }
}
