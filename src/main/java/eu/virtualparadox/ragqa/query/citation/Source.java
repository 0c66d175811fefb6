package eu.virtualparadox.ragqa.query.citation;

import org.apache.commons.lang3.StringUtils;

import java.util.List;

/**
 * One cited document with the page ranges the answer relies on.
 *
 * @param docId document identifier
 * @param pages disjoint, non-adjacent spans in ascending order; empty when pages are unknown
 */
public record Source(String docId, List<PageSpan> pages) {

    public Source {
        pages = List.copyOf(pages);
    }

    /**
     * e.g. {@code 10-K-2023 p. 3-5, 9}
     */
    public String asString() {
        if (pages.isEmpty()) {
            return docId;
        }
        return docId + " p. " + StringUtils.join(pages.stream().map(PageSpan::asString).toList(), ", ");
    }
}
