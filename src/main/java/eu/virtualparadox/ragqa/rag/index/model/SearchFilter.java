package eu.virtualparadox.ragqa.rag.index.model;

import org.apache.commons.lang3.StringUtils;

/**
 * Optional restriction applied to every backend query.
 *
 * @param docId when non-blank, only chunks of this document match
 */
public record SearchFilter(String docId) {

    private static final SearchFilter NONE = new SearchFilter(null);

    public static SearchFilter none() {
        return NONE;
    }

    public static SearchFilter byDocument(final String docId) {
        return StringUtils.isBlank(docId) ? NONE : new SearchFilter(docId);
    }

    public boolean isEmpty() {
        return StringUtils.isBlank(docId);
    }
}
