package eu.virtualparadox.ragqa.rag.index.model;

import java.util.List;

/**
 * Immutable retrievable unit of document text, as stored in the search index.
 * <p>
 * {@code keywords} and {@code summary} come from the optional metadata enrichment step and
 * are normalised to empty values when absent. The embedding vector is kept by the index,
 * not by this record.
 *
 * @param chunkId      stable unique key of the chunk
 * @param docId        identifier of the parent document
 * @param text         chunk body text
 * @param pageStart    first page covered by the chunk
 * @param pageEnd      last page covered by the chunk
 * @param elementType  element kind (narrative, table, title...), may be empty
 * @param sectionTitle title of the enclosing section, may be empty
 * @param keywords     enrichment keywords in their original order, never null
 * @param summary      enrichment summary, never null
 */
public record Chunk(String chunkId,
                    String docId,
                    String text,
                    int pageStart,
                    int pageEnd,
                    String elementType,
                    String sectionTitle,
                    List<String> keywords,
                    String summary) {

    public Chunk {
        text = text == null ? "" : text;
        elementType = elementType == null ? "" : elementType;
        sectionTitle = sectionTitle == null ? "" : sectionTitle;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        summary = summary == null ? "" : summary;
    }

    /**
     * Chunk without enrichment metadata.
     */
    public static Chunk of(final String chunkId,
                           final String docId,
                           final String text,
                           final int pageStart,
                           final int pageEnd) {
        return new Chunk(chunkId, docId, text, pageStart, pageEnd, "", "", List.of(), "");
    }

    /**
     * Human-readable locator, e.g. {@code 10-K-2023 p. 3-4}.
     */
    public String locator() {
        if (pageStart <= 0) {
            return docId;
        }
        return docId + " p. " + (pageStart == pageEnd ? String.valueOf(pageStart) : pageStart + "-" + pageEnd);
    }
}
