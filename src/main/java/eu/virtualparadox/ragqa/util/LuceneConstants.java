package eu.virtualparadox.ragqa.util;

public class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_DOC_ID = "docId";
    public static final String FIELD_CHUNK_ID = "chunkId";
    public static final String FIELD_TEXT = "text";
    public static final String FIELD_SECTION_TITLE = "sectionTitle";
    public static final String FIELD_ELEMENT_TYPE = "elementType";
    public static final String FIELD_KEYWORDS = "keywords";
    public static final String FIELD_SUMMARY = "summary";
    public static final String FIELD_FROM_PAGE = "fromPage";
    public static final String FIELD_TO_PAGE = "toPage";

    private LuceneConstants() {
        // prevent instantiation
    }
}
