package eu.virtualparadox.ragqa.rag.rerank.judge;

import java.util.List;

/**
 * Everything the judge sees about one candidate. Missing metadata is passed as empty
 * values, never null.
 *
 * @param question     user question
 * @param chunkText    chunk excerpt, already cut to the token budget
 * @param summary      enrichment summary or ""
 * @param keywords     enrichment keywords, possibly empty
 * @param sectionTitle section title or ""
 * @param elementType  element kind or ""
 */
public record JudgeRequest(String question,
                           String chunkText,
                           String summary,
                           List<String> keywords,
                           String sectionTitle,
                           String elementType) {

    public JudgeRequest {
        chunkText = chunkText == null ? "" : chunkText;
        summary = summary == null ? "" : summary;
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
        sectionTitle = sectionTitle == null ? "" : sectionTitle;
        elementType = elementType == null ? "" : elementType;
    }
}
