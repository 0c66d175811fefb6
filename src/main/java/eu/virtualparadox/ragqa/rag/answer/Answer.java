package eu.virtualparadox.ragqa.rag.answer;

import eu.virtualparadox.ragqa.query.citation.Source;

import java.util.List;

/**
 * Final artifact of a successful run.
 *
 * @param text              generated answer text
 * @param citations         ids of the cited chunks, in context order
 * @param sources           cited documents with merged page ranges, first-seen order
 * @param citationsInferred true when the answer carried no usable reference and every
 *                          context chunk is cited
 * @param contextChunkIds   ids of the chunks that were given to the generator, in order
 */
public record Answer(String text,
                     List<String> citations,
                     List<Source> sources,
                     boolean citationsInferred,
                     List<String> contextChunkIds) {

    public static final String NO_INFORMATION = "No relevant information found.";

    public Answer {
        citations = List.copyOf(citations);
        sources = List.copyOf(sources);
        contextChunkIds = List.copyOf(contextChunkIds);
    }

    /**
     * Answer for a run where retrieval found nothing to answer from.
     */
    public static Answer noInformation() {
        return new Answer(NO_INFORMATION, List.of(), List.of(), false, List.of());
    }
}
