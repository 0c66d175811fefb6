package eu.virtualparadox.ragqa.query.citation;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups cited chunks into per-document {@link Source}s.
 * <p>
 * Documents keep the order in which their first chunk appears. Within a document, page
 * spans are sorted and every overlapping or adjacent pair is folded into one span.
 * Chunks without page information (page &lt;= 0) contribute the document only.
 * <p>
 * Stateless and thread-safe.
 */
@Service
public class SourceAttributionService {

    /**
     * @param citedChunks chunks in citation order; must not contain null
     * @return unmodifiable list of sources, never null
     */
    public List<Source> attribute(final List<Chunk> citedChunks) {
        Objects.requireNonNull(citedChunks, "citedChunks must not be null");
        if (citedChunks.isEmpty()) {
            return Collections.emptyList();
        }

        final Map<String, List<PageSpan>> spansByDocument = new LinkedHashMap<>();
        for (final Chunk chunk : citedChunks) {
            Objects.requireNonNull(chunk, "citedChunks must not contain null elements");
            final List<PageSpan> spans = spansByDocument.computeIfAbsent(chunk.docId(), k -> new ArrayList<>());
            if (chunk.pageStart() > 0) {
                spans.add(new PageSpan(chunk.pageStart(), Math.max(chunk.pageStart(), chunk.pageEnd())));
            }
        }

        final List<Source> sources = new ArrayList<>(spansByDocument.size());
        spansByDocument.forEach((docId, spans) -> sources.add(new Source(docId, fold(spans))));
        return Collections.unmodifiableList(sources);
    }

    static List<PageSpan> fold(final List<PageSpan> spans) {
        if (spans.size() < 2) {
            return spans;
        }
        final List<PageSpan> sorted = new ArrayList<>(spans);
        sorted.sort(Comparator.comparingInt(PageSpan::fromPage).thenComparingInt(PageSpan::toPage));

        final List<PageSpan> folded = new ArrayList<>();
        for (final PageSpan span : sorted) {
            final int last = folded.size() - 1;
            if (last >= 0 && folded.get(last).touches(span)) {
                folded.set(last, folded.get(last).union(span));
            } else {
                folded.add(span);
            }
        }
        return folded;
    }
}
