package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import eu.virtualparadox.ragqa.rag.index.model.SearchFilter;
import eu.virtualparadox.ragqa.rag.index.model.SearchHit;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.TokenStream;
import org.apache.lucene.analysis.tokenattributes.CharTermAttribute;
import org.apache.lucene.document.Document;
import org.apache.lucene.index.IndexableField;
import org.apache.lucene.index.Term;
import org.apache.lucene.queryparser.classic.MultiFieldQueryParser;
import org.apache.lucene.queryparser.classic.ParseException;
import org.apache.lucene.queryparser.classic.QueryParserBase;
import org.apache.lucene.search.BooleanClause;
import org.apache.lucene.search.BooleanQuery;
import org.apache.lucene.search.IndexSearcher;
import org.apache.lucene.search.KnnFloatVectorQuery;
import org.apache.lucene.search.Query;
import org.apache.lucene.search.ScoreDoc;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.search.TermQuery;
import org.apache.lucene.search.TopDocs;
import org.apache.lucene.store.AlreadyClosedException;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static eu.virtualparadox.ragqa.util.LuceneConstants.*;

/**
 * Lucene implementation of {@link SearchBackend}.
 * <p>
 * Steps per query:
 * <ol>
 *   <li>Acquire a near-real-time searcher from the {@link SearcherManager}</li>
 *   <li>Run an ANN search with {@link KnnFloatVectorQuery}, a BM25 search parsed by
 *       {@link MultiFieldQueryParser}, or both for hybrid</li>
 *   <li>Map Lucene doc ids to chunk ids</li>
 * </ol>
 * Hybrid search fuses both legs by max-normalised score, weighted by {@code alpha}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class LuceneSearchBackend implements SearchBackend {

    /** Each hybrid leg fetches this many times {@code topK} before fusing. */
    private static final int HYBRID_OVERSAMPLE = 2;

    private final SearcherManager searcherManager;
    private final Analyzer analyzer;

    @Override
    public List<SearchHit> vectorSearch(final float[] vector, final int topK, final SearchFilter filter) {
        return withSearcher(searcher -> toHits(searcher, searcher.search(knnQuery(vector, topK, filter), topK)));
    }

    @Override
    public List<SearchHit> keywordSearch(final String text,
                                         final List<String> properties,
                                         final int topK,
                                         final SearchFilter filter) {
        final Optional<Query> query = keywordQuery(text, properties, filter);
        if (query.isEmpty()) {
            return List.of();
        }
        return withSearcher(searcher -> toHits(searcher, searcher.search(query.get(), topK)));
    }

    @Override
    public List<SearchHit> hybridSearch(final String text,
                                        final float[] vector,
                                        final List<String> properties,
                                        final int topK,
                                        final double alpha,
                                        final SearchFilter filter) {
        final int legK = topK * HYBRID_OVERSAMPLE;
        final Optional<Query> keyword = keywordQuery(text, properties, filter);

        return withSearcher(searcher -> {
            final TopDocs vectorDocs = searcher.search(knnQuery(vector, legK, filter), legK);
            final Map<Integer, Float> scoreMap = new HashMap<>();
            normalizeAndAccumulate(vectorDocs, scoreMap, (float) alpha);
            if (keyword.isPresent()) {
                normalizeAndAccumulate(searcher.search(keyword.get(), legK), scoreMap, (float) (1.0 - alpha));
            }

            final List<Map.Entry<Integer, Float>> ranked = new ArrayList<>(scoreMap.entrySet());
            ranked.sort(Map.Entry.<Integer, Float>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.comparingByKey()));

            final List<SearchHit> hits = new ArrayList<>(Math.min(topK, ranked.size()));
            for (final Map.Entry<Integer, Float> e : ranked) {
                if (hits.size() >= topK) {
                    break;
                }
                hits.add(new SearchHit(chunkIdOf(searcher, e.getKey()), e.getValue()));
            }
            return hits;
        });
    }

    @Override
    public boolean supportsHybrid() {
        return true;
    }

    @Override
    public Optional<Chunk> fetchChunk(final String chunkId) {
        return withSearcher(searcher -> {
            final TopDocs docs = searcher.search(new TermQuery(new Term(FIELD_CHUNK_ID, chunkId)), 1);
            if (docs.scoreDocs.length == 0) {
                return Optional.empty();
            }
            return Optional.of(toChunk(searcher.storedFields().document(docs.scoreDocs[0].doc)));
        });
    }

    private Query knnQuery(final float[] vector, final int k, final SearchFilter filter) {
        if (vector == null || vector.length == 0) {
            throw new IllegalArgumentException("Vector search requires a query embedding");
        }
        return new KnnFloatVectorQuery(FIELD_VECTOR, vector, k, filterQuery(filter));
    }

    private Optional<Query> keywordQuery(final String text, final List<String> properties, final SearchFilter filter) {
        final String[] fields = properties.toArray(String[]::new);
        final MultiFieldQueryParser parser = new MultiFieldQueryParser(fields, analyzer);
        final Query parsed;
        try {
            parsed = parser.parse(QueryParserBase.escape(boundedTerms(text, fields)));
        } catch (final ParseException | IndexSearcher.TooManyClauses e) {
            log.warn("Question cannot be turned into a keyword query, keyword leg is empty: {}", text);
            return Optional.empty();
        }

        final Query restriction = filterQuery(filter);
        if (restriction == null) {
            return Optional.of(parsed);
        }
        return Optional.of(new BooleanQuery.Builder()
                .add(parsed, BooleanClause.Occur.MUST)
                .add(restriction, BooleanClause.Occur.FILTER)
                .build());
    }

    /**
     * Distinct analysed terms of the question, in order, capped so that one clause per term and
     * field plus the filter clause stays within {@link IndexSearcher#getMaxClauseCount()}.
     */
    private String boundedTerms(final String text, final String[] fields) {
        final int maxTerms = Math.max(1, (IndexSearcher.getMaxClauseCount() - 1) / Math.max(1, fields.length));
        final LinkedHashSet<String> terms = new LinkedHashSet<>();
        try (TokenStream stream = analyzer.tokenStream(fields.length == 0 ? FIELD_TEXT : fields[0], text)) {
            final CharTermAttribute term = stream.addAttribute(CharTermAttribute.class);
            stream.reset();
            while (terms.size() < maxTerms && stream.incrementToken()) {
                terms.add(term.toString());
            }
            stream.end();
        } catch (final IOException e) {
            throw new SearchBackendException("Unable to analyse the question", e);
        }
        if (terms.size() == maxTerms) {
            log.warn("Keyword query capped at {} distinct terms", maxTerms);
        }
        return String.join(" ", terms);
    }

    private Query filterQuery(final SearchFilter filter) {
        if (filter == null || filter.isEmpty()) {
            return null;
        }
        return new TermQuery(new Term(FIELD_DOC_ID, filter.docId()));
    }

    /**
     * Normalize scores within TopDocs and accumulate weighted into scoreMap.
     */
    private void normalizeAndAccumulate(final TopDocs docs,
                                        final Map<Integer, Float> scoreMap,
                                        final float weight) {
        if (docs.scoreDocs.length == 0 || weight <= 0f) {
            return;
        }
        final float maxScore = Arrays.stream(docs.scoreDocs)
                .map(sd -> sd.score)
                .max(Float::compare)
                .orElse(1.0f);

        for (final ScoreDoc sd : docs.scoreDocs) {
            final float normalized = maxScore > 0f ? sd.score / maxScore : 0f;
            scoreMap.merge(sd.doc, normalized * weight, Float::sum);
        }
    }

    private List<SearchHit> toHits(final IndexSearcher searcher, final TopDocs topDocs) throws IOException {
        final List<SearchHit> hits = new ArrayList<>(topDocs.scoreDocs.length);
        for (final ScoreDoc sd : topDocs.scoreDocs) {
            hits.add(new SearchHit(chunkIdOf(searcher, sd.doc), sd.score));
        }
        return hits;
    }

    private String chunkIdOf(final IndexSearcher searcher, final int luceneDocId) throws IOException {
        return searcher.storedFields().document(luceneDocId).get(FIELD_CHUNK_ID);
    }

    private Chunk toChunk(final Document doc) {
        return new Chunk(
                doc.get(FIELD_CHUNK_ID),
                doc.get(FIELD_DOC_ID),
                doc.get(FIELD_TEXT),
                intField(doc, FIELD_FROM_PAGE),
                intField(doc, FIELD_TO_PAGE),
                doc.get(FIELD_ELEMENT_TYPE),
                doc.get(FIELD_SECTION_TITLE),
                Arrays.asList(doc.getValues(FIELD_KEYWORDS)),
                doc.get(FIELD_SUMMARY));
    }

    private int intField(final Document doc, final String name) {
        final IndexableField field = doc.getField(name);
        return field == null || field.numericValue() == null ? 0 : field.numericValue().intValue();
    }

    private <T> T withSearcher(final SearcherCall<T> call) {
        final IndexSearcher searcher;
        try {
            searcher = searcherManager.acquire();
        } catch (final IOException | AlreadyClosedException e) {
            throw new SearchBackendException("Lucene index is not available", e);
        }
        try {
            return call.apply(searcher);
        } catch (final IOException | AlreadyClosedException | IndexSearcher.TooManyClauses e) {
            throw new SearchBackendException("Lucene search failed", e);
        } finally {
            release(searcher);
        }
    }

    private void release(final IndexSearcher searcher) {
        try {
            searcherManager.release(searcher);
        } catch (final IOException e) {
            log.error("Unable to release IndexSearcher", e);
        }
    }

    @FunctionalInterface
    private interface SearcherCall<T> {
        T apply(IndexSearcher searcher) throws IOException;
    }
}
