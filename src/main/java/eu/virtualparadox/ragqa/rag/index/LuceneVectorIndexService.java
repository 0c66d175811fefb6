package eu.virtualparadox.ragqa.rag.index;

import eu.virtualparadox.ragqa.rag.index.model.Chunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.document.TextField;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.Term;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.SearcherManager;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.List;

import static eu.virtualparadox.ragqa.util.LuceneConstants.*;

/**
 * Lucene-backed {@link VectorIndexService}: one Lucene {@link Document} per chunk.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code docId}, {@code chunkId}, {@code elementType}: {@link StringField}, stored</li>
 *   <li>{@code text}, {@code sectionTitle}, {@code keywords}: {@link TextField}, stored, BM25 searchable</li>
 *   <li>{@code summary}: {@link StoredField} only</li>
 *   <li>{@code vector}: {@link KnnFloatVectorField}, cosine similarity (HNSW)</li>
 *   <li>{@code fromPage}, {@code toPage}: {@link StoredField}</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public final class LuceneVectorIndexService implements VectorIndexService {

    private final IndexWriter writer;
    private final SearcherManager searcherManager;

    /**
     * First-seen vector dimension; Lucene allows one dimension per vector field.
     */
    private Integer vectorDim;

    @Override
    public synchronized void upsert(final String docId,
                                    final List<Chunk> chunks,
                                    final List<float[]> vectors) throws IOException {
        if (StringUtils.isBlank(docId)) {
            throw new IllegalArgumentException("docId must not be blank");
        }
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("chunks must not be empty");
        }
        if (vectors == null || chunks.size() != vectors.size()) {
            throw new IllegalArgumentException("chunks.size() != vectors.size()");
        }

        final int dim = vectors.get(0) == null ? 0 : vectors.get(0).length;
        ensureConsistentDimension(dim);
        for (final float[] v : vectors) {
            if (v == null || v.length != dim) {
                throw new IllegalArgumentException("All vectors must be non-null and of length " + dim);
            }
        }

        for (final Chunk chunk : chunks) {
            if (!docId.equals(chunk.docId())) {
                throw new IllegalArgumentException("Chunk " + chunk.chunkId() + " does not belong to document " + docId);
            }
        }

        writer.deleteDocuments(new Term(FIELD_DOC_ID, docId));
        for (int i = 0; i < chunks.size(); i++) {
            writer.addDocument(buildLuceneDocument(chunks.get(i), vectors.get(i)));
        }

        writer.commit();
        searcherManager.maybeRefreshBlocking();
        log.info("Indexed {} chunks for document {}", chunks.size(), docId);
    }

    @Override
    public synchronized void deleteByDocId(final String docId) throws IOException {
        if (StringUtils.isBlank(docId)) {
            throw new IllegalArgumentException("docId must not be blank");
        }
        writer.deleteDocuments(new Term(FIELD_DOC_ID, docId));
        writer.commit();
        searcherManager.maybeRefreshBlocking();
    }

    private void ensureConsistentDimension(final int dim) {
        if (dim <= 0) {
            throw new IllegalArgumentException("Vector dimension must be > 0");
        }
        if (vectorDim == null) {
            vectorDim = dim;
        } else if (vectorDim != dim) {
            throw new IllegalArgumentException(
                    "Vector dimension mismatch. Existing=" + vectorDim + ", new=" + dim +
                            " (reindex into a fresh index if you changed the embedder)");
        }
    }

    private Document buildLuceneDocument(final Chunk c, final float[] vec) {
        final Document d = new Document();

        d.add(new StringField(FIELD_DOC_ID, c.docId(), Field.Store.YES));
        d.add(new StringField(FIELD_CHUNK_ID, c.chunkId(), Field.Store.YES));
        d.add(new StringField(FIELD_ELEMENT_TYPE, c.elementType(), Field.Store.YES));

        d.add(new TextField(FIELD_TEXT, c.text(), Field.Store.YES));
        d.add(new TextField(FIELD_SECTION_TITLE, c.sectionTitle(), Field.Store.YES));
        for (final String keyword : c.keywords()) {
            d.add(new TextField(FIELD_KEYWORDS, keyword, Field.Store.YES));
        }
        d.add(new StoredField(FIELD_SUMMARY, c.summary()));

        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.COSINE));

        d.add(new StoredField(FIELD_FROM_PAGE, c.pageStart()));
        d.add(new StoredField(FIELD_TO_PAGE, c.pageEnd()));

        return d;
    }
}
