package eu.virtualparadox.ragqa.rag.embed;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.stereotype.Service;

/**
 * {@link EmbeddingService} backed by the configured Spring AI {@link EmbeddingModel}.
 * <p>
 * Query vectors are L2-normalised so that they compare with the cosine-indexed chunk vectors.
 */
@Service
@Slf4j
public final class ModelEmbeddingService implements EmbeddingService {

    private final EmbeddingModel embeddingModel;

    public ModelEmbeddingService(final EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public float[] embedQuery(final String text) {
        final float[] vector;
        try {
            vector = embeddingModel.embed(text);
        } catch (final RuntimeException e) {
            throw new EmbeddingException("Embedding model call failed", e);
        }
        if (vector == null || vector.length == 0) {
            throw new EmbeddingException("Embedding model returned an empty vector", null);
        }
        normalize(vector);
        log.debug("Embedded question into {} dimensions", vector.length);
        return vector;
    }

    private void normalize(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += v * v;
        }
        norm = Math.sqrt(norm);
        if (norm > 0.0) {
            for (int i = 0; i < vec.length; i++) {
                vec[i] /= (float) norm;
            }
        }
    }
}
