package eu.virtualparadox.ragqa.web;

import eu.virtualparadox.ragqa.rag.index.VectorIndexService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.io.IOException;
import java.util.List;

/**
 * Write side for the external ingestion pipeline: replaces or removes the chunks of a document.
 */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentIndexController {

    private final VectorIndexService indexService;

    @PutMapping("/{docId}/chunks")
    public ResponseEntity<Void> upsert(@PathVariable("docId") final String docId,
                                       @RequestBody final List<IndexedChunk> chunks) throws IOException {
        if (chunks == null || chunks.isEmpty()) {
            throw new IllegalArgumentException("chunks must not be empty");
        }
        indexService.upsert(docId,
                chunks.stream().map(IndexedChunk::chunk).toList(),
                chunks.stream().map(IndexedChunk::vector).toList());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{docId}")
    public ResponseEntity<Void> delete(@PathVariable("docId") final String docId) throws IOException {
        indexService.deleteByDocId(docId);
        return ResponseEntity.noContent().build();
    }
}
