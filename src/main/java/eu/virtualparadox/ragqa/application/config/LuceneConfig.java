package eu.virtualparadox.ragqa.application.config;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Analyzer;
import org.apache.lucene.analysis.standard.StandardAnalyzer;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.search.SearcherManager;
import org.apache.lucene.store.Directory;
import org.apache.lucene.store.FSDirectory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Lucene resources backing the search backend, opened against {@code ragqa.index} and closed on shutdown.
 */
@Configuration
@Slf4j
public class LuceneConfig {

    private Directory directory;
    private IndexWriter indexWriter;
    private SearcherManager searcherManager;
    private Analyzer analyzer;

    /**
     * @throws IOException if the index directory cannot be opened
     */
    @Bean
    public Directory luceneDirectory(final ApplicationConfig props) throws IOException {
        final Path indexPath = props.getIndex();
        if (indexPath == null) {
            throw new IllegalStateException("ragqa.index must be set");
        }
        this.directory = FSDirectory.open(indexPath);
        log.info("Opened Lucene index at {}", indexPath.toAbsolutePath());
        return this.directory;
    }

    /**
     * Analyzer shared by indexing and keyword queries; both sides must agree on it.
     */
    @Bean
    public Analyzer analyzer() {
        this.analyzer = new StandardAnalyzer();
        return this.analyzer;
    }

    @Bean
    public IndexWriter indexWriter(final Directory dir, final Analyzer analyzer) throws IOException {
        final IndexWriterConfig cfg = new IndexWriterConfig(analyzer)
                .setOpenMode(IndexWriterConfig.OpenMode.CREATE_OR_APPEND);
        this.indexWriter = new IndexWriter(dir, cfg);
        return this.indexWriter;
    }

    /**
     * Near-real-time searcher over the writer; sees upserts after {@code maybeRefresh}.
     */
    @Bean
    public SearcherManager searcherManager(final IndexWriter writer) throws IOException {
        this.searcherManager = new SearcherManager(writer, null);
        return this.searcherManager;
    }

    @PreDestroy
    public void close() {
        closeQuietly(searcherManager, "SearcherManager");
        closeQuietly(indexWriter, "IndexWriter");
        closeQuietly(analyzer, "Analyzer");
        closeQuietly(directory, "Directory");
    }

    private static void closeQuietly(final AutoCloseable resource, final String name) {
        if (resource == null) {
            return;
        }
        try {
            resource.close();
        } catch (Exception e) {
            log.error("Unable to close {}", name, e);
        }
    }
}
