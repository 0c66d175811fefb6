package eu.virtualparadox.ragqa.application.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
@ConfigurationProperties(prefix = "ragqa")
@Getter @Setter
public class ApplicationConfig {

    /** Lucene index directory holding the chunk records. */
    private Path index;

    @PostConstruct
    public void ensureFolders() throws IOException {
        if (index != null) Files.createDirectories(index);
    }
}
