package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.model.ExtractionArtifact;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes the extraction artifact as indented JSON.
 */
@Component
@Slf4j
public class ExtractionArtifactStore {

    private final ObjectMapper objectMapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public void write(ExtractionArtifact artifact, Path path) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), artifact);
            log.info("[Extractor] Wrote extraction artifact {}", path);
        } catch (IOException e) {
            throw new ExtractionException("Failed to write extraction artifact " + path, e);
        }
    }

    public ExtractionArtifact read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ExtractionException("Extraction artifact not found: " + path + ". Run extraction first.");
        }
        try {
            return objectMapper.readValue(path.toFile(), ExtractionArtifact.class);
        } catch (IOException e) {
            throw new ExtractionException("Failed to read extraction artifact " + path, e);
        }
    }
}
