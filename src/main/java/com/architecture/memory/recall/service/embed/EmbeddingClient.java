package com.architecture.memory.recall.service.embed;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Maps text to dense vectors of a fixed dimension. Indexing and query embedding both go
 * through here so they always share one model.
 */
@Slf4j
public class EmbeddingClient {

    private final EmbeddingModel embeddingModel;

    @Getter
    private final int dimension;

    public EmbeddingClient(EmbeddingModel embeddingModel, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("embedding.dimension must be positive");
        }
        this.embeddingModel = embeddingModel;
        this.dimension = dimension;
    }

    public List<Float> embed(String text) {
        Embedding embedding = embeddingModel.embed(text).content();
        return checked(embedding);
    }

    /**
     * Embeds several texts in one model call, preserving input order.
     */
    public List<List<Float>> embedAll(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }
        List<TextSegment> segments = texts.stream()
                .map(TextSegment::from)
                .collect(Collectors.toList());
        List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
        if (embeddings.size() != texts.size()) {
            throw new IllegalStateException("Embedding model returned " + embeddings.size()
                    + " vectors for " + texts.size() + " texts");
        }
        log.debug("[Embedding] Embedded {} texts", texts.size());
        return embeddings.stream()
                .map(this::checked)
                .collect(Collectors.toList());
    }

    private List<Float> checked(Embedding embedding) {
        List<Float> vector = embedding.vectorAsList();
        if (vector.size() != dimension) {
            throw new IllegalStateException("Embedding dimension " + vector.size()
                    + " does not match configured dimension " + dimension);
        }
        return vector;
    }
}
