package com.architecture.memory.recall.service.embed;

import com.architecture.memory.recall.support.HashingEmbeddingModel;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmbeddingClientTest {

    @Test
    void embedsWithConfiguredDimension() {
        EmbeddingClient client = new EmbeddingClient(new HashingEmbeddingModel(16), 16);

        assertThat(client.embed("load config")).hasSize(16);
        assertThat(client.embed("load config")).isEqualTo(client.embed("load config"));
    }

    @Test
    void embedAllKeepsInputOrder() {
        EmbeddingClient client = new EmbeddingClient(new HashingEmbeddingModel(16), 16);

        List<List<Float>> vectors = client.embedAll(List.of("alpha", "beta"));

        assertThat(vectors).containsExactly(client.embed("alpha"), client.embed("beta"));
        assertThat(client.embedAll(List.of())).isEmpty();
    }

    @Test
    void rejectsModelWithDifferentDimension() {
        EmbeddingClient client = new EmbeddingClient(new HashingEmbeddingModel(8), 16);

        assertThatThrownBy(() -> client.embed("x"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Embedding dimension 8");
    }

    @Test
    void rejectsNonPositiveDimension() {
        assertThatThrownBy(() -> new EmbeddingClient(new HashingEmbeddingModel(8), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
