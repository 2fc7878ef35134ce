package com.eainde.literature.dedup;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EmbeddingCosineSimilarityTest {

    private static final Map<String, float[]> VECTORS = Map.of(
            "myotis lucifugus", new float[]{1f, 0f},
            "little brown bat", new float[]{0.96f, 0.28f},
            "moth", new float[]{0f, 1f});

    @Mock
    private EmbeddingModel embeddingModel;

    @Test
    void cosine_shouldComputeNormalisedDotProduct() {
        assertThat(EmbeddingCosineSimilarity.cosine(new float[]{1f, 0f}, new float[]{1f, 0f})).isEqualTo(1.0);
        assertThat(EmbeddingCosineSimilarity.cosine(new float[]{1f, 0f}, new float[]{0f, 1f})).isZero();
        assertThat(EmbeddingCosineSimilarity.cosine(new float[]{3f, 4f}, new float[]{4f, 3f})).isCloseTo(0.96, within(1e-6));
    }

    @Test
    void cosine_shouldReturnZero_whenVectorHasZeroNorm() {
        assertThat(EmbeddingCosineSimilarity.cosine(new float[]{0f, 0f}, new float[]{1f, 0f})).isZero();
    }

    @Test
    void cosine_shouldRejectDimensionMismatch() {
        assertThatThrownBy(() -> EmbeddingCosineSimilarity.cosine(new float[]{1f}, new float[]{1f, 0f}))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void similarity_shouldUseVectorsEmbeddedDuringPrepare() {
        // Arrange
        stubEmbedAll();
        EmbeddingCosineSimilarity similarity = new EmbeddingCosineSimilarity(embeddingModel, 2);

        // Act
        similarity.prepare(List.of("Myotis lucifugus", "Little brown bat", "Moth", "moth"));

        // Assert
        assertThat(similarity.similarity("Myotis lucifugus", "little brown bat")).isCloseTo(0.96, within(1e-6));
        assertThat(similarity.similarity("Myotis lucifugus", "Moth")).isCloseTo(0.0, within(1e-6));
        verify(embeddingModel, times(2)).embedAll(anyList());
    }

    @Test
    void prepare_shouldNotReembedCachedValues() {
        stubEmbedAll();
        EmbeddingCosineSimilarity similarity = new EmbeddingCosineSimilarity(embeddingModel, 10);

        similarity.prepare(List.of("moth"));
        similarity.prepare(List.of("Moth", " moth "));

        verify(embeddingModel, times(1)).embedAll(anyList());
    }

    @Test
    void similarity_shouldShortCircuitEqualText_withoutEmbedding() {
        EmbeddingCosineSimilarity similarity = new EmbeddingCosineSimilarity(embeddingModel, 10);

        assertThat(similarity.similarity("Moth", "moth")).isEqualTo(1.0);
        assertThat(similarity.similarity("", "moth")).isZero();
    }

    @SuppressWarnings("unchecked")
    private void stubEmbedAll() {
        when(embeddingModel.embedAll(anyList())).thenAnswer(invocation -> {
            List<TextSegment> segments = invocation.getArgument(0);
            List<Embedding> embeddings = segments.stream()
                    .map(segment -> Embedding.from(VECTORS.get(segment.text())))
                    .toList();
            return Response.from(embeddings);
        });
    }
}
