package me.golemcore.matching.adapter.outbound.embedding;

import me.golemcore.matching.infrastructure.config.MatchingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.*;

class Langchain4jEmbeddingAdapterTest {

    private MatchingProperties properties;
    private Langchain4jEmbeddingAdapter adapter;

    @BeforeEach
    void setUp() {
        properties = new MatchingProperties();
        adapter = new Langchain4jEmbeddingAdapter(properties);
    }

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        properties.getEmbedding().setApiKey("  ");

        assertFalse(adapter.isAvailable());
    }

    @Test
    void shouldFailEmbeddingWithoutApiKey() {
        CompletionException ex = assertThrows(CompletionException.class,
                () -> adapter.embed("Built payment services in Java").join());
        assertInstanceOf(IllegalStateException.class, ex.getCause());

        assertThrows(CompletionException.class, () -> adapter.embedBatch(List.of("a b", "c d")).join());
    }

    @Test
    void shouldBecomeAvailableWithApiKey() {
        properties.getEmbedding().setApiKey("sk-test");
        properties.getEmbedding().setBaseUrl("http://localhost:1/v1");

        assertTrue(adapter.isAvailable());
    }

    @Test
    void shouldFallBackToDefaultModelName() {
        properties.getEmbedding().setModel("");

        assertEquals("text-embedding-3-small", adapter.getModel());
    }

    @Test
    void shouldExposeConfiguredModelAndDimension() {
        properties.getEmbedding().setModel("text-embedding-3-large");
        properties.getEmbedding().setDimension(3072);

        assertEquals("text-embedding-3-large", adapter.getModel());
        assertEquals(3072, adapter.getDimension());
    }
}
