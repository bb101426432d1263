package me.golemcore.matching.engine;

import me.golemcore.matching.domain.exception.DimensionMismatchException;
import me.golemcore.matching.domain.model.EmbeddingVector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

class CosineSimilarityTest {

    private CosineSimilarity cosine;

    @BeforeEach
    void setUp() {
        cosine = new CosineSimilarity();
    }

    @Test
    void shouldReturnOneForIdenticalVectors() {
        EmbeddingVector v = EmbeddingVector.of(0.3, -1.2, 4.5);

        assertEquals(1.0, cosine.similarity(v, v));
    }

    @Test
    void shouldReturnExactlyOneForIdenticalEmbeddingSizedVectors() {
        Random random = new Random(42);
        for (int n = 0; n < 1000; n++) {
            float[] values = new float[768];
            for (int i = 0; i < values.length; i++) {
                values[i] = (float) random.nextGaussian();
            }
            EmbeddingVector v = EmbeddingVector.of(values);

            assertEquals(1.0, cosine.similarity(v, v), "vector #" + n);
            assertEquals(1.0, cosine.similarity(v, EmbeddingVector.of(values)), "copy of vector #" + n);
        }
    }

    @Test
    void shouldReturnZeroForOrthogonalVectors() {
        assertEquals(0.0, cosine.similarity(EmbeddingVector.of(1.0, 0.0), EmbeddingVector.of(0.0, 2.0)), 1e-9);
    }

    @Test
    void shouldReturnMinusOneForOppositeVectors() {
        assertEquals(-1.0, cosine.similarity(EmbeddingVector.of(1.0, 2.0), EmbeddingVector.of(-1.0, -2.0)), 1e-9);
    }

    @Test
    void shouldBeSymmetric() {
        EmbeddingVector a = EmbeddingVector.of(0.12, 0.5, -0.33, 0.9);
        EmbeddingVector b = EmbeddingVector.of(-0.4, 0.25, 0.61, 0.07);

        assertEquals(cosine.similarity(a, b), cosine.similarity(b, a));
    }

    @Test
    void shouldIgnoreMagnitude() {
        EmbeddingVector a = EmbeddingVector.of(1.0, 1.0);
        EmbeddingVector scaled = EmbeddingVector.of(10.0, 10.0);

        assertEquals(1.0, cosine.similarity(a, scaled), 1e-9);
    }

    @Test
    void shouldReturnZeroForZeroMagnitudeVector() {
        EmbeddingVector zero = EmbeddingVector.of(0.0, 0.0, 0.0);
        EmbeddingVector other = EmbeddingVector.of(1.0, 2.0, 3.0);

        assertEquals(0.0, cosine.similarity(zero, other));
        assertEquals(0.0, cosine.similarity(other, zero));
    }

    @Test
    void shouldStayWithinUnitRange() {
        EmbeddingVector a = EmbeddingVector.of(0.1f, 0.2f, 0.3f);

        double similarity = cosine.similarity(a, a);

        assertTrue(similarity <= 1.0);
        assertTrue(similarity >= -1.0);
    }

    @Test
    void shouldRejectDimensionMismatch() {
        DimensionMismatchException ex = assertThrows(DimensionMismatchException.class,
                () -> cosine.similarity(EmbeddingVector.of(1.0, 0.0), EmbeddingVector.of(1.0, 0.0, 0.0)));

        assertEquals(2, ex.getLeftDimension());
        assertEquals(3, ex.getRightDimension());
        assertInstanceOf(IllegalArgumentException.class, ex);
    }

    @Test
    void shouldRejectNullVector() {
        assertThrows(NullPointerException.class, () -> cosine.similarity(null, EmbeddingVector.of(1.0)));
    }
}
