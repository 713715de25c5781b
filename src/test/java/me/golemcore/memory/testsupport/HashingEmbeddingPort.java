package me.golemcore.memory.testsupport;

import me.golemcore.memory.port.outbound.EmbeddingPort;
import me.golemcore.memory.text.TextTokenizer;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic bag-of-words embedding: every token is hashed into one of
 * {@code dimension} buckets and the vector is L2-normalised. Texts sharing
 * tokens get a positive cosine, texts sharing none get zero.
 */
public class HashingEmbeddingPort implements EmbeddingPort {

    private final int dimension;
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean available = true;

    public HashingEmbeddingPort() {
        this(256);
    }

    public HashingEmbeddingPort(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public CompletableFuture<float[]> embed(String text) {
        calls.incrementAndGet();
        return CompletableFuture.completedFuture(vector(text));
    }

    @Override
    public CompletableFuture<List<float[]>> embedBatch(List<String> texts) {
        calls.incrementAndGet();
        List<float[]> vectors = new ArrayList<>();
        texts.forEach(text -> vectors.add(vector(text)));
        return CompletableFuture.completedFuture(vectors);
    }

    @Override
    public int getDimension() {
        return dimension;
    }

    @Override
    public String getModel() {
        return "hashing-test";
    }

    @Override
    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public int getCalls() {
        return calls.get();
    }

    private float[] vector(String text) {
        float[] vector = new float[dimension];
        for (String token : TextTokenizer.tokenize(text)) {
            vector[Math.floorMod(token.hashCode(), dimension)] += 1f;
        }
        double norm = 0;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm > 0) {
            float scale = (float) (1.0 / Math.sqrt(norm));
            for (int i = 0; i < vector.length; i++) {
                vector[i] *= scale;
            }
        }
        return vector;
    }
}
