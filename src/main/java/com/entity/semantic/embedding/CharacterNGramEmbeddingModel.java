package com.entity.semantic.embedding;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Deterministic in-process model: hashed character n-gram counts.
 *
 * <p>Text is lower-cased and split into word tokens; each token is wrapped as
 * {@code ^token$} and every n-gram of the configured sizes is hashed (FNV-1a over UTF-8)
 * into one of {@code dimension} buckets. Names sharing spelling fragments
 * ("Bob Johnson", "Bobby Johnson") land close together. It knows nothing of meaning,
 * so it is meant for tests and offline runs rather than production matching.</p>
 */
public class CharacterNGramEmbeddingModel implements EmbeddingModel {

    public static final int DEFAULT_DIMENSION = 384;
    private static final int[] DEFAULT_NGRAM_SIZES = {1, 2};
    private static final Pattern TOKEN_SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}_]+");

    private static final int FNV_OFFSET_BASIS = 0x811c9dc5;
    private static final int FNV_PRIME = 0x01000193;

    private final int dimension;
    private final int[] ngramSizes;

    public CharacterNGramEmbeddingModel() {
        this(DEFAULT_DIMENSION);
    }

    public CharacterNGramEmbeddingModel(int dimension) {
        this(dimension, DEFAULT_NGRAM_SIZES);
    }

    public CharacterNGramEmbeddingModel(int dimension, int... ngramSizes) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("dimension must be > 0");
        }
        if (ngramSizes == null || ngramSizes.length == 0) {
            throw new IllegalArgumentException("at least one n-gram size is required");
        }
        for (int n : ngramSizes) {
            if (n <= 0) {
                throw new IllegalArgumentException("n-gram sizes must be > 0");
            }
        }
        this.dimension = dimension;
        this.ngramSizes = ngramSizes.clone();
    }

    @Override
    public List<float[]> embedAll(List<String> texts) {
        List<float[]> vectors = new ArrayList<>(texts.size());
        for (String text : texts) {
            vectors.add(vectorize(text));
        }
        return vectors;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String getModelName() {
        return "char-ngram" + Arrays.toString(ngramSizes) + "/" + dimension;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    private float[] vectorize(String text) {
        if (text == null) {
            throw new EmbeddingException("Cannot embed null text", false);
        }
        float[] vector = new float[dimension];
        boolean anyToken = false;
        for (String token : TOKEN_SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (token.isEmpty()) {
                continue;
            }
            anyToken = true;
            String padded = "^" + token + "$";
            for (int n : ngramSizes) {
                for (int i = 0; i + n <= padded.length(); i++) {
                    vector[bucket(padded.substring(i, i + n))] += 1.0f;
                }
            }
        }
        if (!anyToken) {
            throw new EmbeddingException("Text has no word characters: '" + text + "'", false);
        }
        return vector;
    }

    private int bucket(String gram) {
        int hash = FNV_OFFSET_BASIS;
        for (byte b : gram.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return Integer.remainderUnsigned(hash, dimension);
    }
}
