package com.spsync.ingest;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Offline embedding built from signed feature hashing, deterministic for a given dimension.
 *
 * <p>Chunks coming out of {@link ChunkerRegistry} start with a {@code [Document: name | Folder: path]}
 * line. That header is parsed rather than embedded as prose: file name words (extension dropped)
 * and folder segments are hashed into the same term space as the body with their own weights, so a
 * query naming a document or folder lands near every chunk of it. Body terms get sublinear term
 * frequency, word bigrams and character trigrams. Queries carry no header and are embedded as body.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-hash-v2";
    private static final String HEADER_START = "[Document: ";
    private static final String HEADER_END = "]\n";
    private static final String FOLDER_SEPARATOR = " | Folder: ";
    private static final Pattern NON_WORD = Pattern.compile("[^\\p{L}\\p{N}]+");

    static final float NAME_WEIGHT = 1.5f;
    static final float FOLDER_WEIGHT = 0.75f;
    static final float BIGRAM_WEIGHT = 0.5f;
    static final float TRIGRAM_WEIGHT = 0.25f;

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("embedding dimension must be > 0");
        }
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String body = text;
        if (text.startsWith(HEADER_START)) {
            int end = text.indexOf(HEADER_END);
            if (end > 0) {
                addHeader(vector, text.substring(HEADER_START.length(), end));
                body = text.substring(end + HEADER_END.length());
            }
        }
        addBody(vector, words(body));

        normalize(vector);
        return vector;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION + "-" + dimension;
    }

    private static void addHeader(float[] vector, String header) {
        int folderAt = header.indexOf(FOLDER_SEPARATOR);
        String name = folderAt >= 0 ? header.substring(0, folderAt) : header;
        int dot = name.lastIndexOf('.');
        if (dot > 0) {
            name = name.substring(0, dot);
        }
        for (String word : words(name)) {
            addHashed(vector, "tok:" + word, NAME_WEIGHT);
        }
        if (folderAt >= 0) {
            for (String word : words(header.substring(folderAt + FOLDER_SEPARATOR.length()))) {
                addHashed(vector, "tok:" + word, FOLDER_WEIGHT);
            }
        }
    }

    private static void addBody(float[] vector, List<String> words) {
        Map<String, Integer> frequencies = new HashMap<>();
        for (String word : words) {
            frequencies.merge(word, 1, Integer::sum);
        }
        for (Map.Entry<String, Integer> entry : frequencies.entrySet()) {
            String word = entry.getKey();
            addHashed(vector, "tok:" + word, 1.0f + (float) Math.log(entry.getValue()));
            for (int i = 0; i + 3 <= word.length(); i++) {
                addHashed(vector, "tri:" + word.substring(i, i + 3), TRIGRAM_WEIGHT);
            }
        }
        for (int i = 1; i < words.size(); i++) {
            addHashed(vector, "bi:" + words.get(i - 1) + " " + words.get(i), BIGRAM_WEIGHT);
        }
    }

    private static List<String> words(String text) {
        List<String> words = new ArrayList<>();
        for (String word : NON_WORD.split(text.toLowerCase(Locale.ROOT))) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words;
    }

    private static void addHashed(float[] vector, String feature, float weight) {
        int hash = feature.hashCode();
        int index = Math.floorMod(hash, vector.length);
        // bit 16 picks the sign, colliding features tend to cancel out
        vector[index] += ((hash >>> 16) & 1) == 0 ? weight : -weight;
    }

    private static void normalize(float[] vector) {
        double norm = 0d;
        for (float value : vector) {
            norm += value * value;
        }
        if (norm <= 0d) {
            return;
        }
        float scale = (float) (1d / Math.sqrt(norm));
        for (int i = 0; i < vector.length; i++) {
            vector[i] *= scale;
        }
    }
}
