package com.spsync.ingest;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Recursive character splitter. Text is split on the first separator that occurs in it, pieces that
 * are still too large are split again with the remaining separators, and small pieces are merged
 * back into chunks of at most {@code chunkSize} characters that share up to {@code chunkOverlap}
 * characters with their predecessor.
 */
public class TextChunker implements ContentChunker {
    static final List<String> DEFAULT_SEPARATORS = List.of("\n\n", "\n", " ", "");

    private final int chunkSize;
    private final int chunkOverlap;
    private final List<String> separators;

    public TextChunker(int chunkSize, int chunkOverlap) {
        this(chunkSize, chunkOverlap, DEFAULT_SEPARATORS);
    }

    public TextChunker(int chunkSize, int chunkOverlap, List<String> separators) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be > 0");
        }
        if (chunkOverlap < 0 || chunkOverlap >= chunkSize) {
            throw new IllegalArgumentException("chunkOverlap must be >= 0 and < chunkSize");
        }
        this.chunkSize = chunkSize;
        this.chunkOverlap = chunkOverlap;
        this.separators = List.copyOf(separators);
    }

    @Override
    public List<String> chunk(byte[] content, String contentType) {
        String text = new String(content, StandardCharsets.UTF_8);
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return split(text);
    }

    public List<String> split(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        return split(text, separators);
    }

    private List<String> split(String text, List<String> candidates) {
        String separator = candidates.get(candidates.size() - 1);
        List<String> remaining = List.of();
        for (int i = 0; i < candidates.size(); i++) {
            String candidate = candidates.get(i);
            if (candidate.isEmpty()) {
                separator = candidate;
                break;
            }
            if (text.contains(candidate)) {
                separator = candidate;
                remaining = candidates.subList(i + 1, candidates.size());
                break;
            }
        }

        List<String> chunks = new ArrayList<>();
        List<String> small = new ArrayList<>();
        for (String piece : splitOn(text, separator)) {
            if (piece.length() < chunkSize) {
                small.add(piece);
                continue;
            }
            if (!small.isEmpty()) {
                chunks.addAll(merge(small, separator));
                small = new ArrayList<>();
            }
            if (remaining.isEmpty()) {
                chunks.add(piece);
            } else {
                chunks.addAll(split(piece, remaining));
            }
        }
        if (!small.isEmpty()) {
            chunks.addAll(merge(small, separator));
        }
        return chunks;
    }

    private static List<String> splitOn(String text, String separator) {
        List<String> pieces = new ArrayList<>();
        if (separator.isEmpty()) {
            text.codePoints().forEach(cp -> pieces.add(new String(Character.toChars(cp))));
            return pieces;
        }
        int start = 0;
        int next;
        while ((next = text.indexOf(separator, start)) >= 0) {
            if (next > start) {
                pieces.add(text.substring(start, next));
            }
            start = next + separator.length();
        }
        if (start < text.length()) {
            pieces.add(text.substring(start));
        }
        return pieces;
    }

    private List<String> merge(List<String> pieces, String separator) {
        int separatorLength = separator.length();
        List<String> merged = new ArrayList<>();
        Deque<String> current = new ArrayDeque<>();
        int total = 0;
        for (String piece : pieces) {
            int length = piece.length();
            if (total + length + (current.isEmpty() ? 0 : separatorLength) > chunkSize) {
                if (!current.isEmpty()) {
                    addIfNotBlank(merged, String.join(separator, current));
                    // drop from the front until the window fits the overlap and the next piece
                    while (total > chunkOverlap
                            || (total > 0 && total + length + (current.isEmpty() ? 0 : separatorLength) > chunkSize)) {
                        String dropped = current.pollFirst();
                        total -= dropped.length() + (current.isEmpty() ? 0 : separatorLength);
                    }
                }
            }
            current.addLast(piece);
            total += length + (current.size() > 1 ? separatorLength : 0);
        }
        addIfNotBlank(merged, String.join(separator, current));
        return merged;
    }

    private static void addIfNotBlank(List<String> target, String chunk) {
        String stripped = chunk.strip();
        if (!stripped.isEmpty()) {
            target.add(stripped);
        }
    }
}
