package br.edu.ifba.finrag.chunking;

import br.edu.ifba.finrag.exception.InvalidConfigException;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits raw text into overlapping windows, preferring to cut at sentence ends.
 *
 * <p>A window of {@code chunkSize} characters is cut at the last {@code '.'} inside it,
 * but only when that period lies past the middle of the window; otherwise the window is
 * cut at its full width. The next window starts {@code overlap} characters before the
 * previous cut. Output depends only on the text and the two parameters.</p>
 */
public final class TextChunker {

    public static final int DEFAULT_CHUNK_SIZE = 1000;
    public static final int DEFAULT_OVERLAP = 200;

    private static final char SENTENCE_END = '.';

    private final int chunkSize;
    private final int overlap;

    public TextChunker() {
        this(DEFAULT_CHUNK_SIZE, DEFAULT_OVERLAP);
    }

    /**
     * @param chunkSize maximum window width in characters
     * @param overlap   characters shared between consecutive windows
     * @throws InvalidConfigException if {@code chunkSize <= 0}, {@code overlap < 0}
     *                                or {@code overlap >= chunkSize}
     */
    public TextChunker(int chunkSize, int overlap) {
        if (chunkSize <= 0) {
            throw new InvalidConfigException("Chunk size must be a positive integer, got " + chunkSize);
        }
        if (overlap < 0) {
            throw new InvalidConfigException("Chunk overlap must not be negative, got " + overlap);
        }
        if (overlap >= chunkSize) {
            throw new InvalidConfigException(
                    String.format("Chunk overlap (%d) must be smaller than chunk size (%d)", overlap, chunkSize));
        }
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public int getOverlap() {
        return overlap;
    }

    /**
     * Splits text into trimmed, non-blank windows.
     *
     * @param text the input text, may be null
     * @return the windows in document order; empty for null or blank input
     */
    @NotNull
    public List<String> split(@Nullable String text) {
        List<String> windows = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return windows;
        }

        int length = text.length();
        if (length <= chunkSize) {
            windows.add(text.trim());
            return windows;
        }

        int start = 0;
        while (start < length) {
            int end = start + chunkSize;
            boolean last = end >= length;

            if (last) {
                end = length;
            } else {
                int sentenceEnd = text.lastIndexOf(SENTENCE_END, end - 1);
                if (sentenceEnd > start + chunkSize / 2) {
                    end = sentenceEnd + 1;
                }
            }

            String window = text.substring(start, end).trim();
            if (!window.isEmpty()) {
                windows.add(window);
            }

            if (last) {
                break;
            }

            int next = end - overlap;
            // a sentence cut shorter than the overlap would otherwise move the window backwards
            start = next > start ? next : end;
        }
        return windows;
    }

    /**
     * Chunks a document, assigning contiguous indices and deterministic ids.
     *
     * @param documentId owning document id
     * @param text       document text
     * @param metadata   document-level metadata copied onto every chunk, may be null
     * @return chunks with indices 0..n-1
     */
    @NotNull
    public List<Chunk> chunk(@NotNull String documentId, @Nullable String text, @Nullable Map<String, String> metadata) {
        List<String> windows = split(text);
        List<Chunk> chunks = new ArrayList<>(windows.size());
        for (int i = 0; i < windows.size(); i++) {
            String window = windows.get(i);
            Map<String, String> chunkMetadata = new HashMap<>();
            if (metadata != null) {
                chunkMetadata.putAll(metadata);
            }
            chunkMetadata.put(Chunk.META_DOCUMENT_ID, documentId);
            chunkMetadata.put(Chunk.META_CHUNK_INDEX, Integer.toString(i));
            chunkMetadata.put(Chunk.META_CHUNK_LENGTH, Integer.toString(window.length()));
            chunks.add(new Chunk(Chunk.idFor(documentId, i), documentId, i, window, chunkMetadata));
        }
        return chunks;
    }

    @NotNull
    public List<Chunk> chunk(@NotNull String documentId, @Nullable String text) {
        return chunk(documentId, text, null);
    }
}
