package com.oyemi.lexicon.source;

import com.oyemi.lexicon.model.PartOfSpeech;
import com.oyemi.lexicon.model.SentimentScore;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

/**
 * Sentiment scores from a SentiWordNet 3.0 dump, keyed by part of speech and synset offset.
 * <p>
 * Each data line reads {@code POS \t ID \t PosScore \t NegScore \t SynsetTerms \t Gloss};
 * lines starting with {@code #} are comments. Satellite adjectives share the {@code a} tag.
 */
@Slf4j
public class SentiWordNetIndex {

    private final Map<Long, SentimentScore> scores;

    private SentiWordNetIndex(Map<Long, SentimentScore> scores) {
        this.scores = scores;
    }

    public static SentiWordNetIndex load(Path file) {
        if (!Files.isReadable(file)) {
            throw new IllegalStateException("SentiWordNet file not readable: " + file.toAbsolutePath());
        }
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            SentiWordNetIndex index = parse(reader);
            log.info("Loaded {} SentiWordNet entries from {}", index.size(), file);
            return index;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read SentiWordNet file: " + file, e);
        }
    }

    public static SentiWordNetIndex parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        Map<Long, SentimentScore> scores = new HashMap<>();
        int skipped = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            String[] fields = line.split("\t");
            if (fields.length < 4) {
                skipped++;
                continue;
            }
            try {
                PartOfSpeech pos = PartOfSpeech.fromTag(fields[0].trim().charAt(0));
                long offset = Long.parseLong(fields[1].trim());
                SentimentScore score = new SentimentScore(
                        Double.parseDouble(fields[2].trim()), Double.parseDouble(fields[3].trim()));
                scores.put(key(pos, offset), score);
            } catch (IllegalArgumentException | StringIndexOutOfBoundsException e) {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} malformed SentiWordNet lines", skipped);
        }
        return new SentiWordNetIndex(scores);
    }

    /**
     * @return the score pair, or {@link SentimentScore#NONE} when the synset has no entry
     */
    public SentimentScore scoreOf(PartOfSpeech pos, long offset) {
        return scores.getOrDefault(key(pos, offset), SentimentScore.NONE);
    }

    public int size() {
        return scores.size();
    }

    private static long key(PartOfSpeech pos, long offset) {
        return offset * 10 + pos.getDigit();
    }
}
