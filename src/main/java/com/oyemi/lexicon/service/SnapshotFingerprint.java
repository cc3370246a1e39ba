package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.LexiconRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;

/**
 * Hashes lexicon contents so two builds can be compared without diffing every row.
 * Row order does not matter: rows are sorted by word, code and priority before hashing.
 */
@Service
@Slf4j
public class SnapshotFingerprint {

    private static final String HASH_ALGORITHM = "SHA-256";

    private static final Comparator<LexiconRow> ROW_ORDER = Comparator
            .comparing(LexiconRow::word)
            .thenComparing(LexiconRow::code)
            .thenComparingLong(LexiconRow::priority);

    /**
     * @return 64-char hex SHA-256
     */
    public String fingerprint(Collection<LexiconRow> rows) {
        List<LexiconRow> sorted = rows.stream().sorted(ROW_ORDER).toList();
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            for (LexiconRow row : sorted) {
                String line = row.word() + '\t' + row.code() + '\t' + row.priority() + '\n';
                digest.update(line.getBytes(StandardCharsets.UTF_8));
            }
            return HexFormat.of().formatHex(digest.digest());
        } catch (NoSuchAlgorithmException e) {
            log.error("SHA-256 algorithm not available", e);
            throw new IllegalStateException("Failed to fingerprint lexicon", e);
        }
    }
}
