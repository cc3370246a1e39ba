package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.LexiconProperties;
import com.oyemi.lexicon.entity.AntonymPair;
import com.oyemi.lexicon.entity.LemmaBaseForm;
import com.oyemi.lexicon.entity.LexiconEntry;
import com.oyemi.lexicon.model.AntonymLink;
import com.oyemi.lexicon.model.CodeUpdate;
import com.oyemi.lexicon.model.EncodedSense;
import com.oyemi.lexicon.repository.AntonymPairRepository;
import com.oyemi.lexicon.repository.LemmaBaseFormRepository;
import com.oyemi.lexicon.repository.LexiconEntryRepository;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes pipeline output to the lexicon tables. Each public method is one transaction.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LexiconPersistenceService {

    private final LexiconEntryRepository lexiconEntryRepository;
    private final LemmaBaseFormRepository lemmaBaseFormRepository;
    private final AntonymPairRepository antonymPairRepository;
    private final EntityManager entityManager;
    private final LexiconProperties properties;

    /**
     * Inserts the encoded rows and the base-form mappings, plus one antonym row per direction of
     * every distinct link regardless of which orientation the caller supplied.
     */
    @Transactional
    public void insertAll(Collection<EncodedSense> senses, Map<String, String> baseForms, Collection<AntonymLink> antonyms) {
        List<LexiconEntry> entries = senses.stream()
                .map(sense -> new LexiconEntry(sense.word(), sense.code().format(), sense.priority()))
                .toList();
        batchSave(lexiconEntryRepository, entries);
        log.info("Inserted {} lexicon rows", entries.size());

        List<LemmaBaseForm> lemmas = baseForms.entrySet().stream()
                .map(e -> new LemmaBaseForm(e.getKey(), e.getValue()))
                .toList();
        batchSave(lemmaBaseFormRepository, lemmas);
        log.info("Inserted {} base-form mappings", lemmas.size());

        Map<String, AntonymPair> unique = new LinkedHashMap<>();
        for (AntonymLink link : antonyms) {
            unique.putIfAbsent(link.word() + '\t' + link.antonym(), new AntonymPair(link.word(), link.antonym()));
            unique.putIfAbsent(link.antonym() + '\t' + link.word(), new AntonymPair(link.antonym(), link.word()));
        }
        List<AntonymPair> pairs = new ArrayList<>(unique.values());
        batchSave(antonymPairRepository, pairs);
        log.info("Inserted {} antonym rows", pairs.size());
    }

    /**
     * Applies point updates addressed by exact (word, old code).
     *
     * @return rows actually rewritten
     */
    @Transactional
    public int applyUpdates(String stage, List<CodeUpdate> updates) {
        int rewritten = 0;
        for (CodeUpdate update : updates) {
            int rows = lexiconEntryRepository.updateCode(
                    update.word(), update.oldCode().format(), update.newCode().format());
            if (rows == 0) {
                log.warn("[{}] No row for '{}' with code {}", stage, update.word(), update.oldCode());
            }
            rewritten += rows;
        }
        log.info("[{}] Rewrote {} of {} rows", stage, rewritten, updates.size());
        return rewritten;
    }

    private <T> void batchSave(JpaRepository<T, ?> repository, List<T> rows) {
        int batchSize = Math.max(1, properties.getBatchSize());
        for (int from = 0; from < rows.size(); from += batchSize) {
            List<T> batch = rows.subList(from, Math.min(rows.size(), from + batchSize));
            repository.saveAll(batch);
            entityManager.flush();
            entityManager.clear();
        }
    }
}
