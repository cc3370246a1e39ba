package com.oyemi.lexicon.repository;

import com.oyemi.lexicon.entity.LexiconEntry;
import com.oyemi.lexicon.entity.LexiconEntryId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface LexiconEntryRepository extends JpaRepository<LexiconEntry, LexiconEntryId> {

    /**
     * Primary sense for single-sense consumers.
     */
    Optional<LexiconEntry> findFirstByWordOrderByPriorityDesc(String word);

    List<LexiconEntry> findAllByOrderByWordAscCodeAsc();

    /**
     * Rewrites one row addressed by its exact current code. Native because the code is part of the key.
     */
    @Modifying
    @Query(value = "UPDATE lexicon SET code = :newCode WHERE word = :word AND code = :oldCode", nativeQuery = true)
    int updateCode(@Param("word") String word, @Param("oldCode") String oldCode, @Param("newCode") String newCode);

    @Query("SELECT COUNT(DISTINCT e.word) FROM LexiconEntry e")
    long countDistinctWords();

    @Query("SELECT COUNT(DISTINCT e.code) FROM LexiconEntry e")
    long countDistinctCodes();
}
