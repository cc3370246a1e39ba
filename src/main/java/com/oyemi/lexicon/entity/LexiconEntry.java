package com.oyemi.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * lexicon: one row per (word, code); a polysemous word owns several rows.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@IdClass(LexiconEntryId.class)
@Table(name = "lexicon", indexes = @Index(name = "idx_word", columnList = "word"))
public class LexiconEntry extends AssignedIdEntity<LexiconEntryId> {

    /**
     * Lowercase surface form; multi-word entries keep their spaces and hyphens
     */
    @Id
    @Column(name = "word", nullable = false)
    private String word;

    /**
     * HHHH-LLLLL-P-A-V
     */
    @Id
    @Column(name = "code", length = 16, nullable = false)
    private String code;

    /**
     * Primary-sense rank; higher wins
     */
    @Column(name = "priority", nullable = false)
    private long priority;

    public LexiconEntry(String word, String code, long priority) {
        this.word = word;
        this.code = code;
        this.priority = priority;
    }

    @Override
    public LexiconEntryId getId() {
        return new LexiconEntryId(word, code);
    }
}
