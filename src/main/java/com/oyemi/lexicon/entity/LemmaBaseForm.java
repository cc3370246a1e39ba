package com.oyemi.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * lemma_base_form: inflected word to its base form, stored only when the two differ.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "lemma_base_form", indexes = @Index(name = "idx_lemma", columnList = "lemma"))
public class LemmaBaseForm extends AssignedIdEntity<String> {

    @Id
    @Column(name = "word", nullable = false)
    private String word;

    @Column(name = "lemma", nullable = false)
    private String lemma;

    public LemmaBaseForm(String word, String lemma) {
        this.word = word;
        this.lemma = lemma;
    }

    @Override
    public String getId() {
        return word;
    }
}
