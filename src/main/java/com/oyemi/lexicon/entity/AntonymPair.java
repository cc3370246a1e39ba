package com.oyemi.lexicon.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * antonym: one row per direction of a symmetric antonym relation.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@IdClass(AntonymPairId.class)
@Table(name = "antonym")
public class AntonymPair extends AssignedIdEntity<AntonymPairId> {

    @Id
    @Column(name = "word", nullable = false)
    private String word;

    @Id
    @Column(name = "antonym", nullable = false)
    private String antonym;

    public AntonymPair(String word, String antonym) {
        this.word = word;
        this.antonym = antonym;
    }

    @Override
    public AntonymPairId getId() {
        return new AntonymPairId(word, antonym);
    }
}
