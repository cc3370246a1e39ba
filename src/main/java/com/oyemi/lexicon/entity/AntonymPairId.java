package com.oyemi.lexicon.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AntonymPairId implements Serializable {
    private String word;
    private String antonym;
}
