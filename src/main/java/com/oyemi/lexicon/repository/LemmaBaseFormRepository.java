package com.oyemi.lexicon.repository;

import com.oyemi.lexicon.entity.LemmaBaseForm;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface LemmaBaseFormRepository extends JpaRepository<LemmaBaseForm, String> {
}
