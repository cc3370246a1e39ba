package com.oyemi.lexicon.repository;

import com.oyemi.lexicon.entity.AntonymPair;
import com.oyemi.lexicon.entity.AntonymPairId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface AntonymPairRepository extends JpaRepository<AntonymPair, AntonymPairId> {
}
