package com.tagatlas.repository;

import com.tagatlas.entity.SearchDocument;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

@Repository
public interface SearchDocumentRepository extends JpaRepository<SearchDocument, Long> {

    @Query("SELECT AVG(d.tokenCount) FROM SearchDocument d")
    Double averageTokenCount();
}
