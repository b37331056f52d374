package com.tagatlas.repository;

import com.tagatlas.entity.SearchPosting;
import com.tagatlas.entity.SearchPostingId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface SearchPostingRepository extends JpaRepository<SearchPosting, SearchPostingId> {

    List<SearchPosting> findByTokenIn(Collection<String> tokens);

    @Modifying
    @Query("DELETE FROM SearchPosting p WHERE p.nodeId = :nodeId")
    int deleteByNode(@Param("nodeId") Long nodeId);
}
