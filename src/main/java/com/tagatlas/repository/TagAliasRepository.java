package com.tagatlas.repository;

import com.tagatlas.entity.TagAlias;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TagAliasRepository extends JpaRepository<TagAlias, String> {

    List<TagAlias> findByNodeId(Long nodeId);

    @Modifying
    @Query("DELETE FROM TagAlias a WHERE a.nodeId = :nodeId")
    int deleteByNode(@Param("nodeId") Long nodeId);
}
