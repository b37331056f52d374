package com.tagatlas.repository;

import com.tagatlas.entity.MetaEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MetaEntryRepository extends JpaRepository<MetaEntry, String> {
}
