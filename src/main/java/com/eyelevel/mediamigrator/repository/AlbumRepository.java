package com.eyelevel.mediamigrator.repository;

import com.eyelevel.mediamigrator.model.Album;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AlbumRepository extends JpaRepository<Album, Long> {

    Optional<Album> findByCanonicalKey(String canonicalKey);

    long countByCreatedInRunId(Long runId);
}
