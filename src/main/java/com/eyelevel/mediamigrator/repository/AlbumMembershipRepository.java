package com.eyelevel.mediamigrator.repository;

import com.eyelevel.mediamigrator.model.AlbumMembership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface AlbumMembershipRepository extends JpaRepository<AlbumMembership, Long> {

    boolean existsByAlbumIdAndMediaItemId(Long albumId, String mediaItemId);

    long countByAlbumId(Long albumId);

    List<AlbumMembership> findByMediaItemId(String mediaItemId);
}
