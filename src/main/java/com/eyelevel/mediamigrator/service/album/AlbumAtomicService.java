package com.eyelevel.mediamigrator.service.album;

import com.eyelevel.mediamigrator.model.Album;
import com.eyelevel.mediamigrator.model.AlbumMembership;
import com.eyelevel.mediamigrator.repository.AlbumMembershipRepository;
import com.eyelevel.mediamigrator.repository.AlbumRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Single-statement album writes, each in its own transaction so a unique-constraint race rolls back only the
 * losing insert and the caller can read the winner.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AlbumAtomicService {

    private final AlbumRepository albumRepository;
    private final AlbumMembershipRepository albumMembershipRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public Optional<Album> findByCanonicalKey(String canonicalKey) {
        return albumRepository.findByCanonicalKey(canonicalKey);
    }

    /**
     * @throws DataIntegrityViolationException if another writer created the same canonical key first.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Album attemptToCreate(Album album) throws DataIntegrityViolationException {
        return albumRepository.saveAndFlush(album);
    }

    /**
     * Adds the membership unless it already exists.
     *
     * @return {@code true} if a new membership row was written.
     * @throws DataIntegrityViolationException if a concurrent writer inserted the same membership.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean attemptToAttach(Long albumId, String mediaItemId) throws DataIntegrityViolationException {
        if (albumMembershipRepository.existsByAlbumIdAndMediaItemId(albumId, mediaItemId)) {
            return false;
        }
        albumMembershipRepository.saveAndFlush(AlbumMembership.builder()
                                                              .albumId(albumId)
                                                              .mediaItemId(mediaItemId)
                                                              .build());
        return true;
    }
}
