package com.shortly.backend.modules.link.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.shortly.backend.modules.link.domain.ShortLink;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ShortLinkRepository extends JpaRepository<ShortLink, UUID> {

    Optional<ShortLink> findByShortCode(String shortCode);

    boolean existsByShortCode(String shortCode);

    Optional<ShortLink> findByIdAndOwnerId(UUID id, UUID ownerId);

    List<ShortLink> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId);

    long countByOwnerId(UUID ownerId);

    @Modifying
    @Query("delete from ShortLink sl where sl.id = :linkId and sl.ownerId = :ownerId")
    int deleteOwned(@Param("linkId") UUID linkId, @Param("ownerId") UUID ownerId);
}
