package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.UserBlock;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface UserBlockRepository extends JpaRepository<UserBlock, UUID> {

    boolean existsByUserIdAndBlockedActorUri(UUID userId, String blockedActorUri);

    boolean existsByUserIdAndBlockedDomainIgnoreCase(UUID userId, String blockedDomain);
}
