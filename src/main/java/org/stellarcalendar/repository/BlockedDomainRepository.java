package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.BlockedDomain;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface BlockedDomainRepository extends JpaRepository<BlockedDomain, UUID> {

    boolean existsByDomainIgnoreCase(String domain);
}
