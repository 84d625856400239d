package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.Comment;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for event comments.
 */
@Repository
public interface CommentRepository extends JpaRepository<Comment, UUID> {

    Optional<Comment> findByExternalId(String externalId);

    boolean existsByExternalId(String externalId);
}
