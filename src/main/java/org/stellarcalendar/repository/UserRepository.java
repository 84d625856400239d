package org.stellarcalendar.repository;

import org.stellarcalendar.model.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

/**
 * Repository for local users.
 */
@Repository
public interface UserRepository extends JpaRepository<User, UUID> {

    /**
     * Finds a user by username.
     * Used for actor documents, WebFinger and inbox routing.
     *
     * @param username the username
     * @return optional user
     */
    Optional<User> findByUsername(String username);

    /**
     * Finds an enabled user by username.
     *
     * @param username the username
     * @return optional user
     */
    Optional<User> findByUsernameAndEnabledTrue(String username);

    long countByEnabledTrue();
}
