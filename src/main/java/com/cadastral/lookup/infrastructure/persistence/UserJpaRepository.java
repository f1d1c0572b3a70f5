package com.cadastral.lookup.infrastructure.persistence;

import com.cadastral.lookup.application.port.out.UserRepository;
import com.cadastral.lookup.domain.model.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * JPA implementation of UserRepository output port.
 */
@Repository
public interface UserJpaRepository extends JpaRepository<User, Long>, UserRepository {

    @Override
    Optional<User> findByEmailIgnoreCase(String email);

    @Override
    boolean existsByEmailIgnoreCase(String email);
}
