package com.cadastral.lookup.application.port.out;

import com.cadastral.lookup.domain.model.User;

import java.util.Optional;

/**
 * Output port for user accounts.
 */
public interface UserRepository {

  Optional<User> findById(Long id);

  Optional<User> findByEmailIgnoreCase(String email);

  boolean existsByEmailIgnoreCase(String email);

  User save(User user);

  void delete(User user);

  /**
   * Push pending inserts and deletes to the database.
   */
  void flush();
}
