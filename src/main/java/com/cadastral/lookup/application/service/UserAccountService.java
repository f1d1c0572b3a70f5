package com.cadastral.lookup.application.service;

import com.cadastral.lookup.application.port.out.QueryHistoryRepository;
import com.cadastral.lookup.application.port.out.UserRepository;
import com.cadastral.lookup.domain.model.User;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Locale;

/**
 * Application service for user accounts: registration, lookup and removal.
 *
 * Removing a user removes that user's history in the same transaction.
 */
@Service
public class UserAccountService {

  private static final Logger logger = LoggerFactory.getLogger(UserAccountService.class);

  private final UserRepository userRepository;
  private final QueryHistoryRepository queryHistoryRepository;
  private final PasswordEncoder passwordEncoder;

  public UserAccountService(
      UserRepository userRepository,
      QueryHistoryRepository queryHistoryRepository,
      PasswordEncoder passwordEncoder) {
    this.userRepository = userRepository;
    this.queryHistoryRepository = queryHistoryRepository;
    this.passwordEncoder = passwordEncoder;
  }

  @Transactional
  public User register(String email, String password) {
    return register(email, password, false);
  }

  @Transactional
  public User register(String email, String password, boolean superuser) {
    String normalizedEmail = email.trim().toLowerCase(Locale.ROOT);
    if (userRepository.existsByEmailIgnoreCase(normalizedEmail)) {
      throw new UserAlreadyExistsException("REGISTER_USER_ALREADY_EXISTS");
    }

    User user = new User(normalizedEmail, passwordEncoder.encode(password));
    user.setSuperuser(superuser);
    user = userRepository.save(user);
    logger.info("Registered user {} ({})", user.getId(), normalizedEmail);
    return user;
  }

  @Transactional(readOnly = true)
  public User getUser(Long id) {
    return userRepository.findById(id)
        .orElseThrow(() -> new UserNotFoundException("User " + id + " not found"));
  }

  /**
   * Delete a user together with all of the user's query history.
   *
   * @param callerIsSuperuser whether the caller may administer users
   * @param id user to delete
   */
  @Transactional
  public void deleteUser(boolean callerIsSuperuser, Long id) {
    if (!callerIsSuperuser) {
      throw new InsufficientPrivilegesException("Only superusers may delete users");
    }
    User user = getUser(id);

    int removed = queryHistoryRepository.deleteByUserId(user.getId());
    userRepository.delete(user);
    logger.info("Deleted user {} and {} history records", id, removed);
  }

  public static class UserAlreadyExistsException extends RuntimeException {
    public UserAlreadyExistsException(String message) {
      super(message);
    }
  }

  public static class UserNotFoundException extends RuntimeException {
    public UserNotFoundException(String message) {
      super(message);
    }
  }

  public static class InsufficientPrivilegesException extends RuntimeException {
    public InsufficientPrivilegesException(String message) {
      super(message);
    }
  }
}
