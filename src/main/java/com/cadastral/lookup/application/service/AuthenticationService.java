package com.cadastral.lookup.application.service;

import com.cadastral.lookup.api.dto.TokenResponseDto;
import com.cadastral.lookup.application.port.out.UserRepository;
import com.cadastral.lookup.domain.model.User;
import com.cadastral.lookup.infrastructure.security.JwtTokenService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Exchanges email and password for a bearer access token.
 */
@Service
public class AuthenticationService {

  private static final Logger logger = LoggerFactory.getLogger(AuthenticationService.class);

  static final String BAD_CREDENTIALS = "LOGIN_BAD_CREDENTIALS";

  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;
  private final JwtTokenService jwtTokenService;

  public AuthenticationService(
      UserRepository userRepository,
      PasswordEncoder passwordEncoder,
      JwtTokenService jwtTokenService) {
    this.userRepository = userRepository;
    this.passwordEncoder = passwordEncoder;
    this.jwtTokenService = jwtTokenService;
  }

  @Transactional(readOnly = true)
  public TokenResponseDto login(String email, String password) {
    Optional<User> user = email == null
        ? Optional.empty()
        : userRepository.findByEmailIgnoreCase(email.trim());

    if (user.isEmpty()
        || password == null
        || !passwordEncoder.matches(password, user.get().getHashedPassword())
        || !user.get().isActive()) {
      logger.info("Failed login for {}", email);
      throw new InvalidCredentialsException(BAD_CREDENTIALS);
    }

    logger.info("User {} logged in", user.get().getId());
    return new TokenResponseDto(jwtTokenService.issueToken(user.get().getId()), "bearer");
  }

  public static class InvalidCredentialsException extends RuntimeException {
    public InvalidCredentialsException(String message) {
      super(message);
    }
  }
}
