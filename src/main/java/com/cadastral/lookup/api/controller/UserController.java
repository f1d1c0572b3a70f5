package com.cadastral.lookup.api.controller;

import com.cadastral.lookup.api.dto.UserResponseDto;
import com.cadastral.lookup.application.mapper.UserMapper;
import com.cadastral.lookup.application.service.UserAccountService;
import com.cadastral.lookup.infrastructure.security.AuthenticatedUser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/users")
public class UserController {

    private static final Logger logger = LoggerFactory.getLogger(UserController.class);

    private final UserAccountService userAccountService;
    private final UserMapper userMapper;

    public UserController(UserAccountService userAccountService, UserMapper userMapper) {
        this.userAccountService = userAccountService;
        this.userMapper = userMapper;
    }

    @GetMapping("/me")
    public ResponseEntity<UserResponseDto> me(
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        return ResponseEntity.ok(userMapper.toDto(userAccountService.getUser(user.getId())));
    }

    /**
     * DELETE /users/{id}
     *
     * Superusers only. The user's query history is removed along with the account.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(
            @PathVariable Long id,
            @RequestAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE) AuthenticatedUser user) {
        logger.info("User {} requested deletion of user {}", user.getId(), id);
        userAccountService.deleteUser(user.isSuperuser(), id);
        return ResponseEntity.noContent().build();
    }
}
