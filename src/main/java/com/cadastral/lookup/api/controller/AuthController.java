package com.cadastral.lookup.api.controller;

import com.cadastral.lookup.api.dto.RegisterRequestDto;
import com.cadastral.lookup.api.dto.TokenResponseDto;
import com.cadastral.lookup.api.dto.UserResponseDto;
import com.cadastral.lookup.application.mapper.UserMapper;
import com.cadastral.lookup.application.service.AuthenticationService;
import com.cadastral.lookup.application.service.UserAccountService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * Registration and token issuance. These endpoints are public.
 */
@RestController
@RequestMapping("/auth")
public class AuthController {

    private final UserAccountService userAccountService;
    private final AuthenticationService authenticationService;
    private final UserMapper userMapper;

    public AuthController(
            UserAccountService userAccountService,
            AuthenticationService authenticationService,
            UserMapper userMapper) {
        this.userAccountService = userAccountService;
        this.authenticationService = authenticationService;
        this.userMapper = userMapper;
    }

    @PostMapping("/register")
    public ResponseEntity<UserResponseDto> register(@Valid @RequestBody RegisterRequestDto request) {
        UserResponseDto user = userMapper.toDto(userAccountService.register(request.getEmail(), request.getPassword()));
        return ResponseEntity.status(HttpStatus.CREATED).body(user);
    }

    /**
     * POST /auth/jwt/login with form fields {@code username} (the email) and {@code password}.
     */
    @PostMapping(value = "/jwt/login", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public ResponseEntity<TokenResponseDto> login(
            @RequestParam("username") String username,
            @RequestParam("password") String password) {
        return ResponseEntity.ok(authenticationService.login(username, password));
    }
}
