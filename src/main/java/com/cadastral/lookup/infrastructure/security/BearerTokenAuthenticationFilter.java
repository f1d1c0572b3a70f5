package com.cadastral.lookup.infrastructure.security;

import com.cadastral.lookup.application.port.out.UserRepository;
import com.cadastral.lookup.domain.model.User;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Authenticates protected endpoints with a Bearer access token.
 *
 * On success the caller is stored under {@link AuthenticatedUser#REQUEST_ATTRIBUTE};
 * otherwise the request is answered with 401 and a JSON error body.
 */
@Component
public class BearerTokenAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(BearerTokenAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private static final List<String> PROTECTED_PATHS = List.of("/query", "/history", "/result", "/users");

    private final JwtTokenService jwtTokenService;
    private final UserRepository userRepository;
    private final ObjectMapper objectMapper;

    public BearerTokenAuthenticationFilter(
        JwtTokenService jwtTokenService,
        UserRepository userRepository,
        ObjectMapper objectMapper
    ) {
        this.jwtTokenService = jwtTokenService;
        this.userRepository = userRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI().substring(request.getContextPath().length());
        return PROTECTED_PATHS.stream()
            .noneMatch(prefix -> path.equals(prefix) || path.startsWith(prefix + "/"));
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain
    ) throws ServletException, IOException {

        String authHeader = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            logger.warn("Missing or invalid Authorization header for {} {}", request.getMethod(), request.getRequestURI());
            sendUnauthorized(response, "Missing or invalid Authorization header");
            return;
        }

        String token = authHeader.substring(BEARER_PREFIX.length()).trim();
        Optional<User> user = jwtTokenService.parseUserId(token).flatMap(userRepository::findById);

        if (user.isEmpty() || !user.get().isActive()) {
            logger.warn("Rejected bearer token for {} {}", request.getMethod(), request.getRequestURI());
            sendUnauthorized(response, "Invalid token");
            return;
        }

        request.setAttribute(AuthenticatedUser.REQUEST_ATTRIBUTE, AuthenticatedUser.of(user.get()));
        filterChain.doFilter(request, response);
    }

    private void sendUnauthorized(HttpServletResponse response, String detail) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());

        Map<String, String> errorBody = Map.of(
            "error", "UNAUTHORIZED",
            "detail", detail
        );

        response.getWriter().write(objectMapper.writeValueAsString(errorBody));
    }
}
