package com.elis.analysis.service;

import com.elis.analysis.dto.AuthResponse;
import com.elis.analysis.dto.LoginRequest;
import com.elis.analysis.dto.RegisterRequest;
import com.elis.analysis.model.User;
import com.elis.analysis.repository.UserRepository;
import com.elis.analysis.security.JwtUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

import java.time.Instant;
import java.util.Map;

@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtUtil jwtUtil;

    @Value("${jwt.expiration-ms:3600000}")
    private long expirationMs;

    public AuthService(UserRepository userRepository,
                       PasswordEncoder passwordEncoder,
                       JwtUtil jwtUtil) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtUtil = jwtUtil;
    }

    @Transactional
    public AuthResponse register(RegisterRequest request) {
        if (userRepository.existsByUsernameOrEmail(request.username(), request.email())) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "Username or email already registered");
        }

        var user = new User(request.username(), request.email(), passwordEncoder.encode(request.password()));
        user = userRepository.save(user);
        log.info("Registered user {}", user.getId());

        return generateTokenResponse(user);
    }

    @Transactional
    public AuthResponse login(LoginRequest request) {
        if (request.identifier() == null || request.password() == null) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid credentials");
        }
        var user = userRepository.findByUsernameOrEmail(request.identifier(), request.identifier())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid credentials"));

        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Invalid credentials");
        }

        user.setLastLoginAt(Instant.now());
        return generateTokenResponse(user);
    }

    private AuthResponse generateTokenResponse(User user) {
        String token = jwtUtil.generate(
                user.getId().toString(),
                Map.of("username", user.getUsername(), "email", user.getEmail())
        );
        return AuthResponse.of(token, expirationMs, user.getUsername());
    }
}
