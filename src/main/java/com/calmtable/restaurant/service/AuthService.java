package com.calmtable.restaurant.service;

import com.calmtable.restaurant.dto.AuthResponse;
import com.calmtable.restaurant.dto.LoginRequest;
import com.calmtable.restaurant.dto.ProfileUpdateRequest;
import com.calmtable.restaurant.dto.RegisterRequest;
import com.calmtable.restaurant.dto.UserDto;
import com.calmtable.restaurant.exception.AuthenticationRequiredException;
import com.calmtable.restaurant.exception.ValidationException;
import com.calmtable.restaurant.model.User;
import com.calmtable.restaurant.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;

@Service
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;
    private final CallerResolver callerResolver;
    private final Clock clock;

    public AuthService(UserRepository userRepository, PasswordEncoder passwordEncoder, JwtService jwtService,
                       CallerResolver callerResolver, Clock clock) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtService = jwtService;
        this.callerResolver = callerResolver;
        this.clock = clock;
    }

    /** Self-registration always creates a customer account; staff accounts are provisioned separately. */
    @Transactional
    public AuthResponse register(RegisterRequest request) {
        String email = request.getEmail().trim().toLowerCase();
        if (userRepository.existsByEmailIgnoreCase(email)) {
            throw new ValidationException("An account with this email already exists");
        }

        User user = new User();
        user.setEmail(email);
        user.setPassword(passwordEncoder.encode(request.getPassword()));
        user.setFirstName(request.getFirstName());
        user.setLastName(request.getLastName());
        user.setPhone(request.getPhone());
        user.setRole(User.ROLE_CUSTOMER);
        user.setActive(true);
        user.setCreatedAt(LocalDateTime.now(clock));

        User savedUser = userRepository.save(user);
        logger.info("[AuthService] Registered customer {}", savedUser.getId());
        String token = jwtService.generateToken(savedUser.getId(), savedUser.getEmail(), savedUser.getRole());
        return new AuthResponse("User registered successfully", token, UserDto.from(savedUser));
    }

    public AuthResponse login(LoginRequest request) {
        User user = userRepository.findByEmailIgnoreCase(request.getEmail().trim())
                .orElseThrow(() -> new AuthenticationRequiredException("Invalid credentials"));

        if (!passwordEncoder.matches(request.getPassword(), user.getPassword())) {
            throw new AuthenticationRequiredException("Invalid credentials");
        }
        if (!Boolean.TRUE.equals(user.getActive())) {
            throw new AuthenticationRequiredException("Account is disabled");
        }

        String token = jwtService.generateToken(user.getId(), user.getEmail(), user.getRole());
        return new AuthResponse("Login successful", token, UserDto.from(user));
    }

    public UserDto me(Long callerId) {
        return UserDto.from(callerResolver.requireUser(callerId));
    }

    /** E-mail and role are not editable here. */
    @Transactional
    public UserDto updateProfile(Long callerId, ProfileUpdateRequest request) {
        User user = callerResolver.requireUser(callerId);
        if (request.getFirstName() != null) {
            user.setFirstName(request.getFirstName().trim());
        }
        if (request.getLastName() != null) {
            user.setLastName(request.getLastName().trim());
        }
        if (request.getPhone() != null) {
            user.setPhone(request.getPhone().trim());
        }
        User saved = userRepository.save(user);
        logger.info("[AuthService] Updated profile of user {}", saved.getId());
        return UserDto.from(saved);
    }
}
