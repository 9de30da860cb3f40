package com.calmtable.restaurant.controller;

import com.calmtable.restaurant.dto.AuthResponse;
import com.calmtable.restaurant.dto.LoginRequest;
import com.calmtable.restaurant.dto.ProfileUpdateRequest;
import com.calmtable.restaurant.dto.RegisterRequest;
import com.calmtable.restaurant.dto.UserDto;
import com.calmtable.restaurant.service.AuthService;
import com.calmtable.restaurant.util.AuthenticationUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(authService.register(request));
    }

    @PostMapping("/login")
    public ResponseEntity<AuthResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(authService.login(request));
    }

    @GetMapping("/me")
    public ResponseEntity<UserDto> me(Authentication authentication) {
        return ResponseEntity.ok(authService.me(AuthenticationUtils.callerId(authentication)));
    }

    @PatchMapping("/me")
    public ResponseEntity<UserDto> updateProfile(Authentication authentication,
                                                 @Valid @RequestBody ProfileUpdateRequest request) {
        return ResponseEntity.ok(authService.updateProfile(AuthenticationUtils.callerId(authentication), request));
    }
}
