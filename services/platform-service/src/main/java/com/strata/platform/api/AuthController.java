package com.strata.platform.api;

import com.strata.platform.api.dto.LoginRequest;
import com.strata.platform.api.dto.LoginResponse;
import com.strata.platform.api.dto.MeResponse;
import com.strata.platform.api.dto.UserProfile;
import com.strata.platform.application.AuthService;
import com.strata.security.Principal;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/auth/login")
    public LoginResponse login(@Valid @RequestBody LoginRequest request) {
        AuthService.LoginResult result = authService.login(request.email(), request.password());
        return new LoginResponse(result.token(), UserProfile.from(result.user()));
    }

    @GetMapping("/users/me")
    public MeResponse me(Principal principal) {
        return MeResponse.from(principal);
    }
}
