package com.strata.platform.api;

import com.strata.platform.api.dto.CreateUserRequest;
import com.strata.platform.api.dto.UserProfile;
import com.strata.platform.application.UserService;
import com.strata.security.Principal;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class UserController {

    private final UserService userService;

    public UserController(UserService userService) {
        this.userService = userService;
    }

    @PostMapping("/users")
    @ResponseStatus(HttpStatus.CREATED)
    public UserProfile create(Principal principal, @Valid @RequestBody CreateUserRequest request) {
        var command = new UserService.CreateUserCommand(
                request.email(),
                request.password(),
                request.role(),
                request.clientId(),
                request.status(),
                request.accessLevel());
        return UserProfile.from(userService.create(principal, command));
    }

    @GetMapping("/company/users")
    public List<UserProfile> list(Principal principal) {
        return userService.list(principal).stream().map(UserProfile::from).toList();
    }
}
