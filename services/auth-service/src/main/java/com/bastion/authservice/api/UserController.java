package com.bastion.authservice.api;

import com.bastion.authservice.domain.UserAccountService;
import com.bastion.authservice.infrastructure.web.AuthenticationFilter;
import com.bastion.security.User;
import jakarta.validation.Valid;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * User registration, the current-user view and the password reset flow.
 *
 * <p>PII is logged as {@code field=value;} pairs, which the {@code %redactedMsg} log converter
 * masks.
 */
@RestController
@RequestMapping("/api/v1")
public class UserController {

    private static final Logger log = LoggerFactory.getLogger(UserController.class);

    private final UserAccountService accounts;

    public UserController(UserAccountService accounts) {
        this.accounts = accounts;
    }

    @PostMapping("/users")
    public Map<String, Object> register(@Valid @RequestBody RegistrationRequest request) {
        log.info("Registration request email={};", request.email());
        User user = accounts.register(request.email(), request.password());
        return Map.of("id", user.id(), "email", user.email(), "message", "user created");
    }

    @GetMapping("/users/me")
    public ResponseEntity<Map<String, Object>> me(
            @RequestAttribute(name = AuthenticationFilter.CURRENT_USER_ATTRIBUTE, required = false)
                    User user) {
        if (user == null) {
            return ResponseEntity.status(HttpStatus.FORBIDDEN)
                    .body(Map.of("error", HttpStatus.FORBIDDEN.getReasonPhrase()));
        }
        return ResponseEntity.ok(Map.of("id", user.id(), "email", user.email()));
    }

    @PostMapping("/reset_password")
    public Map<String, String> issueResetToken(@Valid @RequestBody ResetTokenRequest request) {
        log.info("Reset token request email={};", request.email());
        String token = accounts.issueResetToken(request.email());
        return Map.of("email", request.email(), "reset_token", token);
    }

    @PutMapping("/reset_password")
    public Map<String, String> updatePassword(@Valid @RequestBody PasswordUpdateRequest request) {
        accounts.updatePassword(request.email(), request.resetToken(), request.newPassword());
        return Map.of("email", request.email(), "message", "Password updated");
    }
}
