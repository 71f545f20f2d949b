package com.strata.platform.application;

import com.strata.platform.config.StrataProperties;
import com.strata.platform.domain.UserAccount;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.UserRepository;
import com.strata.security.SessionCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

/**
 * Email and password login.
 *
 * <p>Unknown email and wrong password share one message. A disabled account is reported as such.
 */
@Service
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    static final String INVALID_CREDENTIALS = "Invalid credentials";
    static final String ACCOUNT_DISABLED = "Account disabled by administrator";

    /** Issued session plus the account it belongs to. */
    public record LoginResult(String token, UserAccount user) {}

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final SessionCodec sessionCodec;
    private final StrataProperties properties;

    public AuthService(
            UserRepository users,
            PasswordEncoder passwordEncoder,
            SessionCodec sessionCodec,
            StrataProperties properties) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
        this.sessionCodec = sessionCodec;
        this.properties = properties;
    }

    public LoginResult login(String email, String password) {
        UserAccount user = users.findByEmail(email)
                .orElseThrow(() -> PlatformException.authError(INVALID_CREDENTIALS));

        if (user.isDisabled()) {
            log.warn("Login attempt on disabled account {}", user.id());
            throw PlatformException.authError(ACCOUNT_DISABLED);
        }
        if (!passwordEncoder.matches(password, user.credentialHash())) {
            throw PlatformException.authError(INVALID_CREDENTIALS);
        }

        String token = sessionCodec.issue(user.toPrincipal(), properties.session().ttl());
        log.info("User {} logged in as {}", user.id(), user.role().value());
        return new LoginResult(token, user);
    }
}
