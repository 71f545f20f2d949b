package com.strata.platform.application;

import com.strata.platform.config.StrataProperties;
import com.strata.platform.domain.AccountStatus;
import com.strata.platform.domain.UserAccount;
import com.strata.platform.persistence.UserRepository;
import com.strata.security.AccessLevel;
import com.strata.security.Role;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * Creates the configured Root account on startup when no account with its email exists.
 */
@Component
public class RootAccountBootstrapper implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(RootAccountBootstrapper.class);

    private final UserRepository users;
    private final PasswordEncoder passwordEncoder;
    private final StrataProperties properties;
    private final Clock clock;

    public RootAccountBootstrapper(
            UserRepository users, PasswordEncoder passwordEncoder, StrataProperties properties, Clock clock) {
        this.users = users;
        this.passwordEncoder = passwordEncoder;
        this.properties = properties;
        this.clock = clock;
    }

    @Override
    public void run(ApplicationArguments args) {
        ensureRootAccount();
    }

    /**
     * @return true if an account was created
     */
    public boolean ensureRootAccount() {
        StrataProperties.Bootstrap bootstrap = properties.bootstrap();
        if (!bootstrap.enabled()) {
            return false;
        }
        if (users.findByEmail(bootstrap.rootEmail()).isPresent()) {
            return false;
        }
        users.insert(new UserAccount(
                UUID.randomUUID(),
                null,
                bootstrap.rootEmail(),
                passwordEncoder.encode(bootstrap.rootPassword()),
                Role.ROOT,
                AccountStatus.ACTIVE,
                AccessLevel.READ_WRITE,
                OffsetDateTime.now(clock)));
        log.info("Created Root account {}", bootstrap.rootEmail());
        return true;
    }
}
