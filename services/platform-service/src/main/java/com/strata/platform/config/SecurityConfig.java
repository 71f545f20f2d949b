package com.strata.platform.config;

import com.strata.security.SessionCodec;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.argon2.Argon2PasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Credential hashing and session token signing.
 */
@Configuration
public class SecurityConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public SessionCodec sessionCodec(StrataProperties properties, Clock clock) {
        StrataProperties.Session session = properties.session();
        return new SessionCodec(session.secret(), session.issuer(), clock);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new Argon2PasswordEncoder(16, 32, 1, 64 * 1024, 3);
    }
}
