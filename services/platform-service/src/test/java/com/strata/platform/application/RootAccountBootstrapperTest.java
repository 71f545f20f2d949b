package com.strata.platform.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.strata.platform.config.StrataProperties;
import com.strata.platform.domain.AccountStatus;
import com.strata.platform.domain.UserAccount;
import com.strata.platform.persistence.UserRepository;
import com.strata.security.AccessLevel;
import com.strata.security.Role;
import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.security.crypto.password.PasswordEncoder;

@DisplayName("RootAccountBootstrapper")
class RootAccountBootstrapperTest {

    private final UserRepository users = mock(UserRepository.class);
    private final PasswordEncoder passwordEncoder = mock(PasswordEncoder.class);

    private RootAccountBootstrapper bootstrapper(boolean enabled) {
        var properties = new StrataProperties(
                null,
                new StrataProperties.Session("x".repeat(40), null, null),
                new StrataProperties.Training("http://training", null, null),
                new StrataProperties.Bootstrap(enabled, "root@strata.test", "admin"),
                null);
        return new RootAccountBootstrapper(users, passwordEncoder, properties, Clock.systemUTC());
    }

    @Test
    @DisplayName("creates a tenantless Root account when missing")
    void creates() {
        when(users.findByEmail("root@strata.test")).thenReturn(Optional.empty());
        when(passwordEncoder.encode("admin")).thenReturn("hashed");

        assertThat(bootstrapper(true).ensureRootAccount()).isTrue();

        var captor = ArgumentCaptor.forClass(UserAccount.class);
        verify(users).insert(captor.capture());
        assertThat(captor.getValue().role()).isEqualTo(Role.ROOT);
        assertThat(captor.getValue().tenantId()).isNull();
        assertThat(captor.getValue().credentialHash()).isEqualTo("hashed");
    }

    @Test
    @DisplayName("leaves an existing account alone")
    void existing() {
        when(users.findByEmail("root@strata.test")).thenReturn(Optional.of(new UserAccount(
                UUID.randomUUID(), null, "root@strata.test", "hash",
                Role.ROOT, AccountStatus.ACTIVE, AccessLevel.READ_WRITE, OffsetDateTime.now())));

        assertThat(bootstrapper(true).ensureRootAccount()).isFalse();
        verify(users, never()).insert(any());
    }

    @Test
    @DisplayName("does nothing when disabled")
    void disabled() {
        assertThat(bootstrapper(false).ensureRootAccount()).isFalse();
        verify(users, never()).findByEmail(any());
    }
}
