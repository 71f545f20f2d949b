package com.strata.platform.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.strata.platform.config.StrataProperties;
import com.strata.platform.domain.AccountStatus;
import com.strata.platform.domain.UserAccount;
import com.strata.platform.error.ErrorKind;
import com.strata.platform.error.PlatformException;
import com.strata.platform.persistence.UserRepository;
import com.strata.security.AccessLevel;
import com.strata.security.Role;
import com.strata.security.SessionCodec;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.password.PasswordEncoder;

@DisplayName("AuthService")
class AuthServiceTest {

    private static final String SECRET = "unit-test-secret-that-is-long-enough-0123456789";

    private UserRepository users;
    private PasswordEncoder passwordEncoder;
    private SessionCodec sessionCodec;
    private AuthService authService;

    @BeforeEach
    void setUp() {
        users = mock(UserRepository.class);
        passwordEncoder = mock(PasswordEncoder.class);
        sessionCodec = new SessionCodec(SECRET, "strata");
        var properties = new StrataProperties(
                null,
                new StrataProperties.Session(SECRET, null, null),
                new StrataProperties.Training("http://training", null, null),
                new StrataProperties.Bootstrap(false, "root@strata.test", "x"),
                null);
        authService = new AuthService(users, passwordEncoder, sessionCodec, properties);
    }

    private UserAccount account(AccountStatus status) {
        return new UserAccount(
                UUID.randomUUID(), UUID.randomUUID(), "ana@acme.test", "hash",
                Role.USER, status, AccessLevel.READ_ONLY, OffsetDateTime.now());
    }

    @Test
    @DisplayName("issues a token carrying the account's principal")
    void success() {
        var user = account(AccountStatus.ACTIVE);
        when(users.findByEmail("ana@acme.test")).thenReturn(Optional.of(user));
        when(passwordEncoder.matches("pw", "hash")).thenReturn(true);

        var result = authService.login("ana@acme.test", "pw");

        assertThat(result.user()).isEqualTo(user);
        assertThat(sessionCodec.verify(result.token())).isEqualTo(user.toPrincipal());
    }

    @Test
    @DisplayName("unknown email and wrong password are indistinguishable")
    void invalidCredentials() {
        when(users.findByEmail(anyString())).thenReturn(Optional.empty());
        assertThatThrownBy(() -> authService.login("ghost@acme.test", "pw"))
                .isInstanceOf(PlatformException.class)
                .hasMessage(AuthService.INVALID_CREDENTIALS);

        when(users.findByEmail("ana@acme.test")).thenReturn(Optional.of(account(AccountStatus.ACTIVE)));
        when(passwordEncoder.matches("bad", "hash")).thenReturn(false);
        assertThatThrownBy(() -> authService.login("ana@acme.test", "bad"))
                .isInstanceOf(PlatformException.class)
                .hasMessage(AuthService.INVALID_CREDENTIALS)
                .satisfies(e -> assertThat(((PlatformException) e).kind()).isEqualTo(ErrorKind.AUTH_ERROR));
    }

    @Test
    @DisplayName("a disabled account is reported before the password is checked")
    void disabled() {
        when(users.findByEmail("ana@acme.test")).thenReturn(Optional.of(account(AccountStatus.DISABLED)));

        assertThatThrownBy(() -> authService.login("ana@acme.test", "whatever"))
                .isInstanceOf(PlatformException.class)
                .hasMessage(AuthService.ACCOUNT_DISABLED);
        verify(passwordEncoder, never()).matches(anyString(), anyString());
    }
}
