package com.strata.platform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.strata.database.MigrationService;
import com.strata.platform.config.StrataProperties;
import com.strata.platform.infrastructure.web.CorrelationIdFilter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Boots the full context against an in-memory database.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Platform Application")
class PlatformApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("context loads with the test profile")
    void contextLoads() {
        var props = context.getBean(StrataProperties.class);
        assertThat(props.serviceName()).isEqualTo("platform-service-test");
    }

    @Test
    @DisplayName("schema migrations are applied at startup")
    void migrated() {
        assertThat(context.getBean(MigrationService.class).isUpToDate()).isTrue();
    }

    @Test
    @DisplayName("greeting is public")
    void greeting() throws Exception {
        mockMvc.perform(get("/api/greeting"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Hello from the Strata API"));
    }

    @Test
    @DisplayName("correlation id is echoed on responses")
    void correlationHeader() throws Exception {
        mockMvc.perform(get("/api/greeting").header(CorrelationIdFilter.CORRELATION_ID_HEADER, "boot-1"))
                .andExpect(header().string(CorrelationIdFilter.CORRELATION_ID_HEADER, "boot-1"));
    }

    @Test
    @DisplayName("an unreachable training service degrades health without failing it")
    void health() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("DEGRADED"))
                .andExpect(jsonPath("$.checks.storage.status").value("HEALTHY"))
                .andExpect(jsonPath("$.checks['training-service'].status").value("DEGRADED"));
    }

    @Test
    @DisplayName("actuator health endpoint is available")
    void actuatorHealth() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
    }
}
