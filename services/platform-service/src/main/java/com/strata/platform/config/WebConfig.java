package com.strata.platform.config;

import com.strata.platform.infrastructure.web.SessionPrincipalResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for the browser front end and session principal resolution.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final StrataProperties properties;
    private final SessionPrincipalResolver sessionPrincipalResolver;

    public WebConfig(StrataProperties properties, SessionPrincipalResolver sessionPrincipalResolver) {
        this.properties = properties;
        this.sessionPrincipalResolver = sessionPrincipalResolver;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping("/api/**")
                .allowedOrigins(properties.cors().allowedOrigins().toArray(String[]::new))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "PATCH", "OPTIONS")
                .allowedHeaders("*")
                .allowCredentials(true)
                .maxAge(3600);
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(sessionPrincipalResolver);
    }
}
