package com.strata.platform.api;

import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Unauthenticated liveness endpoint.
 */
@RestController
@RequestMapping("/api")
public class GreetingController {

    static final String GREETING = "Hello from the Strata API";

    @GetMapping("/greeting")
    public Map<String, String> greeting() {
        return Map.of("message", GREETING);
    }
}
