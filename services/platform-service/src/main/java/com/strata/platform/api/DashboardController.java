package com.strata.platform.api;

import com.strata.platform.api.dto.AnalyticsResponse;
import com.strata.platform.application.AnalyticsService;
import com.strata.platform.application.StatsService;
import com.strata.security.Principal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class DashboardController {

    private final StatsService statsService;
    private final AnalyticsService analyticsService;

    public DashboardController(StatsService statsService, AnalyticsService analyticsService) {
        this.statsService = statsService;
        this.analyticsService = analyticsService;
    }

    @GetMapping("/stats")
    public StatsService.DashboardStats stats(Principal principal) {
        return statsService.stats(principal);
    }

    @GetMapping("/analytics")
    public AnalyticsResponse analytics(Principal principal) {
        return AnalyticsResponse.from(analyticsService.analytics(principal));
    }
}
