package com.strata.platform.api;

import com.strata.platform.api.dto.CreateClientRequest;
import com.strata.platform.application.TenantService;
import com.strata.platform.domain.Tenant;
import com.strata.platform.domain.TenantOption;
import com.strata.security.Principal;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Tenants are called clients on the wire.
 */
@RestController
@RequestMapping("/api")
public class ClientController {

    private final TenantService tenantService;

    public ClientController(TenantService tenantService) {
        this.tenantService = tenantService;
    }

    @GetMapping("/public/clients/search")
    public List<TenantOption> searchPublic(@RequestParam("q") String query) {
        return tenantService.searchPublic(query);
    }

    @GetMapping("/clients/search")
    public List<TenantOption> search(Principal principal, @RequestParam("q") String query) {
        return tenantService.search(principal, query);
    }

    @PostMapping("/clients")
    @ResponseStatus(HttpStatus.CREATED)
    public Tenant create(Principal principal, @Valid @RequestBody CreateClientRequest request) {
        return tenantService.create(principal, new TenantService.CreateTenantCommand(
                request.name(), request.clientType(), request.contractDurationDays()));
    }
}
