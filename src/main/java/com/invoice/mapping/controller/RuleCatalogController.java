package com.invoice.mapping.controller;

import com.invoice.mapping.service.RuleCatalogService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/rules")
public class RuleCatalogController {

    private final RuleCatalogService catalogService;

    public RuleCatalogController(RuleCatalogService catalogService) {
        this.catalogService = catalogService;
    }

    // Operators call this after editing rules or forwarders
    @PostMapping("/cache/evict")
    public ResponseEntity<Void> evict() {
        catalogService.invalidateCache();
        return ResponseEntity.noContent().build();
    }
}
