package com.invoice.mapping.service;

import com.invoice.mapping.entity.Forwarder;
import com.invoice.mapping.entity.MappingRule;
import com.invoice.mapping.repository.ForwarderRepository;
import com.invoice.mapping.repository.MappingRuleRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@Slf4j
public class RuleCatalogService {

    public static final String RULES_CACHE = "activeRules";
    public static final String FORWARDERS_CACHE = "activeForwarders";

    private final MappingRuleRepository ruleRepo;
    private final ForwarderRepository forwarderRepo;

    public RuleCatalogService(MappingRuleRepository ruleRepo,
                              ForwarderRepository forwarderRepo) {
        this.ruleRepo = ruleRepo;
        this.forwarderRepo = forwarderRepo;
    }

    /**
     * Active rules of the forwarder plus active universal rules. A null
     * forwarder yields universal rules only.
     */
    // Cached: rules only change through operator edits, followed by an eviction
    @Cacheable(value = RULES_CACHE, key = "#forwarderCode == null ? '<universal>' : #forwarderCode")
    public List<MappingRule> getActiveRules(String forwarderCode) {
        List<MappingRule> rules = forwarderCode == null
                ? ruleRepo.findByForwarderCodeIsNullAndActiveTrue()
                : ruleRepo.findActiveForForwarder(forwarderCode);
        log.info("Loaded {} active rules for forwarder {}", rules.size(),
                forwarderCode == null ? "<universal>" : forwarderCode);
        return List.copyOf(rules);
    }

    @Cacheable(value = FORWARDERS_CACHE)
    public List<Forwarder> getActiveForwarders() {
        List<Forwarder> forwarders = forwarderRepo.findByStatusOrderByPriorityDesc(Forwarder.ForwarderStatus.ACTIVE);
        log.info("Loaded {} active forwarders", forwarders.size());
        return List.copyOf(forwarders);
    }

    // Call this after any change to the rule or forwarder tables
    @CacheEvict(value = {RULES_CACHE, FORWARDERS_CACHE}, allEntries = true)
    public void invalidateCache() {
        log.info("Invalidating rule catalog cache");
    }
}
