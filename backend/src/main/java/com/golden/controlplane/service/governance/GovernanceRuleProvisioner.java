package com.golden.controlplane.service.governance;

import com.golden.controlplane.config.ControlPlaneProperties;
import com.golden.controlplane.model.GovernanceRule;
import com.golden.controlplane.repository.GovernanceRuleRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Inserts a rule with the configured defaults for a role first seen through {@code recordUpdate}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class GovernanceRuleProvisioner {

    private final GovernanceRuleRepository ruleRepository;
    private final ControlPlaneProperties properties;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public GovernanceRule createDefault(String role) {
        ControlPlaneProperties.Governance defaults = properties.getGovernance();
        Instant now = Instant.now(clock);
        GovernanceRule rule = ruleRepository.saveAndFlush(GovernanceRule.builder()
                .role(role)
                .maxUpdatesPerDay(defaults.getDefaultMaxUpdatesPerDay())
                .cooldownSeconds(defaults.getDefaultCooldown().toSeconds())
                .requiresHumanApproval(defaults.isDefaultRequiresHumanApproval())
                .createdAt(now)
                .updatedAt(now)
                .build());
        log.info("Created default governance rule for role {}", role);
        return rule;
    }
}
