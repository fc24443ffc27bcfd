package com.golden.controlplane.service.governance;

import com.golden.controlplane.dto.GovernanceDecision;
import com.golden.controlplane.dto.GovernanceStatus;
import com.golden.controlplane.exception.ConflictException;
import com.golden.controlplane.exception.ValidationException;
import com.golden.controlplane.model.LearningUpdate;
import com.golden.controlplane.repository.GovernanceRuleRepository;
import com.golden.controlplane.repository.LearningUpdateRepository;
import com.golden.controlplane.testutil.MutableClock;
import com.golden.controlplane.testutil.TestClockConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@Import(TestClockConfig.class)
class GovernanceLimiterTest {

    @Autowired
    private GovernanceLimiter limiter;

    @Autowired
    private GovernanceRuleRepository ruleRepository;

    @Autowired
    private LearningUpdateRepository updateRepository;

    @Autowired
    private MutableClock clock;

    private String role;

    @BeforeEach
    void setUp() {
        role = "role-" + UUID.randomUUID();
    }

    @Test
    void securityRoleNeverAutoUpdates() {
        assertThat(limiter.canAutoUpdate("security")).isFalse();
        assertThat(limiter.evaluate("security").reason()).isEqualTo(GovernanceDecision.Reason.REQUIRES_HUMAN_APPROVAL);
    }

    @Test
    void seededRolesCarryDefaultRules() {
        assertThat(ruleRepository.findById("developer")).get().satisfies(rule -> {
            assertThat(rule.getMaxUpdatesPerDay()).isEqualTo(5);
            assertThat(rule.cooldown()).isEqualTo(Duration.ofHours(2));
            assertThat(rule.isRequiresHumanApproval()).isFalse();
        });
        assertThat(ruleRepository.findById("architect")).get()
                .satisfies(rule -> assertThat(rule.isRequiresHumanApproval()).isTrue());
    }

    @Test
    void dailyCapDeniesSixthUpdate() {
        limiter.defineRule(role, 5, Duration.ZERO, false, "admin");

        for (int i = 0; i < 5; i++) {
            assertThat(limiter.canAutoUpdate(role)).isTrue();
            limiter.recordUpdate(role, "update " + i);
        }

        GovernanceDecision decision = limiter.tryAutoUpdate(role, "sixth");
        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(GovernanceDecision.Reason.DAILY_LIMIT_REACHED);
        assertThat(updateRepository.findById(decision.updateId())).get()
                .extracting(LearningUpdate::getStatus)
                .isEqualTo(LearningUpdate.Status.PENDING_REVIEW);
        assertThat(updateRepository.countByRoleAndStatus(role, LearningUpdate.Status.AUTO_APPLIED)).isEqualTo(5);
    }

    @Test
    void rollingWindowForgetsUpdatesOlderThanADay() {
        limiter.defineRule(role, 2, Duration.ZERO, false, "admin");
        limiter.recordUpdate(role);
        limiter.recordUpdate(role);
        assertThat(limiter.evaluate(role).reason()).isEqualTo(GovernanceDecision.Reason.DAILY_LIMIT_REACHED);

        clock.advance(Duration.ofHours(24).plusSeconds(1));

        assertThat(limiter.canAutoUpdate(role)).isTrue();
    }

    @Test
    void cooldownBlocksUntilItElapses() {
        limiter.defineRule(role, 5, Duration.ofHours(1), false, "admin");
        limiter.recordUpdate(role, "first");

        GovernanceDecision blocked = limiter.evaluate(role);
        assertThat(blocked.reason()).isEqualTo(GovernanceDecision.Reason.COOLDOWN_ACTIVE);
        assertThat(blocked.retryAt()).isEqualTo(clock.instant().plus(Duration.ofHours(1)));

        clock.advance(Duration.ofMinutes(59));
        assertThat(limiter.canAutoUpdate(role)).isFalse();
        clock.advance(Duration.ofMinutes(1));
        assertThat(limiter.canAutoUpdate(role)).isTrue();
    }

    @Test
    void unknownRoleIsDenied() {
        GovernanceDecision decision = limiter.evaluate(role);

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).isEqualTo(GovernanceDecision.Reason.UNKNOWN_ROLE);
        assertThatThrownBy(() -> limiter.evaluate(" ")).isInstanceOf(ValidationException.class);
    }

    @Test
    void recordingForNewRoleCreatesDefaultRule() {
        limiter.recordUpdate(role, "bootstrap");

        assertThat(ruleRepository.findById(role)).get().satisfies(rule -> {
            assertThat(rule.getMaxUpdatesPerDay()).isEqualTo(5);
            assertThat(rule.getLastUpdateAt()).isEqualTo(clock.instant());
        });
        assertThat(limiter.evaluate(role).reason()).isEqualTo(GovernanceDecision.Reason.COOLDOWN_ACTIVE);
    }

    @Test
    void approvalAppliesParkedUpdateWithoutConsumingCap() {
        limiter.defineRule(role, 1, Duration.ZERO, true, "admin");

        GovernanceDecision decision = limiter.tryAutoUpdate(role, "retrain prompts");
        assertThat(decision.reason()).isEqualTo(GovernanceDecision.Reason.REQUIRES_HUMAN_APPROVAL);
        assertThat(limiter.pendingApprovals()).containsEntry(role, 1L);

        LearningUpdate approved = limiter.approve(decision.updateId(), "lead", "looks good");

        assertThat(approved.getStatus()).isEqualTo(LearningUpdate.Status.HUMAN_APPROVED);
        assertThat(approved.getReviewer()).isEqualTo("lead");
        assertThat(limiter.pendingApprovals()).doesNotContainKey(role);
        assertThat(ruleRepository.findById(role)).get()
                .satisfies(rule -> assertThat(rule.getLastUpdateAt()).isEqualTo(clock.instant()));
        assertThat(updateRepository.countByRoleAndStatus(role, LearningUpdate.Status.AUTO_APPLIED)).isZero();
        assertThatThrownBy(() -> limiter.approve(decision.updateId(), "lead", "again"))
                .isInstanceOf(ConflictException.class);
    }

    @Test
    void rejectionClosesPendingUpdate() {
        Long updateId = limiter.submitForApproval(role, "risky change", "agent-7");

        LearningUpdate rejected = limiter.reject(updateId, "lead", "too broad");

        assertThat(rejected.getStatus()).isEqualTo(LearningUpdate.Status.REJECTED);
        assertThat(rejected.getReviewNote()).isEqualTo("too broad");
        assertThatThrownBy(() -> limiter.reject(updateId, "lead", "again")).isInstanceOf(ConflictException.class);
    }

    @Test
    void statusReportsGateStatePerRole() {
        String approvalRole = role + "-approval";
        String cappedRole = role + "-capped";
        String coolingRole = role + "-cooling";
        String openRole = role + "-open";
        limiter.defineRule(approvalRole, 5, Duration.ZERO, true, "admin");
        limiter.defineRule(cappedRole, 1, Duration.ZERO, false, "admin");
        limiter.defineRule(coolingRole, 5, Duration.ofHours(1), false, "admin");
        limiter.defineRule(openRole, 5, Duration.ofHours(1), false, "admin");
        limiter.recordUpdate(cappedRole);
        limiter.recordUpdate(coolingRole);

        List<GovernanceStatus> statuses = limiter.status();

        assertThat(statusOf(statuses, approvalRole)).isEqualTo(GovernanceStatus.REQUIRES_APPROVAL);
        assertThat(statusOf(statuses, cappedRole)).isEqualTo(GovernanceStatus.DAILY_LIMIT_REACHED);
        assertThat(statusOf(statuses, coolingRole)).isEqualTo(GovernanceStatus.COOLDOWN_ACTIVE);
        assertThat(statusOf(statuses, openRole)).isEqualTo(GovernanceStatus.CAN_AUTO_UPDATE);
    }

    @Test
    void concurrentAttemptsNeverExceedCap() throws Exception {
        limiter.defineRule(role, 3, Duration.ZERO, false, "admin");
        int callers = 10;
        ExecutorService executor = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<GovernanceDecision>> futures = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                String description = "attempt " + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return limiter.tryAutoUpdate(role, description);
                }));
            }
            start.countDown();
            List<GovernanceDecision> decisions = new ArrayList<>();
            for (Future<GovernanceDecision> future : futures) {
                decisions.add(future.get(30, TimeUnit.SECONDS));
            }

            assertThat(decisions).filteredOn(GovernanceDecision::allowed).hasSize(3);
            assertThat(updateRepository.countByRoleAndStatus(role, LearningUpdate.Status.AUTO_APPLIED)).isEqualTo(3);
            assertThat(updateRepository.countByRoleAndStatus(role, LearningUpdate.Status.PENDING_REVIEW)).isEqualTo(7);
        } finally {
            executor.shutdownNow();
        }
    }

    private static String statusOf(List<GovernanceStatus> statuses, String role) {
        return statuses.stream()
                .filter(s -> s.role().equals(role))
                .map(GovernanceStatus::status)
                .findFirst()
                .orElseThrow();
    }
}
