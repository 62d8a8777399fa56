package com.axiom.gateway.domain.budget;

import com.axiom.eventmodel.EntityType;
import com.axiom.eventmodel.EventEntity;
import com.axiom.eventmodel.EventType;
import com.axiom.eventmodel.payload.UsageRecordedPayload;
import com.axiom.gateway.domain.error.PersistenceException;
import com.axiom.gateway.domain.error.ResourceNotFoundException;
import com.axiom.gateway.domain.error.ValidationException;
import com.axiom.gateway.domain.event.DomainEvents;
import com.axiom.gateway.domain.event.EventPublisher;
import com.axiom.observability.MetricFactory;
import io.micrometer.core.instrument.Counter;
import java.math.BigDecimal;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks project budgets before cost-incurring work and records actual spend afterwards.
 *
 * <p>Usage only ever grows: increments are applied by the store in one statement and negative
 * costs are rejected. The audit trail is best effort, a failed audit insert never fails the
 * usage update it describes.
 *
 * <p>When the budget row cannot be read and {@code failOpen} is set, the check falls back to
 * the default limit with zero usage. A missing project is always an error.
 */
public class BudgetGuard {

    private static final Logger log = LoggerFactory.getLogger(BudgetGuard.class);

    public static final String FAIL_OPEN_REASON = "budget unavailable, default limit applied";

    private final BudgetRepository repository;
    private final EventPublisher events;
    private final BigDecimal defaultLimit;
    private final boolean failOpen;
    private final Clock clock;
    private final MetricFactory metrics;
    private final Counter usageRecorded;

    public BudgetGuard(BudgetRepository repository, EventPublisher events, MetricFactory metrics,
                       BigDecimal defaultLimit, boolean failOpen, Clock clock) {
        this.repository = repository;
        this.events = events;
        this.defaultLimit = defaultLimit;
        this.failOpen = failOpen;
        this.clock = clock;
        this.metrics = metrics;
        this.usageRecorded = metrics.counter("axiom.budget.usage.recorded", "Usage increments applied to project budgets");
    }

    /**
     * @throws ResourceNotFoundException if the project does not exist
     * @throws PersistenceException if the read fails and fail-open is disabled
     */
    public BudgetStatus checkBudget(UUID projectId, BigDecimal estimatedCost) {
        ProjectBudget budget;
        try {
            budget = repository.findBudget(projectId)
                    .orElseThrow(() -> new ResourceNotFoundException("project", projectId));
        } catch (PersistenceException e) {
            if (!failOpen) {
                throw e;
            }
            log.warn("Failed to read budget for project {}, falling back to default limit {}",
                    projectId, defaultLimit, e);
            boolean allowed = defaultLimit.compareTo(estimatedCost) >= 0;
            return new BudgetStatus(allowed, defaultLimit, allowed ? FAIL_OPEN_REASON : BudgetStatus.INSUFFICIENT);
        }

        BigDecimal remaining = budget.effectiveLimit(defaultLimit).subtract(budget.currentUsage());
        if (remaining.compareTo(estimatedCost) < 0) {
            log.info("Budget exceeded for project {}: limit={}, usage={}, estimated={}",
                    projectId, budget.effectiveLimit(defaultLimit), budget.currentUsage(), estimatedCost);
            return new BudgetStatus(false, remaining, BudgetStatus.INSUFFICIENT);
        }
        return new BudgetStatus(true, remaining, BudgetStatus.SUFFICIENT);
    }

    /**
     * Adds {@code cost} to the project's usage and appends an audit entry.
     *
     * @throws ValidationException if the cost is negative
     * @throws ResourceNotFoundException if the project does not exist
     * @throws PersistenceException if the usage update fails
     */
    public void recordUsage(UUID projectId, UUID userId, BigDecimal cost, String operationType,
                            UsageDetails details) {
        if (cost == null || cost.signum() < 0) {
            throw new ValidationException("cost must not be negative", Map.of("cost", String.valueOf(cost)));
        }
        int updated = repository.incrementUsage(projectId, cost);
        if (updated == 0) {
            throw new ResourceNotFoundException("project", projectId);
        }
        usageRecorded.increment();
        metrics.amounts("axiom.budget.spend", "Spend recorded against project budgets", "usd",
                "operation", String.valueOf(operationType)).record(cost.doubleValue());

        var entry = new UsageLogEntry(UUID.randomUUID(), projectId, userId, cost, operationType,
                details != null ? details : UsageDetails.empty(), clock.instant());
        try {
            repository.insertUsageLog(entry);
        } catch (RuntimeException e) {
            log.error("Failed to write usage log for project {} ({} {})", projectId, operationType, cost, e);
        }

        events.publish(DomainEvents.of(EventType.USAGE_RECORDED, projectId,
                EventEntity.of(EntityType.PROJECT, projectId.toString(), 0),
                new UsageRecordedPayload(userId.toString(), cost, operationType), clock));
    }

    /** Budget figures for display. */
    public BudgetSummary summary(UUID projectId) {
        ProjectBudget budget = repository.findBudget(projectId)
                .orElseThrow(() -> new ResourceNotFoundException("project", projectId));
        BigDecimal limit = budget.effectiveLimit(defaultLimit);
        return new BudgetSummary(projectId, limit, budget.currentUsage(),
                limit.subtract(budget.currentUsage()), budget.budgetLimit() == null);
    }

    /** Recent audit entries, newest first. */
    public List<UsageLogEntry> usageHistory(UUID projectId, int limit) {
        if (limit <= 0) {
            throw new ValidationException("limit must be positive");
        }
        return repository.findUsageLogs(projectId, limit);
    }

    public BigDecimal defaultLimit() {
        return defaultLimit;
    }

    public boolean failOpen() {
        return failOpen;
    }
}
