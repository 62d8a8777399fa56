package com.axiom.gateway.domain.budget;

import com.axiom.gateway.domain.error.PersistenceException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Port for project budget state and the usage audit trail. Implementations translate store
 * failures into {@link PersistenceException}.
 */
public interface BudgetRepository {

    Optional<ProjectBudget> findBudget(UUID projectId);

    /**
     * Adds {@code cost} to the project's usage in a single atomic statement.
     *
     * @return number of rows updated, zero when the project does not exist
     */
    int incrementUsage(UUID projectId, BigDecimal cost);

    void insertUsageLog(UsageLogEntry entry);

    /** Most recent entries first. */
    List<UsageLogEntry> findUsageLogs(UUID projectId, int limit);
}
