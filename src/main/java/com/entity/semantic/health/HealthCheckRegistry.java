package com.entity.semantic.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs registered health checks and folds them into one status: the worst one wins.
 * A check that throws counts as DOWN.
 */
public class HealthCheckRegistry {
    private static final Logger log = LoggerFactory.getLogger(HealthCheckRegistry.class);

    private final List<HealthCheck> checks = new CopyOnWriteArrayList<>();

    public void register(HealthCheck check) {
        if (check != null) {
            checks.add(check);
        }
    }

    public HealthStatus checkAll() {
        if (checks.isEmpty()) {
            return HealthStatus.up("No health checks registered");
        }

        HealthStatus worst = HealthStatus.up();
        String worstName = null;
        Map<String, Object> results = new LinkedHashMap<>();
        for (HealthCheck check : checks) {
            HealthStatus result = run(check);
            results.put(check.getName(), Map.of(
                    "status", result.status().name(),
                    "message", String.valueOf(result.message()),
                    "details", result.details()));
            if (worst.isBetterThan(result)) {
                worst = result;
                worstName = check.getName();
            }
        }

        HealthStatus aggregate = new HealthStatus(worst.status(),
                worstName == null ? "OK" : worstName + ": " + worst.message(), Map.of());
        for (Map.Entry<String, Object> entry : results.entrySet()) {
            aggregate = aggregate.withDetail(entry.getKey(), entry.getValue());
        }
        return aggregate;
    }

    private static HealthStatus run(HealthCheck check) {
        try {
            HealthStatus status = check.check();
            return status != null ? status : HealthStatus.down("Check returned no status");
        } catch (RuntimeException e) {
            log.warn("health.check_failed check={} error={}", check.getName(), e.toString());
            return HealthStatus.down("Check failed: " + e.getMessage());
        }
    }

    public int size() {
        return checks.size();
    }
}
