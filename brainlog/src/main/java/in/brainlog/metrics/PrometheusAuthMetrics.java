package in.brainlog.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Prometheus implementation of AuthMetrics.
 *
 * Metrics:
 * - auth_logins_total{outcome}
 * - auth_lockouts_total
 * - auth_authorization_decisions_total{path_class, decision}
 * - auth_audit_write_failures_total
 * - auth_password_verify_seconds
 *
 * Scraped through {@link PrometheusMetricsHandler} at /metrics.
 */
public class PrometheusAuthMetrics implements AuthMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusAuthMetrics.class);

    private final CollectorRegistry registry;

    private final Counter loginCounter;
    private final Counter lockoutCounter;
    private final Counter authorizationCounter;
    private final Counter auditFailureCounter;
    private final Histogram passwordVerifyLatency;

    public PrometheusAuthMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusAuthMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.loginCounter = Counter.build()
            .name("auth_logins_total")
            .help("Total number of login attempts by outcome")
            .labelNames("outcome")
            .register(registry);

        this.lockoutCounter = Counter.build()
            .name("auth_lockouts_total")
            .help("Total number of accounts locked after repeated failures")
            .register(registry);

        this.authorizationCounter = Counter.build()
            .name("auth_authorization_decisions_total")
            .help("Total number of perimeter authorization decisions")
            .labelNames("path_class", "decision")
            .register(registry);

        this.auditFailureCounter = Counter.build()
            .name("auth_audit_write_failures_total")
            .help("Total number of audit events that could not be persisted")
            .register(registry);

        // Buckets sized around a 100k-iteration PBKDF2 derivation
        this.passwordVerifyLatency = Histogram.build()
            .name("auth_password_verify_seconds")
            .help("Password verification latency in seconds")
            .buckets(0.01, 0.025, 0.05, 0.1, 0.2, 0.5, 1.0)
            .register(registry);

        log.info("[PrometheusAuthMetrics] Initialized auth metrics");
    }

    @Override
    public void recordLogin(String outcome) {
        loginCounter.labels(outcome).inc();
    }

    @Override
    public void recordLockout() {
        lockoutCounter.inc();
    }

    @Override
    public void recordAuthorization(String pathClass, String decision) {
        authorizationCounter.labels(pathClass, decision).inc();
    }

    @Override
    public void recordAuditWriteFailure() {
        auditFailureCounter.inc();
    }

    @Override
    public void recordPasswordVerify(Duration elapsed) {
        passwordVerifyLatency.observe(elapsed.toNanos() / 1_000_000_000.0);
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
