package in.brainlog.service.audit;

import in.brainlog.auth.RequestMeta;
import in.brainlog.domain.audit.AuditAction;
import in.brainlog.domain.audit.AuditEvent;
import in.brainlog.metrics.AuthMetrics;
import in.brainlog.repository.AuditSink;
import in.brainlog.security.SecureAuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Fire-and-forget boundary in front of the audit sink.
 *
 * Callers never wait for the write and never see its failure. The writer queue is
 * bounded; when it is full the event is rejected rather than buffered. A rejected or failed
 * write is logged locally through {@link SecureAuditLogger} and counted; this is the
 * only place in the system where audit failures are swallowed.
 */
public final class AuditTrail {
    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    public static final int DEFAULT_QUEUE_CAPACITY = 10_000;

    private final AuditSink sink;
    private final Executor executor;
    private final SecureAuditLogger fallback;
    private final AuthMetrics metrics;
    private final Clock clock;

    public AuditTrail(AuditSink sink, Executor executor, SecureAuditLogger fallback,
                      AuthMetrics metrics, Clock clock) {
        this.sink = sink;
        this.executor = executor;
        this.fallback = fallback;
        this.metrics = metrics;
        this.clock = clock;
    }

    public static ExecutorService newAuditExecutor() {
        return newAuditExecutor(DEFAULT_QUEUE_CAPACITY);
    }

    /**
     * Single daemon writer thread; events are persisted in submission order.
     * At most {@code queueCapacity} events wait behind the one being written;
     * further submissions are rejected (default abort policy).
     */
    public static ExecutorService newAuditExecutor(int queueCapacity) {
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be positive");
        }
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            r -> {
                Thread t = new Thread(r, "AuditWriter");
                t.setDaemon(true);
                return t;
            });
    }

    public void record(AuditAction action, String userId, String resource,
                       RequestMeta meta, Map<String, Object> details) {
        RequestMeta m = meta != null ? meta : RequestMeta.unknown();
        record(new AuditEvent(clock.instant(), userId, action, resource,
            m.ipAddress(), m.userAgent(), details));
    }

    public void record(AuditEvent event) {
        try {
            executor.execute(() -> write(event));
        } catch (RejectedExecutionException e) {
            metrics.recordAuditWriteFailure();
            fallback.logUnpersistedEvent(event, e);
        }
    }

    private void write(AuditEvent event) {
        try {
            sink.record(event);
            log.debug("[AUDIT] {} user={}", event.action(), event.userId());
        } catch (RuntimeException e) {
            metrics.recordAuditWriteFailure();
            fallback.logUnpersistedEvent(event, e);
        }
    }
}
