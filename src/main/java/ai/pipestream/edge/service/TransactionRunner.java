package ai.pipestream.edge.service;

import io.quarkus.narayana.jta.QuarkusTransaction;
import io.quarkus.narayana.jta.QuarkusTransactionException;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.persistence.PersistenceException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.hibernate.exception.ConstraintViolationException;
import org.jboss.logging.Logger;

import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs a unit of work in its own JTA transaction bounded by a timeout.
 * <p>
 * Repositories join the transaction through {@code @Transactional}. An {@link EdgeStoreException}
 * thrown by the work rolls the transaction back and reaches the caller unchanged; any other
 * failure (timeout expiry, constraint or connection errors surfacing at flush or commit) is rolled
 * back and reported as {@link ErrorKind#TRANSACTION_ABORTED}, with the storage exception kept
 * only as the cause.
 */
@ApplicationScoped
public class TransactionRunner {

    private static final Logger LOG = Logger.getLogger(TransactionRunner.class);

    @ConfigProperty(name = "edge.tx.timeout-seconds", defaultValue = "30")
    int defaultTimeoutSeconds;

    public <T> T inTransaction(String operation, Supplier<T> work) {
        return inTransaction(operation, null, work);
    }

    /**
     * @param operation name used in logs and error messages
     * @param timeout   transaction timeout; {@code null} uses {@code edge.tx.timeout-seconds}
     * @param work      unit of work
     * @return the work's result
     */
    public <T> T inTransaction(String operation, Duration timeout, Supplier<T> work) {
        int seconds = timeoutSeconds(timeout);
        try {
            return QuarkusTransaction.requiringNew()
                .timeout(seconds)
                .call(work::get);
        } catch (EdgeStoreException e) {
            throw e;
        } catch (QuarkusTransactionException | PersistenceException | IllegalStateException e) {
            EdgeStoreException domain = findDomainCause(e);
            if (domain != null) {
                throw domain;
            }
            LOG.errorf(e, "%s aborted (timeout %ds)", operation, seconds);
            throw new EdgeStoreException(ErrorKind.TRANSACTION_ABORTED,
                operation + " aborted and rolled back", e);
        }
    }

    public void run(String operation, Duration timeout, Runnable work) {
        inTransaction(operation, timeout, () -> {
            work.run();
            return null;
        });
    }

    private int timeoutSeconds(Duration timeout) {
        if (timeout == null) {
            return defaultTimeoutSeconds;
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw EdgeStoreException.invalidArgument("Timeout must be positive: " + timeout);
        }
        // JTA timeouts have one-second granularity
        return (int) Math.max(1, (timeout.toMillis() + 999) / 1000);
    }

    /**
     * Whether a failure was caused by a unique or integrity constraint rejecting a write.
     */
    public static boolean isConstraintViolation(Throwable t) {
        for (Throwable current = t; current != null; current = current.getCause()) {
            if (current instanceof ConstraintViolationException
                || current instanceof SQLIntegrityConstraintViolationException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }

    private static EdgeStoreException findDomainCause(Throwable t) {
        for (Throwable current = t.getCause(); current != null; current = current.getCause()) {
            if (current instanceof EdgeStoreException) {
                return (EdgeStoreException) current;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return null;
    }
}
