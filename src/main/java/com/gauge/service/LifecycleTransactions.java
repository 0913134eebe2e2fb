package com.gauge.service;

import com.gauge.config.LifecycleProperties;
import com.gauge.exception.GaugeLifecycleException;
import com.gauge.exception.StorageFailureException;
import com.gauge.exception.TransientStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.TransactionTimedOutException;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Runs each lifecycle operation as one bounded transaction and translates storage
 * failures into the engine's error taxonomy.
 *
 * Commit happens inside {@link TransactionTemplate#execute}, so failures raised at
 * commit time (deferred constraint checks, lock timeouts on flush) are translated too.
 * Business exceptions pass through untouched after the rollback.
 */
@Component
@Slf4j
public class LifecycleTransactions {

    private final TransactionTemplate writeTemplate;
    private final TransactionTemplate readTemplate;

    public LifecycleTransactions(PlatformTransactionManager transactionManager, LifecycleProperties properties) {
        this.writeTemplate = new TransactionTemplate(transactionManager);
        this.writeTemplate.setTimeout(properties.transactionTimeoutSeconds());

        this.readTemplate = new TransactionTemplate(transactionManager);
        this.readTemplate.setReadOnly(true);
        this.readTemplate.setTimeout(properties.transactionTimeoutSeconds());
    }

    public <T> T write(String operation, Supplier<T> work) {
        return run(writeTemplate, operation, work);
    }

    public void write(String operation, Runnable work) {
        run(writeTemplate, operation, () -> {
            work.run();
            return null;
        });
    }

    public <T> T read(String operation, Supplier<T> work) {
        return run(readTemplate, operation, work);
    }

    private <T> T run(TransactionTemplate template, String operation, Supplier<T> work) {
        try {
            return template.execute(status -> work.get());
        } catch (GaugeLifecycleException e) {
            throw e;
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | CannotCreateTransactionException | TransactionTimedOutException e) {
            log.warn("Transient storage failure during {}: {}", operation, e.getMessage());
            throw new TransientStorageException(
                "The gauge records are busy or unreachable; please retry (" + operation + ")", e);
        } catch (jakarta.persistence.PessimisticLockException | jakarta.persistence.LockTimeoutException
                 | jakarta.persistence.QueryTimeoutException e) {
            log.warn("Lock wait failed during {}: {}", operation, e.getMessage());
            throw new TransientStorageException(
                "The gauge records are busy; please retry (" + operation + ")", e);
        } catch (DataAccessException | TransactionException | jakarta.persistence.PersistenceException e) {
            log.error("Storage failure during {}", operation, e);
            throw new StorageFailureException("Storage failure during " + operation, e);
        }
    }
}
