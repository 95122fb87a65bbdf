package com.flagship.settlement_engine.balance;

import com.flagship.settlement_engine.config.SettlementProperties;
import com.flagship.settlement_engine.exception.LockTimeoutException;
import com.google.common.util.concurrent.Striped;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks keyed by professional id, serializing every read-modify-write of a
 * professional's balance within this process. The stripe count is fixed
 * ({@code settlement.lock-stripes}), so memory does not grow with the number of
 * professionals; two professionals may share a stripe and then simply wait for each other.
 *
 * Locks covering several professionals are taken in stripe order through
 * {@link Striped#bulkGet}, so two operations over the same pair cannot deadlock.
 * Locks are reentrant: a service holding a professional's lock can call into the
 * ledger, which takes it again. Callers must take every lock they need in one call;
 * acquiring more stripes while already holding one breaks the ordering.
 *
 * Take the lock before opening the database transaction, so the transaction
 * commits before the next waiter reads the row.
 */
@Component
@Slf4j
public class ProfessionalLockRegistry {

    private final Striped<Lock> locks;
    private final long timeoutMs;

    public ProfessionalLockRegistry(SettlementProperties properties) {
        this.locks = Striped.lock(properties.getLockStripes());
        this.timeoutMs = properties.getLockTimeoutMs();
    }

    public <T> T withLock(String professionalId, Supplier<T> action) {
        return withLocks(List.of(professionalId), action);
    }

    /**
     * Runs {@code action} holding the locks of all given professionals.
     *
     * @throws LockTimeoutException if any lock is not acquired within the configured timeout
     */
    public <T> T withLocks(Collection<String> professionalIds, Supplier<T> action) {
        List<String> ordered = professionalIds.stream()
            .filter(Objects::nonNull)
            .distinct()
            .sorted()
            .toList();

        List<Lock> acquired = new ArrayList<>(ordered.size());
        try {
            for (Lock lock : locks.bulkGet(ordered)) {
                if (!lock.tryLock(timeoutMs, TimeUnit.MILLISECONDS)) {
                    log.warn("Lock timeout for professionals {} after {}ms", ordered, timeoutMs);
                    throw new LockTimeoutException(String.join(",", ordered), timeoutMs);
                }
                acquired.add(lock);
            }
            return action.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(String.join(",", ordered), timeoutMs);
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }

    public boolean isHeldByCurrentThread(String professionalId) {
        Lock lock = locks.get(professionalId);
        return lock instanceof ReentrantLock && ((ReentrantLock) lock).isHeldByCurrentThread();
    }

    int stripeCount() {
        return locks.size();
    }
}
