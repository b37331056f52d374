package com.tagatlas.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Single writer for the tag graph.
 * Every mutation runs under one process-wide lock and inside one transaction, so a
 * cycle check and the insert that follows it cannot interleave with another writer.
 * Readers never take the lock.
 *
 * The lock is reentrant: a bulk import holding it can call the regular mutation
 * paths, which then join the import's transaction.
 */
@Component
@Slf4j
public class GraphWriteExecutor {

    private final ReentrantLock writeLock = new ReentrantLock(true);
    private final TransactionTemplate transactionTemplate;

    public GraphWriteExecutor(@Qualifier("graphWriteTransactionTemplate") TransactionTemplate transactionTemplate) {
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T write(TransactionCallback<T> action) {
        if (writeLock.isLocked() && !writeLock.isHeldByCurrentThread()) {
            log.debug("Graph writer busy, waiting for lock");
        }
        writeLock.lock();
        try {
            return transactionTemplate.execute(action);
        } finally {
            writeLock.unlock();
        }
    }

    public void run(Runnable action) {
        write(status -> {
            action.run();
            return null;
        });
    }
}
