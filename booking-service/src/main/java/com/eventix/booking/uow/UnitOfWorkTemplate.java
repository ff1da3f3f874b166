package com.eventix.booking.uow;

import org.jooq.DSLContext;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs work inside one read-committed transaction shared by JPA and jOOQ.
 * Any exception thrown by the work rolls back every change made through the unit of work.
 */
@Component
public class UnitOfWorkTemplate {

    private final TransactionTemplate transactionTemplate;
    private final DSLContext dsl;
    private final Clock clock;

    public UnitOfWorkTemplate(PlatformTransactionManager transactionManager, DSLContext dsl, Clock clock) {
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setIsolationLevel(TransactionTemplate.ISOLATION_READ_COMMITTED);
        this.dsl = dsl;
        this.clock = clock;
    }

    public <T> T execute(Function<UnitOfWork, T> work) {
        return transactionTemplate.execute(status ->
                work.apply(UnitOfWork.open(dsl, LocalDateTime.now(clock))));
    }

    public void run(Consumer<UnitOfWork> work) {
        transactionTemplate.executeWithoutResult(status ->
                work.accept(UnitOfWork.open(dsl, LocalDateTime.now(clock))));
    }
}
