package com.fabtrack.api.infra.tx;

import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.function.Supplier;

/**
 * Programmatic transaction boundaries for services.
 *
 * <p>{@link #savepoint(Supplier)} joins the current transaction through a savepoint, so a failing
 * statement inside it rolls back on its own and leaves the outer work usable. Outside of a
 * transaction it behaves like {@link #execute(Supplier)}.
 */
@Component
public class TransactionalExecutor {

  private final TransactionTemplate tx;
  private final TransactionTemplate nested;

  public TransactionalExecutor(PlatformTransactionManager txManager) {
    this.tx = new TransactionTemplate(txManager);
    this.nested = new TransactionTemplate(txManager);
    this.nested.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
  }

  public <T> T execute(Supplier<T> supplier) {
    return tx.execute(status -> supplier.get());
  }

  public void run(Runnable runnable) {
    execute(() -> {
      runnable.run();
      return null;
    });
  }

  public <T> T savepoint(Supplier<T> supplier) {
    return nested.execute(status -> supplier.get());
  }
}
