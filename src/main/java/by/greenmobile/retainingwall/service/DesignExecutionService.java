package by.greenmobile.retainingwall.service;

import by.greenmobile.retainingwall.config.MdcAwareExecutor;
import by.greenmobile.retainingwall.entity.DesignInput;
import by.greenmobile.retainingwall.entity.DesignResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Запуск расчёта на отдельном воркере с ограничением по времени.
 * Каждый прогон независим, блокировок нет; таймаут - просто страховка по wall-clock.
 */
@Service
@Slf4j
public class DesignExecutionService {

    private final WallDesignFacade facade;
    private final MdcAwareExecutor executor;

    @Value("${wall.execution.timeout-ms:5000}")
    private long timeoutMs = 5000;

    public DesignExecutionService(WallDesignFacade facade, MdcAwareExecutor designExecutor) {
        this.facade = facade;
        this.executor = designExecutor;
    }

    public DesignResult execute(DesignInput input) {
        CompletableFuture<DesignResult> future = CompletableFuture.supplyAsync(() -> facade.run(input), executor);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("EXEC: design run timed out after {} ms: {}", timeoutMs, input);
            throw new DesignTimeoutException(timeoutMs, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for design run", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            if (cause instanceof Error err) throw err;
            throw new IllegalStateException("Design run failed", cause);
        }
    }
}
