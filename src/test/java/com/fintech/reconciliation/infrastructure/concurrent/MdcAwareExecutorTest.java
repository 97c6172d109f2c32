package com.fintech.reconciliation.infrastructure.concurrent;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class MdcAwareExecutorTest {

    private final ExecutorService pool = Executors.newSingleThreadExecutor();

    @AfterEach
    void tearDown() {
        MDC.clear();
        pool.shutdownNow();
    }

    @Test
    void execute_propagatesCallerContext() throws Exception {
        MdcAwareExecutor executor = new MdcAwareExecutor(pool);
        MDC.put("transactionId", "TX-42");

        String seen = CompletableFuture.supplyAsync(() -> MDC.get("transactionId"), executor)
                .get(5, TimeUnit.SECONDS);

        assertEquals("TX-42", seen);
    }

    @Test
    void execute_clearsContextAfterTask() throws Exception {
        MdcAwareExecutor executor = new MdcAwareExecutor(pool);
        MDC.put("transactionId", "TX-1");
        CompletableFuture.runAsync(() -> { }, executor).get(5, TimeUnit.SECONDS);
        MDC.clear();

        String leaked = CompletableFuture.supplyAsync(() -> MDC.get("transactionId"), executor)
                .get(5, TimeUnit.SECONDS);

        assertNull(leaked);
    }

    @Test
    void execute_callerThreadDelegateKeepsCallerContext() {
        MdcAwareExecutor executor = new MdcAwareExecutor(Runnable::run);
        MDC.put("transactionId", "TX-7");

        executor.execute(() -> MDC.put("strategy", "iban"));

        assertEquals("TX-7", MDC.get("transactionId"));
        assertNull(MDC.get("strategy"));
    }
}
