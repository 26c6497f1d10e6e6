package com.flagship.points_ledger.reward;

import com.flagship.points_ledger.error.InsufficientBalanceException;
import com.flagship.points_ledger.error.RewardNotFoundException;
import com.flagship.points_ledger.error.RewardOutOfStockException;
import com.flagship.points_ledger.ledger.IdempotencyKeys;
import com.flagship.points_ledger.store.InMemoryKeyValueStore;
import com.flagship.points_ledger.support.PointsTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Redemptions must never overdraw a balance and must debit at most once per
 * request ID, however often or concurrently the request is retried.
 */
class RewardServiceTest {

    private static final String USER = "user-1";

    private PointsTestContext context;
    private RewardService service;

    @BeforeEach
    void setUp() {
        context = new PointsTestContext(new InMemoryKeyValueStore(), PointsTestContext.noSleepPolicy(1_000), 128);
        service = context.rewardService;
        context.catalogService.save("mug", "Coffee mug", "Ceramic, 350ml", 80, null);
        context.catalogService.save("sticker", "Sticker pack", null, 30, null);
        context.catalogService.save("hoodie", "Hoodie", null, 10, 0L);
    }

    @Test
    @DisplayName("Redeeming debits the cost and records the redemption")
    void redeemDebitsAndRecords() {
        context.ledger.credit(USER, 100, "seed");

        RedemptionResult result = service.redeem(USER, "mug", "req-1");

        assertFalse(result.isReplayed());
        RedemptionRecord record = result.getRecord();
        assertEquals("mug", record.getRewardId());
        assertEquals("Coffee mug", record.getRewardTitle());
        assertEquals(80L, record.getPointsSpent());
        assertEquals(20L, record.getBalanceAfter());
        assertEquals(20L, context.ledger.getBalance(USER));
        assertEquals(List.of(record), service.listRedemptionHistory(USER));
        assertEquals(1.0, context.counter("points.redemptions", "result", "success"));
    }

    @Test
    @DisplayName("Retrying with the same request ID debits once and returns the same record")
    void retryReturnsSameRecord() {
        context.ledger.credit(USER, 100, "seed");

        RedemptionResult first = service.redeem(USER, "mug", "req-1");
        RedemptionResult retry = service.redeem(USER, "mug", "req-1");

        assertTrue(retry.isReplayed());
        assertEquals(first.getRecord(), retry.getRecord());
        assertEquals(20L, context.ledger.getBalance(USER));
        assertEquals(1, service.listRedemptionHistory(USER).size());
    }

    @Test
    @DisplayName("Two concurrent redemptions of an 80 point reward from 100 points: one succeeds")
    void concurrentRedemptionsCannotOverdraw() throws InterruptedException {
        context.ledger.credit(USER, 100, "seed");

        List<Object> outcomes = runConcurrently(2, i -> () -> service.redeem(USER, "mug", "req-" + i));

        assertEquals(1, outcomes.stream().filter(RedemptionResult.class::isInstance).count());
        assertEquals(1, outcomes.stream().filter(InsufficientBalanceException.class::isInstance).count());
        assertEquals(20L, context.ledger.getBalance(USER));
        assertEquals(1, service.listRedemptionHistory(USER).size());
    }

    @Test
    @DisplayName("Many concurrent redemptions never drive the balance negative")
    void balanceStaysNonNegative() throws InterruptedException {
        context.ledger.credit(USER, 100, "seed");

        List<Object> outcomes = runConcurrently(10, i -> () -> service.redeem(USER, "sticker", "req-" + i));

        assertEquals(3, outcomes.stream().filter(RedemptionResult.class::isInstance).count());
        assertEquals(7, outcomes.stream().filter(InsufficientBalanceException.class::isInstance).count());
        assertEquals(10L, context.ledger.getBalance(USER));
    }

    @Test
    @DisplayName("Concurrent calls with one request ID debit exactly once")
    void concurrentSameRequestDebitsOnce() throws InterruptedException {
        context.ledger.credit(USER, 100, "seed");

        List<Object> outcomes = runConcurrently(8, i -> () -> service.redeem(USER, "sticker", "req-same"));

        assertTrue(outcomes.stream().allMatch(RedemptionResult.class::isInstance), "Unexpected: " + outcomes);
        List<RedemptionResult> results = outcomes.stream().map(RedemptionResult.class::cast).toList();
        assertEquals(1, results.stream().filter(result -> !result.isReplayed()).count());
        assertEquals(1, results.stream().map(result -> result.getRecord().getBalanceAfter()).distinct().count());
        assertEquals(70L, context.ledger.getBalance(USER));
        assertEquals(1, service.listRedemptionHistory(USER).size());
    }

    @Test
    @DisplayName("A debit that landed before a crash is not repeated when the request is retried")
    void retryAfterCrashDoesNotDebitTwice() {
        context.ledger.credit(USER, 100, "seed");
        context.ledger.debit(USER, 80, IdempotencyKeys.forRedemption(USER, "req-1"));

        RedemptionResult result = service.redeem(USER, "mug", "req-1");

        assertEquals(20L, result.getRecord().getBalanceAfter());
        assertEquals(20L, context.ledger.getBalance(USER));
        assertEquals(1, service.listRedemptionHistory(USER).size());
    }

    @Test
    @DisplayName("Insufficient balance fails without changing anything")
    void insufficientBalanceIsTerminal() {
        context.ledger.credit(USER, 50, "seed");

        assertThrows(InsufficientBalanceException.class, () -> service.redeem(USER, "mug", "req-1"));

        assertEquals(50L, context.ledger.getBalance(USER));
        assertTrue(service.listRedemptionHistory(USER).isEmpty());
        assertEquals(1.0, context.counter("points.redemptions", "result", "insufficient_balance"));
    }

    @Test
    @DisplayName("Unknown rewards are rejected as not found")
    void unknownRewardIsNotFound() {
        context.ledger.credit(USER, 100, "seed");

        RewardNotFoundException e = assertThrows(RewardNotFoundException.class,
            () -> service.redeem(USER, "yacht", "req-1"));

        assertEquals("yacht", e.getRewardId());
        assertEquals(100L, context.ledger.getBalance(USER));
    }

    @Test
    @DisplayName("Rewards with no stock left are rejected")
    void outOfStockIsRejected() {
        context.ledger.credit(USER, 100, "seed");

        assertThrows(RewardOutOfStockException.class, () -> service.redeem(USER, "hoodie", "req-1"));
        assertEquals(100L, context.ledger.getBalance(USER));
    }

    @Test
    @DisplayName("A request ID cannot be reused for a different reward")
    void requestIdIsBoundToReward() {
        context.ledger.credit(USER, 200, "seed");
        service.redeem(USER, "mug", "req-1");

        assertThrows(IllegalArgumentException.class, () -> service.redeem(USER, "sticker", "req-1"));
        assertEquals(120L, context.ledger.getBalance(USER));
    }

    @Test
    @DisplayName("Redemption history is ordered oldest first")
    void historyIsOrdered() throws InterruptedException {
        context.ledger.credit(USER, 200, "seed");
        service.redeem(USER, "sticker", "b");
        Thread.sleep(5);
        service.redeem(USER, "mug", "a");

        assertEquals(List.of("b", "a"), service.listRedemptionHistory(USER).stream()
            .map(RedemptionRecord::getRequestId)
            .toList());
    }

    interface Task {
        Callable<Object> create(int index);
    }

    private static List<Object> runConcurrently(int threads, Task task) throws InterruptedException {
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);
        ConcurrentLinkedQueue<Object> outcomes = new ConcurrentLinkedQueue<>();
        AtomicInteger index = new AtomicInteger();

        for (int i = 0; i < threads; i++) {
            Callable<Object> call = task.create(index.getAndIncrement());
            executor.submit(() -> {
                try {
                    start.await();
                    outcomes.add(call.call());
                } catch (Exception e) {
                    outcomes.add(e);
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(30, TimeUnit.SECONDS));
        executor.shutdown();
        return List.copyOf(outcomes);
    }
}
