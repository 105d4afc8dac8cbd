package com.marketplace.conversation.service;

import com.marketplace.conversation.model.ActionType;
import com.marketplace.conversation.model.ApprovalOutcome;
import com.marketplace.conversation.model.PendingAction;
import com.marketplace.conversation.testutil.TestDataFactory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class PendingActionRegistryTest {

    private final PendingActionRegistry registry = new PendingActionRegistry();

    @Test
    void register_replacesActiveActionForSameBuyerAndType() {
        PendingAction first = TestDataFactory.pendingAction("PA-1", "B-1");
        PendingAction second = TestDataFactory.pendingAction("PA-2", "B-1");

        assertThat(registry.register(first)).isEmpty();
        assertThat(registry.register(second)).contains(first);

        assertThat(registry.findActive("B-1", ActionType.SEND_MESSAGE)).contains(second);
        assertThat(registry.find("PA-1")).isEmpty();
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    void remove_clearsTargetIndex() {
        registry.register(TestDataFactory.pendingAction("PA-1", "B-1"));

        assertThat(registry.remove("PA-1")).isPresent();
        assertThat(registry.findActive("B-1", ActionType.SEND_MESSAGE)).isEmpty();
        assertThat(registry.remove("PA-1")).isEmpty();
    }

    @Test
    void active_isOldestFirst_andOverdueUsesDeadline() {
        PendingAction older = TestDataFactory.pendingAction("PA-1", "B-1");
        PendingAction newer = TestDataFactory.pendingAction("PA-2", "B-2");
        newer.setCreatedAt(5_000L);
        newer.setExpiresAt(5_000L + 86_400_000L);
        registry.register(newer);
        registry.register(older);

        assertThat(registry.active()).extracting(PendingAction::getId).containsExactly("PA-1", "PA-2");
        assertThat(registry.overdueIds(older.getExpiresAt())).containsExactly("PA-1");
    }

    @Test
    void markResolved_remembersOutcome() {
        registry.markResolved("PA-1", ApprovalOutcome.EXPIRED);

        assertThat(registry.resolvedOutcome("PA-1")).contains(ApprovalOutcome.EXPIRED);
        assertThat(registry.resolvedOutcome("PA-2")).isEmpty();
    }

    @Test
    void remove_concurrentCallers_onlyOneWins() throws Exception {
        registry.register(TestDataFactory.pendingAction("PA-1", "B-1"));
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Boolean> wins = Collections.synchronizedList(new ArrayList<>());
        try {
            for (int i = 0; i < 8; i++) {
                pool.submit(() -> {
                    start.await();
                    wins.add(registry.remove("PA-1").isPresent());
                    return null;
                });
            }
            start.countDown();
            pool.shutdown();
            assertThat(pool.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        } finally {
            pool.shutdownNow();
        }

        assertThat(wins).hasSize(8).containsOnlyOnce(true);
    }
}
