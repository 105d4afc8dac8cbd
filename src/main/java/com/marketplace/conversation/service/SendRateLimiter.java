package com.marketplace.conversation.service;

import com.marketplace.conversation.config.RegimeConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

/**
 * Rolling one-hour send counters plus a minimum gap between sends, globally and per buyer.
 * A permitted send is counted immediately.
 */
@Component
public class SendRateLimiter {

    static final long WINDOW_MS = 3_600_000L;

    public static final String GLOBAL_HOURLY_LIMIT = "global_hourly_limit";
    public static final String BUYER_HOURLY_LIMIT = "buyer_hourly_limit";
    public static final String GLOBAL_MIN_DELAY = "global_min_delay";
    public static final String BUYER_MIN_DELAY = "buyer_min_delay";

    public record Decision(boolean permitted, long retryAfterMillis, String reason) {

        static Decision permit() {
            return new Decision(true, 0L, null);
        }

        static Decision defer(long retryAfterMillis, String reason) {
            return new Decision(false, Math.max(1L, retryAfterMillis), reason);
        }
    }

    private final RegimeConfig regimeConfig;
    private final Deque<Long> globalSends = new ArrayDeque<>();
    private final Map<String, Deque<Long>> buyerSends = new HashMap<>();

    public SendRateLimiter(RegimeConfig regimeConfig) {
        this.regimeConfig = regimeConfig;
    }

    public synchronized Decision tryAcquire(String buyerId, long now) {
        prune(globalSends, now);
        pruneBuyers(now);
        Deque<Long> buyer = buyerSends.getOrDefault(buyerId, new ArrayDeque<>());

        if (globalSends.size() >= regimeConfig.getMaxMessagesPerHour()) {
            return Decision.defer(globalSends.peekFirst() + WINDOW_MS - now, GLOBAL_HOURLY_LIMIT);
        }
        if (buyer.size() >= regimeConfig.getMaxMessagesPerBuyerPerHour()) {
            return Decision.defer(buyer.peekFirst() + WINDOW_MS - now, BUYER_HOURLY_LIMIT);
        }

        long minGapMs = regimeConfig.getMinDelaySeconds() * 1000L;
        if (!globalSends.isEmpty() && now - globalSends.peekLast() < minGapMs) {
            return Decision.defer(globalSends.peekLast() + minGapMs - now, GLOBAL_MIN_DELAY);
        }
        if (!buyer.isEmpty() && now - buyer.peekLast() < minGapMs) {
            return Decision.defer(buyer.peekLast() + minGapMs - now, BUYER_MIN_DELAY);
        }

        globalSends.addLast(now);
        buyer.addLast(now);
        buyerSends.putIfAbsent(buyerId, buyer);
        return Decision.permit();
    }

    synchronized int trackedBuyers() {
        return buyerSends.size();
    }

    // Every tracked buyer has a send inside the window, so the map never outgrows the hourly limit.
    private void pruneBuyers(long now) {
        Iterator<Deque<Long>> it = buyerSends.values().iterator();
        while (it.hasNext()) {
            Deque<Long> sends = it.next();
            prune(sends, now);
            if (sends.isEmpty()) {
                it.remove();
            }
        }
    }

    public synchronized int sentInLastHour(long now) {
        prune(globalSends, now);
        return globalSends.size();
    }

    private static void prune(Deque<Long> sends, long now) {
        while (!sends.isEmpty() && sends.peekFirst() <= now - WINDOW_MS) {
            sends.removeFirst();
        }
    }
}
