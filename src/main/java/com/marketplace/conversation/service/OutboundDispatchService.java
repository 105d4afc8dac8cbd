package com.marketplace.conversation.service;

import com.marketplace.conversation.config.MetricsConfig;
import com.marketplace.conversation.config.RegimeConfig;
import com.marketplace.conversation.model.AuditActor;
import com.marketplace.conversation.model.AuditOutcome;
import com.marketplace.conversation.model.OutboundMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

/**
 * Holds authorized replies until their send time, then hands them to the {@link DeliveryGateway}.
 * Replies that would break the rate limits or fall outside active hours are re-queued, never dropped.
 */
@Service
public class OutboundDispatchService {

    private static final Logger log = LoggerFactory.getLogger(OutboundDispatchService.class);

    static final String OUTSIDE_ACTIVE_HOURS = "outside_active_hours";

    private final SendRateLimiter rateLimiter;
    private final DeliveryGateway deliveryGateway;
    private final AuditTrailService auditTrail;
    private final RegimeConfig regimeConfig;
    private final MetricsConfig metricsConfig;
    private final Clock clock;
    private final PriorityQueue<OutboundMessage> queue =
            new PriorityQueue<>(Comparator.comparingLong(OutboundMessage::getSendAfter));

    public OutboundDispatchService(SendRateLimiter rateLimiter,
                                   DeliveryGateway deliveryGateway,
                                   AuditTrailService auditTrail,
                                   RegimeConfig regimeConfig,
                                   MetricsConfig metricsConfig,
                                   Clock clock) {
        this.rateLimiter = rateLimiter;
        this.deliveryGateway = deliveryGateway;
        this.auditTrail = auditTrail;
        this.regimeConfig = regimeConfig;
        this.metricsConfig = metricsConfig;
        this.clock = clock;
    }

    public OutboundMessage enqueue(String buyerId, String text, Duration delay,
                                   boolean humanConfirmed, boolean disclosureIncluded,
                                   String pendingActionId) {
        long now = clock.millis();
        OutboundMessage message = OutboundMessage.builder()
                .id(UUID.randomUUID().toString())
                .buyerId(buyerId)
                .text(text)
                .enqueuedAt(now)
                .sendAfter(now + delay.toMillis())
                .delaySeconds(delay.getSeconds())
                .humanConfirmed(humanConfirmed)
                .disclosureIncluded(disclosureIncluded)
                .pendingActionId(pendingActionId)
                .deferrals(0)
                .build();

        synchronized (queue) {
            queue.add(message);
        }
        log.info("Reply {} queued for buyer={} in {}s (humanConfirmed={})",
                message.getId(), buyerId, delay.getSeconds(), humanConfirmed);
        return message;
    }

    /**
     * Sends every reply whose time has come.
     * @return number of replies delivered in this pass
     */
    @Scheduled(fixedDelayString = "${engine.dispatch-interval-seconds:5}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "5")
    public int dispatchDue() {
        long now = clock.millis();
        List<OutboundMessage> due = drainDue(now);
        int delivered = 0;

        for (OutboundMessage message : due) {
            long activeFrom = nextActiveStart(now);
            if (activeFrom > now) {
                defer(message, activeFrom, OUTSIDE_ACTIVE_HOURS);
                continue;
            }

            SendRateLimiter.Decision decision = rateLimiter.tryAcquire(message.getBuyerId(), now);
            if (!decision.permitted()) {
                defer(message, now + decision.retryAfterMillis(), decision.reason());
                continue;
            }

            if (deliver(message)) {
                delivered++;
            }
        }
        return delivered;
    }

    public List<OutboundMessage> queued() {
        synchronized (queue) {
            List<OutboundMessage> snapshot = new ArrayList<>(queue);
            snapshot.sort(queue.comparator());
            return snapshot;
        }
    }

    private List<OutboundMessage> drainDue(long now) {
        List<OutboundMessage> due = new ArrayList<>();
        synchronized (queue) {
            while (!queue.isEmpty() && queue.peek().getSendAfter() <= now) {
                due.add(queue.poll());
            }
        }
        return due;
    }

    private boolean deliver(OutboundMessage message) {
        boolean success;
        try {
            success = deliveryGateway.deliver(message.getBuyerId(), message.getText(),
                    Duration.ofSeconds(message.getDelaySeconds()));
        } catch (Exception e) {
            log.error("Delivery of reply {} to buyer={} failed: {}",
                    message.getId(), message.getBuyerId(), e.getMessage(), e);
            success = false;
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("length", message.getText().length());
        details.put("delaySeconds", message.getDelaySeconds());
        details.put("humanConfirmed", message.isHumanConfirmed());
        details.put("disclosure", message.isDisclosureIncluded());
        details.put("deferrals", message.getDeferrals());

        auditTrail.record(success ? "message_sent" : "delivery_failed",
                message.getBuyerId(), message.getId(),
                message.isHumanConfirmed() ? AuditActor.HUMAN : AuditActor.AUTOMATED,
                success ? AuditOutcome.SENT : AuditOutcome.FAILED,
                details);
        metricsConfig.recordDelivery(success ? "sent" : "failed");
        return success;
    }

    private void defer(OutboundMessage message, long sendAfter, String reason) {
        message.setSendAfter(sendAfter);
        message.setDeferrals(message.getDeferrals() + 1);
        synchronized (queue) {
            queue.add(message);
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("reason", reason);
        details.put("sendAfter", sendAfter);
        details.put("deferrals", message.getDeferrals());
        auditTrail.record("send_deferred", message.getBuyerId(), message.getId(),
                AuditActor.AUTOMATED, AuditOutcome.DEFERRED, details);
        metricsConfig.recordDeferral(reason);
        log.warn("Reply {} to buyer={} deferred ({}), next attempt at {}",
                message.getId(), message.getBuyerId(), reason, Instant.ofEpochMilli(sendAfter));
    }

    /**
     * {@code now} when inside the active window (or when the window is disabled),
     * otherwise the start of the next window.
     */
    long nextActiveStart(long now) {
        RegimeConfig.ActiveHours hours = regimeConfig.getActiveHours();
        if (!hours.isEnabled()) {
            return now;
        }
        ZonedDateTime local = Instant.ofEpochMilli(now).atZone(ZoneId.of(hours.getTimezone()));
        int hour = local.getHour();
        if (hour >= hours.getStartHour() && hour < hours.getEndHour()) {
            return now;
        }
        ZonedDateTime start = local.toLocalDate().atStartOfDay(local.getZone()).plusHours(hours.getStartHour());
        if (hour >= hours.getEndHour()) {
            start = start.plusDays(1);
        }
        return start.toInstant().toEpochMilli();
    }
}
