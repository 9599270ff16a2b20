/*
 * Where: Cooldown service layer
 * What: records delivery outcomes, due-to-sent lag and poll cycle results
 * Why: make DM failures and poller stalls visible on the Prometheus endpoint
 */
package com.example.cooldown.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.stereotype.Component;

@Component
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "MeterRegistry is a shared Spring-managed component and cannot be copied")
public class TimerDeliveryMetrics {

  private static final String METRIC_DELIVERY_TOTAL = "cooldown.delivery.total";
  private static final String METRIC_DELIVERY_LAG = "cooldown.delivery.lag";
  private static final String METRIC_CYCLE_TOTAL = "cooldown.delivery.cycle.total";
  private static final String METRIC_BATCH_SIZE = "cooldown.delivery.batch.current";

  private final MeterRegistry meterRegistry;
  private final AtomicInteger batchCurrent = new AtomicInteger(0);
  private final ConcurrentMap<String, Counter> deliveryCounters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Counter> cycleCounters = new ConcurrentHashMap<>();
  private final Timer deliveryLagTimer;

  public TimerDeliveryMetrics(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry;
    Gauge.builder(METRIC_BATCH_SIZE, batchCurrent, AtomicInteger::get)
        .description("Number of due timers fetched by the latest poll cycle")
        .register(meterRegistry);
    this.deliveryLagTimer =
        Timer.builder(METRIC_DELIVERY_LAG)
            .description("Delay between a timer's due time and its DM being sent")
            .register(meterRegistry);
  }

  public void recordDeliveryResult(String result, String timerKind) {
    final String key = result + "|" + timerKind;
    deliveryCounters
        .computeIfAbsent(
            key,
            ignored ->
                Counter.builder(METRIC_DELIVERY_TOTAL)
                    .description("Cooldown DM delivery outcomes")
                    .tags(Tags.of("result", result, "timer_kind", timerKind))
                    .register(meterRegistry))
        .increment();
  }

  public void recordCycleResult(String result) {
    cycleCounters
        .computeIfAbsent(
            result,
            ignored ->
                Counter.builder(METRIC_CYCLE_TOTAL)
                    .description("Due-timer poll cycle outcomes")
                    .tags(Tags.of("result", result))
                    .register(meterRegistry))
        .increment();
  }

  public void recordDeliveryLag(Instant dueAt, Instant sentAt) {
    if (dueAt == null || sentAt == null || sentAt.isBefore(dueAt)) {
      return;
    }
    deliveryLagTimer.record(Duration.between(dueAt, sentAt));
  }

  public void updateBatchCurrent(int batchSize) {
    batchCurrent.set(Math.max(batchSize, 0));
  }
}
