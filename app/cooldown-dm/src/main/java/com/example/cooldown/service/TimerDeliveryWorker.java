/*
 * Where: Cooldown delivery worker
 * What: runs the due-timer poll cycle on a fixed delay
 * Why: the loop must survive any single failing cycle
 */
package com.example.cooldown.service;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "cooldown.delivery.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class TimerDeliveryWorker {

  private static final Logger logger = LoggerFactory.getLogger(TimerDeliveryWorker.class);

  private final TimerDeliveryService deliveryService;
  private final TimerDeliveryMetrics metrics;

  @Scheduled(
      initialDelayString = "${cooldown.delivery.initial-delay:5s}",
      fixedDelayString = "${cooldown.delivery.poll-interval:30s}")
  public void run() {
    try {
      deliveryService.processDueBatch();
    } catch (RuntimeException ex) {
      logger.error("timer delivery cycle failed; retrying on next interval", ex);
      metrics.recordCycleResult("error");
    }
  }
}
