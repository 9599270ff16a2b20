package com.example.cooldown.service;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TimerDeliveryWorkerTest {

  @Mock private TimerDeliveryService deliveryService;
  @Mock private TimerDeliveryMetrics metrics;
  @InjectMocks private TimerDeliveryWorker worker;

  @Test
  void runDelegatesToDeliveryService() {
    when(deliveryService.processDueBatch()).thenReturn(new DeliveryBatchResult(false, 0, 0, 0));

    worker.run();

    verify(deliveryService).processDueBatch();
    verifyNoInteractions(metrics);
  }

  @Test
  void runSwallowsCycleFailureSoTheNextIntervalRuns() {
    when(deliveryService.processDueBatch()).thenThrow(new IllegalStateException("boom"));

    assertThatCode(worker::run).doesNotThrowAnyException();
    verify(metrics).recordCycleResult("error");
  }
}
