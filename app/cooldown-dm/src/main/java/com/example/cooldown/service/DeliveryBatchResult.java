/*
 * Where: Cooldown service layer
 * What: counts of one poll cycle
 * Why: Report cycle outcome to the worker log and tests
 */
package com.example.cooldown.service;

/** Outcome counts of one poll cycle. {@code fetched == sent + failed} unless the fetch failed. */
public record DeliveryBatchResult(boolean fetchFailed, int fetched, int sent, int failed) {

  public static DeliveryBatchResult abandoned() {
    return new DeliveryBatchResult(true, 0, 0, 0);
  }
}
