/*
 * Where: Cooldown API
 * What: common error body
 * Why: the browser client branches on a fixed code instead of the message text
 */
package com.example.cooldown.api;

public record ApiErrorResponse(String code, String message) {}
