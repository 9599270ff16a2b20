/*
 * Where: Cooldown API layer
 * What: maps domain exceptions to ApiErrorResponse bodies
 * Why: Return stable error codes to the browser client
 */
package com.example.cooldown.api;

import com.example.cooldown.model.UnknownTimerKindException;
import com.example.cooldown.service.DiscordLoginRequiredException;
import com.example.cooldown.service.DmNotReadyException;
import com.example.cooldown.service.InvalidTimezoneException;
import com.example.cooldown.service.TestDmFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@RestControllerAdvice
public class CooldownApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(CooldownApiExceptionHandler.class);

  @ExceptionHandler(UnknownTimerKindException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownTimerKind(UnknownTimerKindException ex) {
    return badRequest("UNKNOWN_TIMER_KIND", ex.getMessage());
  }

  @ExceptionHandler(DmNotReadyException.class)
  public ResponseEntity<ApiErrorResponse> handleDmNotReady(DmNotReadyException ex) {
    return badRequest("DM_NOT_READY", ex.getMessage());
  }

  @ExceptionHandler(InvalidTimezoneException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidTimezone(InvalidTimezoneException ex) {
    return badRequest("INVALID_TIMEZONE", ex.getMessage());
  }

  @ExceptionHandler(TestDmFailedException.class)
  public ResponseEntity<ApiErrorResponse> handleTestDmFailed(TestDmFailedException ex) {
    return badRequest("DM_SEND_FAILED", ex.getMessage());
  }

  @ExceptionHandler(UnknownAckKindException.class)
  public ResponseEntity<ApiErrorResponse> handleUnknownAck(UnknownAckKindException ex) {
    return badRequest("UNKNOWN_ACK_KIND", ex.getMessage());
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadable(HttpMessageNotReadableException ex) {
    return badRequest("BAD_REQUEST", "request body is not readable");
  }

  // a session without a usable Discord id is treated like no session
  @ExceptionHandler(DiscordLoginRequiredException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingLogin(DiscordLoginRequiredException ex) {
    return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
        .body(new ApiErrorResponse("UNAUTHORIZED", ex.getMessage()));
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
        .body(new ApiErrorResponse("INTERNAL_ERROR", "internal error"));
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String code, String message) {
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(new ApiErrorResponse(code, message));
  }
}
