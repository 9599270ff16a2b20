/*
 * Where: Cooldown API
 * What: arm / cancel / status endpoints for the signed-in user's timers
 * Why: the browser page polls status.json and posts button clicks here
 */
package com.example.cooldown.api;

import com.example.cooldown.api.response.TimerArmResponse;
import com.example.cooldown.api.response.TimerCancelResponse;
import com.example.cooldown.api.response.TimerStatusResponse;
import com.example.cooldown.service.DiscordPrincipalMapper;
import com.example.cooldown.service.TimerService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
public class TimerController {

  private final DiscordPrincipalMapper principalMapper;
  private final TimerService timerService;

  @PostMapping("/timer/{kind}")
  public ResponseEntity<TimerArmResponse> arm(
      @PathVariable("kind") String kind, Authentication authentication) {
    final String userId = principalMapper.requireDiscordUserId(authentication);
    return ResponseEntity.ok(timerService.arm(userId, kind));
  }

  @PostMapping("/timer/{kind}/cancel")
  public ResponseEntity<TimerCancelResponse> cancel(
      @PathVariable("kind") String kind, Authentication authentication) {
    final String userId = principalMapper.requireDiscordUserId(authentication);
    return ResponseEntity.ok(timerService.cancel(userId, kind));
  }

  @GetMapping("/status.json")
  public ResponseEntity<TimerStatusResponse> status(Authentication authentication) {
    final String userId = principalMapper.requireDiscordUserId(authentication);
    return ResponseEntity.ok(timerService.status(userId));
  }
}
