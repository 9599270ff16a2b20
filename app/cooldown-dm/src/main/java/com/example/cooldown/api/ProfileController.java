/*
 * Where: Cooldown API layer
 * What: timezone, DM health, test DM, banner and invite ack endpoints
 * Why: Let a user verify DM delivery before arming timers
 */
package com.example.cooldown.api;

import com.example.cooldown.api.request.TimezoneRequest;
import com.example.cooldown.api.response.AckResponse;
import com.example.cooldown.api.response.BannerResponse;
import com.example.cooldown.api.response.DmHealthResponse;
import com.example.cooldown.api.response.TestSendResponse;
import com.example.cooldown.api.response.TimezoneResponse;
import com.example.cooldown.service.DiscordPrincipalMapper;
import com.example.cooldown.service.UserProfileService;
import jakarta.servlet.http.HttpSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class ProfileController {

  static final String INVITE_CLICKED_ATTRIBUTE = "invite_clicked";
  private static final String ACK_INVITE = "invite";

  private final DiscordPrincipalMapper principalMapper;
  private final UserProfileService userProfileService;

  @PostMapping("/api/tz")
  public ResponseEntity<TimezoneResponse> updateTimezone(
      @RequestBody TimezoneRequest request, Authentication authentication) {
    final String userId = principalMapper.requireDiscordUserId(authentication);
    return ResponseEntity.ok(
        userProfileService.updateTimezone(userId, request == null ? null : request.tz()));
  }

  @GetMapping("/api/dm/health")
  public ResponseEntity<DmHealthResponse> health(Authentication authentication) {
    final String userId = principalMapper.requireDiscordUserId(authentication);
    return ResponseEntity.ok(userProfileService.health(userId));
  }

  @PostMapping("/api/test-send")
  public ResponseEntity<TestSendResponse> testSend(Authentication authentication) {
    final String userId = principalMapper.requireDiscordUserId(authentication);
    return ResponseEntity.ok(userProfileService.sendTestMessage(userId));
  }

  /** Public: anonymous callers get a banner-less answer instead of a 401. */
  @GetMapping({"/", "/api/banner"})
  public ResponseEntity<BannerResponse> banner(Authentication authentication) {
    return ResponseEntity.ok(
        userProfileService.banner(principalMapper.findDiscordUserId(authentication)));
  }

  @PostMapping("/api/ack/{kind}")
  public ResponseEntity<AckResponse> ack(@PathVariable("kind") String kind, HttpSession session) {
    if (!ACK_INVITE.equals(kind)) {
      throw new UnknownAckKindException("unknown ack kind: " + kind);
    }
    session.setAttribute(INVITE_CLICKED_ATTRIBUTE, Boolean.TRUE);
    return ResponseEntity.ok(new AckResponse(true));
  }
}
