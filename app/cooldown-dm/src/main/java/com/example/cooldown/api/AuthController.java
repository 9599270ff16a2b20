/*
 * Where: Cooldown API
 * What: login entry, bot invite redirect and current user
 * Why: the page links to fixed paths while Spring Security owns the OAuth2 flow itself
 */
package com.example.cooldown.api;

import com.example.cooldown.api.response.MeResponse;
import com.example.cooldown.service.DiscordPrincipalMapper;
import com.example.cooldown.service.InviteLinkService;
import java.net.URI;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.Authentication;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequiredArgsConstructor
public class AuthController {

  static final String AUTHORIZATION_REQUEST_PATH = "/oauth2/authorization/discord";

  private final DiscordPrincipalMapper principalMapper;
  private final InviteLinkService inviteLinkService;

  @GetMapping("/auth/discord/login")
  public ResponseEntity<Void> login() {
    return redirect(AUTHORIZATION_REQUEST_PATH);
  }

  @GetMapping("/out/invite")
  public ResponseEntity<Void> invite() {
    return redirect(inviteLinkService.botInviteUrl());
  }

  @GetMapping("/api/me")
  public ResponseEntity<MeResponse> me(Authentication authentication) {
    final String userId = principalMapper.requireDiscordUserId(authentication);
    return ResponseEntity.ok(
        new MeResponse(userId, principalMapper.findUsername(authentication).orElse(null)));
  }

  private ResponseEntity<Void> redirect(String location) {
    return ResponseEntity.status(HttpStatus.FOUND).location(URI.create(location)).build();
  }
}
