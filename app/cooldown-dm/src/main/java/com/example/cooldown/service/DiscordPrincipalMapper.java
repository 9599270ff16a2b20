/*
 * Where: Cooldown service layer
 * What: resolves the Discord user id from the OAuth2 principal
 * Why: Controllers act on the logged-in Discord account only
 */
package com.example.cooldown.service;

import java.util.Optional;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.oauth2.core.user.OAuth2User;
import org.springframework.stereotype.Component;

// Resolves the Discord snowflake id ("id" attribute of /users/@me) from the login principal.
@Component
public class DiscordPrincipalMapper {

  static final String ID_ATTRIBUTE = "id";
  static final String USERNAME_ATTRIBUTE = "username";

  public String requireDiscordUserId(Authentication authentication) {
    return findDiscordUserId(authentication)
        .orElseThrow(() -> new DiscordLoginRequiredException("discord login is required"));
  }

  public Optional<String> findDiscordUserId(Authentication authentication) {
    return findUser(authentication).map(user -> user.getAttribute(ID_ATTRIBUTE)).map(String::valueOf);
  }

  public Optional<String> findUsername(Authentication authentication) {
    return findUser(authentication)
        .map(user -> user.getAttribute(USERNAME_ATTRIBUTE))
        .map(String::valueOf);
  }

  private Optional<OAuth2User> findUser(Authentication authentication) {
    if (authentication == null
        || authentication instanceof AnonymousAuthenticationToken
        || !authentication.isAuthenticated()) {
      return Optional.empty();
    }
    if (!(authentication.getPrincipal() instanceof OAuth2User user)) {
      return Optional.empty();
    }
    final Object id = user.getAttribute(ID_ATTRIBUTE);
    if (id == null || String.valueOf(id).isBlank()) {
      return Optional.empty();
    }
    return Optional.of(user);
  }
}
