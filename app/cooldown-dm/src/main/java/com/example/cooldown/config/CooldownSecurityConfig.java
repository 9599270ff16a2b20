/*
 * Where: Cooldown web security
 * What: Discord OAuth2 login, public paths, 401 entry point and logout
 * Why: API callers get JSON status codes instead of login page redirects
 */
package com.example.cooldown.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.Customizer;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.logout.HttpStatusReturningLogoutSuccessHandler;

/**
 * Session login through the Discord OAuth2 authorization-code flow.
 *
 * <p>The callback lives at {@code /auth/discord/callback}. API calls without a session get a bare
 * 401 instead of a redirect to the login page.
 */
@Configuration
public class CooldownSecurityConfig {
  private static final Logger logger = LoggerFactory.getLogger(CooldownSecurityConfig.class);
  private final boolean csrfEnabled;

  public CooldownSecurityConfig(@Value("${app.security.csrf-enabled:true}") boolean csrfEnabled) {
    this.csrfEnabled = csrfEnabled;
  }

  @Bean
  SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    if (csrfEnabled) {
      http.csrf(Customizer.withDefaults());
    } else {
      http.csrf(csrf -> csrf.disable());
    }
    http.sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.IF_REQUIRED))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(
                        "/",
                        "/auth/discord/login",
                        "/auth/*/callback",
                        "/oauth2/authorization/**",
                        "/out/invite",
                        "/api/banner",
                        "/api/ack/**",
                        "/error",
                        "/actuator/health",
                        "/actuator/health/**",
                        "/actuator/info",
                        "/actuator/prometheus")
                    .permitAll()
                    .anyRequest()
                    .authenticated())
        .oauth2Login(
            oauth2 ->
                oauth2
                    .loginPage("/auth/discord/login")
                    .redirectionEndpoint(redirect -> redirect.baseUri("/auth/*/callback"))
                    .defaultSuccessUrl("/", true)
                    .failureHandler(
                        (request, response, exception) -> {
                          logger.warn("discord login failed: {}", exception.getMessage(), exception);
                          response.sendRedirect("/?login_error");
                        }))
        .exceptionHandling(ex -> ex.authenticationEntryPoint(authenticationEntryPoint()))
        .logout(
            logout ->
                logout
                    .logoutUrl("/logout")
                    .logoutSuccessHandler(
                        new HttpStatusReturningLogoutSuccessHandler(HttpStatus.NO_CONTENT))
                    .invalidateHttpSession(true)
                    .deleteCookies("JSESSIONID"));

    return http.build();
  }

  @Bean
  AuthenticationEntryPoint authenticationEntryPoint() {
    return new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED);
  }
}
