/*
 * Where: Cooldown configuration
 * What: builds the RestClient used for Discord DM calls
 * Why: Bound every outbound Discord call by a fixed timeout
 */
package com.example.cooldown.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(DiscordClientProperties.class)
public class DiscordClientConfig {

  @Bean
  RestClient discordRestClient(RestClient.Builder builder, DiscordClientProperties properties) {
    // connect and read share the configured per-call limit
    final SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    requestFactory.setConnectTimeout(properties.timeout());
    requestFactory.setReadTimeout(properties.timeout());
    return builder.baseUrl(properties.apiBaseUrl()).requestFactory(requestFactory).build();
  }
}
