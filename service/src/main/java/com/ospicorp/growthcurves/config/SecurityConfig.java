package com.ospicorp.growthcurves.config;

import static org.springframework.security.config.Customizer.withDefaults;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * Open by default. With {@code security.auth.enabled=true} every {@code /v1/growth/**} call
 * needs a bearer JWT; the liveness, status and API documentation endpoints stay reachable
 * without one.
 */
@Configuration
public class SecurityConfig {

  static final String[] UNAUTHENTICATED_PATHS = {
      "/",
      "/error",
      "/v1/ping",
      "/actuator/health/**",
      "/v3/api-docs/**",
      "/swagger-ui/**",
      "/swagger-ui.html"
  };

  @Bean
  @ConditionalOnProperty(name = "security.auth.enabled", havingValue = "true")
  SecurityFilterChain growthJwtChain(HttpSecurity http) throws Exception {
    return stateless(http)
        .authorizeHttpRequests(auth -> auth
            .requestMatchers(UNAUTHENTICATED_PATHS).permitAll()
            .anyRequest().authenticated())
        .oauth2ResourceServer(oauth -> oauth.jwt(withDefaults()))
        .build();
  }

  @Bean
  @ConditionalOnProperty(name = "security.auth.enabled", havingValue = "false",
      matchIfMissing = true)
  SecurityFilterChain growthOpenChain(HttpSecurity http) throws Exception {
    return stateless(http)
        .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
        .build();
  }

  // no sessions and no cookies
  private static HttpSecurity stateless(HttpSecurity http) throws Exception {
    return http.csrf(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS));
  }
}
