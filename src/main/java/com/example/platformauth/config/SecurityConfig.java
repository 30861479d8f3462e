package com.example.platformauth.config;

import com.example.platformauth.properties.ApplicationProperties;
import com.example.platformauth.security.filter.SyncTokenAuthenticationFilter;
import com.example.platformauth.web.rest.errors.DelegatedAuthenticationEntryPoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.annotation.web.configurers.HeadersConfigurer.FrameOptionsConfig;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.security.web.header.writers.ReferrerPolicyHeaderWriter.ReferrerPolicy;

/**
 * Stateless security for the engine's HTTP surface.
 * <p>
 * PUBLIC CHAIN (@Order(1)): health checks, bridge controls and API docs. SYNC CHAIN (@Order(2)):
 * the network sync endpoint, guarded by the shared sync token when one is configured. API CHAIN
 * (@Order(3)): platform status and login control. DEFAULT CHAIN (@Order(4)): deny everything else.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
@EnableWebSecurity
@RequiredArgsConstructor
public class SecurityConfig {

  private final ApplicationProperties properties;
  private final DelegatedAuthenticationEntryPoint delegatedAuthenticationEntryPoint;

  @Bean
  @Order(1)
  public SecurityFilterChain publicEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/health/**",
                         "/bridge/**",
                         "/v3/api-docs/**",
                         "/swagger-ui/**",
                         "/swagger-ui.html")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(2)
  public SecurityFilterChain syncEndpointFilterChain(HttpSecurity http) throws Exception {
    boolean secured = properties.sync().isSecured();
    if (!secured) {
      log.warn("No sync shared secret configured, /api/sync accepts unauthenticated requests");
    }

    http
        .securityMatcher("/api/sync/**")
        .addFilterBefore(new SyncTokenAuthenticationFilter(properties.sync()),
                         UsernamePasswordAuthenticationFilter.class)
        .authorizeHttpRequests(authorize -> {
          if (secured) {
            authorize.anyRequest().authenticated();
          } else {
            authorize.anyRequest().permitAll();
          }
        })
        .exceptionHandling(exceptions ->
                               exceptions.authenticationEntryPoint(delegatedAuthenticationEntryPoint));

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(3)
  public SecurityFilterChain apiEndpointsFilterChain(HttpSecurity http) throws Exception {
    http
        .securityMatcher("/api/**")
        .authorizeHttpRequests(authorize -> authorize.anyRequest().permitAll());

    applyCommonSettings(http);
    return http.build();
  }

  @Bean
  @Order(4)
  public SecurityFilterChain defaultDenyFilterChain(HttpSecurity http) throws Exception {
    http.authorizeHttpRequests(authorize -> authorize.anyRequest().denyAll());
    applyCommonSettings(http);
    return http.build();
  }

  private void applyCommonSettings(HttpSecurity http) throws Exception {
    http
        .csrf(AbstractHttpConfigurer::disable)
        .httpBasic(AbstractHttpConfigurer::disable)
        .formLogin(AbstractHttpConfigurer::disable)
        .sessionManagement(session -> session
            .sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .headers(headers -> headers
            .frameOptions(FrameOptionsConfig::deny)
            .contentTypeOptions(contentType -> {
            })
            .referrerPolicy(referrer -> referrer
                .policy(ReferrerPolicy.STRICT_ORIGIN_WHEN_CROSS_ORIGIN))
            .permissionsPolicyHeader(permissions -> permissions
                .policy("camera=(), microphone=(), geolocation=(), payment=()"))
            // Responses can carry session cookies.
            .addHeaderWriter((request, response) -> {
              response.setHeader("Cache-Control", "no-cache, no-store, must-revalidate");
              response.setHeader("Pragma", "no-cache");
              response.setHeader("Expires", "0");
            }));
  }
}
