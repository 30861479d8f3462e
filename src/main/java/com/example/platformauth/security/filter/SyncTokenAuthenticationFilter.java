package com.example.platformauth.security.filter;

import com.example.platformauth.properties.ApplicationProperties;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates bridge calls to the sync endpoint by a shared secret header. Requests without a
 * matching token pass through unauthenticated and are rejected by the filter chain.
 */
@Slf4j
public class SyncTokenAuthenticationFilter extends OncePerRequestFilter {

  static final String BRIDGE_PRINCIPAL = "cookie-sync-bridge";
  private static final String BRIDGE_AUTHORITY = "ROLE_SESSION_SYNC";

  private final String headerName;
  private final byte[] expectedToken;

  public SyncTokenAuthenticationFilter(ApplicationProperties.SyncProperties sync) {
    this.headerName = sync.headerName();
    this.expectedToken = sync.isSecured() ? sync.sharedSecret().getBytes(StandardCharsets.UTF_8) : null;
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request,
      HttpServletResponse response,
      FilterChain filterChain) throws ServletException, IOException {

    String presented = request.getHeader(headerName);
    if (expectedToken != null && presented != null) {
      if (MessageDigest.isEqual(expectedToken, presented.getBytes(StandardCharsets.UTF_8))) {
        UsernamePasswordAuthenticationToken authentication = UsernamePasswordAuthenticationToken.authenticated(
            BRIDGE_PRINCIPAL, null, List.of(new SimpleGrantedAuthority(BRIDGE_AUTHORITY)));
        SecurityContextHolder.getContext().setAuthentication(authentication);
      } else {
        log.warn("Rejected sync request with invalid {} from {}", headerName, request.getRemoteAddr());
      }
    }

    filterChain.doFilter(request, response);
  }
}
