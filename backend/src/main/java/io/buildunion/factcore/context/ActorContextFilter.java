package io.buildunion.factcore.context;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Binds the acting member from the {@code X-Member-Id} header and decorates the logging MDC with
 * request and member identifiers. Authentication happens upstream; a missing or malformed header
 * leaves the request unbound.
 */
@Component
public class ActorContextFilter extends OncePerRequestFilter {

  public static final String MEMBER_HEADER = "X-Member-Id";

  private static final Logger log = LoggerFactory.getLogger(ActorContextFilter.class);

  private static final String MDC_REQUEST_ID = "requestId";
  private static final String MDC_MEMBER_ID = "memberId";

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    try {
      MDC.put(MDC_REQUEST_ID, UUID.randomUUID().toString());

      UUID memberId = parseMemberId(request.getHeader(MEMBER_HEADER));
      if (memberId != null) {
        RequestScopes.bindMemberId(memberId);
        MDC.put(MDC_MEMBER_ID, memberId.toString());
      }

      filterChain.doFilter(request, response);
    } finally {
      RequestScopes.clear();
      MDC.remove(MDC_MEMBER_ID);
      MDC.remove(MDC_REQUEST_ID);
    }
  }

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return request.getRequestURI().startsWith("/actuator/");
  }

  private UUID parseMemberId(String header) {
    if (header == null || header.isBlank()) {
      return null;
    }
    try {
      return UUID.fromString(header.trim());
    } catch (IllegalArgumentException e) {
      log.debug("Ignoring malformed {} header: {}", MEMBER_HEADER, header);
      return null;
    }
  }
}
