package com.flamingo.ai.notionrag.api.filter;

import com.flamingo.ai.notionrag.ledger.UsageLedger;
import com.google.common.base.Stopwatch;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/** Writes one audit record per {@code /api} request to the usage ledger. */
@Component
@RequiredArgsConstructor
public class ApiAuditFilter extends OncePerRequestFilter {

  private final UsageLedger usageLedger;

  @Override
  protected boolean shouldNotFilter(HttpServletRequest request) {
    return !request.getRequestURI().startsWith("/api");
  }

  @Override
  protected void doFilterInternal(
      HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
      throws ServletException, IOException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    try {
      filterChain.doFilter(request, response);
    } finally {
      double elapsedSeconds = stopwatch.elapsed(TimeUnit.MICROSECONDS) / 1_000_000.0;
      usageLedger.recordApiRequest(
          request.getMethod(),
          request.getRequestURI(),
          response.getStatus(),
          elapsedSeconds,
          request.getRemoteAddr());
    }
  }
}
