package com.ospicorp.templog.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

@Component
public class RequestLoggingFilter extends OncePerRequestFilter {

  private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);
  private static final String HEALTH_PATH = "/health";

  @Override
  protected void doFilterInternal(@NonNull HttpServletRequest request, @NonNull HttpServletResponse response,
      @NonNull FilterChain filterChain) throws ServletException, IOException {
    long startTime = System.currentTimeMillis();
    try {
      filterChain.doFilter(request, response);
    } catch (ServletException | IOException | RuntimeException ex) {
      log.error("Request {} {} from {} failed: {}",
          request.getMethod(),
          HttpRequests.uriWithQuery(request),
          HttpRequests.clientIp(request),
          ex.getMessage(),
          ex);
      throw ex;
    } finally {
      long duration = System.currentTimeMillis() - startTime;
      // liveness probes would drown the access log
      if (HEALTH_PATH.equals(request.getRequestURI())) {
        log.debug("HTTP {} {} -> {} ({} ms)", request.getMethod(), HEALTH_PATH,
            response.getStatus(), duration);
      } else {
        log.info("HTTP {} {} from {} -> {} ({} ms, {} bytes in)",
            request.getMethod(),
            HttpRequests.uriWithQuery(request),
            HttpRequests.clientIp(request),
            response.getStatus(),
            duration,
            request.getContentLengthLong());
      }
    }
  }
}
