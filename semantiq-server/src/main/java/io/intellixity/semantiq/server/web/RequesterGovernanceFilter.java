package io.intellixity.semantiq.server.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semantiq.governance.Governance;
import io.intellixity.semantiq.governance.GovernanceContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.Objects;

/**
 * Binds the requester headers to a {@link GovernanceContext} for the rest of the request.
 * {@code X-Tenant-Id} is required; user and group identities are optional.
 */
@Component
public final class RequesterGovernanceFilter extends OncePerRequestFilter {
  public static final String TENANT_HEADER = "X-Tenant-Id";
  public static final String USER_HEADER = "X-User-Id";
  public static final String GROUP_HEADER = "X-User-Group";

  private final ObjectMapper objectMapper;

  public RequesterGovernanceFilter(ObjectMapper objectMapper) {
    this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
  }

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {

    String tenantId = trimToNull(request.getHeader(TENANT_HEADER));
    if (tenantId == null) {
      response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
      response.setContentType(MediaType.APPLICATION_JSON_VALUE);
      objectMapper.writeValue(response.getOutputStream(),
          ApiError.of(ApiError.BAD_REQUEST, "Missing required header: " + TENANT_HEADER));
      return;
    }

    GovernanceContext ctx = GovernanceContext.of(tenantId,
        trimToNull(request.getHeader(USER_HEADER)),
        trimToNull(request.getHeader(GROUP_HEADER)));

    try {
      Governance.inContext(ctx, () -> {
        try {
          filterChain.doFilter(request, response);
        } catch (IOException | ServletException e) {
          throw new ChainFailure(e);
        }
        return null;
      });
    } catch (ChainFailure e) {
      Throwable c = e.getCause();
      if (c instanceof IOException ioe) throw ioe;
      throw (ServletException) c;
    }
  }

  private static String trimToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }

  private static final class ChainFailure extends RuntimeException {
    ChainFailure(Exception cause) {
      super(cause);
    }
  }
}
