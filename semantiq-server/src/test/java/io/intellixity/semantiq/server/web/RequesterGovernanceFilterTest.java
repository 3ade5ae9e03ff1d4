package io.intellixity.semantiq.server.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.semantiq.governance.Governance;
import io.intellixity.semantiq.governance.GovernanceContext;
import io.intellixity.semantiq.security.Requester;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

final class RequesterGovernanceFilterTest {
  private final ObjectMapper mapper = new ObjectMapper();
  private final RequesterGovernanceFilter filter = new RequesterGovernanceFilter(mapper);

  @Test
  void missingTenantIsRejectedWithJsonError() throws Exception {
    MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/data-modeling/query/plan");
    MockHttpServletResponse res = new MockHttpServletResponse();
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(req, res, chain);

    assertEquals(400, res.getStatus());
    assertNull(chain.getRequest(), "chain must not run");
    JsonNode body = mapper.readTree(res.getContentAsString());
    assertFalse(body.get("success").asBoolean());
    assertEquals("BAD_REQUEST", body.get("code").asText());
    assertEquals("Missing required header: X-Tenant-Id", body.get("message").asText());
  }

  @Test
  void blankTenantIsRejected() throws Exception {
    MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/data-modeling/query/plan");
    req.addHeader(RequesterGovernanceFilter.TENANT_HEADER, "   ");
    MockHttpServletResponse res = new MockHttpServletResponse();

    filter.doFilter(req, res, new MockFilterChain());

    assertEquals(400, res.getStatus());
  }

  @Test
  void bindsRequesterForTheChainAndClearsAfterwards() throws Exception {
    MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/data-modeling/query/execute");
    req.addHeader(RequesterGovernanceFilter.TENANT_HEADER, " acme ");
    req.addHeader(RequesterGovernanceFilter.USER_HEADER, "ana@acme.io");
    req.addHeader(RequesterGovernanceFilter.GROUP_HEADER, "analysts");
    MockHttpServletResponse res = new MockHttpServletResponse();

    AtomicReference<GovernanceContext> seen = new AtomicReference<>();
    MockFilterChain chain = new MockFilterChain() {
      @Override
      public void doFilter(jakarta.servlet.ServletRequest request, jakarta.servlet.ServletResponse response) {
        seen.set(Governance.currentOrNull());
      }
    };

    filter.doFilter(req, res, chain);

    assertEquals(200, res.getStatus());
    GovernanceContext ctx = seen.get();
    assertNotNull(ctx);
    assertEquals("acme", ctx.tenantId());
    assertEquals(new Requester("ana@acme.io", "analysts"), ctx.requester());
    assertNull(Governance.currentOrNull());
  }

  @Test
  void missingIdentitiesLeaveAnAnonymousRequester() throws Exception {
    MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/data-modeling/query/plan");
    req.addHeader(RequesterGovernanceFilter.TENANT_HEADER, "acme");
    AtomicReference<Requester> seen = new AtomicReference<>();
    MockFilterChain chain = new MockFilterChain() {
      @Override
      public void doFilter(jakarta.servlet.ServletRequest request, jakarta.servlet.ServletResponse response) {
        seen.set(Governance.currentOrThrow().requester());
      }
    };

    filter.doFilter(req, new MockHttpServletResponse(), chain);

    assertEquals(Requester.anonymous(), seen.get());
  }

  @Test
  void chainIoFailurePropagatesUnwrapped() {
    MockHttpServletRequest req = new MockHttpServletRequest("POST", "/api/data-modeling/query/plan");
    req.addHeader(RequesterGovernanceFilter.TENANT_HEADER, "acme");
    MockFilterChain chain = new MockFilterChain() {
      @Override
      public void doFilter(jakarta.servlet.ServletRequest request, jakarta.servlet.ServletResponse response)
          throws IOException, ServletException {
        throw new IOException("client gone");
      }
    };

    IOException ex = assertThrows(IOException.class, () -> filter.doFilter(req, new MockHttpServletResponse(), chain));
    assertEquals("client gone", ex.getMessage());
    assertNull(Governance.currentOrNull());
  }
}
