package com.flamingo.ai.notionrag.api.filter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.flamingo.ai.notionrag.ledger.UsageLedger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

@ExtendWith(MockitoExtension.class)
@DisplayName("ApiAuditFilter Tests")
class ApiAuditFilterTest {

  @Mock private UsageLedger usageLedger;

  @Test
  @DisplayName("Should audit API requests with method, path, status and client address")
  void shouldAuditApiRequests() throws Exception {
    ApiAuditFilter filter = new ApiAuditFilter(usageLedger);
    MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/sync");
    request.setRemoteAddr("10.0.0.5");
    MockHttpServletResponse response = new MockHttpServletResponse();
    response.setStatus(202);

    filter.doFilter(request, response, new MockFilterChain());

    verify(usageLedger)
        .recordApiRequest(eq("POST"), eq("/api/sync"), eq(202), anyDouble(), eq("10.0.0.5"));
  }

  @Test
  @DisplayName("Should ignore requests outside /api")
  void shouldIgnoreNonApiRequests() throws Exception {
    ApiAuditFilter filter = new ApiAuditFilter(usageLedger);
    MockHttpServletRequest request = new MockHttpServletRequest("GET", "/actuator/health");
    MockFilterChain chain = new MockFilterChain();

    filter.doFilter(request, new MockHttpServletResponse(), chain);

    assertThat(chain.getRequest()).isSameAs(request);
    verifyNoInteractions(usageLedger);
  }
}
