package com.deepansh.sectools.auth;

import com.deepansh.sectools.exception.ErrorKind;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.assertj.core.api.Assertions.assertThat;

class BearerAuthFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BearerAuthFilter secured = new BearerAuthFilter("s3cret", objectMapper);
    private final BearerAuthFilter open = new BearerAuthFilter("", objectMapper);

    @Test
    void evaluate_noTokenConfigured_authenticatesEverything() {
        assertThat(open.isEnabled()).isFalse();
        assertThat(open.evaluate(null)).isEqualTo(AuthDecision.AUTHENTICATED);
        assertThat(open.evaluate("Bearer anything")).isEqualTo(AuthDecision.AUTHENTICATED);
    }

    @Test
    void evaluate_missingHeader_isUnauthorized() {
        assertThat(secured.evaluate(null)).isEqualTo(AuthDecision.UNAUTHORIZED);
    }

    @Test
    void evaluate_nonBearerScheme_isUnauthorized() {
        assertThat(secured.evaluate("Basic czNjcmV0")).isEqualTo(AuthDecision.UNAUTHORIZED);
        assertThat(secured.evaluate("s3cret")).isEqualTo(AuthDecision.UNAUTHORIZED);
    }

    @Test
    void evaluate_wrongToken_isForbidden() {
        assertThat(secured.evaluate("Bearer wrong")).isEqualTo(AuthDecision.FORBIDDEN);
        assertThat(secured.evaluate("Bearer s3cret2")).isEqualTo(AuthDecision.FORBIDDEN);
        assertThat(secured.evaluate("Bearer ")).isEqualTo(AuthDecision.FORBIDDEN);
    }

    @Test
    void decisions_mapToErrorKinds() {
        assertThat(AuthDecision.UNAUTHORIZED.kind()).isEqualTo(ErrorKind.UNAUTHORIZED);
        assertThat(AuthDecision.FORBIDDEN.kind()).isEqualTo(ErrorKind.FORBIDDEN);
        assertThat(AuthDecision.AUTHENTICATED.kind()).isNull();
    }

    @Test
    void evaluate_matchingToken_isAuthenticated() {
        assertThat(secured.evaluate("Bearer s3cret")).isEqualTo(AuthDecision.AUTHENTICATED);
    }

    @Test
    void doFilter_missingHeader_writes401Json() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/mcp");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        secured.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(401);
        assertThat(response.getContentAsString()).contains("Missing or malformed Authorization header");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void doFilter_wrongToken_writes403Json() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/tools");
        request.addHeader("Authorization", "Bearer wrong");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        secured.doFilter(request, response, chain);

        assertThat(response.getStatus()).isEqualTo(403);
        assertThat(objectMapper.readTree(response.getContentAsString()).get("error").asText())
                .isEqualTo("Invalid bearer token");
        assertThat(chain.getRequest()).isNull();
    }

    @Test
    void doFilter_validToken_continuesChain() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/health");
        request.addHeader("Authorization", "Bearer s3cret");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        secured.doFilter(request, response, chain);

        assertThat(chain.getRequest()).isSameAs(request);
        assertThat(response.getStatus()).isEqualTo(200);
    }
}
