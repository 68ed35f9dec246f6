package com.deepansh.sectools.nvd;

import com.deepansh.sectools.config.ToolProperties;
import com.deepansh.sectools.core.ExternalCallResult;
import com.deepansh.sectools.core.ExternalCallResult.Outcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.util.UriBuilder;

import java.io.IOException;
import java.io.InputStream;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.Map;

/**
 * NVD client over Spring's RestClient.
 *
 * Status handling:
 *
 * | Status        | Outcome                                              |
 * |---------------|------------------------------------------------------|
 * | 200           | SUCCESS, body is the raw NVD JSON                    |
 * | 403           | RATE_LIMITED: NVD signals quota exhaustion           |
 * | anything else | INFRASTRUCTURE_FAILURE with status and body          |
 *
 * Network errors are NOT classified here: they propagate as
 * ResourceAccessException so the circuit breaker in
 * {@link ResilientNvdClient} can count them. Use
 * {@link #classifyFailure(Throwable, long)} to turn them into a result.
 */
@Component("httpNvdClient")
@Slf4j
public class HttpNvdClient implements NvdClient {

    static final String RATE_LIMIT_MESSAGE =
            "Rate limited by NVD API. Set NVD_API_KEY for higher limits (50 req/30s).";

    private final ToolProperties.Nvd nvd;
    private final RestClient restClient;

    @Autowired
    public HttpNvdClient(ToolProperties toolProperties,
                         @Qualifier("nvdRestClientBuilder") RestClient.Builder restClientBuilder) {
        this(toolProperties.nvd(), restClientBuilder);
    }

    HttpNvdClient(ToolProperties.Nvd nvd, RestClient.Builder restClientBuilder) {
        this.nvd = nvd;
        this.restClient = restClientBuilder
                .baseUrl(nvd.baseUrl())
                .defaultHeader("Accept", MediaType.APPLICATION_JSON_VALUE)
                .requestInterceptor((request, body, execution) -> {
                    log.debug("Outbound NVD call: {} {}", request.getMethod(), request.getURI());
                    return execution.execute(request, body);
                })
                .build();
    }

    @Override
    public ExternalCallResult query(Map<String, ?> queryParams) {
        log.info("NVD query: {}", queryParams);

        return restClient.get()
                .uri(uriBuilder -> buildUri(uriBuilder, queryParams))
                .headers(headers -> {
                    if (nvd.hasApiKey()) headers.set("apiKey", nvd.apiKey());
                })
                .exchange((request, response) -> {
                    int status = response.getStatusCode().value();
                    String body = readBody(response.getBody());
                    log.info("NVD response: status={} body-length={}", status, body.length());
                    return classify(status, body);
                });
    }

    static ExternalCallResult classify(int status, String body) {
        if (status == 200) {
            return ExternalCallResult.http(Outcome.SUCCESS, status, body, null);
        }
        if (status == 403) {
            return ExternalCallResult.http(Outcome.RATE_LIMITED, status, "", RATE_LIMIT_MESSAGE);
        }
        return ExternalCallResult.http(Outcome.INFRASTRUCTURE_FAILURE, status, body,
                "NVD API returned HTTP " + status);
    }

    /**
     * Maps a transport-level failure (thrown by {@link #query}) to a result.
     */
    public static ExternalCallResult classifyFailure(Throwable error, long timeoutSeconds) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SocketTimeoutException
                    || t.getClass().getSimpleName().endsWith("TimeoutException")) {
                return ExternalCallResult.httpFailed(Outcome.TIMEOUT,
                        "NVD API request timed out after " + timeoutSeconds + " seconds");
            }
        }
        Throwable root = error;
        while (root.getCause() != null) root = root.getCause();
        String reason = root.getMessage() != null ? root.getMessage() : root.getClass().getSimpleName();
        return ExternalCallResult.httpFailed(Outcome.INFRASTRUCTURE_FAILURE, "NVD API request failed: " + reason);
    }

    // Values go in as URI variables so they are strictly encoded and never parsed as templates
    private static URI buildUri(UriBuilder uriBuilder, Map<String, ?> queryParams) {
        queryParams.keySet().forEach(name -> uriBuilder.queryParam(name, "{" + name + "}"));
        return uriBuilder.build(queryParams);
    }

    private static String readBody(InputStream body) throws IOException {
        if (body == null) return "";
        return new String(body.readAllBytes(), StandardCharsets.UTF_8);
    }
}
