package io.github.drompincen.sprintplanner.runtime.tracker;

import com.fasterxml.jackson.databind.JsonNode;
import io.github.drompincen.sprintplanner.runtime.error.RemoteQueryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.stereotype.Service;
import org.springframework.util.StreamUtils;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link TrackerSearchClient} over the tracker's REST search endpoint. Failures
 * surface as {@link RemoteQueryException} with the remote status and body.
 */
@Service
public class JiraSearchClient implements TrackerSearchClient {

    private static final Logger log = LoggerFactory.getLogger(JiraSearchClient.class);

    private final RestClient restClient;
    private final TrackerProperties properties;
    private final TrackerIssueMapper mapper;

    public JiraSearchClient(RestClient.Builder restClientBuilder,
                            TrackerProperties properties,
                            TrackerIssueMapper mapper) {
        this.properties = properties;
        this.mapper = mapper;
        this.restClient = restClientBuilder
                .baseUrl(properties.getBaseUrl())
                .defaultHeaders(headers -> {
                    if (StringUtils.hasText(properties.getEmail()) && StringUtils.hasText(properties.getApiToken())) {
                        headers.setBasicAuth(properties.getEmail(), properties.getApiToken());
                    }
                    headers.setAccept(List.of(MediaType.APPLICATION_JSON));
                })
                .build();
    }

    @Override
    public SearchResult search(IssueQuery query, List<String> fields, PageWindow window) {
        String jql = query.toJql();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("jql", jql);
        body.put("fields", fields);
        body.put("startAt", window.startAt());
        body.put("maxResults", window.limit());

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(properties.getSearchPath())
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (request, res) -> {
                        int status = res.getStatusCode().value();
                        String errorBody = readBody(res);
                        log.warn("[Tracker] search failed status={} jql={}", status, jql);
                        throw new RemoteQueryException(status, errorBody);
                    })
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            log.warn("[Tracker] search unreachable jql={}: {}", jql, e.getMessage());
            throw new RemoteQueryException("Issue tracker unreachable: " + e.getMessage(), e);
        }

        if (response == null) {
            return new SearchResult(List.of(), 0);
        }
        List<TrackerIssue> issues = mapper.toIssues(response.path("issues"));
        if (issues.size() > window.limit()) {
            issues = issues.subList(0, window.limit());
        }
        int total = response.path("total").asInt(issues.size());
        log.debug("[Tracker] jql={} startAt={} limit={} -> {} of {}",
                jql, window.startAt(), window.limit(), issues.size(), total);
        return new SearchResult(List.copyOf(issues), total);
    }

    private static String readBody(ClientHttpResponse response) {
        try {
            return StreamUtils.copyToString(response.getBody(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.debug("[Tracker] could not read error body: {}", e.getMessage());
            return "";
        }
    }
}
