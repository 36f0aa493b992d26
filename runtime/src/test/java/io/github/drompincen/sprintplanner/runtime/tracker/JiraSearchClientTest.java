package io.github.drompincen.sprintplanner.runtime.tracker;

import io.github.drompincen.sprintplanner.runtime.error.RemoteQueryException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class JiraSearchClientTest {

    private MockRestServiceServer server;
    private JiraSearchClient client;

    @BeforeEach
    void setUp() {
        TrackerProperties properties = new TrackerProperties();
        properties.setBaseUrl("https://tracker.example");
        properties.setEmail("bot@example.com");
        properties.setApiToken("secret");

        RestClient.Builder builder = RestClient.builder();
        server = MockRestServiceServer.bindTo(builder).build();
        client = new JiraSearchClient(builder, properties, new TrackerIssueMapper(properties));
    }

    @Test
    void postsQueryAndTruncatesToLimit() {
        String auth = Base64.getEncoder().encodeToString("bot@example.com:secret".getBytes(StandardCharsets.UTF_8));
        server.expect(requestTo("https://tracker.example/rest/api/3/search"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Authorization", "Basic " + auth))
                .andExpect(jsonPath("$.jql").value("project = \"REF\""))
                .andExpect(jsonPath("$.startAt").value(10))
                .andExpect(jsonPath("$.maxResults").value(2))
                .andRespond(withSuccess("""
                        {"total":57,"issues":[
                          {"key":"REF-1","fields":{"summary":"a"}},
                          {"key":"REF-2","fields":{"summary":"b"}},
                          {"key":"REF-3","fields":{"summary":"c"}}
                        ]}""", MediaType.APPLICATION_JSON));

        SearchResult result = client.search(IssueQuery.builder().project("REF").build(),
                List.of("summary"), new PageWindow(10, 2));

        assertThat(result.issues()).extracting(TrackerIssue::key).containsExactly("REF-1", "REF-2");
        assertThat(result.total()).isEqualTo(57);
        server.verify();
    }

    @Test
    void nonSuccessStatusSurfacesStatusAndBody() {
        server.expect(requestTo("https://tracker.example/rest/api/3/search"))
                .andRespond(withStatus(HttpStatus.UNAUTHORIZED)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"errorMessages\":[\"not allowed\"]}"));

        assertThatThrownBy(() -> client.search(IssueQuery.builder().project("REF").build(),
                List.of("summary"), PageWindow.cap(10)))
                .isInstanceOfSatisfying(RemoteQueryException.class, e -> {
                    assertThat(e.getStatusCode()).isEqualTo(401);
                    assertThat(e.getBody()).contains("not allowed");
                });
    }

    @Test
    void transportFailureHasStatusZero() {
        server.expect(requestTo("https://tracker.example/rest/api/3/search"))
                .andRespond(withException(new IOException("connection reset")));

        assertThatThrownBy(() -> client.search(IssueQuery.builder().project("REF").build(),
                List.of("summary"), PageWindow.cap(10)))
                .isInstanceOfSatisfying(RemoteQueryException.class,
                        e -> assertThat(e.getStatusCode()).isZero());
    }
}
