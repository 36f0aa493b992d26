package io.github.drompincen.sprintplanner.runtime.tracker;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Connection settings for the issue tracker.
 *
 * <pre>
 * planner:
 *   tracker:
 *     base-url: https://example.atlassian.net
 *     email: bot@example.com
 *     api-token: ${PLANNER_TRACKER_API_TOKEN}
 *     story-points-field: customfield_10016
 * </pre>
 */
@ConfigurationProperties(prefix = "planner.tracker")
public class TrackerProperties {

    private String baseUrl = "http://localhost:8081";
    private String searchPath = "/rest/api/3/search";
    private String email;
    private String apiToken;

    /** Custom field carrying the numeric estimate. */
    private String storyPointsField = "customfield_10016";

    /** Custom field carrying the sprint associations. */
    private String sprintField = "customfield_10020";

    private int searchPageSize = 100;
    private Duration connectTimeout = Duration.ofSeconds(5);
    private Duration readTimeout = Duration.ofSeconds(30);

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

    public String getSearchPath() { return searchPath; }
    public void setSearchPath(String searchPath) { this.searchPath = searchPath; }

    public String getEmail() { return email; }
    public void setEmail(String email) { this.email = email; }

    public String getApiToken() { return apiToken; }
    public void setApiToken(String apiToken) { this.apiToken = apiToken; }

    public String getStoryPointsField() { return storyPointsField; }
    public void setStoryPointsField(String storyPointsField) { this.storyPointsField = storyPointsField; }

    public String getSprintField() { return sprintField; }
    public void setSprintField(String sprintField) { this.sprintField = sprintField; }

    public int getSearchPageSize() { return searchPageSize; }
    public void setSearchPageSize(int searchPageSize) { this.searchPageSize = searchPageSize; }

    public Duration getConnectTimeout() { return connectTimeout; }
    public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }

    public Duration getReadTimeout() { return readTimeout; }
    public void setReadTimeout(Duration readTimeout) { this.readTimeout = readTimeout; }
}
