package io.github.drompincen.sprintplanner.runtime.tracker;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Structured tracker query. Rendered to JQL by {@link #toJql()}; every value is
 * quoted so user input never changes the query structure.
 */
public record IssueQuery(
        String projectKey,
        List<String> issueTypes,
        List<String> statusIn,
        List<String> statusNotIn,
        String parentKey,
        String issueKey,
        String assignee,
        Instant updatedFrom,
        Instant updatedTo,
        String orderBy
) {

    private static final DateTimeFormatter JQL_DATE =
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm").withZone(ZoneOffset.UTC);

    public static Builder builder() {
        return new Builder();
    }

    public String toJql() {
        List<String> clauses = new ArrayList<>();
        if (projectKey != null) clauses.add("project = " + quote(projectKey));
        if (issueKey != null) clauses.add("key = " + quote(issueKey));
        if (issueTypes != null && !issueTypes.isEmpty()) clauses.add("issuetype in " + list(issueTypes));
        if (statusIn != null && !statusIn.isEmpty()) clauses.add("status in " + list(statusIn));
        if (statusNotIn != null && !statusNotIn.isEmpty()) clauses.add("status not in " + list(statusNotIn));
        if (parentKey != null) clauses.add("parent = " + quote(parentKey));
        if (assignee != null) clauses.add("assignee = " + quote(assignee));
        if (updatedFrom != null) clauses.add("updated >= " + quote(JQL_DATE.format(updatedFrom)));
        if (updatedTo != null) clauses.add("updated <= " + quote(JQL_DATE.format(ceilToMinute(updatedTo))));

        String jql = String.join(" AND ", clauses);
        if (orderBy != null) {
            jql = jql + " ORDER BY " + orderBy;
        }
        return jql;
    }

    // JQL dates have minute precision; round the upper bound up so the window stays inclusive
    private static Instant ceilToMinute(Instant instant) {
        Instant floor = instant.truncatedTo(ChronoUnit.MINUTES);
        return floor.equals(instant) ? floor : floor.plus(1, ChronoUnit.MINUTES);
    }

    private static String list(List<String> values) {
        return values.stream().map(IssueQuery::quote).collect(Collectors.joining(", ", "(", ")"));
    }

    static String quote(String value) {
        return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
    }

    public static final class Builder {
        private String projectKey;
        private List<String> issueTypes = List.of();
        private List<String> statusIn = List.of();
        private List<String> statusNotIn = List.of();
        private String parentKey;
        private String issueKey;
        private String assignee;
        private Instant updatedFrom;
        private Instant updatedTo;
        private String orderBy;

        private Builder() {}

        public Builder project(String projectKey) { this.projectKey = projectKey; return this; }
        public Builder issueTypes(String... types) { this.issueTypes = List.of(types); return this; }
        public Builder statusIn(String... statuses) { this.statusIn = List.of(statuses); return this; }
        public Builder statusNotIn(String... statuses) { this.statusNotIn = List.of(statuses); return this; }
        public Builder parent(String parentKey) { this.parentKey = parentKey; return this; }
        public Builder key(String issueKey) { this.issueKey = issueKey; return this; }
        public Builder assignee(String assignee) { this.assignee = assignee; return this; }
        public Builder updatedFrom(Instant from) { this.updatedFrom = from; return this; }
        public Builder updatedTo(Instant to) { this.updatedTo = to; return this; }
        public Builder orderBy(String orderBy) { this.orderBy = orderBy; return this; }

        public IssueQuery build() {
            return new IssueQuery(projectKey, issueTypes, statusIn, statusNotIn, parentKey, issueKey,
                    assignee, updatedFrom, updatedTo, orderBy);
        }
    }
}
