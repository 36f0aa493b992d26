package io.github.drompincen.sprintplanner.runtime.tracker;

import java.util.List;

public interface TrackerSearchClient {

    /**
     * Runs one search page. The returned list never exceeds {@code window.limit()};
     * {@code total} counts every match regardless of the page.
     *
     * @throws io.github.drompincen.sprintplanner.runtime.error.RemoteQueryException
     *         on any non-success response; never retried here
     */
    SearchResult search(IssueQuery query, List<String> fields, PageWindow window);
}
