package io.github.drompincen.sprintplanner.runtime.epic;

import io.github.drompincen.sprintplanner.protocol.api.EpicAggregate;
import io.github.drompincen.sprintplanner.protocol.api.PaginatedEpicsResponse;
import io.github.drompincen.sprintplanner.protocol.api.Pagination;
import io.github.drompincen.sprintplanner.runtime.error.NotFoundException;
import io.github.drompincen.sprintplanner.runtime.error.ValidationException;
import io.github.drompincen.sprintplanner.runtime.normalize.FieldNormalizer;
import io.github.drompincen.sprintplanner.runtime.sync.SyncProperties;
import io.github.drompincen.sprintplanner.runtime.tracker.IssueQuery;
import io.github.drompincen.sprintplanner.runtime.tracker.PageWindow;
import io.github.drompincen.sprintplanner.runtime.tracker.SearchResult;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerIssue;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerIssueMapper;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerProperties;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerSearchClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * Reads open epics from the tracker and joins each with its children.
 *
 * <p>Children are fetched concurrently in batches of {@code planner.sync.epic-batch-size}
 * with a pause between batches. A failed children fetch is logged and the epic is
 * returned with no children and zero totals. Interrupting the caller cancels every
 * children fetch still in flight.
 */
@Service
public class EpicAggregationService {

    private static final Logger log = LoggerFactory.getLogger(EpicAggregationService.class);

    static final String[] CLOSED_EPIC_STATUSES = {"Done", "Cancelled"};

    private final TrackerSearchClient trackerClient;
    private final TrackerIssueMapper issueMapper;
    private final TrackerProperties trackerProperties;
    private final SyncProperties syncProperties;
    private final ExecutorService fetchExecutor;

    public EpicAggregationService(TrackerSearchClient trackerClient,
                                  TrackerIssueMapper issueMapper,
                                  TrackerProperties trackerProperties,
                                  SyncProperties syncProperties,
                                  @Qualifier("epicFetchExecutor") ExecutorService fetchExecutor) {
        this.trackerClient = trackerClient;
        this.issueMapper = issueMapper;
        this.trackerProperties = trackerProperties;
        this.syncProperties = syncProperties;
        this.fetchExecutor = fetchExecutor;
    }

    public PaginatedEpicsResponse fetchEpicsWithChildren(String projectKey, int limit, int startAt) {
        if (projectKey == null || projectKey.isBlank()) {
            throw new ValidationException("projectKey is required");
        }
        if (limit <= 0 || startAt < 0) {
            throw new ValidationException("limit must be > 0 and startAt must be >= 0",
                    "Pass a positive limit and a non-negative startAt");
        }

        IssueQuery query = IssueQuery.builder()
                .project(projectKey)
                .issueTypes("Epic")
                .statusNotIn(CLOSED_EPIC_STATUSES)
                .orderBy("created DESC")
                .build();
        SearchResult page = trackerClient.search(query, issueMapper.searchFields(), new PageWindow(startAt, limit));
        log.info("[Epics] project={} startAt={} limit={} -> {} of {} epics",
                projectKey, startAt, limit, page.issues().size(), page.total());

        List<EpicAggregate> epics = aggregate(page.issues());
        boolean hasMore = startAt + page.issues().size() < page.total();
        return new PaginatedEpicsResponse(epics, new Pagination(limit, startAt, page.total(), hasMore));
    }

    public EpicAggregate fetchSingleEpic(String epicKey) {
        if (epicKey == null || epicKey.isBlank()) {
            throw new ValidationException("epicKey is required");
        }
        IssueQuery query = IssueQuery.builder().key(epicKey).build();
        SearchResult result = trackerClient.search(query, issueMapper.searchFields(), PageWindow.cap(1));
        if (result.issues().isEmpty() || !result.issues().get(0).isEpic()) {
            throw new NotFoundException("Epic", epicKey);
        }
        return aggregate(result.issues()).get(0);
    }

    List<EpicAggregate> aggregate(List<TrackerIssue> epics) {
        List<EpicAggregate> aggregates = new ArrayList<>(epics.size());
        int batchSize = Math.max(1, syncProperties.getEpicBatchSize());

        for (int from = 0; from < epics.size(); from += batchSize) {
            if (from > 0) {
                pauseBetweenBatches();
            }
            List<TrackerIssue> batch = epics.subList(from, Math.min(from + batchSize, epics.size()));
            List<Future<List<TrackerIssue>>> pending = new ArrayList<>(batch.size());
            for (TrackerIssue epic : batch) {
                pending.add(fetchExecutor.submit(() -> fetchChildren(epic.key())));
            }
            try {
                for (int i = 0; i < batch.size(); i++) {
                    TrackerIssue epic = batch.get(i);
                    aggregates.add(toAggregate(epic, awaitChildren(epic.key(), pending.get(i))));
                }
            } catch (CancellationException e) {
                int cancelled = cancelUnfinished(pending);
                log.warn("[Epics] aggregation cancelled, interrupted {} in-flight children fetches", cancelled);
                throw e;
            }
        }
        return aggregates;
    }

    private static int cancelUnfinished(List<Future<List<TrackerIssue>>> pending) {
        int cancelled = 0;
        for (Future<List<TrackerIssue>> future : pending) {
            if (!future.isDone() && future.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }

    /** Every child of the epic, paging until the remote total is reached. */
    List<TrackerIssue> fetchChildren(String epicKey) {
        IssueQuery query = IssueQuery.builder().parent(epicKey).build();
        int pageSize = Math.max(1, trackerProperties.getSearchPageSize());
        List<TrackerIssue> children = new ArrayList<>();
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new CancellationException("Children fetch for " + epicKey + " cancelled");
            }
            SearchResult page = trackerClient.search(query, issueMapper.searchFields(),
                    new PageWindow(children.size(), pageSize));
            children.addAll(page.issues());
            if (page.issues().isEmpty() || children.size() >= page.total()) {
                return children;
            }
        }
    }

    private List<TrackerIssue> awaitChildren(String epicKey, Future<List<TrackerIssue>> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Epic aggregation interrupted at " + epicKey);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Epics] children fetch failed for {}, continuing without children: {}",
                    epicKey, cause.getMessage());
            return List.of();
        }
    }

    private void pauseBetweenBatches() {
        long millis = syncProperties.getEpicBatchPause().toMillis();
        if (millis <= 0) {
            return;
        }
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Epic aggregation interrupted between batches");
        }
    }

    static EpicAggregate toAggregate(TrackerIssue epic, List<TrackerIssue> children) {
        List<EpicAggregate.EpicChild> mapped = new ArrayList<>(children.size());
        double total = 0;
        double completed = 0;
        for (TrackerIssue child : children) {
            double points = FieldNormalizer.normalizeStoryPoints(child.rawStoryPoints());
            total += points;
            if (FieldNormalizer.isCompleted(child.statusName())) {
                completed += points;
            }
            mapped.add(new EpicAggregate.EpicChild(
                    child.key(),
                    child.summary(),
                    child.descriptionText(),
                    points,
                    FieldNormalizer.mapExternalStatus(child.statusName()),
                    child.statusName(),
                    FieldNormalizer.deriveSkills(child.labels())));
        }
        return new EpicAggregate(
                epic.key(),
                epic.summary(),
                epic.descriptionText(),
                FieldNormalizer.mapExternalStatus(epic.statusName()),
                epic.statusName(),
                epic.created(),
                epic.updated(),
                mapped,
                total,
                completed);
    }
}
