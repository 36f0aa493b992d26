package io.github.drompincen.sprintplanner.runtime.sync;

import io.github.drompincen.sprintplanner.persistence.document.SprintDocument;
import io.github.drompincen.sprintplanner.persistence.document.WorkItemDocument;
import io.github.drompincen.sprintplanner.protocol.api.DateRange;
import io.github.drompincen.sprintplanner.protocol.api.EpicAggregate;
import io.github.drompincen.sprintplanner.protocol.api.MatchStrategy;
import io.github.drompincen.sprintplanner.protocol.api.PaginatedEpicsResponse;
import io.github.drompincen.sprintplanner.protocol.api.SprintSyncResponse;
import io.github.drompincen.sprintplanner.protocol.api.SprintUpdate;
import io.github.drompincen.sprintplanner.protocol.api.SyncResult;
import io.github.drompincen.sprintplanner.protocol.api.VelocityAnalysisResponse;
import io.github.drompincen.sprintplanner.protocol.api.VelocityGroup;
import io.github.drompincen.sprintplanner.protocol.api.WorkItemAction;
import io.github.drompincen.sprintplanner.protocol.api.WorkItemStatus;
import io.github.drompincen.sprintplanner.runtime.epic.EpicAggregationService;
import io.github.drompincen.sprintplanner.runtime.error.SyncTimeoutException;
import io.github.drompincen.sprintplanner.runtime.error.ValidationException;
import io.github.drompincen.sprintplanner.runtime.normalize.FieldNormalizer;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintMatch;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintMatcher;
import io.github.drompincen.sprintplanner.runtime.sprint.SprintService;
import io.github.drompincen.sprintplanner.runtime.tracker.IssueQuery;
import io.github.drompincen.sprintplanner.runtime.tracker.PageWindow;
import io.github.drompincen.sprintplanner.runtime.tracker.SearchResult;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerIssue;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerIssueMapper;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerProperties;
import io.github.drompincen.sprintplanner.runtime.tracker.TrackerSearchClient;
import io.github.drompincen.sprintplanner.runtime.workitem.WorkItemService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionOperations;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Entry points that reconcile the tracker with local planning data: time-boxed epic
 * imports, attribution of completed tickets to past sprints, and velocity analysis.
 */
@Service
public class SprintSyncService {

    private static final Logger log = LoggerFactory.getLogger(SprintSyncService.class);

    static final Duration JQL_ZONE_SLACK = Duration.ofDays(1);

    static final String[] DONE_STATUSES = {"Done", "Closed", "Resolved"};
    static final String UNASSIGNED_GROUP = "Unassigned";

    private final EpicAggregationService epicAggregationService;
    private final TrackerSearchClient trackerClient;
    private final TrackerIssueMapper issueMapper;
    private final TrackerProperties trackerProperties;
    private final SprintService sprintService;
    private final WorkItemService workItemService;
    private final SprintMatcher sprintMatcher;
    private final TransactionOperations transactions;
    private final SyncProperties syncProperties;
    private final ExecutorService pipelineExecutor;
    private final Clock clock;

    public SprintSyncService(EpicAggregationService epicAggregationService,
                             TrackerSearchClient trackerClient,
                             TrackerIssueMapper issueMapper,
                             TrackerProperties trackerProperties,
                             SprintService sprintService,
                             WorkItemService workItemService,
                             SprintMatcher sprintMatcher,
                             TransactionOperations transactions,
                             SyncProperties syncProperties,
                             @Qualifier("syncPipelineExecutor") ExecutorService pipelineExecutor,
                             Clock clock) {
        this.epicAggregationService = epicAggregationService;
        this.trackerClient = trackerClient;
        this.issueMapper = issueMapper;
        this.trackerProperties = trackerProperties;
        this.sprintService = sprintService;
        this.workItemService = workItemService;
        this.sprintMatcher = sprintMatcher;
        this.transactions = transactions;
        this.syncProperties = syncProperties;
        this.pipelineExecutor = pipelineExecutor;
        this.clock = clock;
    }

    // ---- Epic import ----

    public PaginatedEpicsResponse importEpicsWithChildren(String projectKey, int limit, int startAt) {
        return timeBoxed("Epic import for " + projectKey,
                () -> epicAggregationService.fetchEpicsWithChildren(projectKey, limit, startAt));
    }

    public EpicAggregate importSingleEpicWithChildren(String epicKey) {
        return timeBoxed("Epic import for " + epicKey,
                () -> epicAggregationService.fetchSingleEpic(epicKey));
    }

    /** Runs {@code task} on the pipeline executor and abandons it once the aggregation budget is spent. */
    <T> T timeBoxed(String operation, Supplier<T> task) {
        Duration budget = syncProperties.getAggregationTimeout();
        Future<T> future = pipelineExecutor.submit(task::get);
        try {
            return future.get(budget.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("[Sync] {} exceeded {}ms, abandoning", operation, budget.toMillis());
            throw new SyncTimeoutException(operation, budget);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException(operation + " interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException(operation + " failed", cause);
        }
    }

    // ---- Past sprint sync ----

    /**
     * Attributes every Done ticket in the window to a started sprint. Each matched
     * ticket is persisted in its own transaction: work item upsert, sprint
     * assignment and the sprint's recomputed actual velocity.
     */
    public SprintSyncResponse syncCompletedTicketsToPastSprints(String projectKey, DateRange range) {
        requireProjectKey(projectKey);
        DateRange window = range != null ? range : DateRange.unbounded();
        if (window.from() != null && window.to() != null && window.to().isBefore(window.from())) {
            throw new ValidationException("dateRange.to is before dateRange.from");
        }

        List<TrackerIssue> tickets = fetchDoneTickets(projectKey, window);
        List<SprintDocument> candidates = sprintService.findActiveStartedBy(clock.instant());
        log.info("[Sync] project={} done tickets={} candidate sprints={}",
                projectKey, tickets.size(), candidates.size());

        List<SyncResult> results = new ArrayList<>(tickets.size());
        Map<String, SprintUpdate> updates = new LinkedHashMap<>();
        for (TrackerIssue ticket : tickets) {
            double points = FieldNormalizer.normalizeStoryPoints(ticket.rawStoryPoints());
            SprintMatch match = sprintMatcher.match(ticket, candidates);
            if (!match.matched()) {
                results.add(new SyncResult(ticket.key(), null, null, MatchStrategy.NO_SPRINT_FOUND,
                        points, WorkItemAction.NONE));
                continue;
            }

            SprintDocument sprint = match.sprint();
            TicketOutcome outcome = transactions.execute(status -> persistTicket(ticket, points, sprint));
            results.add(new SyncResult(ticket.key(), sprint.getSprintId(), sprint.getName(),
                    match.strategy(), points, outcome.action()));
            if (outcome.update() != null) {
                SprintUpdate previous = updates.get(sprint.getSprintId());
                updates.put(sprint.getSprintId(), previous == null ? outcome.update()
                        : new SprintUpdate(sprint.getSprintId(), sprint.getName(),
                        previous.previousVelocity(), outcome.update().actualVelocity()));
            }
        }

        log.info("[Sync] project={} synced={} sprint velocity updates={}",
                projectKey, results.size(), updates.size());
        return new SprintSyncResponse(projectKey, results, new ArrayList<>(updates.values()));
    }

    private TicketOutcome persistTicket(TrackerIssue ticket, double points, SprintDocument sprint) {
        Optional<WorkItemDocument> existing = workItemService.findByExternalId(ticket.key());
        WorkItemDocument item;
        WorkItemAction action;
        if (existing.isEmpty()) {
            item = workItemService.save(newCompletedItem(ticket, points));
            action = WorkItemAction.CREATED;
        } else if (existing.get().getStatus() != WorkItemStatus.COMPLETED) {
            item = existing.get();
            item.setStatus(WorkItemStatus.COMPLETED);
            item.setExternalStatus(ticket.statusName());
            item = workItemService.save(item);
            action = WorkItemAction.UPDATED;
        } else {
            item = existing.get();
            action = WorkItemAction.UNCHANGED;
        }

        workItemService.ensureAssigned(item.getWorkItemId(), sprint.getSprintId());
        return new TicketOutcome(action, recomputeVelocity(sprint));
    }

    /** Writes the sprint only when the completed-points sum differs from the stored velocity. */
    SprintUpdate recomputeVelocity(SprintDocument sprint) {
        double velocity = workItemService.findCompletedAssignedTo(sprint.getSprintId()).stream()
                .mapToDouble(WorkItemDocument::getStoryPoints)
                .sum();
        Double previous = sprint.getActualVelocity();
        if (previous != null && Double.compare(previous, velocity) == 0) {
            return null;
        }
        sprint.setActualVelocity(velocity);
        sprintService.save(sprint);
        return new SprintUpdate(sprint.getSprintId(), sprint.getName(), previous, velocity);
    }

    private static WorkItemDocument newCompletedItem(TrackerIssue ticket, double points) {
        WorkItemDocument item = new WorkItemDocument();
        item.setExternalId(ticket.key());
        item.setTitle(ticket.summary());
        item.setDescription(ticket.descriptionText());
        item.setPriority(WorkItemService.DEFAULT_PRIORITY);
        item.setStoryPoints(points);
        item.setRequiredSkills(FieldNormalizer.deriveSkills(ticket.labels()));
        item.setStatus(WorkItemStatus.COMPLETED);
        item.setExternalStatus(ticket.statusName());
        item.setEpicId(ticket.parentKey());
        item.setEpic(ticket.isEpic());
        item.setDependencyIds(new ArrayList<>());
        return item;
    }

    // ---- Velocity analysis ----

    /** Groups Done tickets by fix version, else latest sprint tag. Nothing is written. */
    public VelocityAnalysisResponse analyzeVelocity(String projectKey) {
        requireProjectKey(projectKey);
        List<TrackerIssue> tickets = fetchDoneTickets(projectKey, DateRange.unbounded());
        List<SprintDocument> candidates = sprintService.findActiveStartedBy(clock.instant());

        Map<String, GroupTally> groups = new LinkedHashMap<>();
        List<SyncResult> results = new ArrayList<>(tickets.size());
        double totalPoints = 0;
        for (TrackerIssue ticket : tickets) {
            double points = FieldNormalizer.normalizeStoryPoints(ticket.rawStoryPoints());
            totalPoints += points;

            String name;
            VelocityGroup.GroupSource source;
            if (ticket.fixVersions() != null && !ticket.fixVersions().isEmpty()) {
                name = ticket.fixVersions().get(0);
                source = VelocityGroup.GroupSource.FIX_VERSION;
            } else if (ticket.latestSprint().isPresent()) {
                name = ticket.latestSprint().get().name();
                source = VelocityGroup.GroupSource.SPRINT_TAG;
            } else {
                name = UNASSIGNED_GROUP;
                source = VelocityGroup.GroupSource.UNASSIGNED;
            }
            groups.computeIfAbsent(source + ":" + name, k -> new GroupTally(name, source)).add(ticket.key(), points);

            SprintMatch match = sprintMatcher.match(ticket, candidates);
            results.add(new SyncResult(ticket.key(),
                    match.matched() ? match.sprint().getSprintId() : null,
                    match.matched() ? match.sprint().getName() : null,
                    match.strategy(), points, WorkItemAction.NONE));
        }

        List<VelocityGroup> velocityGroups = groups.values().stream().map(GroupTally::toGroup).toList();
        log.info("[Velocity] project={} tickets={} groups={}", projectKey, tickets.size(), velocityGroups.size());
        return new VelocityAnalysisResponse(projectKey, tickets.size(), totalPoints, velocityGroups, results);
    }

    // ---- Tracker reads ----

    /** Every Done ticket updated inside {@code window}, across all result pages. */
    /**
     * The tracker reads JQL dates in the requesting user's time zone, so the remote
     * bounds are widened by {@link #JQL_ZONE_SLACK} and the exact window is applied here.
     */
    List<TrackerIssue> fetchDoneTickets(String projectKey, DateRange window) {
        IssueQuery query = IssueQuery.builder()
                .project(projectKey)
                .statusIn(DONE_STATUSES)
                .updatedFrom(window.from() != null ? window.from().minus(JQL_ZONE_SLACK) : null)
                .updatedTo(window.to() != null ? window.to().plus(JQL_ZONE_SLACK) : null)
                .orderBy("updated ASC")
                .build();
        int pageSize = Math.max(1, trackerProperties.getSearchPageSize());
        List<TrackerIssue> tickets = new ArrayList<>();
        int fetched = 0;
        while (true) {
            SearchResult page = trackerClient.search(query, issueMapper.searchFields(), new PageWindow(fetched, pageSize));
            fetched += page.issues().size();
            for (TrackerIssue issue : page.issues()) {
                if (window.from() == null && window.to() == null || window.contains(issue.updated())) {
                    tickets.add(issue);
                }
            }
            if (page.issues().isEmpty() || fetched >= page.total()) {
                return tickets;
            }
        }
    }

    private static void requireProjectKey(String projectKey) {
        if (projectKey == null || projectKey.isBlank()) {
            throw new ValidationException("projectKey is required");
        }
    }

    private record TicketOutcome(WorkItemAction action, SprintUpdate update) {}

    private static final class GroupTally {
        private final String name;
        private final VelocityGroup.GroupSource source;
        private final List<String> keys = new ArrayList<>();
        private double points;

        GroupTally(String name, VelocityGroup.GroupSource source) {
            this.name = name;
            this.source = source;
        }

        void add(String key, double storyPoints) {
            keys.add(key);
            points += storyPoints;
        }

        VelocityGroup toGroup() {
            return new VelocityGroup(name, source, keys.size(), points, List.copyOf(keys));
        }
    }
}
