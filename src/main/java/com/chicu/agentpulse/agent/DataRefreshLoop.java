package com.chicu.agentpulse.agent;

import com.chicu.agentpulse.common.enums.ActionOutcome;
import com.chicu.agentpulse.common.enums.ActionType;
import com.chicu.agentpulse.ecosystem.EcosystemClient;
import com.chicu.agentpulse.ecosystem.EcosystemProperties;
import com.chicu.agentpulse.ecosystem.EcosystemSnapshotHolder;
import com.chicu.agentpulse.ecosystem.ForumPostSnapshot;
import com.chicu.agentpulse.ecosystem.ProjectSnapshot;
import com.chicu.agentpulse.engine.AgentLoop;
import com.chicu.agentpulse.engine.SchedulerProperties;
import com.chicu.agentpulse.journal.ActionDraft;
import com.chicu.agentpulse.journal.ActionJournalService;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Обновление среза экосистемы. Проекты и форум тянутся параллельно,
 * срез заменяется целиком только если оба запроса успешны.
 */
@Slf4j
@Component
public class DataRefreshLoop implements AgentLoop {

    public static final String NAME = "data-refresh";
    static final String FORUM_SORT = "new";

    private final EcosystemClient ecosystem;
    private final EcosystemSnapshotHolder snapshots;
    private final EcosystemProperties ecosystemProps;
    private final SchedulerProperties schedulerProps;
    private final ActionJournalService journal;
    private final Clock clock;

    private final ExecutorService fetchPool = Executors.newFixedThreadPool(2, r -> {
        Thread t = new Thread(r);
        t.setDaemon(true);
        t.setName("DataFetch-" + t.getId());
        return t;
    });

    public DataRefreshLoop(EcosystemClient ecosystem,
                           EcosystemSnapshotHolder snapshots,
                           EcosystemProperties ecosystemProps,
                           SchedulerProperties schedulerProps,
                           ActionJournalService journal,
                           Clock clock) {
        this.ecosystem = ecosystem;
        this.snapshots = snapshots;
        this.ecosystemProps = ecosystemProps;
        this.schedulerProps = schedulerProps;
        this.journal = journal;
        this.clock = clock;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public ActionType actionType() {
        return ActionType.DATA_REFRESH;
    }

    @Override
    public Duration interval() {
        return schedulerProps.getDataRefresh();
    }

    @Override
    public int priority() {
        return 100;
    }

    @Override
    public void runIteration() {
        CompletableFuture<List<ProjectSnapshot>> projectsF =
                CompletableFuture.supplyAsync(ecosystem::fetchProjects, fetchPool);
        CompletableFuture<List<ForumPostSnapshot>> postsF =
                CompletableFuture.supplyAsync(() -> ecosystem.fetchForumPosts(FORUM_SORT, ecosystemProps.getForumFetchLimit()), fetchPool);

        List<ProjectSnapshot> projects;
        List<ForumPostSnapshot> posts;
        try {
            projects = projectsF.join();
            posts = postsF.join();
        } catch (CompletionException e) {
            // наружу отдаём исходную ошибку клиента, а не обёртку
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }

        Instant now = clock.instant();
        snapshots.replace(projects, posts, now);

        journal.record(ActionDraft.builder()
                .type(ActionType.DATA_REFRESH)
                .summary("Refreshed " + projects.size() + " projects, " + posts.size() + " forum posts")
                .metadata(Map.of(
                        "projects", projects.size(),
                        "forumPosts", posts.size()
                ))
                .outcome(ActionOutcome.SUCCESS)
                .build());

        log.info("📥 Data refresh: projects={} posts={}", projects.size(), posts.size());
    }

    @PreDestroy
    public void shutdown() {
        fetchPool.shutdown();
    }
}
