package com.chicu.agentpulse.ecosystem;

import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Последний срез экосистемы в памяти. Пишет только цикл обновления данных.
 */
@Component
public class EcosystemSnapshotHolder {

    public record Snapshot(
            List<ProjectSnapshot> projects,
            List<ForumPostSnapshot> forumPosts,
            Instant fetchedAt
    ) {
        public static Snapshot empty() {
            return new Snapshot(List.of(), List.of(), null);
        }
    }

    private final AtomicReference<Snapshot> current = new AtomicReference<>(Snapshot.empty());

    public Snapshot current() {
        return current.get();
    }

    public void replace(List<ProjectSnapshot> projects, List<ForumPostSnapshot> posts, Instant at) {
        current.set(new Snapshot(List.copyOf(projects), List.copyOf(posts), at));
    }
}
