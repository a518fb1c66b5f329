package dev.invox.files;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps invoice files in memory. Used by the local profile and by tests.
 */
public class InMemoryFileTaskRepository implements FileTaskRepository {

    private final Map<String, FileTask> tasks = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryFileTaskRepository() {
        this(Clock.systemUTC());
    }

    public InMemoryFileTaskRepository(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void save(FileTask task) {
        tasks.put(task.id(), task);
    }

    @Override
    public void updateStatus(String fileId, FileStatus status) {
        tasks.computeIfPresent(fileId, (id, task) -> task.withStatus(status, clock.instant()));
    }

    @Override
    public void updateParsedDetails(String fileId, String parsedDetailsJson) {
        tasks.computeIfPresent(fileId, (id, task) -> task.withParsedDetails(parsedDetailsJson, clock.instant()));
    }

    @Override
    public List<FileTask> findByIds(List<String> fileIds) {
        List<FileTask> found = new ArrayList<>();
        for (String id : fileIds) {
            FileTask task = tasks.get(id);
            if (task != null) {
                found.add(task);
            }
        }
        return found;
    }

    public List<FileTask> findAll() {
        return List.copyOf(tasks.values());
    }
}
