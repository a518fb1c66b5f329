package dev.invox.files;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryFileTaskRepositoryTest {

    private static final Instant IMPORTED = Instant.parse("2024-05-01T08:00:00Z");
    private static final Instant NOW = Instant.parse("2024-05-01T09:30:00Z");

    private InMemoryFileTaskRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemoryFileTaskRepository(Clock.fixed(NOW, ZoneOffset.UTC));
        repository.save(FileTask.imported("a", "a.pdf", null, "/tmp/a.pdf", IMPORTED));
        repository.save(FileTask.imported("b", "b.png", "image/png", "/tmp/b.png", IMPORTED));
    }

    @Test
    void findByIdsKeepsRequestedOrderAndSkipsUnknownIds() {
        List<FileTask> found = repository.findByIds(List.of("b", "missing", "a"));

        assertThat(found).extracting(FileTask::id).containsExactly("b", "a");
    }

    @Test
    void updatesStatusAndPayload() {
        repository.updateStatus("a", FileStatus.PROCESSED);
        repository.updateParsedDetails("a", "{\"grand total\":10}");

        FileTask task = repository.findByIds(List.of("a")).get(0);
        assertThat(task.status()).isEqualTo(FileStatus.PROCESSED);
        assertThat(task.parsedDetails()).isEqualTo("{\"grand total\":10}");
        assertThat(task.createdAt()).isEqualTo(IMPORTED);
        assertThat(task.updatedAt()).isEqualTo(NOW);
    }

    @Test
    void ignoresUpdatesForUnknownFiles() {
        repository.updateStatus("missing", FileStatus.FAILED);

        assertThat(repository.findAll()).hasSize(2);
    }
}
