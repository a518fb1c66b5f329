package dev.invox.invoiceparser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.invox.files.FileStatus;
import dev.invox.files.FileTask;
import dev.invox.files.InMemoryFileTaskRepository;
import dev.invox.invoiceparser.catalog.ModelCatalog;
import dev.invox.invoiceparser.googleai.GeminiApiException;
import dev.invox.invoiceparser.googleai.GeminiClient;
import dev.invox.invoiceparser.googleai.GeminiContentRequest;
import dev.invox.invoiceparser.usage.ModelLockRegistry;
import dev.invox.invoiceparser.usage.Sleeper;
import dev.invox.invoiceparser.usage.UsageTracker;
import dev.invox.storage.FileContentReader;
import dev.invox.storage.InvoiceStorageException;
import dev.invox.usage.InMemoryModelUsageRepository;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BatchOrchestratorTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RecordingListener listener = new RecordingListener();

    private InMemoryFileTaskRepository repository;
    private Map<String, byte[]> contents;
    private FileContentReader contentReader;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        repository = new InMemoryFileTaskRepository(Clock.fixed(NOW, ZoneOffset.UTC));
        contents = new HashMap<>();
        contentReader = path -> {
            byte[] content = contents.get(path);
            if (content == null) {
                throw new InvoiceStorageException("Failed to read file " + path);
            }
            return content;
        };
        executor = Executors.newCachedThreadPool();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void processesBatchAcrossModelsAndPersistsEachFile() throws Exception {
        FileTask ok = importFile("aaaaaaaa-1", "ok.pdf", "ok");
        FileTask busy = importFile("bbbbbbbb-2", "busy.png", "busy");
        FileTask slow = importFile("cccccccc-3", "slow.jpg", "slow");

        GeminiClient geminiClient = mock(GeminiClient.class);
        when(geminiClient.generateContent(any(), anyString())).thenAnswer(invocation -> {
            GeminiContentRequest request = invocation.getArgument(0);
            String marker = new String(request.fileBytes(), StandardCharsets.UTF_8);
            switch (marker) {
                case "ok":
                    return "{\"invoce number\": \"INV-1\"}";
                case "busy":
                    throw new GeminiApiException(429, "Google AI Gemini request failed with status 429", null);
                default:
                    Thread.sleep(10_000);
                    return "{}";
            }
        });

        BatchOrchestrator orchestrator = realOrchestrator(geminiClient, () -> "key");
        BatchResult result = orchestrator.run(List.of(ok, busy, slow), listener);

        assertThat(result).isEqualTo(new BatchResult(1, 2));

        FileTask storedOk = stored(ok.id());
        assertThat(storedOk.status()).isEqualTo(FileStatus.PROCESSED);
        assertThat(objectMapper.readTree(storedOk.parsedDetails()).get("invoce number").asText()).isEqualTo("INV-1");

        JsonNode busyPayload = objectMapper.readTree(stored(busy.id()).parsedDetails());
        assertThat(stored(busy.id()).status()).isEqualTo(FileStatus.FAILED);
        assertThat(busyPayload.get("statusCode").asInt()).isEqualTo(429);
        assertThat(busyPayload.get("error").asText()).contains("429");

        JsonNode slowPayload = objectMapper.readTree(stored(slow.id()).parsedDetails());
        assertThat(stored(slow.id()).status()).isEqualTo(FileStatus.FAILED);
        assertThat(slowPayload.get("error").asText()).startsWith("Request timed out after");
        assertThat(slowPayload.has("statusCode")).isFalse();

        assertThat(listener.progress).containsExactly("1/3", "2/3", "3/3");
        assertThat(listener.messages).containsExactly(
            "Reading files from disk...",
            "Processing 3 files...",
            "Processing files: 1 processed, 2 remaining",
            "Processing files: 2 processed, 1 remaining",
            "Processing files: 3 processed, 0 remaining",
            "Processing completed with 2 failed file(s).");
    }

    @Test
    void marksFilesProcessingBeforeTheFirstCall() {
        FileTask first = importFile("aaaaaaaa-1", "first.pdf", "one");
        FileTask second = importFile("bbbbbbbb-2", "second.pdf", "two");
        List<FileStatus> statusesAtFirstCall = new ArrayList<>();

        ModelSequencer sequencer = mock(ModelSequencer.class);
        when(sequencer.resolveOrder()).thenReturn(List.of("gemini-2.5-flash"));
        when(sequencer.run(any(), anyList(), anyString())).thenAnswer(invocation -> {
            if (statusesAtFirstCall.isEmpty()) {
                statusesAtFirstCall.add(stored(first.id()).status());
                statusesAtFirstCall.add(stored(second.id()).status());
            }
            InvoiceInput input = invocation.getArgument(0);
            return FileExtractionResult.success(input.fileId(), "gemini-2.5-flash",
                objectMapper.createObjectNode(), false);
        });

        BatchResult result = orchestrator(sequencer, () -> "key").run(List.of(first, second), listener);

        assertThat(result).isEqualTo(new BatchResult(2, 0));
        assertThat(statusesAtFirstCall).containsExactly(FileStatus.PROCESSING, FileStatus.PROCESSING);
        assertThat(listener.messages).last().isEqualTo("Processing completed successfully.");
    }

    @Test
    void reportsWhenEveryFileFails() {
        FileTask only = importFile("aaaaaaaa-1", "only.pdf", "one");
        ModelSequencer sequencer = mock(ModelSequencer.class);
        when(sequencer.resolveOrder()).thenReturn(List.of("gemini-2.5-flash"));
        when(sequencer.run(any(), anyList(), anyString()))
            .thenReturn(FileExtractionResult.failure(only.id(), "API key not valid", null));

        BatchResult result = orchestrator(sequencer, () -> "key").run(List.of(only), listener);

        assertThat(result).isEqualTo(new BatchResult(0, 1));
        assertThat(stored(only.id()).parsedDetails()).isEqualTo("{\"error\":\"API key not valid\"}");
        assertThat(listener.messages).last().isEqualTo("Processing failed: all files failed to process.");
    }

    @Test
    void rawFallbackIsStoredAsProcessedAndFlagged() {
        FileTask only = importFile("aaaaaaaa-1", "scan.png", "one");
        ModelSequencer sequencer = mock(ModelSequencer.class);
        when(sequencer.resolveOrder()).thenReturn(List.of("gemini-2.5-flash"));
        when(sequencer.run(any(), anyList(), anyString())).thenReturn(FileExtractionResult.success(only.id(),
            "gemini-2.5-flash", objectMapper.createObjectNode().put("_raw", "not json"), true));

        BatchResult result = orchestrator(sequencer, () -> "key").run(List.of(only), listener);

        assertThat(result).isEqualTo(new BatchResult(1, 0));
        assertThat(stored(only.id()).status()).isEqualTo(FileStatus.PROCESSED);
        assertThat(stored(only.id()).parsedDetails()).isEqualTo("{\"_raw\":\"not json\"}");
        assertThat(listener.messages).contains("Stored unparsed response for scan.png (#aaaaaaaa); it needs review.");
    }

    @Test
    void missingCredentialRejectsBatchWithoutTouchingFiles() {
        FileTask only = importFile("aaaaaaaa-1", "only.pdf", "one");
        ModelSequencer sequencer = mock(ModelSequencer.class);

        assertThatThrownBy(() -> orchestrator(sequencer, () -> "  ").run(List.of(only), listener))
            .isInstanceOf(CredentialMissingException.class)
            .hasMessageContaining("GEMINI_API_KEY");

        assertThat(stored(only.id()).status()).isEqualTo(FileStatus.UNPROCESSED);
        assertThat(listener.messages).isEmpty();
        verify(sequencer, never()).run(any(), anyList(), anyString());
    }

    @Test
    void emptyBatchIsRejected() {
        ModelSequencer sequencer = mock(ModelSequencer.class);

        assertThatThrownBy(() -> orchestrator(sequencer, () -> "key").run(List.of(), listener))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessage("No files provided for processing.");
    }

    @Test
    void unreadableFileFailsTheWholeBatch() {
        FileTask first = importFile("aaaaaaaa-1", "first.pdf", "one");
        FileTask missing = repositoryOnly("bbbbbbbb-2", "missing.pdf");
        ModelSequencer sequencer = mock(ModelSequencer.class);

        assertThatThrownBy(() -> orchestrator(sequencer, () -> "key").run(List.of(first, missing), listener))
            .isInstanceOf(InvoiceStorageException.class);

        assertThat(stored(first.id()).status()).isEqualTo(FileStatus.FAILED);
        assertThat(stored(missing.id()).status()).isEqualTo(FileStatus.FAILED);
        verify(sequencer, never()).run(any(), anyList(), anyString());
    }

    @Test
    void crashKeepsResolvedFilesAndFailsTheRest() {
        FileTask first = importFile("aaaaaaaa-1", "first.pdf", "one");
        FileTask second = importFile("bbbbbbbb-2", "second.pdf", "two");
        FileTask third = importFile("cccccccc-3", "third.pdf", "three");
        ModelSequencer sequencer = mock(ModelSequencer.class);
        when(sequencer.resolveOrder()).thenReturn(List.of("gemini-2.5-flash"));
        when(sequencer.run(any(), anyList(), anyString()))
            .thenReturn(FileExtractionResult.success(first.id(), "gemini-2.5-flash",
                objectMapper.createObjectNode(), false))
            .thenThrow(new InvoiceProcessingException("Interrupted while waiting for Gemini model gemini-2.5-flash",
                new InterruptedException()));

        assertThatThrownBy(() -> orchestrator(sequencer, () -> "key").run(List.of(first, second, third), listener))
            .isInstanceOf(InvoiceProcessingException.class);

        assertThat(stored(first.id()).status()).isEqualTo(FileStatus.PROCESSED);
        assertThat(stored(second.id()).status()).isEqualTo(FileStatus.FAILED);
        assertThat(stored(third.id()).status()).isEqualTo(FileStatus.FAILED);
    }

    @Test
    void failuresWhileMarkingFilesAreSuppressed() {
        repository = new InMemoryFileTaskRepository(Clock.fixed(NOW, ZoneOffset.UTC)) {
            @Override
            public void updateStatus(String fileId, FileStatus status) {
                if (status == FileStatus.FAILED) {
                    throw new IllegalStateException("Storage unavailable");
                }
                super.updateStatus(fileId, status);
            }
        };
        FileTask only = importFile("aaaaaaaa-1", "only.pdf", "one");
        ModelSequencer sequencer = mock(ModelSequencer.class);
        when(sequencer.resolveOrder()).thenReturn(List.of("gemini-2.5-flash"));
        when(sequencer.run(any(), anyList(), anyString())).thenThrow(new IllegalStateException("boom"));

        assertThatThrownBy(() -> orchestrator(sequencer, () -> "key").run(List.of(only), listener))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom")
            .satisfies(ex -> assertThat(ex.getSuppressed()).hasSize(1)
                .allSatisfy(suppressed -> assertThat(suppressed).hasMessage("Storage unavailable")));
    }

    private BatchOrchestrator realOrchestrator(GeminiClient geminiClient, CredentialProvider credentials) {
        ModelCatalog catalog = new ModelCatalog("model-a", List.of("model-a", "model-b"),
            List.of("model-a", "model-b"), Map.of());
        UsageTracker tracker = new UsageTracker(new InMemoryModelUsageRepository(), new ModelLockRegistry(),
            Clock.systemUTC(), Sleeper.THREAD, UsageTracker.DEFAULT_ZONE);
        InvoicePrompts prompts = new InvoicePrompts("system", "user", Map.of("type", "object"));
        ExtractionInvoker invoker = new ExtractionInvoker(geminiClient, objectMapper, prompts, executor,
            Duration.ofMillis(200));
        return orchestrator(new ModelSequencer(tracker, invoker, () -> catalog), credentials);
    }

    private BatchOrchestrator orchestrator(ModelSequencer sequencer, CredentialProvider credentials) {
        return new BatchOrchestrator(repository, contentReader, sequencer, credentials, objectMapper);
    }

    private FileTask importFile(String id, String fileName, String content) {
        String path = "/invoices/" + fileName;
        contents.put(path, content.getBytes(StandardCharsets.UTF_8));
        return repositoryOnly(id, fileName);
    }

    private FileTask repositoryOnly(String id, String fileName) {
        FileTask task = FileTask.imported(id, fileName, null, "/invoices/" + fileName, NOW);
        repository.save(task);
        return task;
    }

    private FileTask stored(String id) {
        return repository.findByIds(List.of(id)).get(0);
    }

    private static final class RecordingListener implements BatchProgressListener {

        private final List<String> messages = new ArrayList<>();
        private final List<String> progress = new ArrayList<>();

        @Override
        public void onStatusUpdate(String message) {
            messages.add(message);
        }

        @Override
        public void onProgress(int completed, int total) {
            progress.add(completed + "/" + total);
        }
    }
}
