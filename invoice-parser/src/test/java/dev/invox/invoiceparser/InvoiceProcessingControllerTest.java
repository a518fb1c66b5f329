package dev.invox.invoiceparser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import dev.invox.files.FileTask;
import dev.invox.files.InMemoryFileTaskRepository;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
class InvoiceProcessingControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private BatchOrchestrator batchOrchestrator;

    private InMemoryFileTaskRepository repository;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        repository = new InMemoryFileTaskRepository();
        repository.save(FileTask.imported("file-1", "a.pdf", "application/pdf", "/tmp/a.pdf", NOW));
        repository.save(FileTask.imported("file-2", "b.png", "image/png", "/tmp/b.png", NOW));
        mockMvc = MockMvcBuilders.standaloneSetup(new InvoiceProcessingController(repository, batchOrchestrator))
            .build();
    }

    @SuppressWarnings("unchecked")
    @Test
    void runsBatchForRequestedFilesInOrder() throws Exception {
        when(batchOrchestrator.run(anyList(), any())).thenReturn(new BatchResult(1, 1));

        mockMvc.perform(post("/api/files/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileIds\": [\"file-2\", \"file-1\", \"file-2\"]}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.processedFiles").value(1))
            .andExpect(jsonPath("$.failedFiles").value(1));

        ArgumentCaptor<List<FileTask>> files = ArgumentCaptor.forClass(List.class);
        verify(batchOrchestrator).run(files.capture(), any(LoggingBatchProgressListener.class));
        assertThat(files.getValue()).extracting(FileTask::id).containsExactly("file-2", "file-1");
    }

    @Test
    void rejectsEmptySelection() throws Exception {
        mockMvc.perform(post("/api/files/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileIds\": []}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("No files provided for processing."));

        verifyNoInteractions(batchOrchestrator);
    }

    @Test
    void rejectsMissingBody() throws Exception {
        mockMvc.perform(post("/api/files/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content(""))
            .andExpect(status().isBadRequest());

        verifyNoInteractions(batchOrchestrator);
    }

    @Test
    void reportsUnknownFiles() throws Exception {
        mockMvc.perform(post("/api/files/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileIds\": [\"file-1\", \"nope\"]}"))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error").value("Unknown file id(s): nope"));

        verifyNoInteractions(batchOrchestrator);
    }

    @Test
    void missingCredentialIsPreconditionFailed() throws Exception {
        when(batchOrchestrator.run(anyList(), any()))
            .thenThrow(new CredentialMissingException("Set the Gemini API key (GEMINI_API_KEY) before processing files."));

        mockMvc.perform(post("/api/files/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileIds\": [\"file-1\"]}"))
            .andExpect(status().isPreconditionFailed())
            .andExpect(jsonPath("$.error").value("Set the Gemini API key (GEMINI_API_KEY) before processing files."));
    }

    @Test
    void crashedBatchIsServerError() throws Exception {
        when(batchOrchestrator.run(anyList(), any()))
            .thenThrow(new IllegalStateException("Firestore unavailable"));

        mockMvc.perform(post("/api/files/process")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"fileIds\": [\"file-1\"]}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.error").value("Firestore unavailable"));
    }
}
