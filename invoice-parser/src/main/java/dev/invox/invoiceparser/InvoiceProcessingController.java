package dev.invox.invoiceparser;

import dev.invox.files.FileTask;
import dev.invox.files.FileTaskRepository;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP entry point that runs a batch extraction for previously imported files.
 */
@RestController
@RequestMapping(path = "/api/files")
public class InvoiceProcessingController {

    private static final Logger LOGGER = LoggerFactory.getLogger(InvoiceProcessingController.class);

    private final FileTaskRepository fileTaskRepository;
    private final BatchOrchestrator batchOrchestrator;

    public InvoiceProcessingController(FileTaskRepository fileTaskRepository, BatchOrchestrator batchOrchestrator) {
        this.fileTaskRepository = fileTaskRepository;
        this.batchOrchestrator = batchOrchestrator;
    }

    @PostMapping(path = "/process", consumes = MediaType.APPLICATION_JSON_VALUE,
        produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> processFiles(@RequestBody(required = false) ProcessFilesRequest request) {
        Set<String> fileIds = new LinkedHashSet<>();
        if (request != null && request.fileIds() != null) {
            request.fileIds().stream().filter(StringUtils::hasText).forEach(fileIds::add);
        }
        if (fileIds.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No files provided for processing."));
        }

        List<FileTask> files = fileTaskRepository.findByIds(new ArrayList<>(fileIds));
        if (files.size() != fileIds.size()) {
            List<String> missing = new ArrayList<>(fileIds);
            files.forEach(file -> missing.remove(file.id()));
            LOGGER.warn("Batch request referenced unknown files {}", missing);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(Map.of("error", "Unknown file id(s): " + String.join(", ", missing)));
        }

        LOGGER.info("Processing batch of {} file(s)", files.size());
        BatchResult result = batchOrchestrator.run(files, new LoggingBatchProgressListener());
        return ResponseEntity.ok(result);
    }

    @ExceptionHandler(CredentialMissingException.class)
    ResponseEntity<Map<String, String>> handleMissingCredential(CredentialMissingException ex) {
        LOGGER.warn("Rejecting batch: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.PRECONDITION_FAILED).body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<Map<String, String>> handleBadRequest(IllegalArgumentException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    @ExceptionHandler(RuntimeException.class)
    ResponseEntity<Map<String, String>> handleProcessingFailure(RuntimeException ex) {
        LOGGER.error("Invoice batch processing error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(Map.of("error", String.valueOf(ex.getMessage())));
    }

    public record ProcessFilesRequest(List<String> fileIds) {
    }
}
