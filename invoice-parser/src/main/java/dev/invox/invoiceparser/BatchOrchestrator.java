package dev.invox.invoiceparser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.invox.files.FileStatus;
import dev.invox.files.FileTask;
import dev.invox.files.FileTaskRepository;
import dev.invox.files.InvoiceMimeTypes;
import dev.invox.storage.FileContentReader;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

/**
 * Runs a list of stored invoice files through the model sequencer one after another, persisting each file's
 * status and payload as soon as it is known.
 */
public class BatchOrchestrator {

    private static final Logger LOGGER = LoggerFactory.getLogger(BatchOrchestrator.class);

    private final FileTaskRepository fileTaskRepository;
    private final FileContentReader fileContentReader;
    private final ModelSequencer modelSequencer;
    private final CredentialProvider credentialProvider;
    private final ObjectMapper objectMapper;

    public BatchOrchestrator(FileTaskRepository fileTaskRepository, FileContentReader fileContentReader,
        ModelSequencer modelSequencer, CredentialProvider credentialProvider, ObjectMapper objectMapper) {
        this.fileTaskRepository = fileTaskRepository;
        this.fileContentReader = fileContentReader;
        this.modelSequencer = modelSequencer;
        this.credentialProvider = credentialProvider;
        this.objectMapper = objectMapper;
    }

    /**
     * Processes {@code files} in order. Individual extraction failures are recorded on the file; an exception
     * only escapes for missing input or credentials, or when storage fails, in which case every file without a
     * final status is marked {@link FileStatus#FAILED} first.
     */
    public BatchResult run(List<FileTask> files, BatchProgressListener listener) {
        if (files == null || files.isEmpty()) {
            throw new IllegalArgumentException("No files provided for processing.");
        }
        String apiKey = credentialProvider.getApiKey();
        if (!StringUtils.hasText(apiKey)) {
            LOGGER.error("Gemini API key missing");
            throw new CredentialMissingException(
                "Set the Gemini API key (GEMINI_API_KEY) before processing files.");
        }
        BatchProgressListener progress = listener != null ? listener : BatchProgressListener.none();

        String batchId = UUID.randomUUID().toString();
        Set<String> resolved = new HashSet<>();
        try (InvoiceProcessingMdc.Context ignored = InvoiceProcessingMdc.open(batchId)) {
            LOGGER.info("Starting invoice batch with {} file(s)", files.size());
            try {
                return process(files, apiKey, progress, resolved);
            } catch (RuntimeException ex) {
                markUnresolvedFailed(files, resolved, ex);
                LOGGER.error("Invoice batch failed; {} file(s) marked as failed", files.size() - resolved.size(), ex);
                throw ex;
            }
        }
    }

    private BatchResult process(List<FileTask> files, String apiKey, BatchProgressListener progress,
        Set<String> resolved) {

        InvoiceProcessingMdc.setStage("prepare");
        for (FileTask file : files) {
            fileTaskRepository.updateStatus(file.id(), FileStatus.PROCESSING);
        }

        progress.onStatusUpdate("Reading files from disk...");
        List<InvoiceInput> inputs = new ArrayList<>(files.size());
        for (int index = 0; index < files.size(); index++) {
            inputs.add(toInput(files.get(index), index));
        }

        progress.onStatusUpdate("Processing %d files...".formatted(inputs.size()));
        List<String> models = modelSequencer.resolveOrder();
        LOGGER.info("Gemini model order for this batch: {}", models);

        int total = inputs.size();
        int processed = 0;
        int failed = 0;
        for (InvoiceInput input : inputs) {
            InvoiceProcessingMdc.attachFile(input.fileId());
            InvoiceProcessingMdc.setStage("extract");
            FileExtractionResult result = modelSequencer.run(input, models, apiKey);

            InvoiceProcessingMdc.setStage("persist");
            if (result.isSuccess()) {
                fileTaskRepository.updateParsedDetails(input.fileId(), toJson(result.payload()));
                fileTaskRepository.updateStatus(input.fileId(), FileStatus.PROCESSED);
                processed++;
                if (result.rawFallback()) {
                    progress.onStatusUpdate("Stored unparsed response for %s; it needs review.".formatted(input.label()));
                }
            } else {
                fileTaskRepository.updateParsedDetails(input.fileId(), toJson(errorPayload(result)));
                fileTaskRepository.updateStatus(input.fileId(), FileStatus.FAILED);
                failed++;
                LOGGER.warn("File processing failed for {}: {}", input.label(), result.errorMessage());
            }
            resolved.add(input.fileId());

            int completed = processed + failed;
            progress.onProgress(completed, total);
            progress.onStatusUpdate("Processing files: %d processed, %d remaining".formatted(completed,
                total - completed));
        }
        InvoiceProcessingMdc.attachFile(null);
        InvoiceProcessingMdc.setStage("complete");

        if (failed == 0) {
            progress.onStatusUpdate("Processing completed successfully.");
        } else if (processed == 0) {
            progress.onStatusUpdate("Processing failed: all files failed to process.");
        } else {
            progress.onStatusUpdate("Processing completed with %d failed file(s).".formatted(failed));
        }
        LOGGER.info("Invoice batch finished: {} processed, {} failed", processed, failed);
        return new BatchResult(processed, failed);
    }

    private InvoiceInput toInput(FileTask file, int index) {
        String fileName = StringUtils.hasText(file.fileName()) ? file.fileName() : "file-" + (index + 1);
        byte[] content = fileContentReader.readBinary(file.storedPath());
        String mimeType = InvoiceMimeTypes.resolve(file.fileName(), file.mimeType());
        return new InvoiceInput(file.id(), InvoiceInput.labelFor(fileName, file.id()), mimeType, content);
    }

    private JsonNode errorPayload(FileExtractionResult result) {
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("error", result.errorMessage());
        if (result.statusCode() != null) {
            payload.put("statusCode", result.statusCode());
        }
        return payload;
    }

    private String toJson(JsonNode payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException ex) {
            throw new InvoiceProcessingException("Failed to serialise extraction payload", ex);
        }
    }

    private void markUnresolvedFailed(List<FileTask> files, Set<String> resolved, RuntimeException failure) {
        for (FileTask file : files) {
            if (resolved.contains(file.id())) {
                continue;
            }
            try {
                fileTaskRepository.updateStatus(file.id(), FileStatus.FAILED);
            } catch (RuntimeException ex) {
                failure.addSuppressed(ex);
            }
        }
    }
}
