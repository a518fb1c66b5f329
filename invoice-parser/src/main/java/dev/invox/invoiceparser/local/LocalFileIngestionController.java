package dev.invox.invoiceparser.local;

import dev.invox.files.FileTask;
import dev.invox.files.InMemoryFileTaskRepository;
import dev.invox.files.InvoiceMimeTypes;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.core.env.Environment;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/**
 * Stores uploaded invoices on the local disk and registers them as unprocessed files so that batches can be
 * exercised without the import pipeline.
 */
@RestController
@RequestMapping("/local-files")
@Profile("local-invoice-test")
public class LocalFileIngestionController {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalFileIngestionController.class);

    static final String UPLOAD_DIR_PROPERTY = "invoice.local.upload-dir";

    private final InMemoryFileTaskRepository fileTaskRepository;
    private final Clock clock;
    private final Path uploadDirectory;

    public LocalFileIngestionController(InMemoryFileTaskRepository fileTaskRepository, Clock clock,
        Environment environment) {
        this.fileTaskRepository = fileTaskRepository;
        this.clock = clock;
        this.uploadDirectory = Path.of(environment.getProperty(UPLOAD_DIR_PROPERTY,
            Path.of(System.getProperty("java.io.tmpdir"), "invox-uploads").toString()));
    }

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<?> upload(@RequestPart("file") MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of(
                "error", "A non-empty invoice must be provided as the 'file' part"
            ));
        }

        String fileName = StringUtils.hasText(file.getOriginalFilename()) ? file.getOriginalFilename() : "invoice";
        if (!InvoiceMimeTypes.isSupported(fileName) && !StringUtils.hasText(file.getContentType())) {
            return ResponseEntity.badRequest().body(Map.of(
                "error", "Unsupported invoice file type: " + fileName
            ));
        }

        String id = UUID.randomUUID().toString();
        Files.createDirectories(uploadDirectory);
        Path target = uploadDirectory.resolve(id + "-" + fileName.replaceAll("[^a-zA-Z0-9._-]", "_"));
        file.transferTo(target);

        FileTask task = FileTask.imported(id, fileName, InvoiceMimeTypes.resolve(fileName, file.getContentType()),
            target.toString(), clock.instant());
        fileTaskRepository.save(task);
        LOGGER.info("Registered local invoice {} as file {}", fileName, id);
        return ResponseEntity.status(HttpStatus.CREATED).body(task);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<FileTask> list() {
        return fileTaskRepository.findAll();
    }
}
