package dev.invox.files;

import java.util.List;

/**
 * Stores invoice files and their extraction status. Writes are idempotent; during a batch
 * run the orchestrator is the only writer.
 */
public interface FileTaskRepository {

    void save(FileTask task);

    void updateStatus(String fileId, FileStatus status);

    void updateParsedDetails(String fileId, String parsedDetailsJson);

    /**
     * @return the files that exist, in the order of the requested ids
     */
    List<FileTask> findByIds(List<String> fileIds);
}
