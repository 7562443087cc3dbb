package com.ryuqq.resumable.adapter.file.ledger;

import com.ryuqq.resumable.core.outcome.Outcome;
import com.ryuqq.resumable.core.spi.ResultStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Writes the identifiers of every failed outcome to a ledger file.
 *
 * <p>Failed items are terminal within a job. Re-queuing them is an operator action: export
 * the failed identifiers, then start a new job over the exported file with fresh stores.
 * The output is readable by {@link LineWorkLedgerReader}.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FailedIdsExporter {

    private static final Logger log = LoggerFactory.getLogger(FailedIdsExporter.class);

    private final ResultStore resultStore;

    /**
     * Creates an exporter reading from the given result store.
     *
     * @param resultStore the job's result store
     * @throws IllegalArgumentException if resultStore is null
     */
    public FailedIdsExporter(ResultStore resultStore) {
        if (resultStore == null) {
            throw new IllegalArgumentException("resultStore cannot be null");
        }
        this.resultStore = resultStore;
    }

    /**
     * Exports failed identifiers in result-store order, replacing the target file.
     *
     * @param target the ledger file to write
     * @return number of identifiers written
     * @throws IOException if the file cannot be written
     * @throws com.ryuqq.resumable.core.spi.StoreException if the result store cannot be read
     */
    public int export(Path target) throws IOException {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        List<String> failedIds = new ArrayList<>();
        for (Outcome outcome : resultStore.loadAll()) {
            if (outcome.isFailed()) {
                failedIds.add(outcome.id());
            }
        }

        Path directory = target.toAbsolutePath().getParent();
        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, target.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, failedIds, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        } finally {
            Files.deleteIfExists(temp);
        }

        log.info("Exported {} failed id(s) to {}", failedIds.size(), target);
        return failedIds.size();
    }
}
