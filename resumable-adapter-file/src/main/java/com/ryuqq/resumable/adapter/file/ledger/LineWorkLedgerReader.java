package com.ryuqq.resumable.adapter.file.ledger;

import com.ryuqq.resumable.core.model.WorkLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a Work Ledger from a UTF-8 text file with one identifier per line.
 *
 * <p>Lines are trimmed and blank lines are skipped, so a trailing newline or an empty
 * separator line does not create an item. Duplicates are kept; the orchestrator skips
 * the second occurrence as already processed.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class LineWorkLedgerReader {

    private static final Logger log = LoggerFactory.getLogger(LineWorkLedgerReader.class);

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    /**
     * Reads the ledger.
     *
     * @param file the ledger file
     * @return the ledger, in file order
     * @throws IOException if the file cannot be read
     * @throws IllegalArgumentException if file is null
     */
    public WorkLedger read(Path file) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<String> ids = new ArrayList<>(lines.size());
        int blank = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (i == 0 && !line.isEmpty() && line.charAt(0) == BYTE_ORDER_MARK) {
                line = line.substring(1);
            }
            String id = line.trim();
            if (id.isEmpty()) {
                blank++;
                continue;
            }
            ids.add(id);
        }
        log.info("Loaded {} item(s) from {} ({} blank line(s) skipped)", ids.size(), file, blank);
        return WorkLedger.of(ids);
    }
}
