package com.largomodo.ramanfit.ledger;

import com.largomodo.ramanfit.core.domain.SampleRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.SeekableByteChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * Ledger backed by a whitespace-separated text file.
 * <p>
 * Layout: a column header, a metadata line recording the tool version and noise threshold,
 * then one row per sample. A missing file is created with header and metadata; an existing
 * file is loaded as-is and appended to, so results accumulate across runs.
 * <p>
 * Keys are the first token of each data row and are cached at construction. The file is
 * assumed to be written only through this class while it is open.
 */
public class TextFileResultLedger implements ResultLedger {

    private static final Logger log = LoggerFactory.getLogger(TextFileResultLedger.class);

    private final Path file;
    private final String version;
    private final double noiseThreshold;
    private final LedgerKeyMatching matching;
    private final List<String> keys = new ArrayList<>();

    /**
     * Opens or creates the ledger file.
     *
     * @throws IOException if the file cannot be read or created
     */
    public TextFileResultLedger(Path file, String version, double noiseThreshold,
                                LedgerKeyMatching matching) throws IOException {
        if (file == null || version == null || matching == null) {
            throw new IllegalArgumentException("All ledger arguments must not be null");
        }
        this.file = file;
        this.version = version;
        this.noiseThreshold = noiseThreshold;
        this.matching = matching;

        if (Files.exists(file)) {
            for (String line : Files.readAllLines(file, StandardCharsets.UTF_8)) {
                if (LedgerRowFormatter.isPreamble(line)) {
                    continue;
                }
                String key = LedgerRowFormatter.keyOf(line);
                if (key != null) {
                    keys.add(key);
                }
            }
            log.debug("Loaded {} existing record(s) from {}", keys.size(), file);
        } else {
            writePreamble();
            log.info("Created result ledger {}", file);
        }
    }

    @Override
    public synchronized boolean contains(String name) {
        return keys.stream().anyMatch(key -> matching.matches(key, name));
    }

    @Override
    public synchronized boolean append(SampleRecord record) throws IOException {
        if (contains(record.name())) {
            log.debug("{} already recorded, not appending", record.name());
            return false;
        }
        String row = LedgerRowFormatter.format(record) + System.lineSeparator();
        if (!endsWithNewline()) {
            row = System.lineSeparator() + row;
        }
        Files.writeString(file, row, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        keys.add(record.name());
        return true;
    }

    @Override
    public synchronized boolean reset(ResetConfirmation confirmation) throws IOException {
        if (!confirmation.confirm(RESET_PROMPT)) {
            return false;
        }
        writePreamble();
        int deleted = keys.size();
        keys.clear();
        log.info("Deleted {} record(s) from {}", deleted, file);
        return true;
    }

    @Override
    public synchronized List<String> names() {
        return List.copyOf(keys);
    }

    public Path getFile() {
        return file;
    }

    /**
     * True if the file is missing, empty or ends with a line break, so a row can be appended as is.
     */
    private boolean endsWithNewline() throws IOException {
        if (!Files.exists(file)) {
            return true;
        }
        try (SeekableByteChannel channel = Files.newByteChannel(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size == 0) {
                return true;
            }
            ByteBuffer last = ByteBuffer.allocate(1);
            channel.position(size - 1);
            channel.read(last);
            return last.get(0) == '\n' || last.get(0) == '\r';
        }
    }

    private void writePreamble() throws IOException {
        String preamble = LedgerRowFormatter.header() + System.lineSeparator()
                + LedgerRowFormatter.metadata(version, noiseThreshold) + System.lineSeparator();
        Files.writeString(file, preamble, StandardCharsets.UTF_8);
    }
}
