package com.discernus.pipeline;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

import com.discernus.store.StorageException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;

/** Append-only JSONL audit trail of run events. */
public class RunLedger {
    private final Path ledgerPath;
    private final ObjectMapper mapper = JsonMapper.builder()
            .findAndAddModules()
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .build();

    public RunLedger(Path ledgerPath) {
        this.ledgerPath = ledgerPath;
    }

    public synchronized void append(RunEvent event) {
        try {
            if (ledgerPath.getParent() != null) {
                Files.createDirectories(ledgerPath.getParent());
            }
            String line = mapper.writeValueAsString(event) + System.lineSeparator();
            Files.writeString(ledgerPath, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new StorageException("Unable to append to run ledger " + ledgerPath, e);
        }
    }

    public List<RunEvent> readAll() throws IOException {
        if (!Files.exists(ledgerPath)) {
            return List.of();
        }
        List<RunEvent> events = new ArrayList<>();
        for (String line : Files.readAllLines(ledgerPath, StandardCharsets.UTF_8)) {
            if (line == null || line.isBlank()) {
                continue;
            }
            events.add(mapper.readValue(line, RunEvent.class));
        }
        return events;
    }

    public List<RunEvent> eventsFor(String runId) throws IOException {
        return readAll().stream().filter(event -> runId.equals(event.runId())).toList();
    }
}
