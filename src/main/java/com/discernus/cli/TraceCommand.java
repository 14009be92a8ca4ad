package com.discernus.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

import com.discernus.Main;
import com.discernus.store.LocalArtifactStore;
import com.discernus.store.ProvenanceRecord;
import com.discernus.store.StorageException;

import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

@Command(name = "trace", mixinStandardHelpOptions = true, description = "Print the provenance chain of an artifact")
public class TraceCommand implements Callable<Integer> {
    static final int EXIT_NOT_FOUND = 1;

    @ParentCommand
    Main parent;

    @Parameters(index = "0", description = "Artifact content hash")
    String artifactHash;

    @Override
    public Integer call() {
        LocalArtifactStore store;
        try {
            store = LocalArtifactStore.open(Path.of(parent.loadConfig().getEngine().getStorePath()));
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return Main.EXIT_USAGE;
        } catch (StorageException e) {
            System.err.println("Storage error: " + e.getMessage());
            return VerifyCommand.EXIT_CORRUPT;
        }
        List<ProvenanceRecord> chain = store.trace(artifactHash);
        if (chain.isEmpty()) {
            boolean seed = store.find(artifactHash).isPresent();
            System.out.println(seed ? artifactHash + " is a seed artifact" : "No artifact " + artifactHash);
            return seed ? 0 : EXIT_NOT_FOUND;
        }
        for (ProvenanceRecord record : chain) {
            System.out.printf("%s <- stage=%s model=%s fingerprint=%s inputs=%s%n",
                    record.artifactHash(),
                    record.producerStageId(),
                    record.producingModelId(),
                    record.producingFingerprint(),
                    record.upstreamArtifactHashes());
        }
        return 0;
    }
}
