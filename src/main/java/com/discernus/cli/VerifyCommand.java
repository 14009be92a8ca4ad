package com.discernus.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

import com.discernus.Main;
import com.discernus.store.IntegrityReport;
import com.discernus.store.LocalArtifactStore;
import com.discernus.store.StorageException;

import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

@Command(name = "verify", mixinStandardHelpOptions = true, description = "Re-hash stored artifacts and check index references")
public class VerifyCommand implements Callable<Integer> {
    static final int EXIT_CORRUPT = 4;

    @ParentCommand
    Main parent;

    @Override
    public Integer call() {
        IntegrityReport report;
        try {
            report = LocalArtifactStore.open(Path.of(parent.loadConfig().getEngine().getStorePath())).verify();
        } catch (IOException | IllegalArgumentException e) {
            System.err.println("Configuration error: " + e.getMessage());
            return Main.EXIT_USAGE;
        } catch (StorageException e) {
            System.err.println("Storage error: " + e.getMessage());
            return EXIT_CORRUPT;
        }
        System.out.printf("checked=%d corrupt=%d missingContent=%d danglingProvenance=%d%n",
                report.checkedArtifacts(),
                report.corruptArtifacts().size(),
                report.missingContent().size(),
                report.danglingProvenance().size());
        report.corruptArtifacts().forEach(hash -> System.out.println("  corrupt " + hash));
        report.missingContent().forEach(hash -> System.out.println("  missing " + hash));
        report.danglingProvenance().forEach(hash -> System.out.println("  dangling " + hash));
        return report.clean() ? 0 : EXIT_CORRUPT;
    }
}
