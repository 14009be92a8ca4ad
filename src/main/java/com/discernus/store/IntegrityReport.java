package com.discernus.store;

import java.util.List;

public record IntegrityReport(
        int checkedArtifacts,
        List<String> corruptArtifacts,
        List<String> missingContent,
        List<String> danglingProvenance) {

    public IntegrityReport {
        corruptArtifacts = List.copyOf(corruptArtifacts);
        missingContent = List.copyOf(missingContent);
        danglingProvenance = List.copyOf(danglingProvenance);
    }

    public boolean clean() {
        return corruptArtifacts.isEmpty() && missingContent.isEmpty() && danglingProvenance.isEmpty();
    }
}
