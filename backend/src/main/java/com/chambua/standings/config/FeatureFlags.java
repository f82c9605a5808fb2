package com.chambua.standings.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class FeatureFlags {
    @Value("${standings.features.automatic-calculation:true}")
    private boolean automaticCalculationEnabled;

    @Value("${standings.features.snapshot-creation:true}")
    private boolean snapshotCreationEnabled;

    public FeatureFlags() {}

    public FeatureFlags(boolean automaticCalculationEnabled, boolean snapshotCreationEnabled) {
        this.automaticCalculationEnabled = automaticCalculationEnabled;
        this.snapshotCreationEnabled = snapshotCreationEnabled;
    }

    public boolean isAutomaticCalculationEnabled() {
        return automaticCalculationEnabled;
    }

    public boolean isSnapshotCreationEnabled() {
        return snapshotCreationEnabled;
    }
}
