package com.govledger.audit;

import java.nio.file.Path;

public record ExportResult(Path bundlePath, BundleManifest manifest, int eventCount, int linkCount) {

    public String bundleId() {
        return manifest.bundleId();
    }

    public String bundleHash() {
        return manifest.bundleHash();
    }
}
