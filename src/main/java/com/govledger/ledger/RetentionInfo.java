package com.govledger.ledger;

import java.nio.file.Path;
import java.util.List;

public record RetentionInfo(
        String policyVersion,
        long maxSizeBytes,
        int maxFileCount,
        Path activePath,
        long activeSizeBytes,
        int fileCount,
        long totalSizeBytes,
        List<SealedFile> sealedFiles,
        SinkState state) {

    public record SealedFile(int index, Path path, long sizeBytes) {
    }
}
