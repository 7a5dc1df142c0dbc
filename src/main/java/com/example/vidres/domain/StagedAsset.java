package com.example.vidres.domain;

import java.nio.file.Path;

/**
 * A video moved into pipeline-owned storage. The staging id doubles as the job id.
 */
public record StagedAsset(String stagingId, Path location) {
}
