/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.collectors;

import com.acme.soc2.evidence.EvidenceRecord;

import java.util.List;

public record CloudTrailEvidence(int trailCount, int multiRegionTrailCount, int loggingTrailCount,
                                 List<Trail> trails, List<String> errors) implements EvidenceRecord {
    public CloudTrailEvidence {
        trails = List.copyOf(trails);
        errors = List.copyOf(errors);
    }

    /** {@code logging} is null when the trail status could not be read. */
    public record Trail(String name, String homeRegion, String region, Boolean multiRegion, Boolean logging,
                        String s3BucketName, String logGroupArn) {}
}
