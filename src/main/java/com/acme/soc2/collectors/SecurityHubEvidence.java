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

public record SecurityHubEvidence(int enabledRegionCount, List<Hub> regions, List<String> errors) implements EvidenceRecord {
    public SecurityHubEvidence {
        regions = List.copyOf(regions);
        errors = List.copyOf(errors);
    }

    public record Hub(String region, boolean enabled, int productSubscriptions) {}
}
