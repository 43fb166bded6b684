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

public record BackupEvidence(int backupPlanCount, List<Plan> plansSample, List<String> errors) implements EvidenceRecord {
    public BackupEvidence {
        plansSample = List.copyOf(plansSample);
        errors = List.copyOf(errors);
    }

    public record Plan(String planId, String name, String region) {}
}
