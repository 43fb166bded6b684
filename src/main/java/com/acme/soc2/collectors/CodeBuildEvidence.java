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

public record CodeBuildEvidence(int projectCount, List<Project> projectsSample, List<String> errors) implements EvidenceRecord {
    public CodeBuildEvidence {
        projectsSample = List.copyOf(projectsSample);
        errors = List.copyOf(errors);
    }

    public record Project(String name, String region) {}
}
