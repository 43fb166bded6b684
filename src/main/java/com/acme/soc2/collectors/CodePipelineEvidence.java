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

public record CodePipelineEvidence(int pipelineCount, List<Pipeline> pipelinesSample, List<String> errors) implements EvidenceRecord {
    public CodePipelineEvidence {
        pipelinesSample = List.copyOf(pipelinesSample);
        errors = List.copyOf(errors);
    }

    public record Pipeline(String name, String region, String latestExecutionStatus) {}
}
