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

public record AccessAnalyzerEvidence(int analyzerCount, int activeAnalyzerCount, List<Analyzer> analyzers,
                                     List<String> errors) implements EvidenceRecord {
    public AccessAnalyzerEvidence {
        analyzers = List.copyOf(analyzers);
        errors = List.copyOf(errors);
    }

    public record Analyzer(String name, String region, String status, String type) {}
}
