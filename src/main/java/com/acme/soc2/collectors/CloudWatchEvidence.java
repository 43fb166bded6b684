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

public record CloudWatchEvidence(int alarmCount, int logGroupCount, List<Alarm> alarmsSample,
                                 List<LogGroup> logGroupsSample, List<String> errors) implements EvidenceRecord {
    public CloudWatchEvidence {
        alarmsSample = List.copyOf(alarmsSample);
        logGroupsSample = List.copyOf(logGroupsSample);
        errors = List.copyOf(errors);
    }

    public record Alarm(String name, String region, String state) {}

    public record LogGroup(String name, String region, Integer retentionDays) {}
}
