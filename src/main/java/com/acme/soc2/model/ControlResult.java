/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.model;

import com.acme.soc2.evidence.EvidenceRecord;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Verdict for one control in one account. {@code data} holds the evidence records the control
 * consulted, keyed by evidence source key.
 */
public record ControlResult(
        String controlId,
        String title,
        ControlStatus status,
        List<String> evidenceSources,
        Instant collectedAt,
        List<String> gaps,
        List<String> errors,
        Map<String, EvidenceRecord> data
) {
    public ControlResult {
        evidenceSources = List.copyOf(evidenceSources);
        gaps = List.copyOf(gaps);
        errors = List.copyOf(errors);
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
