/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.controls;

import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceRecord;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.*;

/**
 * Accumulates what a control evaluation produced: the evidence it read, the gaps it found and
 * the errors carried by that evidence.
 */
public final class ControlFindings {
    private final Map<String, EvidenceRecord> data = new LinkedHashMap<>();
    private final List<String> gaps = new ArrayList<>();
    private final List<String> errors = new ArrayList<>();

    /** Reads {@code source} from the context cache, records it and adopts its errors. */
    public <R extends EvidenceRecord> R use(EvidenceContext ctx, EvidenceSource source, Class<R> type) {
        R record = ctx.evidence(source, type);
        data.put(source.key(), record);
        errors.addAll(record.errors());
        return record;
    }

    public void gapIf(boolean condition, String gap) { if (condition) gaps.add(gap); }
    public void addError(String error) { if (error != null) errors.add(error); }

    public Map<String, EvidenceRecord> data() { return Collections.unmodifiableMap(data); }
    public List<String> gaps() { return List.copyOf(gaps); }
    public List<String> errors() { return List.copyOf(errors); }
}
