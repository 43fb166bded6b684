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

import com.acme.soc2.report.RunSummary;

import java.time.Instant;
import java.util.List;

/**
 * Root document of a run, written as {@code evidence.json}.
 */
public record RunPayload(
        String runId,
        Instant generatedAt,
        List<String> controls,
        List<String> regions,
        String accountId,
        String callerArn,
        String identityError,
        String organizationError,
        List<AccountResult> accounts,
        RunSummary summary
) {
    public RunPayload {
        controls = List.copyOf(controls);
        regions = List.copyOf(regions);
        accounts = List.copyOf(accounts);
    }
}
