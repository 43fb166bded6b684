/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.orchestration;

import com.acme.soc2.model.AccountResult;

import java.util.List;

/**
 * What one orchestrator run produced. {@code accountId}, {@code callerArn} and
 * {@code identityError} describe the base session.
 */
public record ScanOutcome(
        List<String> regions,
        String accountId,
        String callerArn,
        String identityError,
        String organizationError,
        List<AccountResult> accounts
) {
    public ScanOutcome {
        regions = List.copyOf(regions);
        accounts = List.copyOf(accounts);
    }
}
