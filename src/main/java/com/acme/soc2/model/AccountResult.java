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

import java.util.List;

/**
 * Results for one scanned account. An account whose role could not be assumed carries the
 * failure in {@code identityError} and no control results.
 */
public record AccountResult(
        String accountId,
        String accountName,
        String callerArn,
        String identityError,
        List<ControlResult> evidence
) {
    public AccountResult {
        evidence = List.copyOf(evidence);
    }

    public static AccountResult unreachable(String accountId, String accountName, String error) {
        return new AccountResult(accountId, accountName, null, error, List.of());
    }

    /** False for an account that could not be reached, which therefore has no control results. */
    public boolean assessed() { return !evidence.isEmpty() || identityError == null; }
}
