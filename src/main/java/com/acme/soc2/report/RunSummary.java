/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.report;

import com.acme.soc2.model.AccountResult;
import com.acme.soc2.model.ControlResult;

import java.util.List;

/**
 * Run-level roll-up. A run is complete only when every account was reached and every control
 * reached a pass or fail verdict; needs_review and not_implemented both leave it incomplete.
 */
public record RunSummary(
        int accountCount,
        int unreachableAccountCount,
        int controlResultCount,
        int passCount,
        int failCount,
        int needsReviewCount,
        int notImplementedCount,
        boolean complete
) {
    public static RunSummary of(List<AccountResult> accounts) {
        int unreachable = 0, pass = 0, fail = 0, review = 0, notImpl = 0, total = 0;
        for (AccountResult a : accounts) {
            if (!a.assessed()) unreachable++;
            for (ControlResult c : a.evidence()) {
                total++;
                switch (c.status()) {
                    case PASS -> pass++;
                    case FAIL -> fail++;
                    case NEEDS_REVIEW -> review++;
                    case NOT_IMPLEMENTED -> notImpl++;
                }
            }
        }
        boolean complete = unreachable == 0 && review == 0 && notImpl == 0;
        return new RunSummary(accounts.size(), unreachable, total, pass, fail, review, notImpl, complete);
    }
}
