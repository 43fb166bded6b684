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

import com.acme.soc2.controls.ControlCatalogue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Run configuration as it reaches the orchestrator, after command line and config file merging.
 */
public record ScanConfig(
        List<String> controls,
        List<String> regions,
        String profile,
        String outputDir,
        List<String> accountIds,
        boolean allAccounts,
        String roleName,
        String externalId,
        Map<String, String> accountExternalIds,
        int maxParallelAccounts
) {
    public static final String DEFAULT_ROLE_NAME = "OrganizationAccountAccessRole";
    public static final String DEFAULT_OUTPUT_DIR = "reports";

    public ScanConfig {
        controls = (controls == null || controls.isEmpty()) ? ControlCatalogue.DEFAULT_CONTROLS : List.copyOf(controls);
        regions = regions == null ? List.of() : List.copyOf(regions);
        outputDir = (outputDir == null || outputDir.isBlank()) ? DEFAULT_OUTPUT_DIR : outputDir;
        accountIds = accountIds == null ? List.of() : List.copyOf(accountIds);
        roleName = (roleName == null || roleName.isBlank()) ? DEFAULT_ROLE_NAME : roleName;
        accountExternalIds = accountExternalIds == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(accountExternalIds));
        maxParallelAccounts = Math.max(1, maxParallelAccounts);
    }

    /** Single-account scan of the given controls and regions with every other setting defaulted. */
    public static ScanConfig of(List<String> controls, List<String> regions) {
        return new ScanConfig(controls, regions, null, null, null, false, null, null, null, 1);
    }

    /** Per-account external id, then the global one, else null. */
    public String externalIdFor(String accountId) {
        String perAccount = accountExternalIds.get(accountId);
        if (perAccount != null && !perAccount.isBlank()) return perAccount;
        return (externalId == null || externalId.isBlank()) ? null : externalId;
    }
}
