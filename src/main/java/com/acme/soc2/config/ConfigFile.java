/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.config;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Contents of a {@code --config} JSON file. Every field is optional; absent fields stay null and
 * defer to the command line or built-in defaults.
 */
public record ConfigFile(
        @JsonProperty("profile") String profile,
        @JsonProperty("regions") List<String> regions,
        @JsonProperty("controls") List<String> controls,
        @JsonProperty("output") String output,
        @JsonProperty("all_accounts") Boolean allAccounts,
        @JsonProperty("account_ids") List<String> accountIds,
        @JsonProperty("role_name") String roleName,
        @JsonProperty("external_id") String externalId,
        @JsonProperty("account_external_ids") Map<String, String> accountExternalIds,
        @JsonProperty("parallel_accounts") Integer parallelAccounts
) {
    public static final ConfigFile EMPTY = new ConfigFile(null, null, null, null, null, null, null, null, null, null);
}
