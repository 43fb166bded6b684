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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One line of {@code evidence_summary.csv}.
 */
@JsonPropertyOrder({"account_id", "account_name", "control_id", "title", "status", "gap_count", "error_count", "non_compliant"})
public record SummaryRow(
        @JsonProperty("account_id") String accountId,
        @JsonProperty("account_name") String accountName,
        @JsonProperty("control_id") String controlId,
        @JsonProperty("title") String title,
        @JsonProperty("status") String status,
        @JsonProperty("gap_count") int gapCount,
        @JsonProperty("error_count") int errorCount,
        @JsonProperty("non_compliant") int nonCompliant
) {}
