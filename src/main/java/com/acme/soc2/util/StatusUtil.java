/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.util;

import com.acme.soc2.model.ControlStatus;

import java.util.List;

public final class StatusUtil {
    private StatusUtil() {}

    /**
     * Errors win over gaps: when evidence could not be collected, the absence of a gap proves
     * nothing, so the verdict is needs_review.
     */
    public static ControlStatus statusFromFindings(List<String> gaps, List<String> errors) {
        if (!errors.isEmpty()) return ControlStatus.NEEDS_REVIEW;
        if (!gaps.isEmpty()) return ControlStatus.FAIL;
        return ControlStatus.PASS;
    }
}
