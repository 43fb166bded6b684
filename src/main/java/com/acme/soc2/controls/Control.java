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
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

/**
 * One SOC 2 control: the evidence sources it declares and the policy that turns their summary
 * counters into gaps.
 */
public interface Control {
    String id();
    String title();
    List<EvidenceSource> sources();

    /** Reads evidence through {@code ctx} and reports gaps plus the consulted sources' errors. */
    ControlFindings evaluate(EvidenceContext ctx);
}
