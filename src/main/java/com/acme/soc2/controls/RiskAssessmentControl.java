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

import com.acme.soc2.collectors.GuardDutyEvidence;
import com.acme.soc2.collectors.InspectorEvidence;
import com.acme.soc2.collectors.SecurityHubEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.GUARDDUTY;
import static com.acme.soc2.evidence.EvidenceSource.INSPECTOR;
import static com.acme.soc2.evidence.EvidenceSource.SECURITYHUB;

/**
 * CC3: objectives are specified and risks to them identified and assessed.
 */
public final class RiskAssessmentControl implements Control {
    @Override public String id() { return "CC3"; }
    @Override public String title() { return "Risk Assessment"; }
    @Override public List<EvidenceSource> sources() { return List.of(SECURITYHUB, GUARDDUTY, INSPECTOR); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        SecurityHubEvidence hub = out.use(ctx, SECURITYHUB, SecurityHubEvidence.class);
        GuardDutyEvidence gd = out.use(ctx, GUARDDUTY, GuardDutyEvidence.class);
        InspectorEvidence inspector = out.use(ctx, INSPECTOR, InspectorEvidence.class);

        out.gapIf(hub.enabledRegionCount() == 0, Gaps.NO_SECURITY_HUB);
        out.gapIf(gd.enabledDetectorCount() == 0, Gaps.NO_GUARDDUTY);
        out.gapIf(inspector.coverageRegionCount() == 0, Gaps.NO_INSPECTOR);
        return out;
    }
}
