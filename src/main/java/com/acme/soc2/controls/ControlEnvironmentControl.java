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

import com.acme.soc2.collectors.CloudTrailEvidence;
import com.acme.soc2.collectors.OrganizationsEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.CLOUDTRAIL;
import static com.acme.soc2.evidence.EvidenceSource.ORGANIZATIONS;

/**
 * CC1: commitment to integrity, ethical values and governance oversight.
 */
public final class ControlEnvironmentControl implements Control {
    @Override public String id() { return "CC1"; }
    @Override public String title() { return "Control Environment"; }
    @Override public List<EvidenceSource> sources() { return List.of(ORGANIZATIONS, CLOUDTRAIL); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        OrganizationsEvidence org = out.use(ctx, ORGANIZATIONS, OrganizationsEvidence.class);
        CloudTrailEvidence trails = out.use(ctx, CLOUDTRAIL, CloudTrailEvidence.class);

        out.gapIf(!org.organizationPresent(), Gaps.NO_ORGANIZATION);
        out.gapIf(org.scpCount() == 0, Gaps.NO_SCPS);
        out.gapIf(trails.loggingTrailCount() == 0, Gaps.NO_LOGGING_TRAILS);
        return out;
    }
}
