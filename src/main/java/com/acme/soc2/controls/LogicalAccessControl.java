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

import com.acme.soc2.collectors.AccessAnalyzerEvidence;
import com.acme.soc2.collectors.CloudTrailEvidence;
import com.acme.soc2.collectors.IamEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.ACCESS_ANALYZER;
import static com.acme.soc2.evidence.EvidenceSource.CLOUDTRAIL;
import static com.acme.soc2.evidence.EvidenceSource.IAM;

/**
 * CC6: logical and physical access controls.
 */
public final class LogicalAccessControl implements Control {
    @Override public String id() { return "CC6"; }
    @Override public String title() { return "Logical and Physical Access"; }
    @Override public List<EvidenceSource> sources() { return List.of(IAM, ACCESS_ANALYZER, CLOUDTRAIL); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        IamEvidence iam = out.use(ctx, IAM, IamEvidence.class);
        AccessAnalyzerEvidence analyzers = out.use(ctx, ACCESS_ANALYZER, AccessAnalyzerEvidence.class);
        CloudTrailEvidence trails = out.use(ctx, CLOUDTRAIL, CloudTrailEvidence.class);

        out.gapIf(!iam.rootMfaEnabled(), Gaps.NO_ROOT_MFA);
        out.gapIf(!iam.passwordPolicyPresent(), Gaps.NO_PASSWORD_POLICY);
        out.gapIf(analyzers.activeAnalyzerCount() == 0, Gaps.NO_ACCESS_ANALYZER);
        out.gapIf(trails.loggingTrailCount() == 0, Gaps.NO_LOGGING_TRAILS);
        return out;
    }
}
