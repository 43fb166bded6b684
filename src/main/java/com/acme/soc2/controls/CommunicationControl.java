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
import com.acme.soc2.collectors.CloudWatchEvidence;
import com.acme.soc2.collectors.VpcEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.CLOUDTRAIL;
import static com.acme.soc2.evidence.EvidenceSource.CLOUDWATCH;
import static com.acme.soc2.evidence.EvidenceSource.VPC;

/**
 * CC2: relevant information is obtained, generated and communicated.
 */
public final class CommunicationControl implements Control {
    @Override public String id() { return "CC2"; }
    @Override public String title() { return "Communication and Information"; }
    @Override public List<EvidenceSource> sources() { return List.of(CLOUDWATCH, VPC, CLOUDTRAIL); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        CloudWatchEvidence cw = out.use(ctx, CLOUDWATCH, CloudWatchEvidence.class);
        VpcEvidence vpc = out.use(ctx, VPC, VpcEvidence.class);
        CloudTrailEvidence trails = out.use(ctx, CLOUDTRAIL, CloudTrailEvidence.class);

        out.gapIf(cw.logGroupCount() == 0, Gaps.NO_LOG_GROUPS);
        out.gapIf(cw.alarmCount() == 0, Gaps.NO_ALARMS);
        out.gapIf(vpc.activeFlowLogCount() == 0, Gaps.NO_FLOW_LOGS);
        out.gapIf(trails.loggingTrailCount() == 0, Gaps.NO_LOGGING_TRAILS);
        return out;
    }
}
