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
import com.acme.soc2.collectors.ConfigEvidence;
import com.acme.soc2.collectors.SsmEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.CLOUDTRAIL;
import static com.acme.soc2.evidence.EvidenceSource.CONFIG;
import static com.acme.soc2.evidence.EvidenceSource.SSM;

/**
 * CC7: system operations.
 */
public final class SystemOperationsControl implements Control {
    @Override public String id() { return "CC7"; }
    @Override public String title() { return "System Operations"; }
    @Override public List<EvidenceSource> sources() { return List.of(CONFIG, SSM, CLOUDTRAIL); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        ConfigEvidence config = out.use(ctx, CONFIG, ConfigEvidence.class);
        SsmEvidence ssm = out.use(ctx, SSM, SsmEvidence.class);
        CloudTrailEvidence trails = out.use(ctx, CLOUDTRAIL, CloudTrailEvidence.class);

        out.gapIf(config.recordingCount() == 0, Gaps.CONFIG_NOT_RECORDING);
        out.gapIf(ssm.managedInstanceCount() == 0, Gaps.NO_SSM_INSTANCES);
        out.gapIf(trails.loggingTrailCount() == 0, Gaps.NO_LOGGING_TRAILS);
        return out;
    }
}
