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
import com.acme.soc2.collectors.CodeBuildEvidence;
import com.acme.soc2.collectors.CodePipelineEvidence;
import com.acme.soc2.evidence.EvidenceContext;
import com.acme.soc2.evidence.EvidenceSource;

import java.util.List;

import static com.acme.soc2.evidence.EvidenceSource.CLOUDTRAIL;
import static com.acme.soc2.evidence.EvidenceSource.CODEBUILD;
import static com.acme.soc2.evidence.EvidenceSource.CODEPIPELINE;

/**
 * CC8: change management. Either a pipeline or a build project counts as a managed change path.
 */
public final class ChangeManagementControl implements Control {
    @Override public String id() { return "CC8"; }
    @Override public String title() { return "Change Management"; }
    @Override public List<EvidenceSource> sources() { return List.of(CODEPIPELINE, CODEBUILD, CLOUDTRAIL); }

    @Override
    public ControlFindings evaluate(EvidenceContext ctx) {
        ControlFindings out = new ControlFindings();
        CodePipelineEvidence pipelines = out.use(ctx, CODEPIPELINE, CodePipelineEvidence.class);
        CodeBuildEvidence builds = out.use(ctx, CODEBUILD, CodeBuildEvidence.class);
        CloudTrailEvidence trails = out.use(ctx, CLOUDTRAIL, CloudTrailEvidence.class);

        out.gapIf(pipelines.pipelineCount() == 0 && builds.projectCount() == 0, Gaps.NO_CHANGE_PIPELINES);
        out.gapIf(trails.loggingTrailCount() == 0, Gaps.NO_LOGGING_TRAILS);
        return out;
    }
}
