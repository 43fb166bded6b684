/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.collectors;

import com.acme.soc2.aws.AwsSession;
import com.acme.soc2.evidence.Collector;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.codepipeline.CodePipelineClient;
import software.amazon.awssdk.services.codepipeline.model.GetPipelineStateRequest;
import software.amazon.awssdk.services.codepipeline.model.GetPipelineStateResponse;
import software.amazon.awssdk.services.codepipeline.model.ListPipelinesRequest;
import software.amazon.awssdk.services.codepipeline.model.ListPipelinesResponse;
import software.amazon.awssdk.services.codepipeline.model.PipelineSummary;
import software.amazon.awssdk.services.codepipeline.model.StageState;

import java.util.ArrayList;
import java.util.List;

/**
 * CodePipeline pipelines with the latest execution status of their first stage. Consumed by CC8.
 */
public final class CodePipelineCollector implements Collector<CodePipelineEvidence> {
    static final String SERVICE = "codepipeline";
    static final int SAMPLE_LIMIT = 25;

    @Override
    public CodePipelineEvidence collect(AwsSession session, List<String> regions) {
        List<CodePipelineEvidence.Pipeline> pipelines = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (CodePipelineClient client = session.client(CodePipelineClient.builder(), Region.of(region))) {
                ListPipelinesResponse resp = AwsCalls.safeCall(
                        () -> client.listPipelines(ListPipelinesRequest.builder().build()),
                        SERVICE, region, errors);
                if (resp == null) continue;

                for (PipelineSummary p : resp.pipelines()) {
                    GetPipelineStateResponse state = AwsCalls.safeCall(
                            () -> client.getPipelineState(GetPipelineStateRequest.builder().name(p.name()).build()),
                            SERVICE, region, errors);
                    pipelines.add(new CodePipelineEvidence.Pipeline(p.name(), region, latestStatus(state)));
                }
            }
        }

        return new CodePipelineEvidence(pipelines.size(), AwsCalls.sample(pipelines, SAMPLE_LIMIT), errors);
    }

    static String latestStatus(GetPipelineStateResponse state) {
        if (state == null || state.stageStates().isEmpty()) return null;
        StageState first = state.stageStates().get(0);
        return first.latestExecution() == null ? null : first.latestExecution().statusAsString();
    }
}
