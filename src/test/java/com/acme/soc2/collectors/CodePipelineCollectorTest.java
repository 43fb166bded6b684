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
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.core.exception.SdkClientException;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.codepipeline.CodePipelineClient;
import software.amazon.awssdk.services.codepipeline.CodePipelineClientBuilder;
import software.amazon.awssdk.services.codepipeline.model.GetPipelineStateRequest;
import software.amazon.awssdk.services.codepipeline.model.GetPipelineStateResponse;
import software.amazon.awssdk.services.codepipeline.model.ListPipelinesRequest;
import software.amazon.awssdk.services.codepipeline.model.ListPipelinesResponse;
import software.amazon.awssdk.services.codepipeline.model.PipelineSummary;
import software.amazon.awssdk.services.codepipeline.model.StageExecution;
import software.amazon.awssdk.services.codepipeline.model.StageExecutionStatus;
import software.amazon.awssdk.services.codepipeline.model.StageState;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CodePipelineCollectorTest {

    @Mock private AwsSession session;
    @Mock private CodePipelineClient client;

    private static GetPipelineStateResponse firstStage(StageExecutionStatus status) {
        return GetPipelineStateResponse.builder().stageStates(
                StageState.builder().stageName("Source")
                        .latestExecution(StageExecution.builder().pipelineExecutionId("e-1").status(status).build())
                        .build(),
                StageState.builder().stageName("Deploy")
                        .latestExecution(StageExecution.builder().pipelineExecutionId("e-0").status(StageExecutionStatus.FAILED).build())
                        .build())
                .build();
    }

    @Test
    void collect_reportsFirstStageStatusAndKeepsPipelinesWhoseStateFailed() {
        when(session.client(any(CodePipelineClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(client);
        when(client.listPipelines(any(ListPipelinesRequest.class))).thenReturn(ListPipelinesResponse.builder().pipelines(
                PipelineSummary.builder().name("web").build(),
                PipelineSummary.builder().name("never-run").build(),
                PipelineSummary.builder().name("locked").build()).build());
        when(client.getPipelineState(any(GetPipelineStateRequest.class))).thenAnswer(inv -> {
            GetPipelineStateRequest req = inv.getArgument(0);
            if (req.name().equals("web")) return firstStage(StageExecutionStatus.SUCCEEDED);
            if (req.name().equals("never-run")) return GetPipelineStateResponse.builder().build();
            throw SdkClientException.create("AccessDenied");
        });

        CodePipelineEvidence evidence = new CodePipelineCollector().collect(session, List.of("us-east-1"));

        assertThat(evidence.pipelineCount()).isEqualTo(3);
        assertThat(evidence.pipelinesSample()).containsExactly(
                new CodePipelineEvidence.Pipeline("web", "us-east-1", "Succeeded"),
                new CodePipelineEvidence.Pipeline("never-run", "us-east-1", null),
                new CodePipelineEvidence.Pipeline("locked", "us-east-1", null));
        assertThat(evidence.errors()).containsExactly("codepipeline:us-east-1: AccessDenied");
    }

    @Test
    void collect_listingFails_recordsRegionalError() {
        when(session.client(any(CodePipelineClientBuilder.class), eq(Region.US_EAST_1))).thenReturn(client);
        when(client.listPipelines(any(ListPipelinesRequest.class))).thenThrow(SdkClientException.create("Throttling"));

        CodePipelineEvidence evidence = new CodePipelineCollector().collect(session, List.of("us-east-1"));

        assertThat(evidence.pipelineCount()).isZero();
        assertThat(evidence.errors()).containsExactly("codepipeline:us-east-1: Throttling");
    }

    @Test
    void latestStatus_missingStateStagesOrExecution_isNull() {
        assertThat(CodePipelineCollector.latestStatus(null)).isNull();
        assertThat(CodePipelineCollector.latestStatus(GetPipelineStateResponse.builder().build())).isNull();
        assertThat(CodePipelineCollector.latestStatus(GetPipelineStateResponse.builder()
                .stageStates(StageState.builder().stageName("Source").build()).build())).isNull();
        assertThat(CodePipelineCollector.latestStatus(firstStage(StageExecutionStatus.IN_PROGRESS))).isEqualTo("InProgress");
    }
}
