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
import software.amazon.awssdk.services.codebuild.CodeBuildClient;
import software.amazon.awssdk.services.codebuild.model.ListProjectsRequest;
import software.amazon.awssdk.services.codebuild.model.ListProjectsResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * CodeBuild projects. Consumed by CC8.
 */
public final class CodeBuildCollector implements Collector<CodeBuildEvidence> {
    static final String SERVICE = "codebuild";
    static final int SAMPLE_LIMIT = 25;

    @Override
    public CodeBuildEvidence collect(AwsSession session, List<String> regions) {
        List<CodeBuildEvidence.Project> projects = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (CodeBuildClient client = session.client(CodeBuildClient.builder(), Region.of(region))) {
                ListProjectsResponse resp = AwsCalls.safeCall(
                        () -> client.listProjects(ListProjectsRequest.builder().build()),
                        SERVICE, region, errors);
                if (resp == null) continue;
                for (String name : resp.projects()) projects.add(new CodeBuildEvidence.Project(name, region));
            }
        }

        return new CodeBuildEvidence(projects.size(), AwsCalls.sample(projects, SAMPLE_LIMIT), errors);
    }
}
