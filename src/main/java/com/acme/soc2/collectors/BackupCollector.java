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
import software.amazon.awssdk.services.backup.BackupClient;
import software.amazon.awssdk.services.backup.model.BackupPlansListMember;
import software.amazon.awssdk.services.backup.model.ListBackupPlansRequest;
import software.amazon.awssdk.services.backup.model.ListBackupPlansResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * AWS Backup plans. Consumed by CC5.
 */
public final class BackupCollector implements Collector<BackupEvidence> {
    static final String SERVICE = "backup";
    static final int SAMPLE_LIMIT = 25;

    @Override
    public BackupEvidence collect(AwsSession session, List<String> regions) {
        List<BackupEvidence.Plan> plans = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (BackupClient client = session.client(BackupClient.builder(), Region.of(region))) {
                ListBackupPlansResponse resp = AwsCalls.safeCall(
                        () -> client.listBackupPlans(ListBackupPlansRequest.builder().build()),
                        SERVICE, region, errors);
                if (resp == null) continue;
                for (BackupPlansListMember p : resp.backupPlansList()) {
                    plans.add(new BackupEvidence.Plan(p.backupPlanId(), p.backupPlanName(), region));
                }
            }
        }

        return new BackupEvidence(plans.size(), AwsCalls.sample(plans, SAMPLE_LIMIT), errors);
    }
}
