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
import software.amazon.awssdk.services.kms.KmsClient;
import software.amazon.awssdk.services.kms.model.DescribeKeyRequest;
import software.amazon.awssdk.services.kms.model.DescribeKeyResponse;
import software.amazon.awssdk.services.kms.model.GetKeyRotationStatusRequest;
import software.amazon.awssdk.services.kms.model.GetKeyRotationStatusResponse;
import software.amazon.awssdk.services.kms.model.KeyListEntry;
import software.amazon.awssdk.services.kms.model.KeyMetadata;
import software.amazon.awssdk.services.kms.model.ListKeysRequest;
import software.amazon.awssdk.services.kms.model.ListKeysResponse;

import java.util.ArrayList;
import java.util.List;

/**
 * Samples up to 25 KMS keys per region with their manager, state and rotation flag.
 */
public final class KmsCollector implements Collector<KmsEvidence> {
    static final String SERVICE = "kms";
    static final int KEYS_PER_REGION = 25;

    @Override
    public KmsEvidence collect(AwsSession session, List<String> regions) {
        List<KmsEvidence.Key> keys = new ArrayList<>();
        List<String> errors = new ArrayList<>();

        for (String region : regions) {
            try (KmsClient client = session.client(KmsClient.builder(), Region.of(region))) {
                ListKeysResponse resp = AwsCalls.safeCall(
                        () -> client.listKeys(ListKeysRequest.builder().limit(KEYS_PER_REGION).build()),
                        SERVICE, region, errors);
                if (resp == null) continue;

                for (KeyListEntry k : resp.keys()) {
                    DescribeKeyResponse meta = AwsCalls.safeCall(
                            () -> client.describeKey(DescribeKeyRequest.builder().keyId(k.keyId()).build()),
                            SERVICE, region, errors);
                    GetKeyRotationStatusResponse rotation = AwsCalls.safeCall(
                            () -> client.getKeyRotationStatus(GetKeyRotationStatusRequest.builder().keyId(k.keyId()).build()),
                            SERVICE, region, errors);
                    KeyMetadata md = meta == null ? null : meta.keyMetadata();
                    keys.add(new KmsEvidence.Key(
                            k.keyId(),
                            region,
                            md == null ? null : md.keyManagerAsString(),
                            md == null ? null : md.keyStateAsString(),
                            rotation == null ? null : rotation.keyRotationEnabled()));
                }
            }
        }

        int rotating = (int) keys.stream().filter(k -> Boolean.TRUE.equals(k.rotationEnabled())).count();
        return new KmsEvidence(keys.size(), rotating, keys, errors);
    }
}
