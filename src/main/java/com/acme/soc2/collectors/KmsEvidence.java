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

import com.acme.soc2.evidence.EvidenceRecord;

import java.util.List;

public record KmsEvidence(int sampledKeyCount, int rotationEnabledCount, List<Key> keysSampled,
                          List<String> errors) implements EvidenceRecord {
    public KmsEvidence {
        keysSampled = List.copyOf(keysSampled);
        errors = List.copyOf(errors);
    }

    public record Key(String keyId, String region, String keyManager, String keyState, Boolean rotationEnabled) {}
}
