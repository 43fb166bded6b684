/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.evidence;

import com.acme.soc2.aws.AwsSession;

import java.util.List;

@FunctionalInterface
public interface Collector<R extends EvidenceRecord> {
    /** Global services ignore {@code regions}. */
    R collect(AwsSession session, List<String> regions);
}
