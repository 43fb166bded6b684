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

import java.util.List;

/**
 * Normalized output of one collector. Collectors never throw for AWS failures; each failed call
 * becomes an entry in {@link #errors()}.
 */
public interface EvidenceRecord {
    List<String> errors();
}
