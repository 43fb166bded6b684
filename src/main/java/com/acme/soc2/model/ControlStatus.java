/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ControlStatus {
    PASS("pass"),
    FAIL("fail"),
    NEEDS_REVIEW("needs_review"),
    NOT_IMPLEMENTED("not_implemented");

    private final String value;

    ControlStatus(String value) { this.value = value; }

    @JsonValue
    public String value() { return value; }

    @Override
    public String toString() { return value; }
}
