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

import software.amazon.awssdk.core.exception.SdkException;

import java.util.List;
import java.util.function.Supplier;

/**
 * Helpers that turn SDK failures into collector error strings.
 */
public final class AwsCalls {
    private AwsCalls() {}

    /**
     * Runs {@code call}; on an {@link SdkException} appends a formatted error and returns null.
     * Paginated iteration belongs inside the supplier so page fetch failures are caught too.
     */
    public static <T> T safeCall(Supplier<T> call, String service, String region, List<String> errors) {
        try {
            return call.get();
        } catch (SdkException e) {
            errors.add(formatError(service, region, e.getMessage()));
            return null;
        }
    }

    public static String formatError(String service, String region, String error) {
        if (region != null && !region.isBlank()) return service + ":" + region + ": " + error;
        return service + ": " + error;
    }

    public static <T> List<T> sample(List<T> items, int limit) {
        return List.copyOf(items.size() > limit ? items.subList(0, limit) : items);
    }
}
