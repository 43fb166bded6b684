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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Per-account memo of collector results. A source is collected at most once for the lifetime of
 * the cache. Records carrying errors are memoized like any other, and a collector that throws is
 * remembered too: later lookups rethrow the same exception without calling it again.
 *
 * <p>Not thread-safe. One cache belongs to one sequential account pass.
 */
public final class EvidenceCache {
    private static final Logger log = LoggerFactory.getLogger(EvidenceCache.class);

    private final Map<EvidenceSource, EvidenceRecord> records = new EnumMap<>(EvidenceSource.class);
    private final Map<EvidenceSource, RuntimeException> failures = new EnumMap<>(EvidenceSource.class);

    public <R extends EvidenceRecord> R getOrCollect(EvidenceSource source, Class<R> type,
                                                     Supplier<? extends EvidenceRecord> collector) {
        requireDeclaredType(source, type);
        RuntimeException failure = failures.get(source);
        if (failure != null) throw failure;
        EvidenceRecord record = records.get(source);
        if (record == null) {
            log.debug("Collecting evidence source '{}'", source.key());
            try {
                record = checked(source, collector.get());
            } catch (RuntimeException e) {
                failures.put(source, e);
                log.warn("Evidence source '{}' failed: {}", source.key(), e.toString());
                throw e;
            }
            records.put(source, record);
            if (!record.errors().isEmpty()) {
                log.warn("Evidence source '{}' reported {} error(s)", source.key(), record.errors().size());
            }
        }
        return type.cast(record);
    }

    /** Installs a record collected elsewhere (hoisted organization-wide evidence). */
    public void seed(EvidenceSource source, EvidenceRecord record) {
        records.put(source, checked(source, record));
        failures.remove(source);
    }

    public boolean contains(EvidenceSource source) { return records.containsKey(source); }

    public Map<EvidenceSource, EvidenceRecord> snapshot() {
        return Collections.unmodifiableMap(new EnumMap<>(records));
    }

    private static void requireDeclaredType(EvidenceSource source, Class<?> type) {
        if (!type.isAssignableFrom(source.recordType())) {
            throw new IllegalArgumentException("Evidence source '" + source.key() + "' produces "
                    + source.recordType().getSimpleName() + ", not " + type.getSimpleName());
        }
    }

    private static EvidenceRecord checked(EvidenceSource source, EvidenceRecord record) {
        if (record == null) {
            throw new IllegalStateException("Collector for '" + source.key() + "' returned no record");
        }
        if (!source.recordType().isInstance(record)) {
            throw new IllegalStateException("Collector for '" + source.key() + "' returned "
                    + record.getClass().getSimpleName() + ", expected " + source.recordType().getSimpleName());
        }
        if (record.errors() == null) {
            throw new IllegalStateException("Collector for '" + source.key() + "' returned a record without errors list");
        }
        return record;
    }
}
