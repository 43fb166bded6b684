/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: SOC2 Evidence Scanner
 */

package com.acme.soc2.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class ConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .build();

    private ConfigLoader() {}

    /** Reads {@code path}; null yields {@link ConfigFile#EMPTY}. */
    public static ConfigFile load(Path path) {
        if (path == null) return ConfigFile.EMPTY;
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Config file not found: " + path);
        }
        try {
            ConfigFile cfg = MAPPER.readValue(path.toFile(), ConfigFile.class);
            if (cfg == null) throw new ConfigurationException("Config file is empty: " + path);
            if (cfg.parallelAccounts() != null && cfg.parallelAccounts() < 1) {
                throw new ConfigurationException("parallel_accounts must be at least 1 in " + path);
            }
            log.info("Loaded configuration from {}", path);
            return cfg;
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid config file " + path + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read config file " + path + ": " + e.getMessage(), e);
        }
    }
}
