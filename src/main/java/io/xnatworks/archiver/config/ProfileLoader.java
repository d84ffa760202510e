/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.config;

import io.xnatworks.archiver.ArchiveException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.function.Function;

/**
 * Finds and reads the connection profile named by {@code --profile}.
 *
 * <p>A name that points at an existing file is used as is. Otherwise it is resolved in
 * the directory given by the {@value #CONFIG_DIR_ENV} environment variable.</p>
 */
public class ProfileLoader {
    private static final Logger log = LoggerFactory.getLogger(ProfileLoader.class);

    public static final String CONFIG_DIR_ENV = "DICOM_ARCHIVER_CONFIG";

    private final Function<String, String> environment;

    public ProfileLoader() {
        this(System::getenv);
    }

    ProfileLoader(Function<String, String> environment) {
        this.environment = environment;
    }

    /**
     * @throws ArchiveException {@code MISSING_CONFIGURATION} if the profile cannot be found,
     *                          read, or lacks a registry URL
     */
    public ArchiveProfile load(String profileName) throws ArchiveException {
        if (!profileName.endsWith(".yaml") && !profileName.endsWith(".yml")) {
            throw missing("'" + profileName + "' does not appear to be a YAML profile. " +
                          "Try using 'database.yaml' instead.");
        }

        Path profilePath = resolve(profileName);

        ArchiveProfile profile;
        try {
            profile = ArchiveProfile.load(profilePath.toFile());
        } catch (IOException e) {
            throw new ArchiveException(ArchiveException.Kind.MISSING_CONFIGURATION,
                    "Could not read profile '" + profilePath + "': " + e.getMessage(), e);
        }

        if (profile.getRegistry() == null || profile.getRegistry().getUrl() == null
                || profile.getRegistry().getUrl().isBlank()) {
            throw missing("Profile '" + profilePath + "' does not define 'registry.url'.");
        }

        log.info("Using profile {}", profilePath);
        return profile;
    }

    private Path resolve(String profileName) throws ArchiveException {
        Path direct = Paths.get(profileName);
        if (Files.isRegularFile(direct)) {
            return direct;
        }

        String configDir = environment.apply(CONFIG_DIR_ENV);
        if (configDir == null || configDir.isBlank()) {
            throw missing("Profile '" + profileName + "' not found and environment variable '" +
                          CONFIG_DIR_ENV + "' is not set.");
        }

        Path inConfigDir = Paths.get(configDir).resolve(profileName);
        if (!Files.isRegularFile(inConfigDir)) {
            throw missing("'" + profileName + "' does not exist in '" + configDir + "'.");
        }
        if (!Files.isReadable(inConfigDir)) {
            throw missing("Profile '" + inConfigDir + "' is not readable.");
        }
        return inConfigDir;
    }

    private static ArchiveException missing(String message) {
        return new ArchiveException(ArchiveException.Kind.MISSING_CONFIGURATION, message);
    }
}
