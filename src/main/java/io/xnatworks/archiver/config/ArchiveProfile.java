/*
 * DICOM Archiver
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.archiver.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;

/**
 * Connection profile selected with {@code --profile}.
 *
 * <pre>
 * registry:
 *   url: jdbc:sqlite:/var/lib/dicom-archiver/registry.db
 *   username: archiver
 *   password: secret
 * </pre>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ArchiveProfile {
    private static final Logger log = LoggerFactory.getLogger(ArchiveProfile.class);

    private RegistryConfig registry = new RegistryConfig();

    /**
     * Path of the file this profile was read from (set when loaded).
     */
    private transient File profileFile;

    public static ArchiveProfile load(File profileFile) throws IOException {
        log.debug("Loading profile from: {}", profileFile.getAbsolutePath());
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        ArchiveProfile profile = mapper.readValue(profileFile, ArchiveProfile.class);
        if (profile == null) {
            // empty document
            profile = new ArchiveProfile();
        }
        profile.profileFile = profileFile;
        return profile;
    }

    public RegistryConfig getRegistry() { return registry; }
    public void setRegistry(RegistryConfig registry) { this.registry = registry; }

    public File getProfileFile() { return profileFile; }

    /**
     * Registry database connection.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RegistryConfig {
        /**
         * JDBC URL of the registry database.
         */
        private String url;

        private String username;

        private String password;

        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }

        public String getUsername() { return username; }
        public void setUsername(String username) { this.username = username; }

        public String getPassword() { return password; }
        public void setPassword(String password) { this.password = password; }

        @Override
        public String toString() {
            return "RegistryConfig{url=" + url + ", username=" + username + "}";
        }
    }
}
