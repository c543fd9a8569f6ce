package com.funnelcore.analytics.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Serializable;
import java.util.Properties;

/**
 * Build identity (version + commit) stamped into start-up logs of the engine and job operators.
 */
public final class BuildMetadata implements Serializable {
    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(BuildMetadata.class);

    static final String BUILD_INFO_RESOURCE = "build-info.properties";
    private static final BuildMetadata INSTANCE = load(BUILD_INFO_RESOURCE);

    private final String version;
    private final String gitCommit;

    BuildMetadata(String version, String gitCommit) {
        this.version = normalize(version, "dev");
        this.gitCommit = normalize(gitCommit, "unknown");
    }

    public static BuildMetadata current() {
        return INSTANCE;
    }

    public String version() {
        return version;
    }

    public String gitCommit() {
        return gitCommit;
    }

    public String identity() {
        return version + "+" + gitCommit;
    }

    static BuildMetadata load(String resource) {
        Properties props = new Properties();
        try (InputStream in = BuildMetadata.class.getClassLoader().getResourceAsStream(resource)) {
            if (in != null) {
                props.load(in);
            }
        } catch (IOException ex) {
            // Metadata only feeds diagnostics; fall back to dev identity.
            LOG.debug("Build metadata unavailable (resource={}): {}", resource, ex.getMessage());
        }
        return new BuildMetadata(props.getProperty("build.version"), props.getProperty("build.git.commit"));
    }

    private static String normalize(String value, String fallback) {
        if (StringSemantics.isBlank(value)) {
            return fallback;
        }
        String trimmed = value.trim();
        // Unfiltered Maven placeholders mean the resource was copied without filtering.
        if (trimmed.startsWith("${") && trimmed.endsWith("}")) {
            return fallback;
        }
        return trimmed;
    }
}
