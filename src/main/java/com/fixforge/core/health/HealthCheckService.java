package com.fixforge.core.health;

import com.fixforge.core.git.GitClient;
import com.fixforge.core.persistence.DocumentStore;
import com.fixforge.core.platform.PlatformClient;
import com.fixforge.core.platform.PlatformException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Probes the git executable, the data directory and the platform credentials.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final GitClient gitClient;
    private final DocumentStore documentStore;
    private final PlatformClient platformClient;

    public HealthCheckService(
            @Autowired(required = false) GitClient gitClient,
            @Autowired(required = false) DocumentStore documentStore,
            @Autowired(required = false) PlatformClient platformClient) {
        this.gitClient = gitClient;
        this.documentStore = documentStore;
        this.platformClient = platformClient;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkGit());
        results.add(checkStorage());
        results.add(checkPlatform());
        return results;
    }

    private HealthStatus checkGit() {
        if (gitClient == null) {
            return HealthStatus.down("git", "No GitClient configured");
        }
        if (gitClient.isAvailable()) {
            return HealthStatus.up("git", "git executable available");
        }
        return HealthStatus.down("git", "git executable not found on PATH");
    }

    private HealthStatus checkStorage() {
        if (documentStore == null) {
            return HealthStatus.down("storage", "No DocumentStore configured");
        }
        Path dataDir = documentStore.getDataDir();
        if (Files.isDirectory(dataDir) && Files.isWritable(dataDir)) {
            return new HealthStatus("storage", HealthStatus.Status.UP,
                    "Data directory writable", Map.of("path", dataDir.toAbsolutePath().toString()));
        }
        return new HealthStatus("storage", HealthStatus.Status.DOWN,
                "Data directory missing or read-only", Map.of("path", dataDir.toAbsolutePath().toString()));
    }

    private HealthStatus checkPlatform() {
        if (platformClient == null) {
            return HealthStatus.degraded("platform",
                    "No GitHub token configured; issue listing and pull requests disabled");
        }
        try {
            String login = platformClient.currentIdentity();
            return new HealthStatus("platform", HealthStatus.Status.UP,
                    "Authenticated as " + login, Map.of("login", login));
        } catch (PlatformException e) {
            log.warn("Platform health check failed: {}", e.getMessage());
            return HealthStatus.down("platform", "Platform error: " + e.getMessage());
        }
    }
}
