package com.architecture.memory.recall.service.extract;

import com.architecture.memory.recall.config.ExtractionSettings;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.concurrent.TimeUnit;

/**
 * Resolves the repository to extract: a local directory as-is, or a git URL shallow-cloned
 * into the clone directory. An existing clone is reused.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RepositorySourceResolver {

    private static final long CLONE_TIMEOUT_MINUTES = 10;

    private final ExtractionSettings settings;

    public Path resolve(String localPath, String repositoryUrl) {
        if (localPath != null && !localPath.isBlank()) {
            Path local = Paths.get(localPath).toAbsolutePath().normalize();
            if (Files.isDirectory(local)) {
                return local;
            }
            if (repositoryUrl == null || repositoryUrl.isBlank()) {
                throw new ExtractionException("Local repository path does not exist: " + local);
            }
            log.warn("[Extractor] Local path {} not found, falling back to cloning {}", local, repositoryUrl);
        }
        if (repositoryUrl == null || repositoryUrl.isBlank()) {
            throw new ExtractionException("Either a local path or a repository URL is required");
        }

        Path clonePath = Paths.get(settings.getCloneDirectory(), extractRepoName(repositoryUrl))
                .toAbsolutePath().normalize();
        if (Files.isDirectory(clonePath)) {
            log.info("[Extractor] Reusing existing clone at {}", clonePath);
            return clonePath;
        }
        cloneRepository(repositoryUrl, clonePath);
        return clonePath;
    }

    private void cloneRepository(String repositoryUrl, Path targetPath) {
        try {
            Files.createDirectories(targetPath.getParent());

            ProcessBuilder processBuilder = new ProcessBuilder(
                    "git", "clone", "--depth", "1", repositoryUrl, targetPath.toString()
            );
            processBuilder.redirectErrorStream(true);
            processBuilder.redirectOutput(ProcessBuilder.Redirect.DISCARD);

            log.info("[Extractor] Cloning {} -> {}", repositoryUrl, targetPath);
            Process process = processBuilder.start();
            if (!process.waitFor(CLONE_TIMEOUT_MINUTES, TimeUnit.MINUTES)) {
                process.destroyForcibly();
                throw new ExtractionException("git clone timed out for " + repositoryUrl);
            }
            if (process.exitValue() != 0) {
                throw new ExtractionException("git clone failed with exit code " + process.exitValue()
                        + " for " + repositoryUrl);
            }
        } catch (IOException e) {
            throw new ExtractionException("Error cloning repository: " + repositoryUrl, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExtractionException("Interrupted while cloning " + repositoryUrl, e);
        }
    }

    static String extractRepoName(String repositoryUrl) {
        // https://github.com/user/repo.git -> repo_codebase
        String trimmed = repositoryUrl.endsWith("/")
                ? repositoryUrl.substring(0, repositoryUrl.length() - 1)
                : repositoryUrl;
        String[] parts = trimmed.split("/");
        String repoName = parts[parts.length - 1];
        if (repoName.endsWith(".git")) {
            repoName = repoName.substring(0, repoName.length() - 4);
        }
        return repoName + "_codebase";
    }
}
