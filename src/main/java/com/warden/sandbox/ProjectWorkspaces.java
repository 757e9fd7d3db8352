package com.warden.sandbox;

import com.warden.core.jobs.ValidationException;
import com.warden.core.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Per-job project directories under {@code warden.sandbox.projects-root}. A job uses its
 * declared project directory, or its own id when none was declared. Everything read
 * through here is confined to that directory.
 */
@Component
public class ProjectWorkspaces {

    private static final Logger log = LoggerFactory.getLogger(ProjectWorkspaces.class);

    /** Larger files are refused by {@link #read}. */
    static final long MAX_READ_BYTES = 1024 * 1024;

    private final SandboxProperties properties;

    public ProjectWorkspaces(SandboxProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates the job's project directory if needed.
     *
     * @return the directory as the orchestrator sees it
     */
    public Path prepare(Job job) {
        Path dir = projectDir(job);
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ProvisionException("cannot create project directory " + dir + ": " + e.getMessage(), e);
        }
        return dir;
    }

    /** The project directory as the container runtime host sees it, for the bind mount. */
    public Path hostPath(Job job) {
        String hostRoot = properties.getHostProjectsRoot();
        if (hostRoot == null || hostRoot.isBlank()) {
            return projectDir(job);
        }
        return Path.of(hostRoot).toAbsolutePath().normalize().resolve(dirName(job));
    }

    public List<ProjectEntry> list(Job job, String relativePath) {
        Path root = projectDir(job);
        Path dir = resolve(job, relativePath);
        if (!Files.isDirectory(dir)) {
            throw new ProjectFileNotFoundException(job.id(), displayPath(relativePath));
        }
        List<ProjectEntry> entries = new ArrayList<>();
        try (Stream<Path> children = Files.list(dir)) {
            children.sorted(Comparator.comparing(p -> p.getFileName().toString())).forEach(child -> {
                boolean directory = Files.isDirectory(child, LinkOption.NOFOLLOW_LINKS);
                long size = 0;
                if (!directory) {
                    try {
                        size = Files.size(child);
                    } catch (IOException e) {
                        log.debug("Cannot stat {}: {}", child, e.getMessage());
                    }
                }
                String rel = root.relativize(child).toString().replace('\\', '/');
                entries.add(new ProjectEntry(child.getFileName().toString(), rel, directory, size));
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot list " + dir, e);
        }
        return entries;
    }

    /**
     * Reads a text file from the job's project directory.
     *
     * @throws ValidationException if the file is too large or is not valid UTF-8
     */
    public String read(Job job, String relativePath) {
        Path file = resolve(job, relativePath);
        if (!Files.isRegularFile(file)) {
            throw new ProjectFileNotFoundException(job.id(), displayPath(relativePath));
        }
        try {
            if (Files.size(file) > MAX_READ_BYTES) {
                throw new ValidationException("File is larger than " + MAX_READ_BYTES + " bytes: " + relativePath);
            }
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            throw new ValidationException("File is not UTF-8 text: " + relativePath, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + file, e);
        }
    }

    /**
     * Resolves {@code relativePath} inside the job's project directory.
     *
     * @throws ValidationException if the path escapes the project directory, directly or through a symlink
     */
    Path resolve(Job job, String relativePath) {
        Path root = projectDir(job);
        String rel = relativePath == null ? "" : relativePath.replace('\\', '/');
        while (rel.startsWith("/")) {
            rel = rel.substring(1);
        }
        Path candidate = root.resolve(rel).normalize();
        if (!candidate.startsWith(root)) {
            throw new ValidationException("Path escapes the project directory: " + relativePath);
        }
        if (Files.exists(candidate)) {
            try {
                Path realRoot = root.toRealPath();
                if (!candidate.toRealPath().startsWith(realRoot)) {
                    throw new ValidationException("Path escapes the project directory: " + relativePath);
                }
            } catch (IOException e) {
                throw new UncheckedIOException("Cannot resolve " + candidate, e);
            }
        }
        return candidate;
    }

    Path projectDir(Job job) {
        return Path.of(properties.getProjectsRoot()).toAbsolutePath().normalize().resolve(dirName(job));
    }

    private static String dirName(Job job) {
        String declared = job.spec().projectDir();
        return declared != null && !declared.isBlank() ? declared : job.id();
    }

    private static String displayPath(String relativePath) {
        return relativePath == null || relativePath.isBlank() ? "/" : relativePath;
    }
}
