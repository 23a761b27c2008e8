/*
 * Copyright © 2025-2030, All Rights Reserved
 * Ashutosh Sinha | Email: ajsinha@gmail.com
 *
 * Legal Notice: This module and the associated software architecture are proprietary
 * and confidential. Unauthorized copying, distribution, modification, or use is
 * strictly prohibited without explicit written permission from the copyright holder.
 *
 * Patent Pending: Certain architectural patterns and implementations described in
 * this module may be subject to patent applications.
 */
package com.hivemem.server.config;

import com.hivemem.core.constants.HiveMemConstants;
import com.hivemem.core.exception.ValidationException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Validated locations of the store's files.
 * The project root must sit inside the working directory or a system temp directory.
 */
@Slf4j
@Getter
public final class ProjectPaths {
    
    private final Path projectRoot;
    private final Path dataDir;
    
    private ProjectPaths(Path projectRoot) {
        this.projectRoot = projectRoot;
        this.dataDir = projectRoot.resolve(HiveMemConstants.DATA_DIR);
    }
    
    public static ProjectPaths resolve(String projectRoot) {
        if (projectRoot == null || projectRoot.isBlank()) {
            throw ValidationException.invalidPath(String.valueOf(projectRoot), "must not be empty");
        }
        if (projectRoot.indexOf('\0') >= 0) {
            throw ValidationException.invalidPath(projectRoot.replace('\0', '?'), "contains a NUL character");
        }
        
        Path raw;
        try {
            raw = Paths.get(projectRoot);
        } catch (InvalidPathException e) {
            throw ValidationException.invalidPath(projectRoot, e.getReason());
        }
        for (Path segment : raw) {
            if ("..".equals(segment.toString())) {
                throw ValidationException.invalidPath(projectRoot, "parent directory traversal is not allowed");
            }
        }
        
        Path resolved = raw.toAbsolutePath().normalize();
        for (Path allowed : allowedRoots()) {
            if (resolved.startsWith(allowed)) {
                log.debug("Project root resolved to {}", resolved);
                return new ProjectPaths(resolved);
            }
        }
        throw ValidationException.invalidPath(projectRoot,
                "must be within the working directory or a temporary directory");
    }
    
    private static List<Path> allowedRoots() {
        List<Path> roots = new ArrayList<>();
        roots.add(Paths.get("").toAbsolutePath().normalize());
        roots.add(Paths.get(System.getProperty("java.io.tmpdir")).toAbsolutePath().normalize());
        roots.add(Paths.get("/tmp"));
        roots.add(Paths.get("/var/tmp"));
        return roots;
    }
    
    public Path memoryDatabase() {
        return dataDir.resolve(HiveMemConstants.MEMORY_DB_FILE);
    }
    
    public Path hiveDatabase() {
        return dataDir.resolve(HiveMemConstants.HIVE_DB_FILE);
    }
    
    public Path snapshotFile() {
        return dataDir.resolve(HiveMemConstants.SNAPSHOT_FILE);
    }
    
    public Path backupDir() {
        return dataDir.resolve(HiveMemConstants.BACKUP_DIR);
    }
}
