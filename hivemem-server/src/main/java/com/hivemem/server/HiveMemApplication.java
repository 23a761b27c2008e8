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
package com.hivemem.server;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Main entry point for the HiveMem shared memory store.
 * 
 * HiveMem is a shared, namespaced key/value store for cooperating agents:
 * - Typed entries (persistent, transient, cached, versioned, shared, locked)
 * - TTL-bounded key locks and lock-protected atomic updates
 * - Version history for versioned entries
 * - Pattern subscriptions on set, delete and expire
 * - SQLite durability with a snapshot file fallback
 * - Background expiry and LRU eviction under enforced ceilings
 */
@Slf4j
@SpringBootApplication
@EnableScheduling
public class HiveMemApplication {
    
    private static final String DEFAULT_VERSION = "1.0.0";
    
    public static void main(String[] args) {
        printBanner();
        SpringApplication.run(HiveMemApplication.class, args);
    }
    
    /**
     * Read version from application.properties, falling back to DEFAULT_VERSION.
     */
    static String getVersion() {
        try (InputStream input = HiveMemApplication.class.getClassLoader()
                .getResourceAsStream("application.properties")) {
            if (input != null) {
                Properties props = new Properties();
                props.load(input);
                return props.getProperty("hivemem.version", DEFAULT_VERSION);
            }
        } catch (IOException e) {
            log.debug("Could not read application.properties: {}", e.getMessage());
        }
        return DEFAULT_VERSION;
    }
    
    private static void printBanner() {
        String versionLine = String.format("║   Version %-40s║", getVersion());
        
        System.out.println();
        System.out.println("╔═══════════════════════════════════════════════════╗");
        System.out.println("║                                                   ║");
        System.out.println("║   HiveMem Shared Memory Store                     ║");
        System.out.println(versionLine);
        System.out.println("║                                                   ║");
        System.out.println("╚═══════════════════════════════════════════════════╝");
        System.out.println();
    }
}
