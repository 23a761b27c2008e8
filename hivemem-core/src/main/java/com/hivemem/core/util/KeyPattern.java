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
package com.hivemem.core.util;

import com.hivemem.core.exception.ValidationException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * A compiled key pattern used by subscriptions and key filters.
 * <ul>
 *   <li>{@code *} matches every key</li>
 *   <li>a pattern holding any of {@code ^ $ [ ] ( ) { } + | \} is a regular expression, matched with find semantics</li>
 *   <li>a pattern holding {@code *} or {@code ?} is a glob over the whole key</li>
 *   <li>anything else is a literal key</li>
 * </ul>
 */
public final class KeyPattern {
    
    private static final String REGEX_ONLY_CHARS = "^$[](){}+|\\";
    
    public static final KeyPattern ALL = new KeyPattern("*", Kind.ALL, null);
    
    private final String source;
    private final Kind kind;
    private final Pattern compiled;
    
    private KeyPattern(String source, Kind kind, Pattern compiled) {
        this.source = source;
        this.kind = kind;
        this.compiled = compiled;
    }
    
    public static KeyPattern compile(String pattern) {
        if (pattern == null || pattern.isEmpty() || "*".equals(pattern)) {
            return ALL;
        }
        try {
            if (hasAny(pattern, REGEX_ONLY_CHARS)) {
                return new KeyPattern(pattern, Kind.REGEX, Pattern.compile(pattern));
            }
            if (hasAny(pattern, "*?")) {
                return new KeyPattern(pattern, Kind.GLOB, Pattern.compile(globToRegex(pattern)));
            }
        } catch (PatternSyntaxException e) {
            throw new ValidationException("Invalid key pattern '" + pattern + "': " + e.getDescription());
        }
        return new KeyPattern(pattern, Kind.LITERAL, null);
    }
    
    public boolean matches(String key) {
        if (key == null) {
            return false;
        }
        switch (kind) {
            case ALL:
                return true;
            case LITERAL:
                return source.equals(key);
            case GLOB:
                return compiled.matcher(key).matches();
            default:
                return compiled.matcher(key).find();
        }
    }
    
    public String getSource() {
        return source;
    }
    
    public Kind getKind() {
        return kind;
    }
    
    /**
     * Convert glob pattern to regex
     */
    public static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder("^");
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append(".");
                case '.', '(', ')', '+', '|', '^', '$', '@', '%', '[', ']', '{', '}', '\\' ->
                        regex.append("\\").append(c);
                default -> regex.append(c);
            }
        }
        regex.append("$");
        return regex.toString();
    }
    
    private static boolean hasAny(String pattern, String chars) {
        for (int i = 0; i < pattern.length(); i++) {
            if (chars.indexOf(pattern.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
    
    @Override
    public String toString() {
        return kind + "(" + source + ")";
    }
    
    public enum Kind {
        ALL, LITERAL, GLOB, REGEX
    }
}
