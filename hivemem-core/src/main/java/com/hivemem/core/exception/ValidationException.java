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
package com.hivemem.core.exception;

/**
 * Thrown when a key, option or path is malformed. Never retried.
 */
public class ValidationException extends HiveMemException {
    
    public ValidationException(String message) {
        super(ErrorCode.INVALID_ARGUMENT, message);
    }
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }
    
    public static ValidationException invalidKey(String reason) {
        return new ValidationException("Key must be a non-empty string: " + reason);
    }
    
    public static ValidationException invalidPath(String path, String reason) {
        return new ValidationException(ErrorCode.INVALID_PATH,
                "Invalid path '" + path + "': " + reason);
    }
}
