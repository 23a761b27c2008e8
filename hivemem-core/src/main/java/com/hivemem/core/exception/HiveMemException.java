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
 * Base exception for all HiveMem errors.
 */
public class HiveMemException extends RuntimeException {
    
    private static final long serialVersionUID = 1L;
    
    private final ErrorCode errorCode;
    
    public HiveMemException(String message) {
        super(message);
        this.errorCode = ErrorCode.GENERAL_ERROR;
    }
    
    public HiveMemException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = ErrorCode.GENERAL_ERROR;
    }
    
    public HiveMemException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    public HiveMemException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    /**
     * Whether a local retry with backoff may succeed.
     */
    public boolean isRetryable() {
        return errorCode.isRetryable();
    }
    
    /**
     * Error codes for HiveMem operations
     */
    public enum ErrorCode {
        GENERAL_ERROR("ERR", true),
        INVALID_ARGUMENT("INVALIDARG", false),
        INVALID_PATH("INVALIDPATH", false),
        LOCK_CONFLICT("LOCKED", true),
        NOT_LOCK_HOLDER("NOTHOLDER", false),
        MEMORY_LIMIT("MEMLIMIT", false),
        ENTRY_LIMIT("ENTRYLIMIT", false),
        POOL_EXHAUSTED("POOLEXHAUSTED", false),
        BACKEND_UNAVAILABLE("BACKENDERR", true),
        SERIALIZATION_ERROR("SERIALERR", false),
        TIMEOUT("TIMEOUT", true),
        RETRY_EXHAUSTED("RETRYEXHAUSTED", false);
        
        private final String prefix;
        private final boolean retryable;
        
        ErrorCode(String prefix, boolean retryable) {
            this.prefix = prefix;
            this.retryable = retryable;
        }
        
        public String getPrefix() {
            return prefix;
        }
        
        public boolean isRetryable() {
            return retryable;
        }
    }
    
    /**
     * Message prefixed with the error code, as written to logs and event records.
     */
    public String getCodedMessage() {
        return errorCode.getPrefix() + " " + getMessage();
    }
}
