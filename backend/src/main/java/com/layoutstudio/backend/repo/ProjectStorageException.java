package com.layoutstudio.backend.repo;

/**
 * Reading or writing a project directory failed.
 */
public class ProjectStorageException extends RuntimeException {
    public ProjectStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
