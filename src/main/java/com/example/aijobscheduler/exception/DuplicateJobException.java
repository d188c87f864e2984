package com.example.aijobscheduler.exception;

import lombok.Getter;

/**
 * Exception for a job whose name or slug is already taken
 */
@Getter
public class DuplicateJobException extends RuntimeException {

    private final String name;
    private final String slug;

    public DuplicateJobException(String name, String slug) {
        super(String.format("Job name '%s' or slug '%s' already exists", name, slug));
        this.name = name;
        this.slug = slug;
    }
}
