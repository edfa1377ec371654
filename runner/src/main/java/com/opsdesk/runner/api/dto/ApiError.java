package com.opsdesk.runner.api.dto;

/**
 * Error body for refused requests.
 *
 * @param kind the CommandException kind, or null for lookups and disabled runner
 */
public record ApiError(int status, String kind, String message) {}
