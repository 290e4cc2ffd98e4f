package org.profd.node.processes.http.api.session.dto;

/**
 * Acknowledgment for accepted start and stop requests.
 *
 * @param message The response message
 */
public record MessageResponseDto(
    String message
) {}
