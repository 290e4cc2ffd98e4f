package org.profd.node.processes.http.api.session.dto;

/**
 * Result of a shell-style command.
 *
 * @param exitCode The command's exit code, {@code 0} on success.
 * @param output   Everything the command printed.
 */
public record ShellResultDto(
    int exitCode,
    String output
) {}
