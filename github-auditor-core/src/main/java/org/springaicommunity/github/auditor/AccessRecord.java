package org.springaicommunity.github.auditor;

/**
 * One collaborator's access to one repository.
 *
 * @param repository repository name
 * @param username collaborator login
 * @param permission {@code admin}, {@code maintain}, {@code write} or {@code read}
 */
public record AccessRecord(String repository, String username, String permission) {
}
