package org.springaicommunity.github.teamhealth;

/**
 * Sprint figures for the issues one collaborator authored.
 *
 * @param collaborator the author
 * @param stats counts and averages
 */
public record CollaboratorStats(Collaborator collaborator, IssueStats stats) {
}
