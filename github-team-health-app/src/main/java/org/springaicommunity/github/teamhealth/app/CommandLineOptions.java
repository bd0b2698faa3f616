package org.springaicommunity.github.teamhealth.app;

import org.springaicommunity.github.teamhealth.EvaluationType;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Parsed command-line options.
 */
public class CommandLineOptions {

	public Command command;

	// Repository in owner/name form
	public String repository;

	public boolean allRepositories = false;

	public boolean verbose = false;

	// register
	public Integer sprintStartDay;

	public Integer sprintWeeks;

	public LocalDate trackingStart;

	// collaborators, null = every member found
	public List<String> users;

	// sync, null = stored watermark
	public LocalDateTime since;

	// evaluate
	public EvaluationType evaluationType;

	public Integer issueNumber; // single issue instead of a batch

	public Integer limit; // null = configured batch limit

	// dashboard
	public int sprintOffset = 0;

	public String ownerName() {
		return repository.substring(0, repository.indexOf('/'));
	}

	public String repoName() {
		return repository.substring(repository.indexOf('/') + 1);
	}

	/**
	 * Commands understood by the application.
	 */
	public enum Command {

		REGISTER, COLLABORATORS, SYNC, EVALUATE, DASHBOARD;

		public static List<String> names() {
			List<String> names = new ArrayList<>();
			for (Command command : values()) {
				names.add(command.name().toLowerCase());
			}
			return names;
		}

	}

	@Override
	public String toString() {
		return "CommandLineOptions{" + "command=" + command + ", repository='" + repository + '\''
				+ ", allRepositories=" + allRepositories + ", verbose=" + verbose + ", sprintStartDay="
				+ sprintStartDay + ", sprintWeeks=" + sprintWeeks + ", trackingStart=" + trackingStart + ", users="
				+ users + ", since=" + since + ", evaluationType=" + evaluationType + ", issueNumber=" + issueNumber
				+ ", limit=" + limit + ", sprintOffset=" + sprintOffset + '}';
	}

}
