package org.springaicommunity.github.teamhealth.app;

import org.springaicommunity.github.teamhealth.EvaluationType;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Command-line argument parser. The first argument that is not an option names the
 * command.
 */
@Component
public class ArgumentParser {

	/**
	 * Parse command-line arguments.
	 * @param args Command-line arguments
	 * @return Parsed options
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public CommandLineOptions parseAndValidate(String[] args) {
		CommandLineOptions options = new CommandLineOptions();

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-r", "--repo":
					options.repository = getRequiredValue(args, i, "repository");
					i++;
					break;

				case "-a", "--all":
					options.allRepositories = true;
					break;

				case "-v", "--verbose":
					options.verbose = true;
					break;

				case "--sprint-start-day":
					options.sprintStartDay = parseInteger(getRequiredValue(args, i, "sprint-start-day"),
							"sprint start day");
					i++;
					break;

				case "--sprint-weeks":
					options.sprintWeeks = parseInteger(getRequiredValue(args, i, "sprint-weeks"), "sprint weeks");
					i++;
					break;

				case "--tracking-start":
					String trackingStart = getRequiredValue(args, i, "tracking-start");
					try {
						options.trackingStart = LocalDate.parse(trackingStart);
					}
					catch (DateTimeParseException e) {
						throw new IllegalArgumentException(
								"Invalid date '" + trackingStart + "': must be YYYY-MM-DD format");
					}
					i++;
					break;

				case "-u", "--users":
					String users = getRequiredValue(args, i, "users");
					options.users = Arrays.stream(users.split(","))
						.map(String::trim)
						.filter(s -> !s.isEmpty())
						.collect(ArrayList::new, ArrayList::add, ArrayList::addAll);
					i++;
					break;

				case "--since":
					options.since = parseSince(getRequiredValue(args, i, "since"));
					i++;
					break;

				case "-t", "--type":
					options.evaluationType = EvaluationType.fromString(getRequiredValue(args, i, "type"));
					i++;
					break;

				case "-n", "--issue":
					options.issueNumber = parseInteger(getRequiredValue(args, i, "issue"), "issue number");
					if (options.issueNumber <= 0) {
						throw new IllegalArgumentException("Issue number must be positive: " + options.issueNumber);
					}
					i++;
					break;

				case "-l", "--limit":
					options.limit = parseInteger(getRequiredValue(args, i, "limit"), "limit");
					if (options.limit <= 0) {
						throw new IllegalArgumentException("Limit must be positive: " + options.limit);
					}
					i++;
					break;

				case "-o", "--offset":
					options.sprintOffset = parseInteger(getRequiredValue(args, i, "offset"), "sprint offset");
					i++;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					if (options.command != null) {
						throw new IllegalArgumentException("Unexpected argument: " + arg);
					}
					options.command = parseCommand(arg);
					break;
			}
		}

		validateOptions(options);
		return options;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested or no arguments were given
	 */
	public boolean isHelpRequested(String[] args) {
		if (args.length == 0) {
			return true;
		}
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg) || "help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: github-team-health COMMAND [OPTIONS]\n");
		help.append("\n");
		help.append("Track GitHub issues and pull requests per sprint and score team health.\n");
		help.append("\n");
		help.append("COMMANDS:\n");
		help.append("    register               Register a repository for tracking\n");
		help.append("    collaborators          Register repository members as collaborators\n");
		help.append("    sync                   Sync issues and pull requests since the last sync\n");
		help.append("    evaluate               Score issues for speed, quality or consistency\n");
		help.append("    dashboard              Show sprint statistics per collaborator\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help              Show this help message\n");
		help.append("    -r, --repo REPO         Repository in format owner/repo\n");
		help.append("    -v, --verbose           Print per-issue results and stack traces\n");
		help.append("\n");
		help.append("REGISTER OPTIONS:\n");
		help.append("    --sprint-start-day DAY  Sprint start weekday, 0 (Sunday) to 6 (Saturday)\n");
		help.append("    --sprint-weeks WEEKS    Sprint length in weeks: 1 or 2\n");
		help.append("    --tracking-start DATE   Date sprint 1 starts from (YYYY-MM-DD, default: today)\n");
		help.append("\n");
		help.append("COLLABORATORS OPTIONS:\n");
		help.append("    -u, --users LOGINS      Comma-separated logins to register (default: all members)\n");
		help.append("\n");
		help.append("SYNC OPTIONS:\n");
		help.append("    -a, --all               Sync every registered repository\n");
		help.append("    --since TIME            Fetch items updated since TIME (YYYY-MM-DD or YYYY-MM-DDTHH:MM,\n");
		help.append("                            UTC) instead of the last successful sync\n");
		help.append("\n");
		help.append("EVALUATE OPTIONS:\n");
		help.append("    -t, --type TYPE         Evaluation type: speed, quality, consistency (required)\n");
		help.append("    -n, --issue NUMBER      Evaluate a single issue instead of a batch\n");
		help.append("    -l, --limit COUNT       Issues per batch run (default from configuration)\n");
		help.append("\n");
		help.append("DASHBOARD OPTIONS:\n");
		help.append("    -o, --offset N          Sprint relative to the current one, e.g. -1 for the last\n");
		help.append("\n");
		help.append("CONFIGURATION:\n");
		help.append("    Settings under the 'team-health' prefix in application.yml can be overridden\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    GITHUB_TOKEN           GitHub personal access token (required)\n");
		help.append("    OPENAI_API_KEY         API key for quality and consistency scoring\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    github-team-health register --repo acme/app --sprint-start-day 1 --sprint-weeks 2\n");
		help.append("    github-team-health collaborators --repo acme/app --users alice,bob\n");
		help.append("    github-team-health sync --all\n");
		help.append("    github-team-health evaluate --repo acme/app --type quality --limit 5\n");
		help.append("    github-team-health evaluate --repo acme/app --type speed --issue 42\n");
		help.append("    github-team-health dashboard --repo acme/app --offset -1\n");
		help.append("\n");

		return help.toString();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private int parseInteger(String value, String what) {
		try {
			return Integer.parseInt(value);
		}
		catch (NumberFormatException e) {
			throw new IllegalArgumentException("Invalid " + what + " '" + value + "': must be an integer");
		}
	}

	private CommandLineOptions.Command parseCommand(String value) {
		try {
			return CommandLineOptions.Command.valueOf(value.toUpperCase(Locale.ROOT));
		}
		catch (IllegalArgumentException e) {
			throw new IllegalArgumentException("Unknown command '" + value + "': must be one of "
					+ String.join(", ", CommandLineOptions.Command.names()));
		}
	}

	private LocalDateTime parseSince(String value) {
		try {
			if (value.matches("\\d{4}-\\d{2}-\\d{2}")) {
				return LocalDate.parse(value).atStartOfDay();
			}
			return LocalDateTime.parse(value);
		}
		catch (DateTimeParseException e) {
			throw new IllegalArgumentException(
					"Invalid time '" + value + "': must be YYYY-MM-DD or YYYY-MM-DDTHH:MM format");
		}
	}

	private void validateOptions(CommandLineOptions options) {
		List<String> errors = new ArrayList<>();

		if (options.command == null) {
			errors.add("A command is required: " + String.join(", ", CommandLineOptions.Command.names()));
		}
		else {
			boolean needsRepository = !(options.command == CommandLineOptions.Command.SYNC
					&& options.allRepositories);
			if (needsRepository && (options.repository == null || options.repository.isBlank())) {
				errors.add("Repository is required for " + options.command.name().toLowerCase() + " (--repo)");
			}
			if (options.allRepositories && options.command != CommandLineOptions.Command.SYNC) {
				errors.add("--all is only supported by sync");
			}
			if (options.allRepositories && options.repository != null) {
				errors.add("Use either --repo or --all, not both");
			}
			if (options.command == CommandLineOptions.Command.EVALUATE && options.evaluationType == null) {
				errors.add("Evaluation type is required for evaluate (--type)");
			}
			if (options.issueNumber != null && options.limit != null) {
				errors.add("Use either --issue or --limit, not both");
			}
		}

		if (options.repository != null && !options.repository.isBlank()
				&& !options.repository.matches("[^/\\s]+/[^/\\s]+")) {
			errors.add("Repository must be in format 'owner/repo': " + options.repository);
		}

		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Invalid arguments: " + String.join(", ", errors));
		}
	}

}
