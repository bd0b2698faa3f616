package org.springaicommunity.github.teamhealth.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GitHub Team Health command-line application.
 *
 * <p>
 * Registers repositories, syncs their issues and pull requests into the configured
 * database, scores issues and prints sprint dashboards. See
 * {@link ArgumentParser#generateHelpText()} for the commands.
 */
@SpringBootApplication
public class TeamHealthApplication {

	public static void main(String[] args) {
		// Console application, no web server
		SpringApplication app = new SpringApplication(TeamHealthApplication.class);
		app.setWebApplicationType(WebApplicationType.NONE);
		app.run(args);
	}

}
