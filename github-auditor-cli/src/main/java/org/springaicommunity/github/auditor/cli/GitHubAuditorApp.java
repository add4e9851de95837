package org.springaicommunity.github.auditor.cli;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * GitHub Auditor HTTP server.
 *
 * Spring Boot web application exposing the audits as Server-Sent Events streams and the
 * basic organization statistics as JSON. Each request carries its own token; permit pools
 * are shared across requests so concurrent audits of the same kind stay within one
 * ceiling.
 *
 * Usage: java -cp github-auditor-cli.jar
 * org.springaicommunity.github.auditor.cli.GitHubAuditorApp
 */
@SpringBootApplication
public class GitHubAuditorApp {

	public static void main(String[] args) {
		SpringApplication.run(GitHubAuditorApp.class, args);
	}

}
