package com.example.research;

import com.example.research.cli.ResearchCommandRunner;
import com.example.research.config.ResearchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(ResearchProperties.class)
public class ResearchVerifierApplication {

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(ResearchVerifierApplication.class);
		if (ResearchCommandRunner.isCommand(args)) {
			// CLI mode: run one command and exit, no web server
			app.setWebApplicationType(WebApplicationType.NONE);
			System.exit(SpringApplication.exit(app.run(args)));
		}
		app.run(args);
	}

}
