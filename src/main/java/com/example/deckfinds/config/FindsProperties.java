package com.example.deckfinds.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "finds")
public record FindsProperties(Cli cli) {

    public FindsProperties {
        if (cli == null) cli = new Cli(true, false);
    }

    /** Command-line runner switches. */
    public static record Cli(boolean enabled, boolean prettyPrint) { }
}
