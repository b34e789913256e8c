package com.whereq.tally;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for WhereQ Tally.
 * Runs scheduled extraction jobs against banking networks, retries them through a
 * lease-based work queue and supplies them with credentials from an encrypted vault.
 *
 * @author WhereQ Inc.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class TallyApplication {

    public static void main(String[] args) {
        SpringApplication.run(TallyApplication.class, args);
    }
}
