/**
 * Main application class for the mods hub API
 *
 * Features:
 * - Mod records plus slug reservation and public exposure indices
 * - PostgreSQL storage when a datasource URL is set, in-memory storage otherwise
 * - HTTP Basic security with anonymous read access to public mods
 */
package net.modshub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ModsHubApplication {

    public static void main(String[] args) {
        SpringApplication.run(ModsHubApplication.class, args);
    }
}
