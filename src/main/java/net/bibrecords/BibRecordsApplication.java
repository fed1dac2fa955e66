/**
 * Main application class for bibrecords
 *
 * Features:
 * - Hosts the publication write path with author normalization and citation key assignment
 * - Applies the publications schema through Spring SQL initialization
 * - Entry point for Spring Boot application
 */

package net.bibrecords;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class BibRecordsApplication {

    /**
     * Main method that starts the Spring Boot application
     *
     * @param args Command line arguments passed to the application
     */
    public static void main(String[] args) {
        SpringApplication.run(BibRecordsApplication.class, args);
    }
}
