package com.elementcatalog;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point.
 *
 * The context starts without a web server, {@link com.elementcatalog.cli.CatalogCli}
 * runs the requested command once, and its exit code becomes the process exit code.
 *
 * To run:
 *   java -jar element-catalog.jar list --type skill
 */
@SpringBootApplication
public class ElementCatalogApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(ElementCatalogApplication.class, args)));
    }
}
