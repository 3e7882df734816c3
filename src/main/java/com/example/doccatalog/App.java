package com.example.doccatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

public final class App {
    private static final Logger LOGGER = LoggerFactory.getLogger(App.class);

    private App() {
    }

    public static void main(String[] args) throws Exception {
        // A single JSON config file path is the whole command line.
        if (args.length < 1) {
            LOGGER.error("Usage: java -jar document-catalog.jar <config.json>");
            System.exit(1);
        }
        CatalogConfig config = new ConfigLoader().load(Path.of(args[0]));
        CatalogResult result = new CatalogEngine(config).run();
        if (result.state() == EngineState.CANCELLED) {
            LOGGER.info("Run stopped early; {} new records were stored", result.rowsStored());
        }
    }
}
