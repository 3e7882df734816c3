package com.example.doccatalog.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Manages the JSON properties file that accompanies an exported catalog.
 */
public final class PropertiesWriter {
    private final ObjectMapper mapper;
    private final Path propertiesPath;

    public PropertiesWriter(Path propertiesPath) {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.propertiesPath = propertiesPath;
    }

    /**
     * Properties file belonging to an export, e.g. {@code catalog.properties.json} for {@code catalog.csv}.
     */
    public static Path sidecarFor(Path exportPath) {
        String fileName = exportPath.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        return exportPath.resolveSibling(stem + ".properties.json");
    }

    /**
     * Returns the saved properties if the file exists.
     */
    public Optional<CatalogProperties> load() throws IOException {
        if (!Files.exists(propertiesPath)) {
            return Optional.empty();
        }
        return Optional.of(mapper.readValue(propertiesPath.toFile(), CatalogProperties.class));
    }

    /**
     * Writes the properties, creating the parent directories if needed.
     */
    public void save(CatalogProperties properties) throws IOException {
        Path parent = propertiesPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(propertiesPath.toFile(), properties);
    }
}
