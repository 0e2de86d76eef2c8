package com.project.certredeem.eth;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Directory of {@code <network>.json} deployment files.
 */
public class DeploymentRegistry {

    private static final String SUFFIX = ".json";

    private final Path deploymentsDirectory;
    private final ObjectMapper mapper = new ObjectMapper();

    public DeploymentRegistry(Path deploymentsDirectory) {
        this.deploymentsDirectory = Objects.requireNonNull(deploymentsDirectory, "deploymentsDirectory must not be null");
    }

    public Optional<DeploymentMetadata> load(String networkName) {
        Path file = fileFor(networkName);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readValue(file.toFile(), DeploymentMetadata.class));
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read deployment metadata: " + file, e);
        }
    }

    public Path save(DeploymentMetadata metadata) throws IOException {
        Objects.requireNonNull(metadata, "metadata must not be null");
        Files.createDirectories(deploymentsDirectory);
        Path file = fileFor(metadata.network());
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), metadata);
        return file;
    }

    public List<String> networks() {
        if (!Files.isDirectory(deploymentsDirectory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(deploymentsDirectory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted()
                    .toList();
        } catch (IOException e) {
            throw new IllegalStateException("Failed to list deployments in " + deploymentsDirectory, e);
        }
    }

    private Path fileFor(String networkName) {
        if (networkName == null || !networkName.matches("[A-Za-z0-9_-]+")) {
            throw new IllegalArgumentException("Invalid network name: '" + networkName + "'");
        }
        return deploymentsDirectory.resolve(networkName + SUFFIX);
    }
}
