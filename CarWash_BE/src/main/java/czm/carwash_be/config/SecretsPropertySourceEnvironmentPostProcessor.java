package czm.carwash_be.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.env.EnvironmentPostProcessor;
import org.springframework.core.Ordered;
import org.springframework.core.env.ConfigurableEnvironment;
import org.springframework.core.env.MapPropertySource;

/**
 * Promotes Docker secrets (database credentials) to the highest-priority property source.
 */
public class SecretsPropertySourceEnvironmentPostProcessor implements EnvironmentPostProcessor, Ordered {

    private static final Logger log = LoggerFactory.getLogger(SecretsPropertySourceEnvironmentPostProcessor.class);

    private static final String PROPERTY_SOURCE_NAME = "secretsPropertySource";

    private static final Path SECRETS_DIR = Path.of("/run/secrets");

    private final List<SecretDescriptor> secretDescriptors;

    public SecretsPropertySourceEnvironmentPostProcessor() {
        this(defaultSecretDescriptors());
    }

    SecretsPropertySourceEnvironmentPostProcessor(List<SecretDescriptor> secretDescriptors) {
        this.secretDescriptors = List.copyOf(secretDescriptors);
    }

    @Override
    public void postProcessEnvironment(ConfigurableEnvironment environment, SpringApplication application) {
        Map<String, Object> secrets = new HashMap<>();
        for (SecretDescriptor descriptor : secretDescriptors) {
            readSecret(descriptor.path()).ifPresent(value -> secrets.put(descriptor.key(), value));
        }

        if (secrets.isEmpty()) {
            log.info("No secrets found in {}, using environment variables and application.yml", SECRETS_DIR);
            return;
        }
        environment.getPropertySources().addFirst(new MapPropertySource(PROPERTY_SOURCE_NAME, secrets));
        log.info("Loaded secrets property source with keys: {}", secrets.keySet());
    }

    private Optional<String> readSecret(Path path) {
        if (!Files.isReadable(path)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(path).trim();
            return value.isEmpty() ? Optional.empty() : Optional.of(value);
        } catch (IOException exception) {
            log.warn("Failed to read secret from {}", path, exception);
            return Optional.empty();
        }
    }

    private static List<SecretDescriptor> defaultSecretDescriptors() {
        return List.of(
                new SecretDescriptor("DB_USER", SECRETS_DIR.resolve("carwash_postgres-user")),
                new SecretDescriptor("DB_PASSWORD", SECRETS_DIR.resolve("carwash_postgres-password")));
    }

    @Override
    public int getOrder() {
        return Ordered.HIGHEST_PRECEDENCE;
    }

    record SecretDescriptor(String key, Path path) {}
}
