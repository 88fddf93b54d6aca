package fr.lapetina.dopc.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration loader.
 *
 * Looks for the configuration on the file system first, then on the classpath.
 * An empty document yields the defaults.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(DopcConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading fails
     */
    public DopcConfig load() {
        DopcConfig config = loadFromPath();
        validate(config);
        return config;
    }

    private DopcConfig loadFromPath() {
        if (Files.exists(configPath)) {
            return loadFromFile(configPath);
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return orDefault(yaml.load(is));
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Invalid configuration in classpath resource: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private DopcConfig loadFromFile(Path path) {
        log.info("Loading configuration from file: {}", path);
        try (InputStream is = Files.newInputStream(path)) {
            return orDefault(yaml.load(is));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load configuration from: " + path, e);
        } catch (RuntimeException e) {
            throw new ConfigurationException("Invalid configuration in: " + path, e);
        }
    }

    /**
     * Loads configuration from an input stream.
     */
    public DopcConfig loadFromStream(InputStream inputStream) {
        DopcConfig config = orDefault(yaml.load(inputStream));
        validate(config);
        return config;
    }

    private static DopcConfig orDefault(DopcConfig loaded) {
        return loaded != null ? loaded : new DopcConfig();
    }

    private static void validate(DopcConfig config) {
        if (config.getUpstream().getPoolSize() <= 0) {
            throw new ConfigurationException("upstream.poolSize must be positive");
        }
        if (config.getService().getMaxConcurrentRequests() <= 0) {
            throw new ConfigurationException("service.maxConcurrentRequests must be positive");
        }
        if (config.getBalancer().getNumServices() <= 0) {
            throw new ConfigurationException("balancer.numServices must be positive");
        }
        if ("process".equalsIgnoreCase(config.getBalancer().getLaunchMode())
                && config.getBalancer().getServicePortStart() <= 0) {
            throw new ConfigurationException("balancer.servicePortStart must be positive in process launch mode");
        }
        String endpoint = config.getGeneral().getEndpoint();
        if (endpoint == null || !endpoint.startsWith("/")) {
            throw new ConfigurationException("general.endpoint must start with '/': " + endpoint);
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
