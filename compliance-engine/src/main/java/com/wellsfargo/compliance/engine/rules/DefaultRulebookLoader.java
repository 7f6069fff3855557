package com.wellsfargo.compliance.engine.rules;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

/**
 * Loads the default rulebook catalogue from a classpath JSON file.
 * 
 * This class is thread-safe and deterministic.
 */
public class DefaultRulebookLoader {
    
    private static final Logger log = LoggerFactory.getLogger(DefaultRulebookLoader.class);
    public static final String DEFAULT_CATALOGUE_PATH = "/config/default_rulebooks.json";
    
    private final ObjectMapper objectMapper;
    
    public DefaultRulebookLoader() {
        this.objectMapper = new ObjectMapper();
    }
    
    /**
     * Load the catalogue from the default classpath location.
     * 
     * @return DefaultRulebookConfig with one entry per scheme
     * @throws IllegalStateException if the catalogue cannot be loaded
     */
    public DefaultRulebookConfig load() {
        return load(DEFAULT_CATALOGUE_PATH);
    }
    
    /**
     * Load the catalogue from a specific classpath location.
     * 
     * @param classpathPath Path to the JSON file in classpath (e.g., "/config/default_rulebooks.json")
     * @return DefaultRulebookConfig with one entry per scheme
     * @throws IllegalStateException if the catalogue cannot be loaded
     */
    public DefaultRulebookConfig load(String classpathPath) {
        try (InputStream inputStream = getClass().getResourceAsStream(classpathPath)) {
            if (inputStream == null) {
                throw new IllegalStateException("Default rulebook catalogue not found in classpath: " + classpathPath);
            }
            
            DefaultRulebookConfig config = objectMapper.readValue(inputStream, DefaultRulebookConfig.class);
            
            log.info("Loaded {} default rulebooks (catalogue version {}) from {}",
                config.getRulebooks() != null ? config.getRulebooks().size() : 0,
                config.getVersion(),
                classpathPath);
            
            return config;
            
        } catch (IOException e) {
            log.error("Failed to load default rulebook catalogue from: {}", classpathPath, e);
            throw new IllegalStateException("Failed to load default rulebook catalogue", e);
        }
    }
}
