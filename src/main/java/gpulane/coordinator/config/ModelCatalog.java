package gpulane.coordinator.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only set of valid models, their modes and fixed parameters.
 * Loaded once at startup from the {@code models.json} classpath resource.
 */
public final class ModelCatalog {

    private static final Logger log = LoggerFactory.getLogger(ModelCatalog.class);
    private static final String DEFAULT_RESOURCE = "/models.json";

    private final Map<String, ModelSpec> models;

    public ModelCatalog(List<ModelSpec> specs) {
        Map<String, ModelSpec> byId = new LinkedHashMap<>();
        for (ModelSpec spec : specs) {
            spec.validate();
            if (byId.put(spec.id(), spec) != null) {
                throw new IllegalArgumentException("duplicate model id: " + spec.id());
            }
        }
        this.models = Collections.unmodifiableMap(byId);
    }

    public static ModelCatalog loadDefault() {
        return load(DEFAULT_RESOURCE);
    }

    public static ModelCatalog load(String resource) {
        try (InputStream in = ModelCatalog.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalStateException("Model catalog not found on classpath: " + resource);
            }
            List<ModelSpec> specs = new ObjectMapper().readValue(in, new TypeReference<List<ModelSpec>>() {
            });
            ModelCatalog catalog = new ModelCatalog(specs);
            log.info("Loaded {} models from {}: {}", catalog.models.size(), resource, catalog.models.keySet());
            return catalog;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read model catalog " + resource, e);
        }
    }

    public Optional<ModelSpec> find(String modelId) {
        return Optional.ofNullable(modelId == null ? null : models.get(modelId));
    }

    public Collection<ModelSpec> all() {
        return models.values();
    }

    /** Models that own a dedicated lane */
    public List<ModelSpec> heavyModels() {
        return models.values().stream().filter(ModelSpec::isHeavy).toList();
    }
}
