package space.ketterling.airsense.ml;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads the ensemble model artifact from disk, or the bundled default from the classpath.
 */
public final class ModelArtifactLoader {
    private static final Logger log = LoggerFactory.getLogger(ModelArtifactLoader.class);

    static final String BUNDLED_ARTIFACT = "ensemble-model.json";

    private ModelArtifactLoader() {
    }

    /**
     * Loads the artifact at {@code artifactPath}; a blank path loads the bundled model.
     */
    public static ModelArtifact load(String artifactPath, ObjectMapper om) {
        if (artifactPath == null || artifactPath.isBlank()) {
            return loadBundled(om);
        }
        Path path = Path.of(artifactPath);
        try (InputStream in = Files.newInputStream(path)) {
            ModelArtifact artifact = validate(om.readValue(in, ModelArtifact.class), path.toString());
            log.info("Loaded model artifact {} from {}", artifact.modelVersion(), path);
            return artifact;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading model artifact from " + path, e);
        }
    }

    static ModelArtifact loadBundled(ObjectMapper om) {
        try (InputStream in = ModelArtifactLoader.class.getClassLoader().getResourceAsStream(BUNDLED_ARTIFACT)) {
            if (in == null)
                throw new IllegalStateException("Bundled model artifact missing: " + BUNDLED_ARTIFACT);
            ModelArtifact artifact = validate(om.readValue(in, ModelArtifact.class), BUNDLED_ARTIFACT);
            log.info("Loaded bundled model artifact {}", artifact.modelVersion());
            return artifact;
        } catch (IOException e) {
            throw new IllegalStateException("Failed loading bundled model artifact", e);
        }
    }

    /**
     * Only structural checks; dimension mismatches surface per prediction as fallbacks.
     */
    private static ModelArtifact validate(ModelArtifact a, String source) {
        if (a.sequence() == null || a.linear() == null || a.boosted() == null)
            throw new IllegalStateException("Model artifact " + source + " is missing a model section");
        if (a.confidenceInterval() == null)
            throw new IllegalStateException("Model artifact " + source + " is missing confidenceInterval");
        if (a.sequenceLength() < 1)
            throw new IllegalStateException("Model artifact " + source + " has invalid sequenceLength "
                    + a.sequenceLength());
        return a;
    }
}
