package com.zzf.bashnorm.lexicon;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Reads a {@link GrammarProfile} from a JSON document. Locations starting with {@code classpath:}
 * are resolved against the class loader, anything else as a filesystem path.
 */
@Slf4j
public class GrammarProfileLoader {

    public static final String DEFAULT_LOCATION = "classpath:grammar/default-profile.json";
    private static final String CLASSPATH_PREFIX = "classpath:";

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public GrammarProfile loadDefault() {
        return load(DEFAULT_LOCATION);
    }

    /**
     * Loads the profile at {@code location}. A missing, blank or unreadable location falls back to
     * the bundled profile, and only if that is unavailable too to the operator tables alone.
     */
    public GrammarProfile load(String location) {
        if (location == null || location.isBlank()) {
            log.warn("No grammar profile location given, using the bundled profile.");
            return loadBundled();
        }
        String trimmed = location.trim();
        try {
            GrammarProfile profile = read(trimmed);
            if (profile == null) {
                log.warn("Grammar profile not found at {}, using the bundled profile.", trimmed);
                return DEFAULT_LOCATION.equals(trimmed) ? new GrammarProfile() : loadBundled();
            }
            log.info("Loaded grammar profile from {} ({} head commands)", trimmed,
                    profile.getHeadCommands() == null ? 0 : profile.getHeadCommands().size());
            return profile;
        } catch (IOException e) {
            log.error("Failed to load grammar profile from {}, using the bundled profile.", trimmed, e);
            return DEFAULT_LOCATION.equals(trimmed) ? new GrammarProfile() : loadBundled();
        }
    }

    private GrammarProfile loadBundled() {
        try {
            GrammarProfile profile = read(DEFAULT_LOCATION);
            if (profile != null) {
                return profile;
            }
            log.error("Bundled grammar profile {} is missing, using built-in operator tables only.", DEFAULT_LOCATION);
        } catch (IOException e) {
            log.error("Failed to load bundled grammar profile {}, using built-in operator tables only.", DEFAULT_LOCATION, e);
        }
        return new GrammarProfile();
    }

    private GrammarProfile read(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            if (loader == null) {
                loader = GrammarProfileLoader.class.getClassLoader();
            }
            try (InputStream in = loader.getResourceAsStream(resource)) {
                if (in == null) {
                    return null;
                }
                return objectMapper.readValue(in, GrammarProfile.class);
            }
        }
        Path path = Paths.get(location);
        if (!Files.isRegularFile(path)) {
            return null;
        }
        return objectMapper.readValue(path.toFile(), GrammarProfile.class);
    }
}
