package net.bibrecords.support.citation;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Table of the citation styles known to the application, keyed by lowercase name.
 *
 * <p>Style beans are registered at start-up; further styles may be registered at run time and are
 * visible to the next lookup.
 */
@Component
@Slf4j
public class CitationStyleRegistry {

    private final Map<String, CitationStyle> styles = new ConcurrentHashMap<>();

    public CitationStyleRegistry(List<CitationStyle> initialStyles) {
        if (initialStyles != null) {
            initialStyles.forEach(this::register);
        }
    }

    /**
     * Adds or replaces a style.
     */
    public void register(CitationStyle style) {
        if (style == null || style.name() == null || style.name().isBlank()) {
            throw new IllegalArgumentException("Citation style must have a name");
        }
        CitationStyle previous = styles.put(key(style.name()), style);
        if (previous != null && previous != style) {
            log.warn("Citation style '{}' replaced by {}", style.name(), style.getClass().getSimpleName());
        } else {
            log.debug("Registered citation style '{}'", style.name());
        }
    }

    public Optional<CitationStyle> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(styles.get(key(name)));
    }

    /** Registered style names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(styles.keySet());
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }
}
