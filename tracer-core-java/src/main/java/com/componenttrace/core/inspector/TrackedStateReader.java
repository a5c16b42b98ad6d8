package com.componenttrace.core.inspector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads {@link TrackState} fields off component instances.
 *
 * Field lookups are cached per class. Fields that cannot be made accessible are skipped.
 */
public final class TrackedStateReader {

    private static final Logger log = LoggerFactory.getLogger(TrackedStateReader.class);

    private final Map<Class<?>, List<TrackedField>> cache = new ConcurrentHashMap<>();

    /**
     * @return display name to rendered value, in declaration order (superclass fields first);
     *         empty for null instances and classes without tracked fields
     */
    public Map<String, String> read(Object instance) {
        if (instance == null) return Collections.emptyMap();
        List<TrackedField> fields = cache.computeIfAbsent(instance.getClass(), TrackedStateReader::scan);
        if (fields.isEmpty()) return Collections.emptyMap();

        Map<String, String> values = new LinkedHashMap<>();
        for (TrackedField tracked : fields) {
            try {
                values.put(tracked.name, String.valueOf(tracked.field.get(instance)));
            } catch (IllegalAccessException e) {
                log.debug("Cannot read tracked field {} of {}", tracked.name, instance.getClass().getName());
            }
        }
        return values;
    }

    private static List<TrackedField> scan(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }

        List<TrackedField> result = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                TrackState marker = field.getAnnotation(TrackState.class);
                if (marker == null || Modifier.isStatic(field.getModifiers())) continue;
                try {
                    field.setAccessible(true);
                } catch (RuntimeException e) {
                    log.debug("Skipping tracked field {}.{}: {}", c.getName(), field.getName(), e.getMessage());
                    continue;
                }
                String name = marker.value().isEmpty() ? field.getName() : marker.value();
                result.add(new TrackedField(name, field));
            }
        }
        return result.isEmpty() ? Collections.emptyList() : List.copyOf(result);
    }

    private record TrackedField(String name, Field field) {}
}
