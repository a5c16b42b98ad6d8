package com.componenttrace.core.inspector;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.annotation.Annotation;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads the parameters a component received from its parent.
 *
 * Parameters are the fields carrying one of the host runtime's parameter annotations, matched
 * by simple or fully-qualified annotation name since the host's annotation types are not on
 * this module's class path. Field lookups are cached per class.
 */
public final class ParameterReader {

    private static final Logger log = LoggerFactory.getLogger(ParameterReader.class);

    private final Set<String> parameterAnnotations;
    private final Set<String> cascadingAnnotations;
    private final Map<Class<?>, List<ParameterField>> cache = new ConcurrentHashMap<>();

    public ParameterReader(Collection<String> parameterAnnotations, Collection<String> cascadingAnnotations) {
        this.parameterAnnotations = parameterAnnotations != null ? Set.copyOf(parameterAnnotations) : Set.of();
        this.cascadingAnnotations = cascadingAnnotations != null ? Set.copyOf(cascadingAnnotations) : Set.of();
    }

    /** Reader for hosts without parameter annotations; always reads nothing. */
    public static ParameterReader none() {
        return new ParameterReader(Set.of(), Set.of());
    }

    /**
     * @return direct parameters in declaration order (superclass fields first), then cascading
     *         ones; empty for null instances and classes without parameters
     */
    public List<ParameterValue> read(Object instance) {
        if (instance == null || (parameterAnnotations.isEmpty() && cascadingAnnotations.isEmpty())) {
            return Collections.emptyList();
        }
        List<ParameterField> fields = cache.computeIfAbsent(instance.getClass(), this::scan);
        if (fields.isEmpty()) return Collections.emptyList();

        List<ParameterValue> values = new ArrayList<>(fields.size());
        for (ParameterField parameter : fields) {
            try {
                Object value = parameter.field.get(instance);
                values.add(new ParameterValue(parameter.field.getName(), parameter.field.getType().getSimpleName(),
                    value != null ? String.valueOf(value) : null, parameter.cascading));
            } catch (IllegalAccessException | RuntimeException e) {
                log.debug("Cannot read parameter {} of {}", parameter.field.getName(), instance.getClass().getName());
            }
        }
        return values;
    }

    private List<ParameterField> scan(Class<?> type) {
        List<Class<?>> hierarchy = new ArrayList<>();
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            hierarchy.add(0, c);
        }

        List<ParameterField> direct = new ArrayList<>();
        List<ParameterField> cascading = new ArrayList<>();
        for (Class<?> c : hierarchy) {
            for (Field field : c.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers())) continue;
                boolean isCascading = annotated(field, cascadingAnnotations);
                if (!isCascading && !annotated(field, parameterAnnotations)) continue;
                try {
                    field.setAccessible(true);
                } catch (RuntimeException e) {
                    log.debug("Skipping parameter {}.{}: {}", c.getName(), field.getName(), e.getMessage());
                    continue;
                }
                (isCascading ? cascading : direct).add(new ParameterField(field, isCascading));
            }
        }
        direct.addAll(cascading);
        return direct.isEmpty() ? Collections.emptyList() : List.copyOf(direct);
    }

    private static boolean annotated(Field field, Set<String> names) {
        if (names.isEmpty()) return false;
        for (Annotation annotation : field.getDeclaredAnnotations()) {
            Class<? extends Annotation> type = annotation.annotationType();
            if (names.contains(type.getSimpleName()) || names.contains(type.getName())) return true;
        }
        return false;
    }

    /** One parameter as shown to the inspector; the value is null when the field is. */
    public record ParameterValue(String name, String typeName, String value, boolean cascading) {}

    private record ParameterField(Field field, boolean cascading) {}
}
