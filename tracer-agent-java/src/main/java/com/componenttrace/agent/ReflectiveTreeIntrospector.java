package com.componenttrace.agent;

import com.componenttrace.core.introspect.HostTreeEntry;
import com.componenttrace.core.introspect.HostTreeIntrospector;
import com.componenttrace.core.introspect.HostTreeSnapshot;
import com.componenttrace.core.model.ComponentType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.ref.WeakReference;
import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.ConcurrentModificationException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads the component tree out of a renderer's private state map.
 *
 * The renderer is expected to hold a {@code Map<Integer, ?>} of per-component state objects,
 * each carrying the component, its id and its parent's state. Field names are tried in the
 * order {@link HostBinding} lists them; the map falls back to the first {@code Map} field.
 * Once the layout is found not to match, every later call reports unsupported.
 */
public final class ReflectiveTreeIntrospector implements HostTreeIntrospector {

    private static final Logger log = LoggerFactory.getLogger(ReflectiveTreeIntrospector.class);

    private final WeakReference<Object> renderer;
    private final HostBinding binding;
    private final Map<Class<?>, StateAccessor> accessors = new ConcurrentHashMap<>();

    private volatile Field stateMapField;
    private volatile boolean unsupported;

    public ReflectiveTreeIntrospector(Object renderer, HostBinding binding) {
        this.renderer = new WeakReference<>(renderer);
        this.binding = binding != null ? binding : HostBinding.defaults(null, null);
    }

    public boolean isUnsupported() {
        return unsupported;
    }

    /** True once the renderer has been garbage-collected. */
    @Override
    public boolean isDetached() {
        return renderer.get() == null;
    }

    @Override
    public HostTreeSnapshot introspect() {
        Object target = renderer.get();
        if (target == null || unsupported) return HostTreeSnapshot.unsupported();

        try {
            Field mapField = stateMapField(target.getClass());
            if (mapField == null) return markUnsupported(target, "no component state map");
            Object value = mapField.get(target);
            // not yet allocated, or torn down; an empty tree here would drop every record
            if (value == null) return HostTreeSnapshot.unsupported();
            if (!(value instanceof Map<?, ?> states)) return markUnsupported(target, mapField.getName() + " is not a map");

            List<Map.Entry<?, ?>> entries = new ArrayList<>(states.entrySet());
            HostTreeSnapshot.Builder builder = HostTreeSnapshot.builder();
            for (Map.Entry<?, ?> entry : entries) {
                Object state = entry.getValue();
                if (state == null) continue;
                StateAccessor accessor = accessor(state.getClass());
                if (accessor == null) return markUnsupported(target, "unrecognized state type " + state.getClass().getName());

                Integer id = entry.getKey() instanceof Integer key ? key : accessor.id(state);
                if (id == null) continue;
                Object component = accessor.component(state);
                ComponentType type = component != null ? ComponentType.of(component.getClass()) : ComponentType.UNKNOWN;
                builder.add(new HostTreeEntry(id, component, parentId(accessor, state), type));
            }
            return builder.build();
        } catch (ConcurrentModificationException e) {
            // renderer mutated its map mid-copy; the next pass will retry
            return HostTreeSnapshot.unsupported();
        } catch (IllegalAccessException | RuntimeException e) {
            return markUnsupported(target, e.toString());
        }
    }

    private Integer parentId(StateAccessor accessor, Object state) throws IllegalAccessException {
        Object parent = accessor.parent(state);
        if (parent == null) return null;
        if (parent instanceof Integer id) return id;
        StateAccessor parentAccessor = accessor(parent.getClass());
        return parentAccessor != null ? parentAccessor.id(parent) : null;
    }

    private HostTreeSnapshot markUnsupported(Object target, String reason) {
        if (!unsupported) {
            unsupported = true;
            log.warn("Component tree of {} is not readable ({}); falling back to direct resolution",
                target.getClass().getName(), reason);
        }
        return HostTreeSnapshot.unsupported();
    }

    private Field stateMapField(Class<?> rendererClass) {
        Field field = stateMapField;
        if (field != null) return field;
        field = findField(rendererClass, binding.stateMapFields());
        if (field == null || !Map.class.isAssignableFrom(field.getType())) {
            field = firstMapField(rendererClass);
        }
        stateMapField = field;
        return field;
    }

    private StateAccessor accessor(Class<?> stateClass) {
        StateAccessor accessor = accessors.computeIfAbsent(stateClass, c -> {
            Field component = findField(c, binding.stateComponentFields());
            Field id = findField(c, binding.stateIdFields());
            Field parent = findField(c, binding.stateParentFields());
            return new StateAccessor(component, id, parent);
        });
        return accessor.component() != null || accessor.id() != null ? accessor : null;
    }

    private static Field findField(Class<?> type, List<String> names) {
        for (String name : names) {
            for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
                try {
                    Field field = c.getDeclaredField(name);
                    if (Modifier.isStatic(field.getModifiers())) continue;
                    field.setAccessible(true);
                    return field;
                } catch (NoSuchFieldException e) {
                    // try the superclass
                } catch (RuntimeException e) {
                    log.debug("Cannot open {}.{}: {}", c.getName(), name, e.getMessage());
                }
            }
        }
        return null;
    }

    private static Field firstMapField(Class<?> type) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            for (Field field : c.getDeclaredFields()) {
                if (Modifier.isStatic(field.getModifiers()) || !Map.class.isAssignableFrom(field.getType())) continue;
                try {
                    field.setAccessible(true);
                    return field;
                } catch (RuntimeException e) {
                    log.debug("Cannot open {}.{}: {}", c.getName(), field.getName(), e.getMessage());
                }
            }
        }
        return null;
    }

    private record StateAccessor(Field component, Field id, Field parent) {

        Object component(Object state) throws IllegalAccessException {
            return component != null ? component.get(state) : null;
        }

        Integer id(Object state) throws IllegalAccessException {
            Object value = id != null ? id.get(state) : null;
            return value instanceof Integer i ? i : null;
        }

        Object parent(Object state) throws IllegalAccessException {
            return parent != null ? parent.get(state) : null;
        }
    }
}
