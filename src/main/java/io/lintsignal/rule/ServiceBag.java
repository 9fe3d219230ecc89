package io.lintsignal.rule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Services available to rules during one analysis, keyed by type.
 * Immutable: {@link #with(Class, Object)} returns a new bag.
 */
public final class ServiceBag {

    private static final ServiceBag EMPTY = new ServiceBag(Map.of());

    private final Map<Class<?>, Object> services;

    private ServiceBag(Map<Class<?>, Object> services) {
        this.services = services;
    }

    public static ServiceBag empty() {
        return EMPTY;
    }

    public static <T> ServiceBag of(Class<T> type, T service) {
        return EMPTY.with(type, service);
    }

    public <T> ServiceBag with(Class<T> type, T service) {
        if (type == null || service == null) {
            throw new IllegalArgumentException("service type and instance cannot be null");
        }
        Map<Class<?>, Object> copy = new LinkedHashMap<>(services);
        copy.put(type, service);
        return new ServiceBag(Map.copyOf(copy));
    }

    public <T> Optional<T> get(Class<T> type) {
        return Optional.ofNullable(services.get(type)).map(type::cast);
    }

    public boolean contains(Class<?> type) {
        return services.containsKey(type);
    }

    public Set<Class<?>> types() {
        return services.keySet();
    }

    @Override
    public String toString() {
        return "ServiceBag" + services.keySet();
    }
}
