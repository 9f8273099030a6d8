package com.vaceline.json;

import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Source of a matching {@link AstJsonSerializer} and {@link AstJsonDeserializer}.
 * Implementations register themselves in {@code META-INF/services/com.vaceline.json.AstJsonProvider}
 * and are found with {@link ServiceLoader}, so putting vaceline-jackson on the classpath is enough.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(program);
 * Program copy = provider.getDeserializer().deserializeProgram(json);
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    AstJsonDeserializer getDeserializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. {@code "Jackson"}.
     */
    String getName();

    /**
     * @throws IllegalStateException if no provider is on the classpath
     */
    static AstJsonProvider getProvider() {
        return findFirst(null).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider on the classpath; add vaceline-jackson to the dependencies"));
    }

    /**
     * Looks a provider up by name, ignoring case.
     *
     * @throws IllegalStateException if no provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        return findFirst(name).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider named '" + name + "' on the classpath"));
    }

    static boolean isProviderAvailable() {
        return findFirst(null).isPresent();
    }

    private static Optional<AstJsonProvider> findFirst(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (name == null || provider.getName().equalsIgnoreCase(name)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }
}
