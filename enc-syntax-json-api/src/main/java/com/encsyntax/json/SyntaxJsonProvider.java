package com.encsyntax.json;

import java.util.Iterator;
import java.util.ServiceLoader;

/**
 * Provider interface for syntax tree JSON serialization/deserialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., enc-syntax-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * SyntaxJsonProvider provider = SyntaxJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(tree.root());
 * SyntaxTree copy = provider.getDeserializer().deserializeTree(json);
 * }</pre>
 */
public interface SyntaxJsonProvider {

    /**
     * Returns the serializer for converting syntax trees to JSON.
     *
     * @return the syntax JSON serializer
     */
    SyntaxJsonSerializer getSerializer();

    /**
     * Returns the deserializer for converting JSON to syntax trees.
     *
     * @return the syntax JSON deserializer
     */
    SyntaxJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    /**
     * Gets the first available SyntaxJsonProvider via ServiceLoader.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static SyntaxJsonProvider getProvider() {
        ServiceLoader<SyntaxJsonProvider> loader = ServiceLoader.load(SyntaxJsonProvider.class);
        Iterator<SyntaxJsonProvider> iterator = loader.iterator();
        if (iterator.hasNext()) {
            return iterator.next();
        }
        throw new IllegalStateException(
            "No SyntaxJsonProvider found on the classpath. " +
            "Add enc-syntax-jackson (or another provider) to your dependencies."
        );
    }

    /**
     * Gets a SyntaxJsonProvider by name via ServiceLoader.
     *
     * @param name the provider name (e.g., "Jackson")
     * @return the provider
     * @throws IllegalStateException if no matching provider is found
     */
    static SyntaxJsonProvider getProvider(String name) {
        ServiceLoader<SyntaxJsonProvider> loader = ServiceLoader.load(SyntaxJsonProvider.class);
        for (SyntaxJsonProvider provider : loader) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException(
            "No SyntaxJsonProvider found with name '" + name + "'."
        );
    }

    static boolean isProviderAvailable() {
        ServiceLoader<SyntaxJsonProvider> loader = ServiceLoader.load(SyntaxJsonProvider.class);
        return loader.iterator().hasNext();
    }
}
