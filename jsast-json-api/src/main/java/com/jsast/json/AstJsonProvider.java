package com.jsast.json;

import java.util.ServiceLoader;

/**
 * Entry point to an AST JSON implementation, found through {@link ServiceLoader}.
 *
 * <p>Putting an implementation such as jsast-jackson on the classpath is enough for
 * {@link #getProvider()} to find it:</p>
 * <pre>{@code
 * Program<String> program = PlainTreeConverter.convert(spanned);
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(program);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * The serializer writing plain AST nodes as ESTree JSON.
     */
    AstJsonSerializer getSerializer();

    /**
     * A short name identifying the implementation, e.g. "Jackson".
     */
    String getName();

    /**
     * The first provider registered on the classpath.
     *
     * @throws IllegalStateException if none is registered
     */
    static AstJsonProvider getProvider() {
        return ServiceLoader.load(AstJsonProvider.class)
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No AstJsonProvider found on the classpath; add jsast-jackson or another implementation"));
    }

    /**
     * The registered provider with the given name, ignoring case.
     *
     * @throws IllegalStateException if no registered provider has that name
     */
    static AstJsonProvider getProvider(String name) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (provider.getName().equalsIgnoreCase(name)) {
                return provider;
            }
        }
        throw new IllegalStateException("No AstJsonProvider named '" + name + "' found on the classpath");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }
}
