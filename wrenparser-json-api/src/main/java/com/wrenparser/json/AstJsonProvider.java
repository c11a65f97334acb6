package com.wrenparser.json;

import org.slf4j.LoggerFactory;

import java.util.ServiceLoader;
import java.util.function.Predicate;

/**
 * JSON export for Wren syntax trees, implemented by a separate module and
 * found with {@link ServiceLoader}. wrenparser-jackson is the stock
 * implementation.
 *
 * <pre>{@code
 * ParseResult result = Parser.parse("main.wren", text);
 * String json = AstJsonProvider.getProvider().getSerializer().serialize(result.module());
 * }</pre>
 */
public interface AstJsonProvider {

    AstJsonSerializer getSerializer();

    /**
     * Short name used by {@link #getProvider(String)}, e.g. "Jackson".
     */
    String getName();

    /**
     * The first provider on the classpath.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider() {
        return find(provider -> true,
            "No AstJsonProvider on the classpath; add wrenparser-jackson to the dependencies.");
    }

    /**
     * The provider whose {@link #getName()} equals {@code name}, ignoring case.
     *
     * @throws IllegalStateException if there is none
     */
    static AstJsonProvider getProvider(String name) {
        return find(provider -> provider.getName().equalsIgnoreCase(name),
            "No AstJsonProvider named '" + name + "' on the classpath.");
    }

    static boolean isProviderAvailable() {
        return ServiceLoader.load(AstJsonProvider.class).findFirst().isPresent();
    }

    private static AstJsonProvider find(Predicate<AstJsonProvider> wanted, String missing) {
        for (AstJsonProvider provider : ServiceLoader.load(AstJsonProvider.class)) {
            if (wanted.test(provider)) {
                LoggerFactory.getLogger(AstJsonProvider.class)
                    .debug("Using AST JSON provider {} ({})", provider.getName(), provider.getClass().getName());
                return provider;
            }
        }
        throw new IllegalStateException(missing);
    }
}
