package io.herald.cli;

@FunctionalInterface
public interface ServeRunner {
    /**
     * @param userOverride acting console user, or {@code null} for the configured one
     */
    int run(String userOverride) throws Exception;
}
