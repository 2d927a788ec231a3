package io.github.flameyossnowy.filetx.api.backend;

import org.jetbrains.annotations.Contract;
import org.jetbrains.annotations.NotNull;

/**
 * Name validation shared by the bundled backends.
 */
public final class BackendNames {
    private BackendNames() {
    }

    /**
     * Rejects names that are empty or could leave a flat namespace.
     *
     * @param name the entry name
     * @return the same name
     * @throws IllegalArgumentException if the name is not usable as an entry name
     */
    @Contract("null -> fail")
    public static @NotNull String validate(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Entry name must not be empty");
        }
        if (name.equals(".") || name.contains("..") || name.indexOf('/') >= 0 || name.indexOf('\\') >= 0 || name.indexOf('\0') >= 0) {
            throw new IllegalArgumentException("Illegal entry name: " + name);
        }
        return name;
    }
}
