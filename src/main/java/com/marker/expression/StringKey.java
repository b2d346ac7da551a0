package com.marker.expression;

import java.util.Arrays;
import java.util.Optional;

/**
 * Environment markers whose value is an arbitrary string, such as {@code sys_platform}.
 * <p>
 * The PEP 345 spellings ({@code os.name}, {@code sys.platform}, ...) are kept as separate
 * constants so that they can be reported, but they display and resolve as their
 * canonical key.
 */
public enum StringKey {
    IMPLEMENTATION_NAME("implementation_name", null),
    OS_NAME("os_name", null),
    OS_NAME_DEPRECATED("os.name", OS_NAME),
    PLATFORM_MACHINE("platform_machine", null),
    PLATFORM_MACHINE_DEPRECATED("platform.machine", PLATFORM_MACHINE),
    PLATFORM_PYTHON_IMPLEMENTATION("platform_python_implementation", null),
    PLATFORM_PYTHON_IMPLEMENTATION_DEPRECATED("platform.python_implementation", PLATFORM_PYTHON_IMPLEMENTATION),
    PYTHON_IMPLEMENTATION_DEPRECATED("python_implementation", PLATFORM_PYTHON_IMPLEMENTATION),
    PLATFORM_RELEASE("platform_release", null),
    PLATFORM_SYSTEM("platform_system", null),
    PLATFORM_VERSION("platform_version", null),
    PLATFORM_VERSION_DEPRECATED("platform.version", PLATFORM_VERSION),
    SYS_PLATFORM("sys_platform", null),
    SYS_PLATFORM_DEPRECATED("sys.platform", SYS_PLATFORM);

    private final String markerName;
    private final StringKey replacement;

    StringKey(String markerName, StringKey replacement) {
        this.markerName = markerName;
        this.replacement = replacement;
    }

    /**
     * The spelling as written in marker text, deprecated or not.
     */
    public String markerName() {
        return markerName;
    }

    public boolean isDeprecated() {
        return replacement != null;
    }

    /**
     * The modern key; a non-deprecated key is its own canonical form.
     */
    public StringKey canonical() {
        return replacement == null ? this : replacement;
    }

    public String deprecationMessage() {
        return markerName + " is deprecated in favor of " + canonical().markerName;
    }

    public static Optional<StringKey> fromMarkerName(String name) {
        return Arrays.stream(values())
                .filter(key -> key.markerName.equals(name))
                .findFirst();
    }

    @Override
    public String toString() {
        return canonical().markerName;
    }
}
