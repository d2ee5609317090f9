package dk.cloudcreate.essentials.fmodel.application.types;

import dk.cloudcreate.essentials.types.LongType;

/**
 * The version of an event stream or a stored state.<br>
 * Each event appended to a stream gets the next version, starting with {@link #FIRST_VERSION}. A stored state gets
 * a new version every time it's saved.<br>
 * The version is compared on save to detect concurrent modifications of the same identity.
 */
public class Version extends LongType<Version> {
    /**
     * The version of the first event appended to a stream (or of a state the first time it's saved)
     */
    public static final Version FIRST_VERSION = Version.of(0);

    public Version(Long value) {
        super(value);
    }

    /**
     * @param value the version number, where {@link #FIRST_VERSION} is <code>0</code>
     */
    public static Version of(long value) {
        return new Version(value);
    }

    /**
     * The version that the next save of a stream or state is assigned. Versions are immutable, so this
     * version is left unchanged
     *
     * @return a new {@link Version} that is one higher than this version
     */
    public Version increaseAndGet() {
        return new Version(value() + 1);
    }
}
