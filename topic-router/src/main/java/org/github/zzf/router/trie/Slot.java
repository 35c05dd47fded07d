package org.github.zzf.router.trie;

/**
 * The payload holder of a {@link Node}.
 * <p>
 * {@code present} tells "never set" apart from "set". Writes happen under the index write lock,
 * the fields are volatile so a {@link Route} kept by a caller still reads the latest value.
 */
public final class Slot<T> {

    private volatile T value;
    private volatile boolean present;

    Slot() {
    }

    public T get() {
        return value;
    }

    public boolean isPresent() {
        return present;
    }

    public void set(T value) {
        this.value = value;
        this.present = true;
    }

    @Override
    public String toString() {
        return present ? String.valueOf(value) : "<unset>";
    }

}
