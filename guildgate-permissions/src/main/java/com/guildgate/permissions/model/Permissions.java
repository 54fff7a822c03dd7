package com.guildgate.permissions.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Immutable 64-bit permission set.
 *
 * <p>
 * Set algebra mirrors the bit operations the resolver performs: {@link #union}
 * is OR, {@link #difference} is AND-NOT, {@link #contains} is a superset test.
 * Bits without a named {@link Permission} are carried through untouched.
 */
public record Permissions(long bits) {

    public static final Permissions EMPTY = new Permissions(0L);

    /** Union of every named flag. */
    public static final long ALL_BITS;

    static {
        long all = 0L;
        for (Permission p : Permission.values()) {
            all |= p.bit();
        }
        ALL_BITS = all;
    }

    private static final Permissions ALL = new Permissions(ALL_BITS);

    public static Permissions empty() {
        return EMPTY;
    }

    /** The full permission set granted to owners and administrators. */
    public static Permissions all() {
        return ALL;
    }

    public static Permissions of(Permission... flags) {
        long bits = 0L;
        for (Permission flag : flags) {
            bits |= flag.bit();
        }
        return new Permissions(bits);
    }

    /**
     * Parse the decimal string form used by the chat service (e.g. {@code "1024"}).
     *
     * @throws IllegalArgumentException if the text is not an unsigned 64-bit integer
     */
    public static Permissions fromRaw(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        try {
            return new Permissions(Long.parseUnsignedLong(raw.trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid permission bits: " + raw, e);
        }
    }

    /**
     * Build a set from display or constant names.
     *
     * @throws IllegalArgumentException for unknown names
     */
    public static Permissions fromNames(Collection<String> names) {
        long bits = 0L;
        if (names != null) {
            for (String name : names) {
                bits |= Permission.fromName(name).bit();
            }
        }
        return new Permissions(bits);
    }

    public Permissions union(Permissions other) {
        return new Permissions(bits | other.bits);
    }

    public Permissions difference(Permissions other) {
        return new Permissions(bits & ~other.bits);
    }

    public Permissions intersection(Permissions other) {
        return new Permissions(bits & other.bits);
    }

    public Permissions plus(Permission flag) {
        return new Permissions(bits | flag.bit());
    }

    public Permissions minus(Permission flag) {
        return new Permissions(bits & ~flag.bit());
    }

    public boolean contains(Permission flag) {
        return (bits & flag.bit()) == flag.bit();
    }

    /** True when every bit of {@code other} is also set here. */
    public boolean contains(Permissions other) {
        return (bits & other.bits) == other.bits;
    }

    public boolean isEmpty() {
        return bits == 0L;
    }

    public boolean isAll() {
        return (bits & ALL_BITS) == ALL_BITS;
    }

    /** Named flags present in this set, in bit order. */
    public List<Permission> flags() {
        List<Permission> result = new ArrayList<>();
        for (Permission p : Permission.values()) {
            if ((bits & p.bit()) != 0) {
                result.add(p);
            }
        }
        return result;
    }

    /** Display names of the flags present, in bit order. */
    public List<String> names() {
        List<String> result = new ArrayList<>();
        for (Permission p : Permission.values()) {
            if ((bits & p.bit()) != 0) {
                result.add(p.displayName());
            }
        }
        return result;
    }

    /** Decimal string form. */
    public String raw() {
        return Long.toUnsignedString(bits);
    }

    @Override
    public String toString() {
        return "Permissions" + names();
    }
}
