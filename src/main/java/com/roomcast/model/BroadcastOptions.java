package com.roomcast.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Describes who should receive a broadcast.
 *
 * <ul>
 *   <li>{@code rooms}: candidates are the members of any of these rooms; empty means every
 *       registered socket.</li>
 *   <li>{@code except}: members of any of these rooms are excluded.</li>
 *   <li>{@code merge}: when non-empty, a candidate must also be a member of every one of these
 *       rooms.</li>
 * </ul>
 */
public final class BroadcastOptions {

    private final Set<String> rooms;
    private final Set<String> except;
    private final Set<String> merge;
    private final BroadcastFlags flags;

    public BroadcastOptions(Collection<String> rooms, Collection<String> except,
                            Collection<String> merge, BroadcastFlags flags) {
        this.rooms = copyOf(rooms);
        this.except = copyOf(except);
        this.merge = copyOf(merge);
        this.flags = flags != null ? flags : BroadcastFlags.NONE;
    }

    // Static factory methods
    public static BroadcastOptions everyone() {
        return new BroadcastOptions(null, null, null, null);
    }

    public static BroadcastOptions toRooms(Collection<String> rooms) {
        return new BroadcastOptions(rooms, null, null, null);
    }

    public static BroadcastOptions toRooms(String... rooms) {
        return toRooms(Arrays.asList(rooms));
    }

    public BroadcastOptions except(Collection<String> exceptRooms) {
        return new BroadcastOptions(rooms, exceptRooms, merge, flags);
    }

    public BroadcastOptions merge(Collection<String> mergeRooms) {
        return new BroadcastOptions(rooms, except, mergeRooms, flags);
    }

    public BroadcastOptions flags(BroadcastFlags newFlags) {
        return new BroadcastOptions(rooms, except, merge, newFlags);
    }

    private static Set<String> copyOf(Collection<String> values) {
        if (values == null || values.isEmpty()) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(values));
    }

    // Getters
    public Set<String> getRooms() {
        return rooms;
    }

    public Set<String> getExcept() {
        return except;
    }

    public Set<String> getMerge() {
        return merge;
    }

    public BroadcastFlags getFlags() {
        return flags;
    }

    @Override
    public String toString() {
        return "BroadcastOptions{rooms=" + rooms + ", except=" + except + ", merge=" + merge + "}";
    }
}
