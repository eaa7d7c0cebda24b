package com.fieldops.clustering.engine;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Working cluster: indices into a {@link PointSet} plus the current centroid.
 * Groups carry no id; ids are handed out once, by {@link ClusterAssembler}.
 *
 * Membership changes made through {@link #moveTo} and {@link #mergedWith} keep the
 * centroid current. The partitioner batches {@link #clear}/{@link #add} and calls
 * {@link #recomputeCentroid} at the end of each round.
 */
public final class PointGroup {

    private final PointSet arena;
    private final List<Integer> members;
    private GeoPoint centroid;

    private PointGroup(PointSet arena, List<Integer> members, GeoPoint centroid) {
        this.arena = arena;
        this.members = members;
        this.centroid = centroid;
    }

    static PointGroup of(PointSet arena, List<Integer> members) {
        PointGroup group = new PointGroup(arena, members, null);
        group.recomputeCentroid();
        return group;
    }

    /** Empty group positioned at a seed; filled by the partitioner. */
    static PointGroup seeded(PointSet arena, GeoPoint seed) {
        return new PointGroup(arena, new ArrayList<>(), seed);
    }

    /** Singleton whose centroid is the point itself. */
    static PointGroup singleton(PointSet arena, int index) {
        List<Integer> members = new ArrayList<>(1);
        members.add(index);
        return new PointGroup(arena, members, SphericalCentroid.of(List.of(arena.get(index))));
    }

    public PointSet getArena() {
        return arena;
    }

    public GeoPoint getCentroid() {
        return centroid;
    }

    /** Arena indices of the members, in membership order. */
    public List<Integer> getMembers() {
        return Collections.unmodifiableList(members);
    }

    public List<GeoPoint> getPoints() {
        List<GeoPoint> points = new ArrayList<>(members.size());
        for (int index : members) {
            points.add(arena.get(index));
        }
        return points;
    }

    public GeoPoint pointAt(int position) {
        return arena.get(members.get(position));
    }

    public int size() {
        return members.size();
    }

    public boolean isEmpty() {
        return members.isEmpty();
    }

    void clear() {
        members.clear();
    }

    void add(int index) {
        members.add(index);
    }

    /**
     * Recomputes the centroid from the current members. An empty group keeps its
     * previous centroid, or gets the (0,0) sentinel if it never had one.
     */
    GeoPoint recomputeCentroid() {
        if (!members.isEmpty() || centroid == null) {
            centroid = SphericalCentroid.of(getPoints());
        }
        return centroid;
    }

    /** Moves the member at {@code position} into {@code target}; both centroids are refreshed. */
    void moveTo(int position, PointGroup target) {
        int index = members.remove(position);
        target.members.add(index);
        recomputeCentroid();
        target.recomputeCentroid();
    }

    /** New group with this group's members followed by {@code other}'s. */
    PointGroup mergedWith(PointGroup other) {
        List<Integer> combined = new ArrayList<>(members.size() + other.members.size());
        combined.addAll(members);
        combined.addAll(other.members);
        return of(arena, combined);
    }

    public static Comparator<PointGroup> byDistanceFrom(GeoPoint homeBase) {
        return Comparator.comparingDouble(group -> homeBase.distanceTo(group.getCentroid()));
    }
}
