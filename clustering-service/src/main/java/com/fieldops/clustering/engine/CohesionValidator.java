package com.fieldops.clustering.engine;

import com.fieldops.shared.util.GeoUtil;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Geometric sanity pass over a set of groups. k-means only minimises spread, so
 * it can still hand back a group whose points sit on opposite sides of the home
 * base, which makes a one-way daily loop impossible. Two checks, in order:
 *
 *   1. stretched. The farthest point is more than {@link #STRETCH_RATIO} times the
 *      mean distance from the centroid. Split into the closer and farther half.
 *   2. wide fan. The bearings from the home base span more than
 *      {@link #MAX_BEARING_SPAN} degrees. Split into the points within
 *      {@link #SAME_SIDE_ANGLE} degrees of the middle bearing and the rest.
 *
 * A split group is replaced in place by its halves, first half first. Single pass,
 * no recursion: a valid set comes back unchanged.
 */
@Slf4j
public class CohesionValidator {

    static final double STRETCH_RATIO = 3.0;
    static final double MAX_BEARING_SPAN = 100.0;
    static final double SAME_SIDE_ANGLE = 90.0;

    public List<PointGroup> validate(List<PointGroup> groups, GeoPoint homeBase) {
        List<PointGroup> validated = new ArrayList<>(groups.size());

        for (PointGroup group : groups) {
            if (group.size() <= 1) {
                validated.add(group);
                continue;
            }

            List<PointGroup> stretchedHalves = splitIfStretched(group);
            if (stretchedHalves != null) {
                validated.addAll(stretchedHalves);
                continue;
            }

            List<PointGroup> bearingHalves = splitIfWideFan(group, homeBase);
            if (bearingHalves != null) {
                validated.addAll(bearingHalves);
            } else {
                validated.add(group);
            }
        }

        if (validated.size() != groups.size()) {
            log.debug("Cohesion check split {} groups into {}", groups.size(), validated.size());
        }
        return validated;
    }

    /**
     * True when {@code group} would come back from {@link #validate} untouched:
     * neither stretched nor fanned out around the home base.
     */
    public boolean isCohesive(PointGroup group, GeoPoint homeBase) {
        if (group.size() <= 1) {
            return true;
        }
        return !isStretched(rankByDistance(group)) && bearingSpan(rankByBearing(group, homeBase)) <= MAX_BEARING_SPAN;
    }

    private List<PointGroup> splitIfStretched(PointGroup group) {
        List<Ranked> byDistance = rankByDistance(group);
        if (!isStretched(byDistance)) {
            return null;
        }

        double max = byDistance.get(byDistance.size() - 1).getValue();
        double mean = meanOf(byDistance);
        int median = byDistance.size() / 2;
        List<Integer> close = new ArrayList<>();
        List<Integer> far = new ArrayList<>();
        for (int i = 0; i < byDistance.size(); i++) {
            (i < median ? close : far).add(byDistance.get(i).getIndex());
        }

        log.debug("Splitting stretched group of {} (max {} mi vs mean {} mi)", byDistance.size(), max, mean);
        return halves(group.getArena(), close, far);
    }

    private List<PointGroup> splitIfWideFan(PointGroup group, GeoPoint homeBase) {
        List<Ranked> byBearing = rankByBearing(group, homeBase);
        double span = bearingSpan(byBearing);
        if (span <= MAX_BEARING_SPAN) {
            return null;
        }

        double first = byBearing.get(0).getValue();
        double last = byBearing.get(byBearing.size() - 1).getValue();
        double midBearing = (first + last) / 2;
        List<Integer> near = new ArrayList<>();
        List<Integer> opposite = new ArrayList<>();
        for (Ranked ranked : byBearing) {
            if (GeoUtil.angularDifference(ranked.getValue(), midBearing) < SAME_SIDE_ANGLE) {
                near.add(ranked.getIndex());
            } else {
                opposite.add(ranked.getIndex());
            }
        }

        log.debug("Splitting group of {} spanning {}° from home base ({} / {})",
                byBearing.size(), span, near.size(), opposite.size());
        return halves(group.getArena(), near, opposite);
    }

    /** Members ranked by distance from the group centroid, nearest first. */
    private static List<Ranked> rankByDistance(PointGroup group) {
        List<Integer> members = group.getMembers();
        List<Ranked> byDistance = new ArrayList<>(members.size());
        for (int position = 0; position < members.size(); position++) {
            byDistance.add(new Ranked(members.get(position), group.pointAt(position).distanceTo(group.getCentroid())));
        }
        byDistance.sort(Comparator.comparingDouble(Ranked::getValue));
        return byDistance;
    }

    /** Members ranked by bearing from the home base. */
    private static List<Ranked> rankByBearing(PointGroup group, GeoPoint homeBase) {
        List<Integer> members = group.getMembers();
        List<Ranked> byBearing = new ArrayList<>(members.size());
        for (int position = 0; position < members.size(); position++) {
            byBearing.add(new Ranked(members.get(position), homeBase.bearingTo(group.pointAt(position))));
        }
        byBearing.sort(Comparator.comparingDouble(Ranked::getValue));
        return byBearing;
    }

    private static boolean isStretched(List<Ranked> byDistance) {
        double max = byDistance.get(byDistance.size() - 1).getValue();
        return max > meanOf(byDistance) * STRETCH_RATIO;
    }

    private static double meanOf(List<Ranked> ranked) {
        double sum = 0.0;
        for (Ranked r : ranked) {
            sum += r.getValue();
        }
        return sum / ranked.size();
    }

    /** Spread of the sorted bearings, measured the short way round. */
    private static double bearingSpan(List<Ranked> byBearing) {
        double rawSpan = byBearing.get(byBearing.size() - 1).getValue() - byBearing.get(0).getValue();
        return Math.min(rawSpan, 360.0 - rawSpan);
    }

    private static List<PointGroup> halves(PointSet arena, List<Integer> first, List<Integer> second) {
        List<PointGroup> out = new ArrayList<>(2);
        if (!first.isEmpty()) {
            out.add(arena.group(first));
        }
        if (!second.isEmpty()) {
            out.add(arena.group(second));
        }
        return out;
    }

    @Value
    private static class Ranked {
        int index;
        double value;
    }
}
