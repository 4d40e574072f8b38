package com.masterbias.service;

import com.masterbias.model.FileDescriptor;
import com.masterbias.model.SizeKey;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Splits a heterogeneous selection into groups that can each be combined into one master:
 * first by exact size key, then by temperature within each size group.
 */
public class FrameGrouper {

    private final ToleranceComparator comparator;

    public FrameGrouper() {
        this(ToleranceComparator.RELATIVE);
    }

    public FrameGrouper(ToleranceComparator comparator) {
        this.comparator = comparator;
    }

    /**
     * One bucket per distinct (width, height, binning), in ascending key order. Members keep
     * their input order. When not grouping, a single bucket with everything.
     */
    public List<List<FileDescriptor>> groupBySize(List<FileDescriptor> descriptors, boolean enabled) {
        if (descriptors.isEmpty()) return new ArrayList<>();
        if (!enabled) return singleGroup(descriptors);

        Map<SizeKey, List<FileDescriptor>> buckets = new TreeMap<>();
        for (FileDescriptor d : descriptors) {
            buckets.computeIfAbsent(d.sizeKey(), k -> new ArrayList<>()).add(d);
        }
        return new ArrayList<>(buckets.values());
    }

    /**
     * Chain clustering over the temperature-sorted list. Each candidate is compared with the
     * last accepted member, not with the first one, so a slow drift can stretch a cluster
     * past the tolerance measured from its start.
     */
    public List<List<FileDescriptor>> groupByTemperature(List<FileDescriptor> descriptors,
                                                         boolean enabled, double tolerance) {
        if (descriptors.isEmpty()) return new ArrayList<>();
        if (!enabled) return singleGroup(descriptors);

        List<FileDescriptor> sorted = new ArrayList<>(descriptors);
        sorted.sort(Comparator.comparingDouble(FileDescriptor::temperature));

        List<List<FileDescriptor>> result = new ArrayList<>();
        List<FileDescriptor> current = new ArrayList<>();
        double anchor = sorted.get(0).temperature();
        for (FileDescriptor d : sorted) {
            double t = d.temperature();
            if (!comparator.same(anchor, t, tolerance)) {
                result.add(current);
                current = new ArrayList<>();
            }
            current.add(d);
            anchor = t;
        }
        result.add(current);
        return result;
    }

    public static boolean meetsMinimum(List<FileDescriptor> group, int minimumGroupSize) {
        return group.size() >= minimumGroupSize;
    }

    private static List<List<FileDescriptor>> singleGroup(List<FileDescriptor> descriptors) {
        List<List<FileDescriptor>> result = new ArrayList<>();
        result.add(new ArrayList<>(descriptors));
        return result;
    }
}
