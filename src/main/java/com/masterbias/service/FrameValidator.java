package com.masterbias.service;

import com.masterbias.model.FileDescriptor;
import com.masterbias.model.FrameType;
import com.masterbias.model.SizeKey;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Predicates deciding whether a selection of frames may be combined. None of them throw;
 * the caller picks the failure to raise. Empty and single-element lists always pass.
 */
public final class FrameValidator {

    private FrameValidator() {
    }

    // Mismas dimensiones x,y y mismo binning
    public static boolean compatibleSizes(List<FileDescriptor> descriptors) {
        if (descriptors.isEmpty()) return true;
        SizeKey reference = descriptors.get(0).sizeKey();
        for (FileDescriptor d : descriptors) {
            if (!d.sizeKey().equals(reference)) return false;
        }
        return true;
    }

    public static boolean allOfType(List<FileDescriptor> descriptors, FrameType type) {
        for (FileDescriptor d : descriptors) {
            if (d.type() != type) return false;
        }
        return true;
    }

    public static boolean allSameFilter(List<FileDescriptor> descriptors) {
        if (descriptors.isEmpty()) return true;
        String filter = descriptors.get(0).filterName();
        for (FileDescriptor d : descriptors) {
            if (!d.filterName().equals(filter)) return false;
        }
        return true;
    }

    /** Most frequent filter label; ties go to the one seen first. Empty list gives "". */
    public static String mostCommonFilterName(List<FileDescriptor> descriptors) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (FileDescriptor d : descriptors) counts.merge(d.filterName(), 1, Integer::sum);
        String best = "";
        int bestCount = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }
}
