package io.redisoperator.allocation;

import io.redisoperator.models.SlotAssignment;
import io.redisoperator.models.SlotMove;
import io.redisoperator.models.SlotRange;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

import static io.redisoperator.config.Constants.CLUSTER_SLOTS;

/**
 * Partitions the 16384 cluster hash slots across masters.
 * <p>
 * Each master gets {@code 16384 / masters} slots; the first {@code 16384 % masters}
 * ordinals get one more. Ranges are contiguous and ascending, so the assignment
 * depends only on the master count.
 */
public class SlotAllocator {

    public SlotAssignment allocate(int masters) {
        if (masters < 1) {
            throw new IllegalArgumentException("masters must be at least 1, got " + masters);
        }
        if (masters > CLUSTER_SLOTS) {
            throw new IllegalArgumentException("masters must not exceed " + CLUSTER_SLOTS + ", got " + masters);
        }
        int base = CLUSTER_SLOTS / masters;
        int remainder = CLUSTER_SLOTS % masters;
        List<SlotRange> ranges = new ArrayList<>(masters);
        int start = 0;
        for (int ordinal = 0; ordinal < masters; ordinal++) {
            int size = ordinal < remainder ? base + 1 : base;
            ranges.add(new SlotRange(start, start + size - 1));
            start += size;
        }
        return new SlotAssignment(ranges);
    }

    /**
     * Computes the slot ranges whose owner differs between {@code previous} and {@code next}.
     * Adjacent slots with the same (from, to) pair are merged into one move.
     */
    public List<SlotMove> diff(SlotAssignment previous, SlotAssignment next) {
        List<SlotMove> moves = new ArrayList<>();
        if (previous == null || previous.equals(next)) {
            return moves;
        }
        // Segment boundaries: every range start of either assignment, plus the end sentinel
        TreeSet<Integer> boundaries = new TreeSet<>();
        boundaries.add(0);
        boundaries.add(CLUSTER_SLOTS);
        for (SlotRange range : previous.getRanges()) {
            boundaries.add(range.getStart());
            boundaries.add(range.getEnd() + 1);
        }
        for (SlotRange range : next.getRanges()) {
            boundaries.add(range.getStart());
            boundaries.add(range.getEnd() + 1);
        }

        SlotMove current = null;
        Integer segmentStart = null;
        for (int boundary : boundaries) {
            if (segmentStart != null && segmentStart < CLUSTER_SLOTS) {
                int segmentEnd = boundary - 1;
                int from = previous.ownerOf(segmentStart);
                int to = next.ownerOf(segmentStart);
                if (from != to) {
                    if (current != null && current.getEnd() + 1 == segmentStart
                            && current.getFromOrdinal() == from && current.getToOrdinal() == to) {
                        current.setEnd(segmentEnd);
                    } else {
                        current = new SlotMove(segmentStart, segmentEnd, from, to);
                        moves.add(current);
                    }
                }
            }
            segmentStart = boundary;
        }
        return moves;
    }

    /**
     * Rebuilds an assignment from the ranges stored in status; null when nothing was stored.
     */
    public SlotAssignment fromStored(List<SlotRange> stored) {
        if (stored == null || stored.isEmpty()) {
            return null;
        }
        return new SlotAssignment(stored);
    }
}
