package io.redisoperator.models;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Master ordinal to slot range mapping. Index {@code i} of {@link #getRanges()} is owned by ordinal {@code i}.
 */
@EqualsAndHashCode
@ToString
public final class SlotAssignment {

    private final List<SlotRange> ranges;

    public SlotAssignment(List<SlotRange> ranges) {
        List<SlotRange> copy = new ArrayList<>(ranges.size());
        for (SlotRange range : ranges) {
            copy.add(new SlotRange(range.getStart(), range.getEnd()));
        }
        this.ranges = Collections.unmodifiableList(copy);
    }

    public List<SlotRange> getRanges() {
        return ranges;
    }

    public int getMasters() {
        return ranges.size();
    }

    public SlotRange rangeFor(int ordinal) {
        return ranges.get(ordinal);
    }

    /**
     * @return the owning ordinal of {@code slot}, or -1 when no range covers it
     */
    public int ownerOf(int slot) {
        for (int i = 0; i < ranges.size(); i++) {
            if (ranges.get(i).contains(slot)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Renders one "ordinal start-end" line per master, as mounted into the cluster config map.
     */
    public String render() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < ranges.size(); i++) {
            sb.append(i).append(' ').append(ranges.get(i)).append('\n');
        }
        return sb.toString();
    }
}
