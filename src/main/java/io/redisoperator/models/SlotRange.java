package io.redisoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Inclusive range of cluster hash slots.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotRange {
    private int start;
    private int end;

    @JsonIgnore
    public int size() {
        return end - start + 1;
    }

    public boolean contains(int slot) {
        return slot >= start && slot <= end;
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
