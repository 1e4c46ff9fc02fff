package io.redisoperator.models;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A slot range whose owning master ordinal differs between two assignments.
 * {@code fromOrdinal} is -1 when the range had no owner before.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SlotMove {
    private int start;
    private int end;
    private int fromOrdinal;
    private int toOrdinal;

    @JsonIgnore
    public int size() {
        return end - start + 1;
    }
}
