package io.redisoperator.allocation;

import io.redisoperator.models.SlotAssignment;
import io.redisoperator.models.SlotMove;
import io.redisoperator.models.SlotRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SlotAllocatorTest {

    private final SlotAllocator allocator = new SlotAllocator();

    @Test
    void testAllocate_ThreeMasters() {
        SlotAssignment assignment = allocator.allocate(3);

        assertThat(assignment.getRanges()).containsExactly(
                new SlotRange(0, 5461),
                new SlotRange(5462, 10922),
                new SlotRange(10923, 16383));
        assertThat(assignment.getRanges()).extracting(SlotRange::size).containsExactly(5462, 5461, 5461);
    }

    @Test
    void testAllocate_SingleMasterOwnsEverything() {
        SlotAssignment assignment = allocator.allocate(1);

        assertThat(assignment.getRanges()).containsExactly(new SlotRange(0, 16383));
    }

    @ParameterizedTest
    @ValueSource(ints = {1, 2, 3, 5, 7, 10, 100, 1000, 16383, 16384})
    void testAllocate_PartitionsAllSlots(int masters) {
        SlotAssignment assignment = allocator.allocate(masters);
        List<SlotRange> ranges = assignment.getRanges();

        assertThat(ranges).hasSize(masters);
        assertThat(ranges.get(0).getStart()).isZero();
        assertThat(ranges.get(masters - 1).getEnd()).isEqualTo(16383);
        for (int i = 1; i < ranges.size(); i++) {
            assertThat(ranges.get(i).getStart()).isEqualTo(ranges.get(i - 1).getEnd() + 1);
        }
        int min = ranges.stream().mapToInt(SlotRange::size).min().orElseThrow();
        int max = ranges.stream().mapToInt(SlotRange::size).max().orElseThrow();
        assertThat(max - min).isLessThanOrEqualTo(1);
    }

    @Test
    void testAllocate_IsDeterministic() {
        assertThat(allocator.allocate(6)).isEqualTo(allocator.allocate(6));
    }

    @Test
    void testAllocate_RejectsOutOfRangeMasterCounts() {
        assertThatThrownBy(() -> allocator.allocate(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> allocator.allocate(16385)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testDiff_NoPreviousAssignment() {
        assertThat(allocator.diff(null, allocator.allocate(3))).isEmpty();
    }

    @Test
    void testDiff_UnchangedAssignment() {
        assertThat(allocator.diff(allocator.allocate(3), allocator.allocate(3))).isEmpty();
    }

    @Test
    void testDiff_ScaleOutFromTwoToThree() {
        // 2 masters: [0,8191] [8192,16383]; 3 masters: [0,5461] [5462,10922] [10923,16383]
        List<SlotMove> moves = allocator.diff(allocator.allocate(2), allocator.allocate(3));

        assertThat(moves).containsExactly(
                new SlotMove(5462, 8191, 0, 1),
                new SlotMove(10923, 16383, 1, 2));
    }

    @Test
    void testDiff_ScaleInFromThreeToTwo() {
        List<SlotMove> moves = allocator.diff(allocator.allocate(3), allocator.allocate(2));

        assertThat(moves).containsExactly(
                new SlotMove(5462, 8191, 1, 0),
                new SlotMove(10923, 16383, 2, 1));
        assertThat(moves.stream().mapToInt(SlotMove::size).sum()).isEqualTo(2730 + 5461);
    }

    @Test
    void testFromStored() {
        assertThat(allocator.fromStored(null)).isNull();
        assertThat(allocator.fromStored(List.of())).isNull();
        assertThat(allocator.fromStored(allocator.allocate(4).getRanges())).isEqualTo(allocator.allocate(4));
    }
}
