package com.reliabledownloader.services;

import com.reliabledownloader.models.ByteRange;
import com.reliabledownloader.models.ServerCapabilities;
import com.reliabledownloader.models.TransferPlan;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TransferStrategyTest {

    private static ServerCapabilities capabilities(long length, boolean ranges) {
        return new ServerCapabilities(200, length, ranges, null);
    }

    private static List<ByteRange> ranges(TransferPlan plan) {
        List<ByteRange> ranges = new ArrayList<>();
        plan.forEach(ranges::add);
        return ranges;
    }

    @Test
    void selectsChunkedOnlyWithRangesAndKnownLength() {
        assertThat(TransferStrategy.select(capabilities(100, true))).isEqualTo(TransferStrategy.CHUNKED);
        assertThat(TransferStrategy.select(capabilities(100, false))).isEqualTo(TransferStrategy.FULL_STREAM);
        assertThat(TransferStrategy.select(capabilities(-1, true))).isEqualTo(TransferStrategy.FULL_STREAM);
        assertThat(TransferStrategy.select(capabilities(0, true))).isEqualTo(TransferStrategy.FULL_STREAM);
    }

    @Test
    void chunkedRangesAreContiguousAndClippedToLength() {
        TransferPlan plan = TransferStrategy.CHUNKED.plan(capabilities(10, true), 4);

        assertThat(plan.ranged()).isTrue();
        assertThat(plan.rangeCount()).isEqualTo(3);
        assertThat(ranges(plan)).containsExactly(
                new ByteRange(0, 3),
                new ByteRange(4, 7),
                new ByteRange(8, 9));
    }

    @Test
    void exactMultipleOfChunkSizeHasNoTrailingRange() {
        TransferPlan plan = TransferPlan.chunked(8, 4);

        assertThat(ranges(plan)).containsExactly(new ByteRange(0, 3), new ByteRange(4, 7));
        assertThat(plan.rangeCount()).isEqualTo(2);
    }

    @Test
    void chunkLargerThanResourceYieldsSingleRange() {
        TransferPlan plan = TransferPlan.chunked(3, Long.MAX_VALUE);

        assertThat(ranges(plan)).containsExactly(new ByteRange(0, 2));
    }

    @Test
    void fullStreamIsOneOpenEndedRange() {
        TransferPlan plan = TransferStrategy.FULL_STREAM.plan(capabilities(42, false), 4);

        assertThat(plan.ranged()).isFalse();
        assertThat(ranges(plan)).containsExactly(ByteRange.wholeStream());
        assertThat(plan.expectedLength(ByteRange.wholeStream())).isEqualTo(42);
        assertThat(TransferPlan.fullStream(-1).expectedLength(ByteRange.wholeStream())).isEqualTo(-1);
    }

    @Test
    void rangedPlanRequiresKnownLength() {
        assertThatThrownBy(() -> TransferPlan.chunked(-1, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TransferPlan.chunked(10, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
