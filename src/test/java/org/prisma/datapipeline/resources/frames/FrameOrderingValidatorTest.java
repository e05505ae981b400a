package org.prisma.datapipeline.resources.frames;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.prisma.datapipeline.api.frames.FrameDescriptor;
import org.prisma.datapipeline.api.frames.FrameFormat;

@Tag("unit")
class FrameOrderingValidatorTest {

    @Test
    void nonDecreasingTimestampsVerifyOrder() {
        FrameOrderingValidator.Result result = FrameOrderingValidator.validate(List.of(
            frame(0, 1_000L), frame(1, 1_000L), frame(4, 2_000L)));

        assertThat(result.verified()).isTrue();
        assertThat(result.disagreements()).isZero();
    }

    @Test
    void missingTimestampLeavesOrderUnverified() {
        FrameOrderingValidator.Result result = FrameOrderingValidator.validate(List.of(
            frame(0, 1_000L), frame(1, null), frame(2, 3_000L)));

        assertThat(result.verified()).isFalse();
        assertThat(result.disagreements()).isZero();
    }

    @Test
    void decreasingTimestampsAreCountedNotFatal() {
        FrameOrderingValidator.Result result = FrameOrderingValidator.validate(List.of(
            frame(0, 5_000L), frame(1, 4_000L), frame(2, 6_000L), frame(3, 1_000L)));

        assertThat(result.verified()).isFalse();
        assertThat(result.disagreements()).isEqualTo(2);
    }

    @Test
    void emptySequenceIsUnverified() {
        assertThat(FrameOrderingValidator.validate(List.of()).verified()).isFalse();
    }

    @Test
    void repeatedIndexIsRejected() {
        assertThatThrownBy(() -> FrameOrderingValidator.validate(List.of(frame(3, null), frame(3, null))))
            .isInstanceOf(IllegalStateException.class);
    }

    private static FrameDescriptor frame(int index, Long timestamp) {
        return new FrameDescriptor(index, "/data/frames.ge2", index, FrameFormat.GE_RAW, timestamp);
    }
}
