package io.fullerstack.signals;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DispatchResultTest {

    @Test
    void testValues_CopiedAndUnmodifiable() {
        List<String> source = new ArrayList<>(Arrays.asList("a", null));
        DispatchResult<String> result = DispatchResult.complete(source);
        source.add("late");

        assertThat(result.values()).containsExactly("a", null);
        assertThatThrownBy(() -> result.values().add("x")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void testHalted_RequiresHalter() {
        assertThatThrownBy(() -> new DispatchResult<String>(DispatchResult.Status.HALTED, List.of(), null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("haltedBy");
    }

    @Test
    void testCompleted_RejectsHalter() {
        Slot<String> slot = new Signal<String>("result").add(sender -> "x");

        assertThatThrownBy(() -> new DispatchResult<>(DispatchResult.Status.COMPLETED, List.of(), slot))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testHalt_ExposesHalter() {
        Slot<String> slot = new Signal<String>("result").add(sender -> "x");

        DispatchResult<String> result = DispatchResult.halt(List.of("a"), slot);

        assertThat(result.completed()).isFalse();
        assertThat(result.halter()).containsSame(slot);
        assertThat(result.invoked()).isEqualTo(1);
    }
}
