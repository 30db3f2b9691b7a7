package com.example.bugstream.stream.service;

import com.example.bugstream.shared.util.Constants.OverflowPolicy;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BoundedEventQueueTest {

    @Test
    void drainsInArrivalOrder() {
        BoundedEventQueue<String> queue = new BoundedEventQueue<>("test", 10, OverflowPolicy.DROP_OLDEST, 10);
        queue.offer("a");
        queue.offer("b");
        queue.offer("c");

        assertThat(queue.drain(2)).containsExactly("a", "b");
        assertThat(queue.drain(5)).containsExactly("c");
        assertThat(queue.drain(5)).isEmpty();
    }

    @Test
    void dropOldestKeepsNewestEvents() {
        BoundedEventQueue<Integer> queue = new BoundedEventQueue<>("test", 3, OverflowPolicy.DROP_OLDEST, 3);
        for (int i = 1; i <= 5; i++) {
            assertThat(queue.offer(i)).isTrue();
        }

        assertThat(queue.size()).isEqualTo(3);
        assertThat(queue.droppedCount()).isEqualTo(2);
        assertThat(queue.drain(10)).containsExactly(3, 4, 5);
    }

    @Test
    void rejectNewKeepsOldestEvents() {
        BoundedEventQueue<Integer> queue = new BoundedEventQueue<>("test", 2, OverflowPolicy.REJECT_NEW, 2);

        assertThat(queue.offer(1)).isTrue();
        assertThat(queue.offer(2)).isTrue();
        assertThat(queue.offer(3)).isFalse();

        assertThat(queue.droppedCount()).isEqualTo(1);
        assertThat(queue.drain(10)).containsExactly(1, 2);
    }

    @Test
    void backlogFlagFollowsDepthThreshold() {
        BoundedEventQueue<Integer> queue = new BoundedEventQueue<>("test", 10, OverflowPolicy.DROP_OLDEST, 3);
        queue.offer(1);
        queue.offer(2);
        assertThat(queue.isBacklogged()).isFalse();

        queue.offer(3);
        assertThat(queue.isBacklogged()).isTrue();

        queue.drain(1);
        assertThat(queue.isBacklogged()).isFalse();
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new BoundedEventQueue<String>("test", 0, OverflowPolicy.DROP_OLDEST, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
