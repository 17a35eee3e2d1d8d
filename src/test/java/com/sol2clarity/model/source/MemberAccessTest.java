package com.sol2clarity.model.source;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class MemberAccessTest {

    @Test
    void testDottedChain() {
        MemberAccess sender = MemberAccess.of("msg", "sender");

        assertThat(sender.isSimpleName()).isFalse();
        assertThat(sender.getFirst()).isEqualTo("msg");
        assertThat(sender.getLast()).isEqualTo("sender");
        assertThat(sender.describe()).isEqualTo("msg.sender");
    }

    @Test
    void testSimpleName() {
        MemberAccess count = MemberAccess.of("count");

        assertThat(count.isSimpleName()).isTrue();
        assertThat(count.getFirst()).isEqualTo(count.getLast());
    }
}
