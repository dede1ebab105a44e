package com.cinderkv.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class BinaryKeyTest {

    @Test
    void equalContent_isEqualAndHashesAlike() {
        BinaryKey a = new BinaryKey(new byte[]{1, 2, 3});
        BinaryKey b = new BinaryKey(new byte[]{1, 2, 3});

        assertThat(a).isEqualTo(b);
        assertThat(a.hashCode()).isEqualTo(b.hashCode());
        assertThat(a).isNotEqualTo(new BinaryKey(new byte[]{1, 2}));
    }

    @Test
    void constructor_copiesInput() {
        byte[] bytes = {1, 2, 3};
        BinaryKey key = new BinaryKey(bytes);
        bytes[0] = 9;

        assertThat(key.getBytes()).containsExactly(1, 2, 3);
        assertThat(key.length()).isEqualTo(3);
    }

    @Test
    void of_usesUtf8() {
        assertThat(BinaryKey.of("héllo").length()).isEqualTo(6);
        assertThat(BinaryKey.of("héllo").toString()).isEqualTo("héllo");
    }

    @Test
    void nullKey_throws() {
        assertThatThrownBy(() -> new BinaryKey(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
