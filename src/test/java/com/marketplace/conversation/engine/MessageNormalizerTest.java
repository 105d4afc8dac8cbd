package com.marketplace.conversation.engine;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MessageNormalizerTest {

    @Test
    void normalize_foldsCaseAccentsAndWhitespace() {
        assertThat(MessageNormalizer.normalize("  ¿Está   DISPONIBLE?\n Ñandú "))
                .isEqualTo("¿esta disponible? nandu");
    }

    @Test
    void normalize_nullAndBlank_becomeEmpty() {
        assertThat(MessageNormalizer.normalize(null)).isEmpty();
        assertThat(MessageNormalizer.normalize(" \t ")).isEmpty();
    }
}
