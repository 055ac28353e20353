package io.catena.core.checkpoint;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.catena.core.exception.ValidationException;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CheckpointKeyTest {

    private static final String HEX = "00112233445566778899aabbccddeeff".repeat(2);

    @Test
    void shouldParseHexKey() {
        var key = CheckpointKey.fromHex(HEX);

        assertThat(key.secretKey().getEncoded()).hasSize(32);
        assertThat(key.secretKey().getAlgorithm()).isEqualTo("AES");
    }

    @Test
    void shouldRejectWrongLength() {
        assertThatThrownBy(() -> CheckpointKey.fromHex("abcd"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("64 hex characters");
    }

    @Test
    void shouldRejectNonHexCharacters() {
        assertThatThrownBy(() -> CheckpointKey.fromHex("zz".repeat(32)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("hex-encoded");
    }

    @Test
    void shouldReadKeyFromEnvironment() {
        assertThat(CheckpointKey.fromEnvironment(Map.of(CheckpointKey.ENV_VARIABLE, HEX)))
                .isPresent();
        assertThat(CheckpointKey.fromEnvironment(Map.of(CheckpointKey.ENV_VARIABLE, " ")))
                .isEmpty();
        assertThat(CheckpointKey.fromEnvironment(Map.of())).isEmpty();
    }

    @Test
    void shouldNotRevealKeyMaterial() {
        assertThat(CheckpointKey.fromHex(HEX).toString()).doesNotContain("0011");
    }
}
