package dbft.common.util;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class HexTest {

    @Test
    void encodesLowercase() {
        assertThat(Hex.toHex(new byte[] {0x00, 0x0f, (byte) 0xab, (byte) 0xff})).isEqualTo("000fabff");
        assertThat(Hex.toHex(null)).isEmpty();
    }

    @Test
    void decodesWithOrWithoutPrefix() {
        assertThat(Hex.fromHex("0x0FaB")).containsExactly(0x0f, 0xab);
        assertThat(Hex.fromHex("  0fab ")).containsExactly(0x0f, 0xab);
        assertThat(Hex.fromHex(null)).isEmpty();
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> Hex.fromHex("abc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Hex.fromHex("zz")).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("position 0");
    }

    @Test
    void shortHexTruncates() {
        byte[] data = new byte[] {1, 2, 3, 4};
        assertThat(Hex.shortHex(data, 4)).isEqualTo("0102..");
        assertThat(Hex.shortHex(data, 8)).isEqualTo("01020304");
    }
}
