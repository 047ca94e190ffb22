package com.streamfirst.ddns.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.streamfirst.ddns.domain.ContentRef;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class EnsContentHashDecoderTest {

  private static final String DIGEST =
      "29f2d17be6139079dc48696d1f582a8530eb9805b561eda517e22a892c7e3f1f";
  private static final String CID_V0 = "QmRAQB6YaCyidP37UdDnjFY5vQuiBrcqdyoW1CuDgwxkD4";

  private final EnsContentHashDecoder decoder = new EnsContentHashDecoder();

  @Test
  void decodesIpfsContentHashToCidV0() {
    String contentHash = "0xe3010170" + "1220" + DIGEST;

    assertThat(decoder.decode(ContentRef.of(contentHash))).isEqualTo(CID_V0);
  }

  @Test
  void treatsBareDigestAsSha256Multihash() {
    assertThat(decoder.decode(ContentRef.of("0x" + DIGEST))).isEqualTo(CID_V0);
  }

  @Test
  void encodesOtherCodecsAsBase32CidV1() {
    // raw codec (0x55) instead of dag-pb
    String contentHash = "0xe3010155" + "1220" + DIGEST;

    String locator = decoder.decode(ContentRef.of(contentHash));

    assertThat(locator).startsWith("bafkrei").doesNotContain("=");
    assertThat(locator).isEqualTo(locator.toLowerCase());
  }

  @Test
  void passesNonHexReferencesThrough() {
    assertThat(decoder.decode(ContentRef.of("  " + CID_V0 + " "))).isEqualTo(CID_V0);
  }

  @Test
  void rejectsIpnsAndUnknownNamespaces() {
    assertThatThrownBy(() -> decoder.decode(ContentRef.of("0xe5010172" + "1220" + DIGEST)))
        .isInstanceOf(ContentRefDecodingException.class)
        .hasMessageContaining("IPNS");
    assertThatThrownBy(() -> decoder.decode(ContentRef.of("0x01ab")))
        .isInstanceOf(ContentRefDecodingException.class)
        .hasMessageContaining("namespace");
  }

  @Test
  void rejectsMalformedInput() {
    assertThatThrownBy(() -> decoder.decode(ContentRef.of("0xzz")))
        .isInstanceOf(ContentRefDecodingException.class);
    assertThatThrownBy(() -> decoder.decode(ContentRef.of("0xe30101701220" + "abcd")))
        .isInstanceOf(ContentRefDecodingException.class)
        .hasMessageContaining("Truncated");
    assertThatThrownBy(() -> decoder.decode(ContentRef.NONE))
        .isInstanceOf(ContentRefDecodingException.class);
  }

  @Test
  void base58KeepsLeadingZeros() {
    assertThat(Base58.encode("Hello World!".getBytes(StandardCharsets.US_ASCII)))
        .isEqualTo("2NEpo7TZRRrLZSi2U");
    assertThat(Base58.encode(new byte[] {0, 0, 1})).isEqualTo("112");
  }
}
