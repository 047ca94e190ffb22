package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.ContentRef;
import java.io.ByteArrayOutputStream;
import java.util.Arrays;
import java.util.Locale;
import org.bouncycastle.util.encoders.Base32;
import org.bouncycastle.util.encoders.DecoderException;
import org.bouncycastle.util.encoders.Hex;

/**
 * Decodes ENS-style content hashes into IPFS locators.
 *
 * <p>Understood forms:
 *
 * <ul>
 *   <li>{@code 0xe301...}: the {@code ipfs-ns} namespace followed by a binary CID. dag-pb content
 *       hashed with sha2-256 becomes a CIDv0 ({@code Qm...}); anything else a base32 CIDv1
 *       ({@code b...}).
 *   <li>a bare 32-byte hex value: a sha2-256 digest of dag-pb content, the pre-multicodec
 *       convention, returned as CIDv0.
 *   <li>anything not starting with {@code 0x}: already a locator, returned trimmed.
 * </ul>
 */
public class EnsContentHashDecoder implements ContentRefDecoder {

  private static final int IPFS_NS = 0xe3;
  private static final int IPNS_NS = 0xe5;
  private static final int DAG_PB = 0x70;
  private static final int SHA2_256 = 0x12;
  private static final int SHA2_256_LENGTH = 32;

  @Override
  public String decode(ContentRef ref) {
    if (ref.isEmpty()) {
      throw new ContentRefDecodingException("Cannot decode an empty content reference");
    }
    String raw = ref.value().trim();
    if (!raw.startsWith("0x")) {
      return raw;
    }

    byte[] bytes;
    try {
      bytes = Hex.decode(raw.substring(2));
    } catch (DecoderException e) {
      throw new ContentRefDecodingException("Content reference is not valid hex: " + raw, e);
    }

    if (bytes.length == SHA2_256_LENGTH && (bytes[0] & 0xFF) != IPFS_NS) {
      return cidV0(Arrays.copyOf(bytes, bytes.length));
    }

    Reader reader = new Reader(bytes, raw);
    int namespace = reader.varint();
    if (namespace == IPNS_NS) {
      throw new ContentRefDecodingException("IPNS content references are not supported: " + raw);
    }
    if (namespace != IPFS_NS) {
      throw new ContentRefDecodingException(
          String.format("Unsupported content namespace 0x%x in %s", namespace, raw));
    }

    int cidStart = reader.position();
    int version = reader.varint();
    if (version != 1) {
      throw new ContentRefDecodingException("Unsupported CID version " + version + " in " + raw);
    }
    int codec = reader.varint();
    int hashFunction = reader.varint();
    int digestLength = reader.varint();
    byte[] digest = reader.bytes(digestLength);
    if (reader.remaining() != 0) {
      throw new ContentRefDecodingException("Trailing bytes after multihash in " + raw);
    }

    if (codec == DAG_PB && hashFunction == SHA2_256 && digestLength == SHA2_256_LENGTH) {
      return cidV0(digest);
    }
    byte[] cid = Arrays.copyOfRange(bytes, cidStart, bytes.length);
    return "b" + Base32.toBase32String(cid).replace("=", "").toLowerCase(Locale.ROOT);
  }

  private static String cidV0(byte[] sha256Digest) {
    byte[] multihash = new byte[sha256Digest.length + 2];
    multihash[0] = (byte) SHA2_256;
    multihash[1] = (byte) SHA2_256_LENGTH;
    System.arraycopy(sha256Digest, 0, multihash, 2, sha256Digest.length);
    return Base58.encode(multihash);
  }

  /** Sequential reader over unsigned varints and raw bytes. */
  private static final class Reader {
    private final byte[] bytes;
    private final String source;
    private int position;

    Reader(byte[] bytes, String source) {
      this.bytes = bytes;
      this.source = source;
    }

    int position() {
      return position;
    }

    int remaining() {
      return bytes.length - position;
    }

    int varint() {
      int value = 0;
      int shift = 0;
      while (true) {
        if (position >= bytes.length) {
          throw new ContentRefDecodingException("Truncated varint in " + source);
        }
        int b = bytes[position++] & 0xFF;
        value |= (b & 0x7F) << shift;
        if ((b & 0x80) == 0) {
          return value;
        }
        shift += 7;
        if (shift > 28) {
          throw new ContentRefDecodingException("Varint too long in " + source);
        }
      }
    }

    byte[] bytes(int length) {
      if (length < 0 || length > remaining()) {
        throw new ContentRefDecodingException("Truncated multihash in " + source);
      }
      ByteArrayOutputStream out = new ByteArrayOutputStream(length);
      out.write(bytes, position, length);
      position += length;
      return out.toByteArray();
    }
  }
}
