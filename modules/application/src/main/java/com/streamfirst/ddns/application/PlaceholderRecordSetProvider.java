package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.ContentRef;
import com.streamfirst.ddns.domain.RecordSet;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

/**
 * Deterministic placeholder records derived from the content reference, so the same unreadable
 * reference always yields the same records. The result is marked unreliable.
 */
@RequiredArgsConstructor
public class PlaceholderRecordSetProvider implements FallbackRecordSetProvider {

  private final Clock clock;

  @Override
  public RecordSet placeholderFor(ContentRef ref) {
    byte[] seed = new Keccak.Digest256().digest(ref.value().getBytes(StandardCharsets.UTF_8));
    String tag = Hex.toHexString(seed, 0, 4);
    int host = (int) (Long.parseLong(tag, 16) % 255);
    String domain = "example-" + tag + ".eth";

    return RecordSet.builder()
        .domain(domain)
        .record("A", List.of("192.168.1." + host))
        .record("AAAA", List.of("2001:db8::" + host))
        .record("TXT", List.of("Placeholder record for content " + tag))
        .record("MX", List.of(mx(10, "mail1." + domain), mx(20, "mail2." + domain)))
        .ttl(3600)
        .timestamp(clock.instant())
        .reliable(false)
        .build();
  }

  // canonical form: compact, keys sorted
  private static String mx(int preference, String exchange) {
    return "{\"exchange\":\"" + exchange + "\",\"preference\":" + preference + "}";
  }
}
