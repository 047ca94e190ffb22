package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.DomainKey;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import org.bouncycastle.jcajce.provider.digest.Keccak;
import org.bouncycastle.util.encoders.Hex;

/** Derives ledger keys from domain names: Keccak-256 over the UTF-8 bytes of the name. */
public final class DomainKeys {

  private DomainKeys() {}

  public static DomainKey keyOf(String domainName) {
    Objects.requireNonNull(domainName, "Domain name cannot be null");
    byte[] hash = new Keccak.Digest256().digest(domainName.getBytes(StandardCharsets.UTF_8));
    return DomainKey.of("0x" + Hex.toHexString(hash));
  }
}
