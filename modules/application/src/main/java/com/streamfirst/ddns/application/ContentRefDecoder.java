package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.ContentRef;

/**
 * Turns the ledger's encoding of a content reference into a content-store locator. Kept behind
 * an interface so changes to the on-chain format stay out of the engines.
 */
@FunctionalInterface
public interface ContentRefDecoder {

  /**
   * @param ref a non-empty content reference
   * @return the locator to fetch from the content store
   * @throws ContentRefDecodingException if the reference cannot be decoded
   */
  String decode(ContentRef ref);
}
