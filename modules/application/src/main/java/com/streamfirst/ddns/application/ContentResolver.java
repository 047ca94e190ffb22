package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.ContentRef;
import com.streamfirst.ddns.domain.RecordSet;
import com.streamfirst.ddns.ports.ContentStoreException;
import com.streamfirst.ddns.ports.ContentStorePort;
import com.streamfirst.ddns.ports.RecordSetFormatException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Fetches the record set behind a content reference: decodes the reference into a content-store
 * locator, then fetches the document.
 */
@Slf4j
@RequiredArgsConstructor
public class ContentResolver {

  private final ContentStorePort contentStore;
  private final ContentRefDecoder decoder;
  private final FallbackRecordSetProvider fallback;

  /**
   * Resolves a reference strictly.
   *
   * @throws ContentRefDecodingException if the reference cannot be decoded
   * @throws ContentStoreException if the store fails or holds nothing under the locator
   * @throws RecordSetFormatException if the stored document is malformed
   */
  public RecordSet resolve(ContentRef ref) {
    if (ref.isEmpty()) {
      throw new ContentStoreException("No content reference to resolve");
    }
    String locator = decoder.decode(ref);
    log.debug("Fetching content {} for reference {}", locator, ref);
    return contentStore
        .fetch(locator)
        .orElseThrow(() -> new ContentStoreException("No record set stored under " + locator));
  }

  /**
   * Resolves a reference, substituting a placeholder record set when decoding or fetching fails.
   * The placeholder is marked unreliable.
   */
  public RecordSet resolveOrFallback(ContentRef ref) {
    try {
      return resolve(ref);
    } catch (ContentRefDecodingException | ContentStoreException | RecordSetFormatException e) {
      log.warn("Error retrieving records for {}, using placeholder record set: {}", ref, e.getMessage());
      return fallback.placeholderFor(ref).toBuilder().reliable(false).build();
    }
  }
}
