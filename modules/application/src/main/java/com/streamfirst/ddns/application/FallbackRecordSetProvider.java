package com.streamfirst.ddns.application;

import com.streamfirst.ddns.domain.ContentRef;
import com.streamfirst.ddns.domain.RecordSet;

/**
 * Supplies the record set written in place of one that could not be retrieved.
 */
@FunctionalInterface
public interface FallbackRecordSetProvider {

  RecordSet placeholderFor(ContentRef ref);
}
