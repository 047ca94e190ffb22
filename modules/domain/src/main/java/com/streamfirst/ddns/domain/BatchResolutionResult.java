package com.streamfirst.ddns.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Answer to a multi-type query against one domain. {@code values} and {@code ttls} line up with
 * {@code types}; a type without a value has a null value and a zero ttl.
 */
@Value
@Builder(toBuilder = true)
public class BatchResolutionResult {
    @NonNull List<String> types;
    @NonNull List<String> values;
    @NonNull List<Integer> ttls;
    @NonNull ResolutionSource source;
    @NonNull @Builder.Default ContentRef contentRef = ContentRef.NONE;
    String error;
    boolean consistencyWarning;
    @NonNull @Builder.Default Duration latency = Duration.ZERO;

    /** Result with no value for any of {@code types}. */
    public static BatchResolutionResult empty(List<String> types, ResolutionSource source) {
        List<String> values = new ArrayList<>(Collections.nCopies(types.size(), (String) null));
        List<Integer> ttls = new ArrayList<>(Collections.nCopies(types.size(), 0));
        return BatchResolutionResult.builder()
                .types(List.copyOf(types))
                .values(Collections.unmodifiableList(values))
                .ttls(Collections.unmodifiableList(ttls))
                .source(source)
                .build();
    }

    public static BatchResolutionResult failure(List<String> types, String error) {
        return empty(types, ResolutionSource.ERROR).toBuilder().error(error).build();
    }

    /** Value resolved for {@code type}, or null. */
    public String value(String type) {
        int index = types.indexOf(type);
        return index < 0 ? null : values.get(index);
    }

    public boolean isError() {
        return source == ResolutionSource.ERROR;
    }
}
