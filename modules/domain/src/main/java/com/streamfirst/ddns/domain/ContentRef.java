package com.streamfirst.ddns.domain;

import java.util.Objects;

/**
 * Opaque pointer from the authoritative ledger to a record set in the content store. The
 * authoritative ledger stores the pointer in a chain-specific binary encoding; turning it into a
 * content-store locator is the job of a decoder, not of this type.
 *
 * @param value the raw reference as read from the ledger, "" when none has been set
 */
public record ContentRef(String value) {

    /** The reference of a domain that has no content yet. */
    public static final ContentRef NONE = new ContentRef("");

    public ContentRef {
        Objects.requireNonNull(value, "Content reference cannot be null, use ContentRef.NONE");
    }

    public static ContentRef of(String value) {
        return value == null ? NONE : new ContentRef(value);
    }

    /**
     * Returns true when the reference points nowhere: blank, or the ledger's zero hash
     * ("0x" followed only by zeros).
     */
    public boolean isEmpty() {
        String v = value.trim();
        if (v.isEmpty()) {
            return true;
        }
        if (!v.startsWith("0x")) {
            return false;
        }
        for (int i = 2; i < v.length(); i++) {
            if (v.charAt(i) != '0') {
                return false;
            }
        }
        return true;
    }

    public boolean isPresent() {
        return !isEmpty();
    }

    @Override
    public String toString() {
        return isEmpty() ? "<none>" : value;
    }
}
