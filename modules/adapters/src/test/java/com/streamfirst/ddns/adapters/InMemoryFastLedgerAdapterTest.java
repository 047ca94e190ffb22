package com.streamfirst.ddns.adapters;

import com.streamfirst.ddns.domain.BatchWrite;
import com.streamfirst.ddns.domain.ContentRef;
import com.streamfirst.ddns.domain.DomainKey;
import com.streamfirst.ddns.domain.FastBatch;
import com.streamfirst.ddns.domain.FlattenedRecords;
import com.streamfirst.ddns.domain.WriteConfirmation;
import com.streamfirst.ddns.ports.FastLedgerPort;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryFastLedgerAdapterTest {

    private static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");
    private static final DomainKey KEY = DomainKey.of("0x" + "ef".repeat(32));

    private final InMemoryFastLedgerAdapter ledger =
            new InMemoryFastLedgerAdapter(Clock.fixed(T0, ZoneOffset.UTC));

    private static FlattenedRecords records(List<String> types, List<String> values) {
        return new FlattenedRecords(types, values, types.stream().map(t -> 3600).toList());
    }

    @Test
    void batchWriteReplacesWholeDomain() {
        ledger.submitBatchWrite(BatchWrite.of(KEY, ContentRef.of("QmOne"),
                records(List.of("A", "A", "TXT"), List.of("1.1.1.1", "2.2.2.2", "hello"))));
        ledger.submitBatchWrite(BatchWrite.of(KEY, ContentRef.of("QmTwo"),
                records(List.of("A"), List.of("3.3.3.3"))));

        assertThat(ledger.getAllValues(KEY, "A")).containsExactly("3.3.3.3");
        assertThat(ledger.getRecord(KEY, "TXT").hasValue()).isFalse();
        assertThat(ledger.getRecord(KEY, "A").contentRef()).isEqualTo(ContentRef.of("QmTwo"));
    }

    @Test
    void repeatedWriteConverges() {
        BatchWrite write = BatchWrite.of(KEY, ContentRef.of("QmOne"),
                records(List.of("A", "A"), List.of("1.1.1.1", "2.2.2.2")));

        ledger.submitBatchWrite(write);
        ledger.submitBatchWrite(write);

        assertThat(ledger.getAllValues(KEY, "A")).containsExactly("1.1.1.1", "2.2.2.2");
        assertThat(ledger.getSubmittedWrites()).hasSize(2);
    }

    @Test
    void batchReadLeavesGapsForMissingTypes() {
        ledger.submitBatchWrite(BatchWrite.of(KEY, ContentRef.of("QmOne"),
                records(List.of("A"), List.of("1.1.1.1"))));

        FastBatch batch = ledger.getBatchRecords(KEY, List.of("A", "MX"));

        assertThat(batch.values()).containsExactly("1.1.1.1", null);
        assertThat(batch.ttls()).containsExactly(3600, 0);
        assertThat(batch.timestamps()).containsExactly(T0, null);
        assertThat(batch.contentRef()).isEqualTo(ContentRef.of("QmOne"));
    }

    @Test
    void unknownDomainReadsEmpty() {
        assertThat(ledger.getRecord(KEY, "A").hasValue()).isFalse();
        assertThat(ledger.getBatchRecords(KEY, List.of("A")).contentRef()).isEqualTo(ContentRef.NONE);
    }

    @Test
    void writeIsConfirmedAtRequestedDepth() {
        FastLedgerPort.PendingWrite pending = ledger.submitBatchWrite(BatchWrite.of(KEY, ContentRef.of("QmOne"),
                records(List.of("A"), List.of("1.1.1.1"))));

        WriteConfirmation confirmation = pending.awaitConfirmations(3);

        assertThat(confirmation.transactionId()).isEqualTo(pending.transactionId()).startsWith("0x");
        assertThat(confirmation.confirmations()).isEqualTo(3);
        assertThat(confirmation.height()).isEqualTo(1);
    }

    @Test
    void rejectsMalformedBatches() {
        assertThatThrownBy(() -> ledger.submitBatchWrite(BatchWrite.of(KEY, ContentRef.NONE,
                records(List.of(), List.of()))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FlattenedRecords(List.of("A"), List.of(), List.of(3600)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
