package com.investbyyourself.etl.service;

import com.investbyyourself.etl.model.TransformedRecord;
import com.investbyyourself.etl.support.TestRecords;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentHashingServiceTest {

    private final ContentHashingService hashingService = new ContentHashingService(new RecordJsonCodec());

    @Test
    void hashIsHexSha256() {
        assertThat(hashingService.hash("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
        assertThat(hashingService.hash(null)).isNull();
    }

    @Test
    void versionIdIgnoresOrderButCountsDuplicates() {
        String a = hashingService.hash("a");
        String b = hashingService.hash("b");

        assertThat(hashingService.versionId(List.of(a, b))).isEqualTo(hashingService.versionId(List.of(b, a)));
        assertThat(hashingService.versionId(List.of(a, b, b))).isNotEqualTo(hashingService.versionId(List.of(a, b)));
    }

    @Test
    void recordChecksumChangesOnlyWithContent() {
        TransformedRecord first = TestRecords.record("AAPL", "170.5");
        TransformedRecord same = TestRecords.record("AAPL", "170.50");
        TransformedRecord other = TestRecords.record("AAPL", "171");

        assertThat(hashingService.recordChecksum(first)).isEqualTo(hashingService.recordChecksum(same));
        assertThat(hashingService.recordChecksum(first)).isNotEqualTo(hashingService.recordChecksum(other));
    }
}
