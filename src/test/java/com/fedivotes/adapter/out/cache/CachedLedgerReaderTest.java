package com.fedivotes.adapter.out.cache;

import com.fedivotes.application.port.out.VoteLedgerRepository;
import com.fedivotes.application.port.out.VoteLedgerRepository.VoteRow;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.SortOption;
import com.fedivotes.domain.model.VoteFilter;
import com.fedivotes.domain.model.VoteQueryShape;
import com.fedivotes.infrastructure.cache.TtlCacheFactory;
import com.fedivotes.infrastructure.config.AppProperties;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class CachedLedgerReaderTest {

    private static final LocalId ID = new LocalId(12);
    private static final VoteRow ROW = new VoteRow("alice", 1, "https://lemmy.world/u/alice", Instant.parse("2024-01-01T00:00:00Z"));

    @Mock
    private VoteLedgerRepository ledgerRepository;

    private final AtomicLong nanos = new AtomicLong();
    private CachedLedgerReader reader;

    @BeforeEach
    void setUp() {
        TtlCacheFactory factory = new TtlCacheFactory(nanos::get, new SimpleMeterRegistry());
        reader = new CachedLedgerReader(ledgerRepository, factory, new AppProperties());
    }

    private static VoteQueryShape shape(VoteFilter filter, boolean author) {
        return new VoteQueryShape(ObjectKind.POST, filter, SortOption.CREATED_DESC, author);
    }

    @Test
    void shouldMemoizePerShape() {
        when(ledgerRepository.findVotes(any(), eq(ID), isNull())).thenReturn(List.of(ROW));

        reader.fetchVotes(shape(VoteFilter.ALL, false), ID, null);
        reader.fetchVotes(shape(VoteFilter.ALL, false), ID, null);
        reader.fetchVotes(shape(VoteFilter.UPVOTES, false), ID, null);

        verify(ledgerRepository, times(1)).findVotes(shape(VoteFilter.ALL, false), ID, null);
        verify(ledgerRepository, times(1)).findVotes(shape(VoteFilter.UPVOTES, false), ID, null);
    }

    @Test
    void shouldShareEntryAcrossAuthorNameCase() {
        when(ledgerRepository.findVotes(shape(VoteFilter.ALL, true), ID, "alice")).thenReturn(List.of(ROW));

        reader.fetchVotes(shape(VoteFilter.ALL, true), ID, "Alice");
        List<VoteRow> rows = reader.fetchVotes(shape(VoteFilter.ALL, true), ID, "ALICE");

        assertEquals(List.of(ROW), rows);
        verify(ledgerRepository, times(1)).findVotes(any(), any(), any());
    }

    @Test
    void shouldBindTheSameFoldedNameItCachesUnder() {
        when(ledgerRepository.findVotes(any(), eq(ID), anyString())).thenReturn(List.of());

        reader.fetchVotes(shape(VoteFilter.ALL, true), ID, "\u00C9MILE");

        verify(ledgerRepository).findVotes(shape(VoteFilter.ALL, true), ID, "\u00E9mile");
    }

    @Test
    void shouldSeparateDifferentAuthors() {
        when(ledgerRepository.findVotes(eq(shape(VoteFilter.ALL, true)), eq(ID), anyString())).thenReturn(List.of());

        reader.fetchVotes(shape(VoteFilter.ALL, true), ID, "alice");
        reader.fetchVotes(shape(VoteFilter.ALL, true), ID, "bob");

        verify(ledgerRepository, times(2)).findVotes(any(), any(), any());
    }

    @Test
    void shouldExpireFasterThanOtherCaches() {
        when(ledgerRepository.findVotes(any(), eq(ID), isNull())).thenReturn(List.of(ROW));

        reader.fetchVotes(shape(VoteFilter.ALL, false), ID, null);
        nanos.addAndGet(Duration.ofSeconds(61).toNanos());
        reader.fetchVotes(shape(VoteFilter.ALL, false), ID, null);

        verify(ledgerRepository, times(2)).findVotes(any(), any(), any());
    }
}
