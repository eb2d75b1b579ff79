package com.fedivotes.adapter.out.cache;

import com.fedivotes.application.port.out.ObjectRepository;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.infrastructure.cache.TtlCacheFactory;
import com.fedivotes.infrastructure.config.AppProperties;
import com.fedivotes.infrastructure.exception.ObjectNotFoundException;
import com.fedivotes.infrastructure.exception.VoteDataSourceException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("CachedIdentityResolver")
class CachedIdentityResolverTest {

    private static final FederatedUrl URL = FederatedUrl.parse("https://lemmy.world/post/4556641").getOrThrow();

    @Mock
    private ObjectRepository objectRepository;

    private final AtomicLong nanos = new AtomicLong();
    private CachedIdentityResolver resolver;

    @BeforeEach
    void setUp() {
        TtlCacheFactory factory = new TtlCacheFactory(nanos::get, new SimpleMeterRegistry());
        resolver = new CachedIdentityResolver(objectRepository, factory, new AppProperties());
    }

    @Test
    @DisplayName("Should hit the database once for repeated resolutions")
    void shouldMemoizeResolution() {
        when(objectRepository.findLocalId(URL, ObjectKind.POST)).thenReturn(Optional.of(new LocalId(7)));

        assertEquals(new LocalId(7), resolver.resolve(URL, ObjectKind.POST));
        assertEquals(new LocalId(7), resolver.resolve(URL, ObjectKind.POST));

        verify(objectRepository, times(1)).findLocalId(URL, ObjectKind.POST);
    }

    @Test
    @DisplayName("Should key entries by kind as well as URL")
    void shouldKeyByKind() {
        when(objectRepository.findLocalId(URL, ObjectKind.POST)).thenReturn(Optional.of(new LocalId(7)));
        when(objectRepository.findLocalId(URL, ObjectKind.COMMENT)).thenReturn(Optional.of(new LocalId(9)));

        assertEquals(new LocalId(7), resolver.resolve(URL, ObjectKind.POST));
        assertEquals(new LocalId(9), resolver.resolve(URL, ObjectKind.COMMENT));
    }

    @Test
    @DisplayName("Should not remember unknown URLs")
    void shouldNotCacheNotFound() {
        when(objectRepository.findLocalId(URL, ObjectKind.POST))
            .thenReturn(Optional.empty())
            .thenReturn(Optional.of(new LocalId(11)));

        assertThrows(ObjectNotFoundException.class, () -> resolver.resolve(URL, ObjectKind.POST));
        assertEquals(new LocalId(11), resolver.resolve(URL, ObjectKind.POST));
    }

    @Test
    @DisplayName("Should report not found with the post wording")
    void shouldDescribeMissingObject() {
        when(objectRepository.findLocalId(URL, ObjectKind.POST)).thenReturn(Optional.empty());

        ObjectNotFoundException ex = assertThrows(ObjectNotFoundException.class, () -> resolver.resolve(URL, ObjectKind.POST));

        assertEquals("OBJECT_NOT_FOUND", ex.getErrorCode());
        assertEquals("Could not fetch the post from the URL: " + URL.value(), ex.getMessage());
    }

    @Test
    @DisplayName("Should report not found with the comment wording")
    void shouldDescribeMissingComment() {
        FederatedUrl commentUrl = FederatedUrl.parse("https://lemmy.world/comment/99").getOrThrow();
        when(objectRepository.findLocalId(commentUrl, ObjectKind.COMMENT)).thenReturn(Optional.empty());

        ObjectNotFoundException ex = assertThrows(ObjectNotFoundException.class,
            () -> resolver.resolve(commentUrl, ObjectKind.COMMENT));

        assertEquals("Could not fetch the comment from the URL: " + commentUrl.value(), ex.getMessage());
    }

    @Test
    @DisplayName("Should translate database failures")
    void shouldTranslateDatabaseFailures() {
        when(objectRepository.findLocalId(URL, ObjectKind.POST))
            .thenThrow(new DataAccessResourceFailureException("connection refused"));

        VoteDataSourceException ex = assertThrows(VoteDataSourceException.class, () -> resolver.resolve(URL, ObjectKind.POST));
        assertEquals("DATA_SOURCE_ERROR", ex.getErrorCode());
    }

    @Test
    @DisplayName("Should resolve again after expiry or invalidation")
    void shouldRefreshAfterExpiryOrInvalidation() {
        when(objectRepository.findLocalId(URL, ObjectKind.POST)).thenReturn(Optional.of(new LocalId(7)));

        resolver.resolve(URL, ObjectKind.POST);
        nanos.addAndGet(Duration.ofSeconds(181).toNanos());
        resolver.resolve(URL, ObjectKind.POST);
        resolver.invalidate(URL, ObjectKind.POST);
        resolver.resolve(URL, ObjectKind.POST);

        verify(objectRepository, times(3)).findLocalId(URL, ObjectKind.POST);
    }
}
