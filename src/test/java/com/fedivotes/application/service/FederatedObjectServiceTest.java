package com.fedivotes.application.service;

import com.fedivotes.application.port.out.FederationLookupPort;
import com.fedivotes.application.port.out.FederationLookupPort.LookupResult;
import com.fedivotes.application.port.out.InstanceAllowlistPort;
import com.fedivotes.domain.error.ValidationError.UrlError;
import com.fedivotes.domain.error.VoteQueryError;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.infrastructure.config.AppProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("FederatedObjectService")
class FederatedObjectServiceTest {

    private static final String RAW_URL = "https://lemmy.world/post/4556641";

    @Mock
    private InstanceAllowlistPort allowlist;

    @Mock
    private FederationLookupPort federationLookup;

    private AppProperties appProperties;
    private FederatedObjectService service;

    @BeforeEach
    void setUp() {
        appProperties = new AppProperties();
        service = new FederatedObjectService(allowlist, federationLookup, appProperties);
    }

    @Test
    @DisplayName("Should accept a well-formed URL when optional checks are off")
    void shouldAcceptWellFormedUrl() {
        var result = service.verify(RAW_URL, ObjectKind.POST);

        assertTrue(result.isSuccess());
        assertEquals(RAW_URL, result.getOrThrow().value());
        verifyNoInteractions(allowlist, federationLookup);
    }

    @Test
    @DisplayName("Should reject a non-https URL")
    void shouldRejectPlainHttp() {
        var result = service.verify("http://lemmy.world/post/1", ObjectKind.POST);

        assertTrue(result.isFailure());
        var failure = assertInstanceOf(VoteQueryError.ValidationFailed.class, result.errorOrNull());
        assertInstanceOf(UrlError.NotHttps.class, failure.error());
    }

    @Test
    @DisplayName("Should reject hosts missing from the allowlist")
    void shouldRejectUnknownInstance() {
        appProperties.getFederation().getAllowlist().setEnabled(true);
        when(allowlist.isKnownInstance("lemmy.world")).thenReturn(false);

        var result = service.verify(RAW_URL, ObjectKind.POST);

        var error = assertInstanceOf(VoteQueryError.UnknownInstance.class, result.errorOrNull());
        assertEquals("lemmy.world", error.host());
        assertEquals("UNKNOWN_INSTANCE", error.code());
    }

    @Test
    @DisplayName("Should pass hosts on the allowlist")
    void shouldPassKnownInstance() {
        appProperties.getFederation().getAllowlist().setEnabled(true);
        when(allowlist.isKnownInstance("lemmy.world")).thenReturn(true);

        assertTrue(service.verify(RAW_URL, ObjectKind.COMMENT).isSuccess());
    }

    @Test
    @DisplayName("Should reject objects the upstream cannot resolve")
    void shouldRejectUnresolvableObject() {
        appProperties.getFederation().getLookup().setEnabled(true);
        when(federationLookup.resolveObject(any())).thenReturn(new LookupResult(400, "couldnt_find_object"));

        var result = service.verify(RAW_URL, ObjectKind.POST);

        var error = assertInstanceOf(VoteQueryError.UpstreamRejected.class, result.errorOrNull());
        assertEquals(400, error.status());
        assertEquals("couldnt_find_object. Make sure you are passing an ActivityPub link.", error.message());
    }

    @Test
    @DisplayName("Should use a generic detail when upstream gives none")
    void shouldUseGenericDetail() {
        appProperties.getFederation().getLookup().setEnabled(true);
        when(federationLookup.resolveObject(any())).thenReturn(new LookupResult(500, null));

        var error = (VoteQueryError.UpstreamRejected) service.verify(RAW_URL, ObjectKind.POST).errorOrNull();

        assertEquals("External API Error", error.detail());
    }

    @Test
    @DisplayName("Should accept objects the upstream resolves")
    void shouldAcceptResolvedObject() {
        appProperties.getFederation().getLookup().setEnabled(true);
        when(federationLookup.resolveObject(any())).thenReturn(LookupResult.ok());

        assertTrue(service.verify(RAW_URL, ObjectKind.POST).isSuccess());
    }
}
