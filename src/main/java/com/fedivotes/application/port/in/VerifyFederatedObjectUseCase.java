package com.fedivotes.application.port.in;

import com.fedivotes.domain.error.VoteQueryError;
import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.Result;

public interface VerifyFederatedObjectUseCase {
    Result<FederatedUrl, VoteQueryError> verify(String rawUrl, ObjectKind kind);
}
