package com.fedivotes.application.port.out;

import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;

import java.util.Optional;

public interface ObjectRepository {
    Optional<LocalId> findLocalId(FederatedUrl url, ObjectKind kind);
}
