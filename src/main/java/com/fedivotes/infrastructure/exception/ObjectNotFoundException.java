package com.fedivotes.infrastructure.exception;

import com.fedivotes.domain.model.FederatedUrl;
import com.fedivotes.domain.model.ObjectKind;

import java.util.Locale;

public class ObjectNotFoundException extends BusinessException {

    public ObjectNotFoundException(ObjectKind kind, FederatedUrl url) {
        super("OBJECT_NOT_FOUND",
            "Could not fetch the " + kind.name().toLowerCase(Locale.ROOT) + " from the URL: " + url);
    }
}
