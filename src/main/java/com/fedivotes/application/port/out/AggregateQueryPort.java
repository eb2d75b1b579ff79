package com.fedivotes.application.port.out;

import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.VoteAggregate;

public interface AggregateQueryPort {
    VoteAggregate fetchAggregate(ObjectKind kind, LocalId localId);
}
