package com.fedivotes.application.port.out;

import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.ObjectKind;
import com.fedivotes.domain.model.VoteAggregate;

import java.util.Optional;

public interface VoteAggregateRepository {
    Optional<VoteAggregate> findAggregate(ObjectKind kind, LocalId localId);
}
