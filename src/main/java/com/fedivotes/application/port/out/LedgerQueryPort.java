package com.fedivotes.application.port.out;

import com.fedivotes.application.port.out.VoteLedgerRepository.VoteRow;
import com.fedivotes.domain.model.LocalId;
import com.fedivotes.domain.model.VoteQueryShape;

import java.util.List;

public interface LedgerQueryPort {
    List<VoteRow> fetchVotes(VoteQueryShape shape, LocalId localId, String authorName);
}
