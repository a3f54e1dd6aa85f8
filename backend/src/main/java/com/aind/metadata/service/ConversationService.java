package com.aind.metadata.service;

import com.aind.metadata.model.ConversationTurn;
import com.aind.metadata.model.SessionSummary;
import com.aind.metadata.repository.ConversationTurnRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Conversation history per session.
 */
@Service
@Slf4j
public class ConversationService {

    private final ConversationTurnRepository turnRepository;

    public ConversationService(ConversationTurnRepository turnRepository) {
        this.turnRepository = turnRepository;
    }

    @Transactional
    public ConversationTurn saveTurn(String sessionId, String role, String content) {
        ConversationTurn turn = turnRepository.save(new ConversationTurn(sessionId, role, content));
        log.debug("Saved {} turn for session {} ({} chars)", role, sessionId, content.length());
        return turn;
    }

    @Transactional(readOnly = true)
    public List<ConversationTurn> history(String sessionId) {
        return turnRepository.findBySessionIdOrderByCreatedAtAscIdAsc(sessionId);
    }

    /** The last {@code limit} turns, oldest first. */
    @Transactional(readOnly = true)
    public List<ConversationTurn> recentHistory(String sessionId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<ConversationTurn> newestFirst = turnRepository.findBySessionIdOrderByCreatedAtDescIdDesc(
                sessionId, PageRequest.of(0, limit));
        List<ConversationTurn> turns = new ArrayList<>(newestFirst);
        Collections.reverse(turns);
        return turns;
    }

    /** Sessions with message counts, most recently active first. */
    @Transactional(readOnly = true)
    public List<SessionSummary> sessions() {
        List<SessionSummary> sessions = turnRepository.summarizeSessions();
        for (SessionSummary session : sessions) {
            turnRepository.findFirstBySessionIdAndRoleOrderByCreatedAtAscIdAsc(session.getSessionId(), ConversationTurn.USER)
                    .ifPresent(first -> session.setFirstMessage(first.getContent()));
        }
        return sessions;
    }
}
