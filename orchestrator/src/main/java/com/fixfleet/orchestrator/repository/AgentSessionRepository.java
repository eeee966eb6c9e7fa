package com.fixfleet.orchestrator.repository;

import com.fixfleet.orchestrator.model.AgentSession;
import com.fixfleet.orchestrator.model.PullRequestState;
import com.fixfleet.orchestrator.model.SessionStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

/**
 * CRUD + refresher queries for the agent_sessions table.
 */
public interface AgentSessionRepository extends JpaRepository<AgentSession, String> {

    /** Sessions the agent is still working on (refresher polls these). */
    List<AgentSession> findByStatusIn(Collection<SessionStatus> statuses);

    /** Sessions whose PR has not reached a final state yet. */
    List<AgentSession> findByPrState(PullRequestState prState);

    List<AgentSession> findByPrUrl(String prUrl);

    List<AgentSession> findByCycleId(String cycleId);

    /** Every session that carried the fingerprint, oldest first. */
    @Query("select s from AgentSession s where :fingerprint member of s.fingerprints order by s.createdAt")
    List<AgentSession> findByFingerprint(@Param("fingerprint") String fingerprint);
}
