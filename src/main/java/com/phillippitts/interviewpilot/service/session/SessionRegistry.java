package com.phillippitts.interviewpilot.service.session;

import com.phillippitts.interviewpilot.domain.SessionSummary;
import com.phillippitts.interviewpilot.exception.SessionNotFoundException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Live sessions by id plus a bounded archive of terminal summaries.
 *
 * <p>Each live session is owned by its own conductor; the registry only maps ids to them.
 * When the archive is full the oldest summary is evicted.
 */
public class SessionRegistry {

    private final Map<String, LiveSession> live = new ConcurrentHashMap<>();
    private final Map<String, SessionSummary> archive;

    public SessionRegistry(int archiveSize) {
        if (archiveSize <= 0) {
            throw new IllegalArgumentException("archiveSize must be positive");
        }
        this.archive = new LinkedHashMap<>(16, 0.75f, false) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, SessionSummary> eldest) {
                return size() > archiveSize;
            }
        };
    }

    public void register(LiveSession session) {
        if (live.putIfAbsent(session.sessionId(), session) != null) {
            throw new IllegalArgumentException("Session already registered: " + session.sessionId());
        }
    }

    public Optional<LiveSession> find(String sessionId) {
        return sessionId == null ? Optional.empty() : Optional.ofNullable(live.get(sessionId));
    }

    public LiveSession require(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Collection<LiveSession> live() {
        return List.copyOf(live.values());
    }

    /** Moves a terminated session from the live map to the archive. */
    public void archive(SessionSummary summary) {
        synchronized (archive) {
            archive.put(summary.sessionId(), summary);
        }
        live.remove(summary.sessionId());
    }


    public Optional<SessionSummary> findArchived(String sessionId) {
        synchronized (archive) {
            return Optional.ofNullable(archive.get(sessionId));
        }
    }

    public List<SessionSummary> archived() {
        synchronized (archive) {
            return new ArrayList<>(archive.values());
        }
    }
}
