package com.clapgrow.mediarelay.worker.service;

import com.clapgrow.mediarelay.worker.enums.SessionState;
import com.clapgrow.mediarelay.worker.model.GroupRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-wide session state shared by the lifecycle service, the group
 * directory and the API read handlers.
 * 
 * State and label are written only by the lifecycle service, the group list
 * only by the directory. Reads take the read lock and never block on I/O.
 */
@Component
@RequiredArgsConstructor
public class SessionContext {
    
    private final SessionTransitionValidator transitionValidator;
    
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final AtomicBoolean reconnecting = new AtomicBoolean(false);
    
    private SessionState state = SessionState.INITIALIZING;
    private String label = SessionState.INITIALIZING.getDefaultLabel();
    private String qrDataUrl;
    private List<GroupRecord> groups = List.of();
    
    /**
     * Move to a new state if the transition is valid.
     * 
     * @param next Target state
     * @param nextLabel Label surfaced to observers
     * @return true if the state was changed, false if the transition was rejected
     */
    public boolean transition(SessionState next, String nextLabel) {
        lock.writeLock().lock();
        try {
            if (!transitionValidator.isValidTransition(state, next)) {
                return false;
            }
            state = next;
            label = nextLabel != null ? nextLabel : next.getDefaultLabel();
            if (next != SessionState.AWAITING_SCAN) {
                qrDataUrl = null;
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public SessionState getState() {
        lock.readLock().lock();
        try {
            return state;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public String getLabel() {
        lock.readLock().lock();
        try {
            return label;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public void setQrDataUrl(String qrDataUrl) {
        lock.writeLock().lock();
        try {
            this.qrDataUrl = qrDataUrl;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public List<GroupRecord> getGroups() {
        lock.readLock().lock();
        try {
            return groups;
        } finally {
            lock.readLock().unlock();
        }
    }
    
    /**
     * Replace the whole directory; entries missing from {@code next} are dropped.
     */
    public void replaceGroups(List<GroupRecord> next) {
        lock.writeLock().lock();
        try {
            groups = next == null ? List.of() : List.copyOf(next);
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    /**
     * Claim the single reconnect slot.
     * 
     * @return true if the caller now owns the reconnect, false if one is already running
     */
    public boolean beginReconnect() {
        return reconnecting.compareAndSet(false, true);
    }
    
    public void endReconnect() {
        reconnecting.set(false);
    }
    
    public boolean isReconnecting() {
        return reconnecting.get();
    }
    
    /**
     * Consistent view of everything observers care about.
     */
    public Snapshot snapshot() {
        lock.readLock().lock();
        try {
            return new Snapshot(state, label, qrDataUrl, groups, reconnecting.get());
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public record Snapshot(
        SessionState state,
        String label,
        String qrDataUrl,
        List<GroupRecord> groups,
        boolean reconnecting
    ) {
    }
}
