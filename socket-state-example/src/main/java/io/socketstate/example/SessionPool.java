package io.socketstate.example;

import com.fasterxml.jackson.core.type.TypeReference;
import io.socketstate.core.dict.SharedDict;
import io.socketstate.core.exception.KeyNotFoundException;
import io.socketstate.starter.service.SocketStateService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Socket sessions shared by every server process.
 * <p>
 * {@code sessions} maps a socket id to the connected user, {@code user_pool} maps a
 * user id to the socket ids that user currently holds open.
 */
@Service
public class SessionPool {

    private static final Logger log = LoggerFactory.getLogger(SessionPool.class);

    private final SharedDict<Map<String, Object>> sessions;
    private final SharedDict<List<String>> userPool;

    public SessionPool(SocketStateService socketState) {
        this.sessions = socketState.dict("sessions", new TypeReference<Map<String, Object>>() { });
        this.userPool = socketState.dict("user_pool", new TypeReference<List<String>>() { });
    }

    public void connect(String sid, String userId, Map<String, Object> user) {
        sessions.set(sid, user);

        List<String> sids = new ArrayList<>(userPool.get(userId, Collections.emptyList()));
        if (!sids.contains(sid)) {
            sids.add(sid);
        }
        userPool.set(userId, sids);
        log.info("Session connected: {} (user: {}, open sessions: {})", sid, userId, sids.size());
    }

    /**
     * Drops a socket session. Unknown socket ids are ignored.
     *
     * @return the user id the session belonged to, or {@code null}
     */
    public String disconnect(String sid) {
        Map<String, Object> user;
        try {
            user = sessions.get(sid);
            sessions.delete(sid);
        } catch (KeyNotFoundException e) {
            log.debug("Session already gone: {}", sid);
            return null;
        }

        Object id = user == null ? null : user.get("id");
        if (id == null) {
            return null;
        }
        String userId = id.toString();

        List<String> sids = new ArrayList<>(userPool.get(userId, Collections.emptyList()));
        sids.remove(sid);
        if (sids.isEmpty()) {
            try {
                userPool.delete(userId);
            } catch (KeyNotFoundException e) {
                log.debug("User pool entry already gone: {}", userId);
            }
        } else {
            userPool.set(userId, sids);
        }
        log.info("Session disconnected: {} (user: {}, open sessions: {})", sid, userId, sids.size());
        return userId;
    }

    public Map<String, Object> getUser(String sid) {
        return sessions.get(sid, null);
    }

    public List<String> getSessionIds(String userId) {
        return userPool.get(userId, Collections.emptyList());
    }

    public List<String> getActiveUserIds() {
        return userPool.keys();
    }

    public boolean isOnline(String userId) {
        return userPool.contains(userId);
    }
}
