package com.phillippitts.insightbot.service.session;

import com.phillippitts.insightbot.exception.SessionAlreadyExistsException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.LongFunction;

/**
 * Live sessions by guild id, at most one per guild.
 *
 * <p>Insertion is an atomic check-and-insert on the map: of N concurrent
 * {@link #createIfAbsent} calls for one guild exactly one succeeds. Operations on different
 * guilds never contend on a shared lock.
 */
@Component
public class SessionRegistry {

    private final ConcurrentMap<Long, GuildSession> sessions = new ConcurrentHashMap<>();

    /**
     * Creates and registers a session unless the guild already has one.
     *
     * <p>The factory runs while the guild's map entry is locked; it must only construct the
     * session, not acquire external resources.
     *
     * @throws SessionAlreadyExistsException if the guild already has a session
     */
    public GuildSession createIfAbsent(long guildId, LongFunction<GuildSession> factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        AtomicBoolean created = new AtomicBoolean(false);
        GuildSession session = sessions.computeIfAbsent(guildId, id -> {
            created.set(true);
            return Objects.requireNonNull(factory.apply(id), "factory returned null");
        });
        if (!created.get()) {
            throw new SessionAlreadyExistsException(guildId);
        }
        return session;
    }

    public Optional<GuildSession> get(long guildId) {
        return Optional.ofNullable(sessions.get(guildId));
    }

    /**
     * Removes the guild's session. Of concurrent removals only one receives it.
     */
    public Optional<GuildSession> remove(long guildId) {
        return Optional.ofNullable(sessions.remove(guildId));
    }

    /**
     * Removes the entry only if it still maps to the given session.
     */
    public boolean remove(long guildId, GuildSession session) {
        return sessions.remove(guildId, session);
    }

    public int size() {
        return sessions.size();
    }

    public List<Long> guildIds() {
        return List.copyOf(sessions.keySet());
    }
}
