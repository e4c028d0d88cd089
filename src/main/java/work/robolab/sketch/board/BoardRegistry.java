package work.robolab.sketch.board;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable set of board profiles keyed by board id, in document order.
 */
public final class BoardRegistry {
    private final Map<String, BoardProfile> profiles;

    public BoardRegistry(Collection<BoardProfile> profiles) {
        var byId = new LinkedHashMap<String, BoardProfile>();
        for (BoardProfile profile : profiles) {
            byId.put(profile.id(), profile);
        }
        this.profiles = Collections.unmodifiableMap(byId);
    }

    public BoardProfile get(String boardId) {
        var profile = boardId == null ? null : profiles.get(boardId);
        if (profile == null) {
            throw new UnknownBoardException(boardId);
        }
        return profile;
    }

    public Optional<BoardProfile> find(String boardId) {
        return boardId == null ? Optional.empty() : Optional.ofNullable(profiles.get(boardId));
    }

    public Set<String> ids() {
        return profiles.keySet();
    }

    public Collection<BoardProfile> profiles() {
        return profiles.values();
    }

    public boolean isEmpty() {
        return profiles.isEmpty();
    }
}
