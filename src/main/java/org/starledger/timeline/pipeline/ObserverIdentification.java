package org.starledger.timeline.pipeline;

import org.starledger.parser.model.MapValue;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Determines the observer country from the {@code player} list of a snapshot.
 * <p>
 * A single player is the observer. With several players the one whose name matches the configured
 * multiplayer username is the observer and the others are recorded as other players. Without players the
 * series is in observer mode.
 *
 * @param observerCountry The observer country id, {@code null} in observer mode.
 * @param otherPlayers    Countries of the other human players.
 */
public record ObserverIdentification(Long observerCountry, Set<Long> otherPlayers) {

    public ObserverIdentification {
        otherPlayers = Set.copyOf(otherPlayers);
    }

    /**
     * @param gamestate           The parsed snapshot.
     * @param multiplayerUsername The configured username, possibly empty.
     * @return The identification.
     * @throws IllegalArgumentException if there are several players and no username matches.
     */
    public static ObserverIdentification identify(MapValue gamestate, String multiplayerUsername) {
        List<MapValue> players = gamestate.maps("player");
        if (players.isEmpty()) {
            return new ObserverIdentification(null, Set.of());
        }
        if (players.size() == 1) {
            OptionalLong country = players.get(0).longValue("country");
            return new ObserverIdentification(country.isPresent() ? country.getAsLong() : null, Set.of());
        }
        if (multiplayerUsername == null || multiplayerUsername.isEmpty()) {
            throw new IllegalArgumentException(
                    "Snapshot has several players; configure starledger.observer.multiplayer-username");
        }
        Long observer = null;
        Set<Long> others = new LinkedHashSet<>();
        for (MapValue player : players) {
            OptionalLong country = player.longValue("country");
            if (country.isEmpty()) {
                continue;
            }
            if (Objects.equals(multiplayerUsername, player.string("name").orElse(null))) {
                observer = country.getAsLong();
            } else {
                others.add(country.getAsLong());
            }
        }
        if (observer == null) {
            throw new IllegalArgumentException("Could not find player matching multiplayer username "
                    + multiplayerUsername);
        }
        others.remove(observer);
        return new ObserverIdentification(observer, others);
    }
}
