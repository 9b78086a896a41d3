package org.starledger.timeline.processors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.parser.model.MapValue;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EventKind;
import org.starledger.timeline.model.EventSubject;
import org.starledger.timeline.model.HistoricalEvent;
import org.starledger.timeline.pipeline.EventHistory;
import org.starledger.timeline.pipeline.Visibility;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Tracks which country owns each system.
 * <p>
 * A system is owned by the owner of the fleet its starbase station belongs to. Starbases are evaluated in
 * ascending id order; when several starbases claim one system, the first claim wins. Ownership is a
 * continuous fact: a country that gains an unowned system has {@code expanded_to_system}, a country that
 * takes a system from another has {@code conquered_system}, and the former owner records
 * {@code lost_system}. The current owner is kept in the system's {@code owner} attribute.
 */
public class SystemOwnersProcessor implements ITimelineProcessor<IdRelation> {

    private static final Logger log = LoggerFactory.getLogger(SystemOwnersProcessor.class);

    public static final String ID = "system_owners";
    public static final String OWNER = "owner";

    private static final List<EventKind> OWNERSHIP_KINDS = List.of(EventKind.EXPANDED_TO_SYSTEM, EventKind.CONQUERED_SYSTEM);

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Set<String> dependencies() {
        return Set.of(SystemProcessor.ID, CountryProcessor.ID, FleetOwnerProcessor.ID);
    }

    @Override
    public IdRelation process(ProcessingContext context) {
        SystemIndex systems = context.output(SystemProcessor.ID, SystemIndex.class);
        IdLookup fleetOwners = context.output(FleetOwnerProcessor.ID, IdLookup.class);
        Map<Long, Long> claims = claims(context, systems, fleetOwners);

        ITimelineTransaction tx = context.transaction();
        Visibility visibility = Visibility.of(context);
        IdRelation systemsByOwner = new IdRelation();
        for (Entity system : systems.systems().all().values()) {
            Long previous = system.getLong(OWNER).isPresent() ? system.getLong(OWNER).getAsLong() : null;
            Long current = claims.get(system.sourceId());
            if (current != null) {
                systemsByOwner.add(current, system.sourceId());
            }
            boolean known = visibility.hasMetAny(previous, current);
            if (Objects.equals(previous, current)) {
                if (current != null) {
                    extendOwnership(tx, system.sourceId(), current, known);
                }
                continue;
            }
            for (EventKind kind : OWNERSHIP_KINDS) {
                EventHistory.closeAll(tx, kind, EventSubject.NONE.withSystem(system.sourceId()));
            }
            if (previous != null) {
                EventHistory.recordMomentary(tx, EventKind.LOST_SYSTEM,
                        EventSubject.ofCountry(previous).withTargetCountry(current).withSystem(system.sourceId()),
                        null, tx.day(), null, known);
            }
            if (current != null) {
                EventKind kind = previous == null ? EventKind.EXPANDED_TO_SYSTEM : EventKind.CONQUERED_SYSTEM;
                EventHistory.extendOrOpen(tx, kind, new EventHistory.Fact(
                        EventSubject.ofCountry(current).withTargetCountry(previous).withSystem(system.sourceId()),
                        null, known));
                system.set(OWNER, current);
            } else {
                system.remove(OWNER);
            }
        }
        return systemsByOwner;
    }

    private Map<Long, Long> claims(ProcessingContext context, SystemIndex systems, IdLookup fleetOwners) {
        Map<Long, Long> shipFleets = new HashMap<>();
        context.gamestate().map("ships").orElse(MapValue.EMPTY).objectsById()
                .forEach((shipId, ship) -> ship.longValue("fleet").ifPresent(f -> shipFleets.put(shipId, f)));

        Map<Long, Long> claims = new HashMap<>();
        MapValue starbases = context.gamestate().map("starbase_mgr")
                .flatMap(m -> m.map("starbases")).orElse(MapValue.EMPTY);
        for (Map.Entry<Long, MapValue> entry : starbases.objectsById().entrySet()) {
            Optional<Long> systemId = systems.systemOfStarbase(entry.getKey());
            OptionalLong station = entry.getValue().longValue("station");
            Optional<Long> owner = station.isPresent()
                    ? fleetOwners.get(shipFleets.get(station.getAsLong()))
                    : Optional.empty();
            if (systemId.isEmpty() || owner.isEmpty() || !systems.systems().contains(systemId.get())) {
                // some megastructures count as starbases
                log.debug("{} Cannot establish ownership for starbase {}", context.snapshot().logPrefix(), entry.getKey());
                continue;
            }
            Long existing = claims.putIfAbsent(systemId.get(), owner.get());
            if (existing != null && !existing.equals(owner.get())) {
                log.warn("{} System {} is claimed by country {} and country {}; keeping the claim of starbase with the lowest id",
                        context.snapshot().logPrefix(), systemId.get(), existing, owner.get());
            }
        }
        return claims;
    }

    private static void extendOwnership(ITimelineTransaction tx, long systemId, long owner, boolean known) {
        for (EventKind kind : OWNERSHIP_KINDS) {
            for (HistoricalEvent open : tx.findEvents(kind, EventSubject.ofCountry(owner).withSystem(systemId), true)) {
                open.extendTo(tx.day());
                open.widenVisibility(known);
                tx.updateEvent(open);
            }
        }
    }
}
