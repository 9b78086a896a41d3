package org.starledger.timeline.pipeline;

import org.starledger.timeline.api.ProcessingContext;
import org.starledger.timeline.api.SnapshotInfo;
import org.starledger.timeline.model.Attitude;
import org.starledger.timeline.model.Disclosure;
import org.starledger.timeline.model.Entity;
import org.starledger.timeline.model.EntityKind;
import org.starledger.timeline.store.ITimelineTransaction;

import java.util.Optional;

/**
 * Decides what the observer knows about a country.
 * <p>
 * A country has met the observer once its entity carries {@code first_contact_day}. Beyond contact,
 * disclosure follows the country's attitude towards the observer; a sensor link reveals everything. In
 * observer mode every country is fully disclosed.
 */
public final class Visibility {

    public static final String FIRST_CONTACT_DAY = "first_contact_day";
    public static final String ATTITUDE = "attitude";
    public static final String SENSOR_LINK = "sensor_link";

    private final SnapshotInfo snapshot;
    private final ITimelineTransaction transaction;

    public Visibility(SnapshotInfo snapshot, ITimelineTransaction transaction) {
        this.snapshot = snapshot;
        this.transaction = transaction;
    }

    public static Visibility of(ProcessingContext context) {
        return new Visibility(context.snapshot(), context.transaction());
    }

    public boolean hasMet(Long countryId) {
        if (snapshot.isObserverMode()) {
            return true;
        }
        if (countryId == null) {
            return false;
        }
        if (snapshot.isObserver(countryId)) {
            return true;
        }
        return country(countryId).map(c -> c.getLong(FIRST_CONTACT_DAY).isPresent()).orElse(false);
    }

    /**
     * @param countryIds Country ids, {@code null} entries are ignored.
     * @return Whether the observer has met at least one of them.
     */
    public boolean hasMetAny(Long... countryIds) {
        for (Long id : countryIds) {
            if (id != null && hasMet(id)) {
                return true;
            }
        }
        return false;
    }

    public boolean reveals(Long countryId, Disclosure disclosure) {
        if (snapshot.isObserverMode() || snapshot.isObserver(countryId)) {
            return true;
        }
        if (!hasMet(countryId)) {
            return false;
        }
        if (disclosure == Disclosure.CONTACT) {
            return true;
        }
        Optional<Entity> country = country(countryId);
        if (country.isEmpty()) {
            return false;
        }
        if (country.get().getBoolean(SENSOR_LINK)) {
            return true;
        }
        return Attitude.parse(country.get().getString(ATTITUDE).orElse(null)).reveals(disclosure);
    }

    private Optional<Entity> country(long countryId) {
        return transaction.findEntity(EntityKind.COUNTRY, countryId);
    }
}
