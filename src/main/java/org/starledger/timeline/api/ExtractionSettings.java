package org.starledger.timeline.api;

import com.typesafe.config.Config;

import java.util.List;
import java.util.Set;

/**
 * Settings that influence what processors extract.
 *
 * @param readAllCountries        Write per-country breakdown records for every country, not only the observer.
 * @param destroyedPlanetClasses  Planet classes that mark a planet as destroyed.
 */
public record ExtractionSettings(boolean readAllCountries, Set<String> destroyedPlanetClasses) {

    public static final List<String> DEFAULT_DESTROYED_PLANET_CLASSES = List.of(
            "pc_shattered", "pc_shielded", "pc_ringworld_shielded", "pc_habitat_shielded",
            "pc_ringworld_habitable_damaged", "pc_egg_cracked", "pc_shrouded", "pc_ai", "pc_infested",
            "pc_gray_goo");

    public ExtractionSettings {
        destroyedPlanetClasses = Set.copyOf(destroyedPlanetClasses);
    }

    public static ExtractionSettings defaults() {
        return new ExtractionSettings(false, Set.copyOf(DEFAULT_DESTROYED_PLANET_CLASSES));
    }

    /**
     * Reads the settings from the {@code starledger} configuration block.
     *
     * @param config Config with {@code observer.read-all-countries} and {@code game.destroyed-planet-classes}.
     * @return The settings, with defaults for missing keys.
     */
    public static ExtractionSettings fromConfig(Config config) {
        boolean readAll = config.hasPath("observer.read-all-countries")
                && config.getBoolean("observer.read-all-countries");
        List<String> destroyed = config.hasPath("game.destroyed-planet-classes")
                ? config.getStringList("game.destroyed-planet-classes")
                : DEFAULT_DESTROYED_PLANET_CLASSES;
        return new ExtractionSettings(readAll, Set.copyOf(destroyed));
    }
}
