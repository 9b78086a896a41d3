package org.starledger.timeline.processors;

import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.starledger.timeline.api.ITimelineProcessor;
import org.starledger.timeline.pipeline.TimelinePipeline;

import java.lang.reflect.InvocationTargetException;
import java.util.List;

/**
 * Builds the timeline pipeline, either with the standard processors or with the processor classes listed
 * under {@code pipeline.processors}.
 */
public final class ProcessorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProcessorRegistry.class);

    private ProcessorRegistry() {}

    /**
     * @return New instances of the standard processors in registration order.
     */
    public static List<ITimelineProcessor<?>> standardProcessors() {
        return List.of(
                new SystemProcessor(),
                new CountryProcessor(),
                new DiplomacyProcessor(),
                new SensorLinkProcessor(),
                new FleetOwnerProcessor(),
                new SystemOwnersProcessor(),
                new CountryDataProcessor(),
                new SpeciesProcessor(),
                new LeaderProcessor(),
                new PlanetModelsProcessor(),
                new RulerProcessor(),
                new GovernmentProcessor(),
                new FactionProcessor(),
                new DiplomacyEventsProcessor(),
                new ScientistEventsProcessor(),
                new WarProcessor(),
                new TruceProcessor(),
                new PopStatsProcessor());
    }

    public static TimelinePipeline standardPipeline() {
        TimelinePipeline pipeline = new TimelinePipeline();
        standardProcessors().forEach(pipeline::register);
        return pipeline;
    }

    /**
     * Builds the pipeline from {@code pipeline.processors}, a list of processor class names in registration
     * order. Without that key the standard pipeline is returned.
     *
     * @param config The {@code starledger} configuration block.
     * @return The pipeline.
     * @throws IllegalArgumentException if a class cannot be loaded or is not a processor, or if the order
     *                                  violates the dependencies.
     */
    public static TimelinePipeline fromConfig(Config config) {
        if (!config.hasPath("pipeline.processors")) {
            return standardPipeline();
        }
        TimelinePipeline pipeline = new TimelinePipeline();
        for (String className : config.getStringList("pipeline.processors")) {
            pipeline.register(instantiate(className));
        }
        log.info("Configured pipeline with processors {}", pipeline.processorIds());
        return pipeline;
    }

    private static ITimelineProcessor<?> instantiate(String className) {
        try {
            Class<?> clazz = Class.forName(className);
            if (!ITimelineProcessor.class.isAssignableFrom(clazz)) {
                throw new IllegalArgumentException("Class " + className + " does not implement ITimelineProcessor");
            }
            return (ITimelineProcessor<?>) clazz.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException e) {
            throw new IllegalArgumentException("Processor class not found: " + className, e);
        } catch (NoSuchMethodException | InstantiationException | IllegalAccessException | InvocationTargetException e) {
            throw new IllegalArgumentException("Cannot instantiate processor " + className, e);
        }
    }
}
