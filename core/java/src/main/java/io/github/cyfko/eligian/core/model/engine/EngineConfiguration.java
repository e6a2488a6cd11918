package io.github.cyfko.eligian.core.model.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.github.cyfko.eligian.core.model.CompilationMetadata;
import io.github.cyfko.eligian.core.model.EngineInfo;
import io.github.cyfko.eligian.core.model.LanguageLabel;
import io.github.cyfko.eligian.core.utils.CollectionUtils;

import java.util.List;
import java.util.Map;

/**
 * The configuration document consumed by the Eligius runtime engine.
 * <p>
 * This is the resolved form of an {@link io.github.cyfko.eligian.core.model.IrDocument}: every
 * action time is a number, every selector is flattened to its string form and no IR structure
 * remains in operation data. Field names and order are the engine's contract; components are
 * serialized in declaration order and {@code null} optional components are omitted.
 * </p>
 *
 * @param id                       unique configuration identifier
 * @param engine                   targeted engine
 * @param containerSelector        presentation root selector
 * @param language                 default language code
 * @param layoutTemplate           layout template name
 * @param availableLanguages       languages offered to the viewer
 * @param labels                   translated labels, empty for DSL output
 * @param initActions              actions run at initialization, empty for DSL output
 * @param actions                  reusable actions
 * @param eventActions             actions bound to custom events, empty for DSL output
 * @param timelines                timelines with resolved actions
 * @param timelineFlow             timeline sequencing, currently always absent
 * @param timelineProviderSettings provider settings, currently always absent
 * @param metadata                 compilation metadata
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EngineConfiguration(
        String id,
        EngineInfo engine,
        String containerSelector,
        String language,
        String layoutTemplate,
        List<LanguageLabel> availableLanguages,
        List<Map<String, Object>> labels,
        List<ActionConfiguration> initActions,
        List<ActionConfiguration> actions,
        List<ActionConfiguration> eventActions,
        List<TimelineConfiguration> timelines,
        Map<String, Object> timelineFlow,
        Map<String, Object> timelineProviderSettings,
        CompilationMetadata metadata) {

    public EngineConfiguration {
        availableLanguages = CollectionUtils.immutableList(availableLanguages);
        labels = CollectionUtils.immutableList(labels);
        initActions = CollectionUtils.immutableList(initActions);
        actions = CollectionUtils.immutableList(actions);
        eventActions = CollectionUtils.immutableList(eventActions);
        timelines = CollectionUtils.immutableList(timelines);
    }
}
